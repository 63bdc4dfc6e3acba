package com.realdiscount.pipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "discount-pipeline")
@Data
public class DiscountPipelineProperties {

    private List<RetailerSource> retailers = new ArrayList<>();
    private Source source = new Source();
    private Scheduling scheduling = new Scheduling();
    private Matching matching = new Matching();
    private History history = new History();
    private Scoring scoring = new Scoring();
    private Query query = new Query();
    private Export export = new Export();

    @Data
    public static class RetailerSource {
        private String name;
        private String domain;
        /** JSON feed produced by the scraping layer for this retailer */
        private String feedUrl;
        private boolean enabled = true;
    }

    @Data
    public static class Source {
        private int connectTimeoutSeconds = 10;
        private int readTimeoutSeconds = 60;
        /** Retailer feeds fetched in parallel */
        private int parallelism = 4;
        private String defaultCurrency = "CLP";
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 6 * * ?";
        private boolean runOnStartup = false;
    }

    @Data
    public static class Matching {
        /** Stored as match_method for fuzzy matches; bump when the similarity formula changes */
        private String methodVersion = "fuzzy-token-v1";
        private double autoAcceptThreshold = 0.90;
        private double reviewThreshold = 0.70;
        /** Relative size difference still treated as the same size */
        private double sizeTolerance = 0.02;
        private double sizeMismatchFactor = 0.30;
        private double sizeUnknownFactor = 0.80;
        private double tokenWeight = 0.60;
    }

    @Data
    public static class History {
        private int lookbackDays = 90;
        /** R5: minimum span of the prior window */
        private int minRetentionDays = 7;
        /** R1/R4: prior snapshots needed before trend signals are decided */
        private int minPriorSnapshots = 2;
        /** Identical price content within this window is deduplicated */
        private int dedupWindowMinutes = 60;
        /** Peer prices may be observed this much later than the evaluated snapshot */
        private int peerSkewHours = 24;
    }

    @Data
    public static class Scoring {
        private String version = "v1";

        private double histDropThreshold = 0.15;
        private double anchorSpikeThreshold = 0.10;
        private double anchorAnomalyThreshold = 0.25;
        private double crossStoreThreshold = 0.05;
        private double minVisibleDiscount = 0.10;

        private Weights weights = new Weights();

        private double suspiciousMinScore = 0.40;
        private double likelyRealMinScore = 0.55;
        private double realMinScore = 0.75;

        @Data
        public static class Weights {
            private double histDelta = 0.35;
            private double crossStore = 0.30;
            private double anchorSpike = 0.15;
            private double multipleSnapshots = 0.10;
            private double enoughHistory = 0.10;
        }
    }

    @Data
    public static class Query {
        private int defaultLimit = 50;
        private int maxResults = 200;
    }

    @Data
    public static class Export {
        private String outputDir = "data/labels";
    }
}
