package com.realdiscount.pipeline.service;

import com.realdiscount.pipeline.model.DealFilter;
import com.realdiscount.pipeline.model.DealView;
import com.realdiscount.pipeline.model.DiscountLabel;
import com.realdiscount.pipeline.model.MatchStatus;
import com.realdiscount.pipeline.model.RuleSignals;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DealQueryServiceTest {

    private static final Instant T0 = Instant.parse("2025-03-01T06:00:00Z");
    private static final String TITLE = "La Roche-Posay Anthelios UVMune 400 Fluido 50 ml";
    private static final String EAN = "3337875797580";

    private PipelineFixture fx;

    @BeforeEach
    public void setUp() {
        fx = new PipelineFixture()
                .retailer("CruzVerde", "cruzverde.cl")
                .retailer("Salcobrand", "salcobrand.cl");
        fx.source.offers.put("CruzVerde", List.of(PipelineFixture.offer("cv-1", TITLE, EAN, 9000, 10000.0, T0)));
        fx.source.offers.put("Salcobrand", List.of(PipelineFixture.offer("sb-1", TITLE, EAN, 10000, 11000.0, T0)));
        fx.pipeline().runOnce();
    }

    private List<DealView> find(DealFilter.DealFilterBuilder filter) {
        return fx.dealQueryService.findDeals(filter.build());
    }

    @Test
    public void unfilteredReturnsOneRowPerListing() {
        List<DealView> deals = find(DealFilter.builder());

        assertEquals(2, deals.size());
        for (DealView d : deals) {
            assertEquals("v1", d.getScoringVersion());
            assertEquals("anthelios uvmune 400 fluido", d.getCanonicalName());
            assertEquals(MatchStatus.AUTO_ACCEPTED, d.getMatchStatus());
            assertNotNull(d.getExplanation());
            assertNotNull(d.getScrapedAt());
        }
    }

    @Test
    public void filtersByScoreAndLabel() {
        List<DealView> credible = find(DealFilter.builder().minScore(0.55));
        assertEquals(1, credible.size());
        assertEquals("CruzVerde", credible.get(0).getRetailer());

        List<DealView> fake = find(DealFilter.builder().label(DiscountLabel.LIKELY_FAKE));
        assertEquals(1, fake.size());
        assertEquals("Salcobrand", fake.get(0).getRetailer());
    }

    @Test
    public void retailerFilterIgnoresCase() {
        assertEquals(1, find(DealFilter.builder().retailer("cruzverde")).size());
        assertEquals(0, find(DealFilter.builder().retailer("falabella")).size());
    }

    @Test
    public void brandFilterMatchesSubstring() {
        assertEquals(2, find(DealFilter.builder().brand("Roche")).size());
        assertEquals(0, find(DealFilter.builder().brand("vichy")).size());
    }

    @Test
    public void visibleDiscountAndCrossStoreFilters() {
        List<DealView> visible = find(DealFilter.builder().minVisibleDiscount(0.10));
        assertEquals(1, visible.size());
        assertEquals("CruzVerde", visible.get(0).getRetailer());

        List<DealView> cheaper = find(DealFilter.builder().crossStorePositiveOnly(true));
        assertEquals(1, cheaper.size());
        assertTrue(cheaper.get(0).getCrossStoreDeltaPct() < 0);
    }

    @Test
    public void traceIsDecodedAndExplained() {
        DealView dearer = find(DealFilter.builder().retailer("Salcobrand")).get(0);

        assertEquals(Boolean.FALSE, dearer.getRuleTrace().get(RuleSignals.R3_CROSS_STORE));
        assertTrue(dearer.getRuleTrace().containsKey(RuleSignals.R1_HIST_DELTA));
        assertTrue(dearer.getExplanation().contains("not at least 5% below other retailers"));
        assertTrue(dearer.getExplanation().contains("not enough price history"));
    }

    @Test
    public void onlyLatestSnapshotIsReported() {
        Instant later = T0.plus(Duration.ofDays(1));
        fx.source.offers.put("CruzVerde", List.of(PipelineFixture.offer("cv-1", TITLE, EAN, 8500, 10000.0, later)));
        fx.source.offers.put("Salcobrand", List.of(PipelineFixture.offer("sb-1", TITLE, EAN, 9900, 11000.0, later)));
        fx.pipeline().runOnce();

        List<DealView> deals = find(DealFilter.builder());

        assertEquals(2, deals.size());
        assertTrue(deals.stream().allMatch(d -> later.equals(d.getScrapedAt())));
        assertEquals(4, fx.db.count("discount_evaluations"));
    }

    @Test
    public void limitIsApplied() {
        assertEquals(1, find(DealFilter.builder().limit(1)).size());
    }

    @Test
    public void invalidFiltersAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> find(DealFilter.builder().minScore(1.5)));
        assertThrows(IllegalArgumentException.class, () -> find(DealFilter.builder().minScore(-0.1)));
        assertThrows(IllegalArgumentException.class, () -> find(DealFilter.builder().minVisibleDiscount(2.0)));
        assertThrows(IllegalArgumentException.class, () -> find(DealFilter.builder().limit(0)));
    }

    @Test
    public void latestRunIsExposed() {
        assertTrue(fx.dealQueryService.latestRun().isPresent());
    }
}
