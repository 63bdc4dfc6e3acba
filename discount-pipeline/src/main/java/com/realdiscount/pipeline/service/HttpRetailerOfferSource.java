package com.realdiscount.pipeline.service;

import com.realdiscount.pipeline.config.DiscountPipelineProperties;
import com.realdiscount.pipeline.model.RawOffer;
import com.realdiscount.pipeline.model.RetailerOfferPayload;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Reads a retailer's JSON offer feed, as published by the scraping layer.
 *
 * Transient failures (timeouts, 5xx, 429) are retried by Resilience4j with exponential backoff;
 * whatever still fails surfaces as a {@link SourceException}. A missing URL or a 4xx other than
 * 429 raises {@link FeedUnavailableException}, which the retry ignores.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HttpRetailerOfferSource implements RetailerOfferSource {

    private final RestTemplate restTemplate;
    private final OfferMapper offerMapper;

    @Override
    @Retry(name = "retailerSource")
    public List<RawOffer> fetchOffers(DiscountPipelineProperties.RetailerSource retailer) {
        String url = retailer.getFeedUrl();
        if (url == null || url.isBlank()) {
            throw new FeedUnavailableException(retailer.getName(), "No feed URL configured for " + retailer.getName());
        }

        log.debug("Fetching offers for {} from {}", retailer.getName(), url);
        Instant fetchedAt = Instant.now();
        try {
            RetailerOfferPayload[] response = restTemplate.getForObject(url, RetailerOfferPayload[].class);
            if (response == null) {
                return List.of();
            }
            log.debug("{} feed returned {} records", retailer.getName(), response.length);
            return offerMapper.mapAll(Arrays.asList(response), retailer, fetchedAt);

        } catch (HttpClientErrorException.NotFound e) {
            throw new FeedUnavailableException(retailer.getName(), "Feed not found (404): " + url, e);

        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == 429) {
                throw new SourceException(retailer.getName(), "Feed rate limited (429): " + url, e);
            }
            throw new FeedUnavailableException(retailer.getName(), "Feed rejected the request: " + e.getMessage(), e);

        } catch (RestClientException e) {
            log.warn("Feed call failed for {} ({}): {}", retailer.getName(), url, e.getMessage());
            throw new SourceException(retailer.getName(), "Feed call failed: " + e.getMessage(), e);
        }
    }
}
