package com.realdiscount.pipeline.service;

import com.realdiscount.pipeline.model.MatchStatus;
import com.realdiscount.pipeline.model.PendingMatchView;
import com.realdiscount.pipeline.model.ProductMatch;
import com.realdiscount.pipeline.output.CatalogStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Human review of uncertain matches.
 *
 * Confirming pins the link: later runs carry it forward without re-matching. Rejecting removes
 * the link and excludes that canonical product for the listing from then on.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MatchReviewService {

    private static final int MAX_PENDING = 500;

    private final CatalogStore catalogStore;

    public List<PendingMatchView> pendingReviews(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        return catalogStore.findPendingReviews(Math.min(limit, MAX_PENDING));
    }

    @Transactional
    public ProductMatch confirm(long matchId) {
        ProductMatch match = requireActive(matchId);
        catalogStore.updateMatchDecision(matchId, MatchStatus.MANUAL_CONFIRMED, ManualConfirmationSimilarity.METHOD, 1.0);
        log.info("Match {} confirmed: raw product {} → canonical {}",
                matchId, match.getRawProductId(), match.getCanonicalProductId());
        match.setStatus(MatchStatus.MANUAL_CONFIRMED);
        match.setMatchMethod(ManualConfirmationSimilarity.METHOD);
        match.setMatchConfidence(1.0);
        return match;
    }

    @Transactional
    public ProductMatch reject(long matchId) {
        ProductMatch match = requireActive(matchId);
        catalogStore.updateMatchDecision(matchId, MatchStatus.REJECTED, match.getMatchMethod(), match.getMatchConfidence());
        log.info("Match {} rejected: raw product {} ↛ canonical {}",
                matchId, match.getRawProductId(), match.getCanonicalProductId());
        match.setStatus(MatchStatus.REJECTED);
        return match;
    }

    private ProductMatch requireActive(long matchId) {
        ProductMatch match = catalogStore.findMatch(matchId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown match " + matchId));
        if (!match.isActive()) {
            throw new IllegalArgumentException("Match " + matchId + " is not the active link of its product");
        }
        return match;
    }
}
