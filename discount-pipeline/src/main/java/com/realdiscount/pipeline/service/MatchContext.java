package com.realdiscount.pipeline.service;

import com.realdiscount.pipeline.model.MatchStatus;
import com.realdiscount.pipeline.model.NormalizedIdentity;
import com.realdiscount.pipeline.model.ProductMatch;

import java.util.Set;

/**
 * Everything a similarity strategy may look at when comparing one raw product against a candidate.
 *
 * @param rawProductId         the listing being matched
 * @param identity             its normalized identity
 * @param activeMatch          current active link, or null for a first sighting
 * @param rejectedCanonicalIds canonical products a reviewer ruled out for this listing
 */
public record MatchContext(long rawProductId,
                           NormalizedIdentity identity,
                           ProductMatch activeMatch,
                           Set<Long> rejectedCanonicalIds) {

    public Long confirmedCanonicalId() {
        if (activeMatch != null && activeMatch.getStatus() == MatchStatus.MANUAL_CONFIRMED) {
            return activeMatch.getCanonicalProductId();
        }
        return null;
    }
}
