package com.realdiscount.pipeline.output;

import com.realdiscount.pipeline.config.DiscountPipelineProperties;
import com.realdiscount.pipeline.model.MatchStatus;
import com.realdiscount.pipeline.model.PriceSnapshot;
import com.realdiscount.pipeline.model.ProductMatch;
import com.realdiscount.pipeline.model.RawOffer;
import com.realdiscount.pipeline.model.RawProduct;
import com.realdiscount.pipeline.model.CanonicalProduct;
import com.realdiscount.pipeline.service.DuplicateSnapshotException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PriceHistoryStoreTest {

    private static final Instant T0 = Instant.parse("2025-03-01T06:00:00Z");

    private TestDatabase db;
    private CatalogStore catalogStore;
    private PriceHistoryStore store;
    private long retailerId;
    private RawProduct raw;

    @BeforeEach
    public void setUp() {
        db = new TestDatabase();
        catalogStore = new CatalogStore(db.jdbcTemplate);
        store = new PriceHistoryStore(db.jdbcTemplate, new DiscountPipelineProperties());
        retailerId = catalogStore.upsertRetailer("CruzVerde", "cruzverde.cl").getId();
        raw = rawProduct(retailerId, "cv-1");
    }

    private RawProduct rawProduct(long retailer, String id) {
        return catalogStore.upsertRawProduct(retailer, RawOffer.builder()
                .retailerProductId(id)
                .productUrl("https://shop.example/" + id)
                .title("Isdin Fusion Water 50 ml")
                .priceCurrent(1)
                .scrapedAt(T0)
                .build());
    }

    private static PriceSnapshot snapshot(Instant at, double current, Double list) {
        return PriceSnapshot.builder().scrapedAt(at).priceCurrent(current).priceList(list).build();
    }

    @Test
    public void appendStoresSnapshotWithDefaultCurrency() {
        PriceHistoryStore.AppendResult r = store.append(raw.getId(), snapshot(T0, 8900, 10000.0));

        assertTrue(r.inserted());
        assertNotNull(r.snapshot().getId());
        assertEquals("CLP", r.snapshot().getCurrency());
        assertEquals(64, r.snapshot().getSourceHash().length());
        assertEquals(1, db.count("price_snapshots"));
    }

    @Test
    public void sameInstantIsADuplicate() {
        store.append(raw.getId(), snapshot(T0, 8900, 10000.0));

        DuplicateSnapshotException e = assertThrows(DuplicateSnapshotException.class,
                () -> store.append(raw.getId(), snapshot(T0, 7990, 10000.0)));
        assertEquals(raw.getId(), e.getRawProductId());
        assertEquals(1, db.count("price_snapshots"));
    }

    @Test
    public void repeatedContentInsideWindowIsSkipped() {
        PriceHistoryStore.AppendResult first = store.append(raw.getId(), snapshot(T0, 8900, 10000.0));
        PriceHistoryStore.AppendResult repeat = store.append(raw.getId(), snapshot(T0.plus(Duration.ofMinutes(20)), 8900, 10000.0));

        assertFalse(repeat.inserted());
        assertEquals(first.snapshot().getId(), repeat.snapshot().getId());
        assertEquals(1, db.count("price_snapshots"));
    }

    @Test
    public void repeatedContentOutsideWindowIsKept() {
        store.append(raw.getId(), snapshot(T0, 8900, 10000.0));
        PriceHistoryStore.AppendResult nextDay = store.append(raw.getId(), snapshot(T0.plus(Duration.ofDays(1)), 8900, 10000.0));

        assertTrue(nextDay.inserted());
        assertEquals(2, db.count("price_snapshots"));
    }

    @Test
    public void historyIsAscendingAndExcludesTheCutoff() {
        store.append(raw.getId(), snapshot(T0.minus(Duration.ofDays(100)), 12000, null));
        store.append(raw.getId(), snapshot(T0.minus(Duration.ofDays(10)), 11000, null));
        store.append(raw.getId(), snapshot(T0.minus(Duration.ofDays(3)), 10500, null));
        store.append(raw.getId(), snapshot(T0, 9000, null));

        List<PriceSnapshot> history = store.history(raw.getId(), Duration.ofDays(90), T0);

        assertEquals(2, history.size());
        assertEquals(11000, history.get(0).getPriceCurrent());
        assertEquals(10500, history.get(1).getPriceCurrent());
        assertTrue(history.get(0).getScrapedAt().isBefore(history.get(1).getScrapedAt()));
    }

    @Test
    public void historyOfUnknownListingIsEmpty() {
        assertTrue(store.history(999L, Duration.ofDays(90), T0).isEmpty());
    }

    @Test
    public void peerPricesUseLatestSnapshotOfOtherRetailers() {
        long otherRetailer = catalogStore.upsertRetailer("Salcobrand", "salcobrand.cl").getId();
        RawProduct peer = rawProduct(otherRetailer, "sb-1");
        RawProduct sameStore = rawProduct(retailerId, "cv-2");
        long canonicalId = catalogStore.insertCanonical(CanonicalProduct.builder()
                .canonicalName("fusion water").brandNorm("isdin").categoryNorm("sunscreen").build()).getId();
        for (RawProduct r : List.of(raw, peer, sameStore)) {
            catalogStore.insertMatch(ProductMatch.builder()
                    .rawProductId(r.getId()).canonicalProductId(canonicalId)
                    .matchConfidence(1.0).matchMethod("exact-ean").status(MatchStatus.AUTO_ACCEPTED)
                    .runId("run-1").build());
        }
        store.append(peer.getId(), snapshot(T0.minus(Duration.ofDays(2)), 11000, null));
        store.append(peer.getId(), snapshot(T0.minus(Duration.ofHours(1)), 10000, null));
        store.append(sameStore.getId(), snapshot(T0, 5000, null));

        List<Double> peers = store.peerPrices(canonicalId, retailerId, T0);

        assertEquals(List.of(10000.0), peers);
    }

    @Test
    public void peerPricesIgnoreRejectedLinksAndFutureObservations() {
        long otherRetailer = catalogStore.upsertRetailer("Salcobrand", "salcobrand.cl").getId();
        RawProduct peer = rawProduct(otherRetailer, "sb-1");
        long canonicalId = catalogStore.insertCanonical(CanonicalProduct.builder()
                .canonicalName("fusion water").brandNorm("isdin").categoryNorm("sunscreen").build()).getId();
        ProductMatch link = catalogStore.insertMatch(ProductMatch.builder()
                .rawProductId(peer.getId()).canonicalProductId(canonicalId)
                .matchConfidence(0.8).matchMethod("fuzzy-token").status(MatchStatus.PENDING_REVIEW)
                .runId("run-1").build());
        store.append(peer.getId(), snapshot(T0.plus(Duration.ofDays(3)), 10000, null));

        assertTrue(store.peerPrices(canonicalId, retailerId, T0).isEmpty());

        store.append(peer.getId(), snapshot(T0.minus(Duration.ofHours(2)), 9500, null));
        assertEquals(List.of(9500.0), store.peerPrices(canonicalId, retailerId, T0));

        catalogStore.updateMatchDecision(link.getId(), MatchStatus.REJECTED, "fuzzy-token", 0.8);
        assertTrue(store.peerPrices(canonicalId, retailerId, T0).isEmpty());
    }
}
