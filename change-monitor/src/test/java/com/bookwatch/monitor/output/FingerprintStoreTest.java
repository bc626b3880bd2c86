package com.bookwatch.monitor.output;

import com.bookwatch.monitor.TestItems;
import com.bookwatch.monitor.TestSupport;
import com.bookwatch.monitor.model.Fingerprint;
import com.bookwatch.monitor.model.FingerprintStats;
import com.bookwatch.monitor.model.Item;
import com.bookwatch.monitor.service.FingerprintEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class FingerprintStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-15T14:30:00Z");

    private JdbcTemplate jdbcTemplate;
    private FingerprintStore store;

    @BeforeEach
    void setUp() {
        jdbcTemplate = TestSupport.h2WithSchema();
        store = new FingerprintStore(jdbcTemplate, TestSupport.objectMapper());
    }

    @Test
    void insertsAndReadsBackFingerprintWithSnapshot() {
        Fingerprint fp = fingerprint(TestItems.book(), T0);

        store.upsert(fp);

        Fingerprint stored = store.find(fp.getItemId()).orElseThrow();
        assertThat(stored).usingRecursiveComparison().isEqualTo(fp);
        assertThat(store.findBySourceUrl(fp.getSourceUrl())).contains(stored);
        assertThat(store.count()).isEqualTo(1);
    }

    @Test
    void updateKeepsCreatedAtAndReplacesHashes() {
        Fingerprint original = fingerprint(TestItems.book(), T0);
        store.upsert(original);

        Item cheaper = TestItems.book().toBuilder().priceIncludingTax(new BigDecimal("45.00")).build();
        Fingerprint updated = fingerprint(cheaper, T0.plusSeconds(3600));
        store.upsert(updated);

        Fingerprint stored = store.find(original.getItemId()).orElseThrow();
        assertThat(stored.getCreatedAt()).isEqualTo(T0);
        assertThat(stored.getUpdatedAt()).isEqualTo(T0.plusSeconds(3600));
        assertThat(stored.getPriceHash()).isEqualTo(updated.getPriceHash()).isNotEqualTo(original.getPriceHash());
        assertThat(stored.getSnapshot().getPriceIncludingTax()).isEqualByComparingTo("45.00");
        assertThat(store.count()).isEqualTo(1);
    }

    @Test
    void removalMarkerHidesItemFromActiveIdsUntilSeenAgain() {
        Fingerprint a = fingerprint(TestItems.book("a_1"), T0);
        Fingerprint b = fingerprint(TestItems.book("b_2"), T0);
        store.upsert(a);
        store.upsert(b);

        store.markRemoved(b.getItemId(), T0.plusSeconds(60));
        // Second mark keeps the first removal time.
        store.markRemoved(b.getItemId(), T0.plusSeconds(120));

        assertThat(store.listAllItemIds()).containsExactlyInAnyOrder(a.getItemId(), b.getItemId());
        assertThat(store.listActiveItemIds()).containsExactly(a.getItemId());
        assertThat(store.find(b.getItemId()).orElseThrow().getRemovedAt()).isEqualTo(T0.plusSeconds(60));

        store.upsert(fingerprint(TestItems.book("b_2"), T0.plusSeconds(3600)));

        assertThat(store.listActiveItemIds()).containsExactlyInAnyOrder(a.getItemId(), b.getItemId());
        assertThat(store.find(b.getItemId()).orElseThrow().isRemoved()).isFalse();
    }

    @Test
    void unreadableSnapshotFallsBackToHashesOnly() {
        Fingerprint fp = fingerprint(TestItems.book(), T0);
        store.upsert(fp);
        jdbcTemplate.update("UPDATE fingerprints SET snapshot = ? WHERE item_id = ?", "{not json", fp.getItemId());

        Fingerprint stored = store.find(fp.getItemId()).orElseThrow();

        assertThat(stored.getSnapshot()).isNull();
        assertThat(stored.getContentHash()).isEqualTo(fp.getContentHash());
    }

    @Test
    void statsCountActiveAndRemoved() {
        store.upsert(fingerprint(TestItems.book("a_1"), T0));
        store.upsert(fingerprint(TestItems.book("b_2"), T0.plusSeconds(10)));
        Fingerprint c = fingerprint(TestItems.book("c_3"), T0.plusSeconds(20));
        store.upsert(c);
        store.markRemoved(c.getItemId(), T0.plusSeconds(30));

        FingerprintStats stats = store.stats();

        assertThat(stats.total()).isEqualTo(3);
        assertThat(stats.active()).isEqualTo(2);
        assertThat(stats.removed()).isEqualTo(1);
        assertThat(stats.oldestUpdate()).isEqualTo(T0);
        assertThat(stats.newestUpdate()).isEqualTo(T0.plusSeconds(20));
    }

    @Test
    void emptyStoreHasZeroStats() {
        FingerprintStats stats = store.stats();

        assertThat(stats.total()).isZero();
        assertThat(stats.active()).isZero();
        assertThat(stats.oldestUpdate()).isNull();
        assertThat(store.find("book_missing")).isEmpty();
    }

    private static Fingerprint fingerprint(Item item, Instant at) {
        return new FingerprintEngine(Clock.fixed(at, ZoneOffset.UTC)).computeFingerprint(item);
    }
}
