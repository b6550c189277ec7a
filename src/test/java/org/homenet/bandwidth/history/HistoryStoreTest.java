package org.homenet.bandwidth.history;

import org.homenet.bandwidth.model.ActivityType;
import org.homenet.bandwidth.model.Allocation;
import org.homenet.bandwidth.model.Device;
import org.homenet.bandwidth.model.HistoricalSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HistoryStore - ordered retention of tick snapshots.
 */
class HistoryStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void appendEvictsEntriesOlderThanWindow() {
        HistoryStore store = new HistoryStore(Duration.ofSeconds(10));

        for (int i = 0; i <= 30; i++) {
            store.append(snapshotAt(T0.plusSeconds(i), i));
        }

        // Window [20, 30] survives; 20 sits exactly on the cutoff
        assertEquals(11, store.size());
        assertEquals(T0.plusSeconds(20), store.oldest().orElseThrow().getTimestamp());
        assertEquals(T0.plusSeconds(30), store.latest().orElseThrow().getTimestamp());
    }

    @Test
    void appendReportsEvictionCount() {
        HistoryStore store = new HistoryStore(Duration.ofMinutes(1));
        store.append(snapshotAt(T0, 1));
        store.append(snapshotAt(T0.plusSeconds(30), 2));

        assertEquals(2, store.append(snapshotAt(T0.plusSeconds(120), 3)));
        assertEquals(1, store.size());
    }

    @Test
    void pruneRemovesOnlyStrictlyOlderEntries() {
        HistoryStore store = new HistoryStore(Duration.ofHours(24));
        store.append(snapshotAt(T0, 1));
        store.append(snapshotAt(T0.plusSeconds(1), 2));
        store.append(snapshotAt(T0.plusSeconds(2), 3));

        assertEquals(1, store.prune(T0.plusSeconds(1)));
        assertEquals(T0.plusSeconds(1), store.oldest().orElseThrow().getTimestamp());
        assertEquals(0, store.prune(T0));
    }

    @Test
    void queryIsInclusiveAndOrdered() {
        HistoryStore store = new HistoryStore();
        for (int i = 0; i < 10; i++) {
            store.append(snapshotAt(T0.plusSeconds(i), i));
        }

        List<HistoricalSnapshot> range = store.query(T0.plusSeconds(3), T0.plusSeconds(6));
        assertEquals(4, range.size());
        assertEquals(T0.plusSeconds(3), range.get(0).getTimestamp());
        assertEquals(T0.plusSeconds(6), range.get(3).getTimestamp());

        assertEquals(10, store.getAll().size());
        assertEquals(3, store.query(null, T0.plusSeconds(2)).size());
        assertEquals(2, store.recent(Duration.ofSeconds(1), T0.plusSeconds(9)).size());
        assertTrue(store.query(T0.plusSeconds(20), null).isEmpty());
    }

    @Test
    void outOfOrderAppendKeepsTimestampOrder() {
        HistoryStore store = new HistoryStore();
        store.append(snapshotAt(T0.plusSeconds(5), 1));
        store.append(snapshotAt(T0.plusSeconds(10), 2));
        store.append(snapshotAt(T0.plusSeconds(7), 3));

        assertTrue(store.isOrdered());
        assertEquals(T0.plusSeconds(7), store.getAll().get(1).getTimestamp());
    }

    @Test
    void snapshotsAreImmutable() {
        Device device = new Device("TV", 100, 2, ActivityType.STREAMING, 90, 1.0);
        HistoricalSnapshot snapshot = new HistoricalSnapshot(T0, List.of(device),
            new Allocation(Map.of("TV", 100.0), 500));

        device.setUsage(900);
        snapshot.getDevices().get(0).setUsage(5);

        assertEquals(100.0, snapshot.getDevices().get(0).getUsage());
        assertThrows(UnsupportedOperationException.class,
            () -> snapshot.getAllocation().asMap().put("TV", 1.0));
    }

    @Test
    void retentionMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new HistoryStore(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new HistoryStore(Duration.ofSeconds(-1)));
    }

    static HistoricalSnapshot snapshotAt(Instant timestamp, double usage) {
        Device device = new Device("Laptop", usage, 2, ActivityType.DOWNLOAD, 80, 0);
        return new HistoricalSnapshot(timestamp, List.of(device),
            new Allocation(Map.of("Laptop", usage), 500));
    }
}
