package org.homenet.bandwidth.history;

import org.homenet.bandwidth.model.HistoricalSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Rolling log of tick snapshots, oldest first.
 *
 * Every {@link #append} prunes entries strictly older than the newest
 * timestamp minus the retention window, so the store holds roughly
 * retentionWindow / tickPeriod entries.
 */
public class HistoryStore {

    private static final Logger log = LoggerFactory.getLogger(HistoryStore.class);

    public static final Duration DEFAULT_RETENTION = Duration.ofHours(24);

    private final Deque<HistoricalSnapshot> entries;
    private final Duration retentionWindow;
    private final ReadWriteLock lock;

    public HistoryStore() {
        this(DEFAULT_RETENTION);
    }

    public HistoryStore(Duration retentionWindow) {
        Objects.requireNonNull(retentionWindow, "Retention window cannot be null");
        if (retentionWindow.isNegative() || retentionWindow.isZero()) {
            throw new IllegalArgumentException("Retention window must be positive: " + retentionWindow);
        }
        this.retentionWindow = retentionWindow;
        this.entries = new ArrayDeque<>();
        this.lock = new ReentrantReadWriteLock();
    }

    // ========================================================================
    // Writes
    // ========================================================================

    /**
     * Append a snapshot and evict everything older than the retention window,
     * measured back from the newest entry.
     *
     * @return number of evicted entries
     */
    public int append(HistoricalSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "Snapshot cannot be null");
        lock.writeLock().lock();
        try {
            HistoricalSnapshot last = entries.peekLast();
            if (last == null || !snapshot.getTimestamp().isBefore(last.getTimestamp())) {
                entries.addLast(snapshot);
            } else {
                insertInOrder(snapshot);
            }
            Instant newest = entries.peekLast().getTimestamp();
            return pruneLocked(newest.minus(retentionWindow));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove all entries with a timestamp strictly before {@code cutoff}.
     *
     * @return number of evicted entries
     */
    public int prune(Instant cutoff) {
        lock.writeLock().lock();
        try {
            return pruneLocked(cutoff);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private int pruneLocked(Instant cutoff) {
        int evicted = 0;
        while (!entries.isEmpty() && entries.peekFirst().getTimestamp().isBefore(cutoff)) {
            entries.removeFirst();
            evicted++;
        }
        if (evicted > 0) {
            log.debug("Pruned {} snapshot(s) older than {}", evicted, cutoff);
        }
        return evicted;
    }

    // Clock stepped backwards; rare, so a linear rebuild is fine.
    private void insertInOrder(HistoricalSnapshot snapshot) {
        List<HistoricalSnapshot> ordered = new ArrayList<>(entries.size() + 1);
        boolean inserted = false;
        for (HistoricalSnapshot existing : entries) {
            if (!inserted && snapshot.getTimestamp().isBefore(existing.getTimestamp())) {
                ordered.add(snapshot);
                inserted = true;
            }
            ordered.add(existing);
        }
        if (!inserted) {
            ordered.add(snapshot);
        }
        entries.clear();
        entries.addAll(ordered);
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ========================================================================
    // Queries
    // ========================================================================

    /**
     * Snapshots with {@code from <= timestamp <= to}, oldest first.
     * A null bound is open.
     */
    public List<HistoricalSnapshot> query(Instant from, Instant to) {
        lock.readLock().lock();
        try {
            List<HistoricalSnapshot> result = new ArrayList<>();
            for (HistoricalSnapshot snapshot : entries) {
                Instant ts = snapshot.getTimestamp();
                if (from != null && ts.isBefore(from)) continue;
                if (to != null && ts.isAfter(to)) break;
                result.add(snapshot);
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshots from the last {@code window} before {@code now}.
     */
    public List<HistoricalSnapshot> recent(Duration window, Instant now) {
        return query(now.minus(window), now);
    }

    public List<HistoricalSnapshot> getAll() {
        return query(null, null);
    }

    public Optional<HistoricalSnapshot> latest() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.peekLast());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<HistoricalSnapshot> oldest() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.peekFirst());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public Duration getRetentionWindow() {
        return retentionWindow;
    }

    /**
     * True if timestamps never decrease front to back.
     */
    boolean isOrdered() {
        lock.readLock().lock();
        try {
            Iterator<HistoricalSnapshot> it = entries.iterator();
            Instant previous = null;
            while (it.hasNext()) {
                Instant ts = it.next().getTimestamp();
                if (previous != null && ts.isBefore(previous)) return false;
                previous = ts;
            }
            return true;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        return String.format("HistoryStore[entries=%d, retention=%s]", size(), retentionWindow);
    }
}
