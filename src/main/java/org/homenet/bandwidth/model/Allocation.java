package org.homenet.bandwidth.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one bandwidth allocation pass.
 *
 * Contains:
 * - Allocated Mbps per device name, in ranking order
 * - The budget the pass was run against
 *
 * Instances are immutable.
 */
public final class Allocation {

    private static final Allocation EMPTY = new Allocation(new LinkedHashMap<>(), 0.0);

    private final Map<String, Double> shares;
    private final double totalBandwidth;

    public Allocation(Map<String, Double> shares, double totalBandwidth) {
        this.shares = Collections.unmodifiableMap(new LinkedHashMap<>(shares));
        this.totalBandwidth = totalBandwidth;
    }

    public static Allocation empty() {
        return EMPTY;
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public double getShare(String deviceName) {
        return shares.getOrDefault(deviceName, 0.0);
    }

    public boolean contains(String deviceName) {
        return shares.containsKey(deviceName);
    }

    /**
     * Read-only view of the mapping, iterating in ranking order.
     */
    public Map<String, Double> asMap() {
        return shares;
    }

    public double getTotalBandwidth() {
        return totalBandwidth;
    }

    public int size() {
        return shares.size();
    }

    public boolean isEmpty() {
        return shares.isEmpty();
    }

    // ========================================================================
    // Computed Properties
    // ========================================================================

    public double getTotalAllocated() {
        return shares.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public double getUnallocated() {
        return Math.max(0.0, totalBandwidth - getTotalAllocated());
    }

    // ========================================================================
    // Object Methods
    // ========================================================================

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Allocation that)) return false;
        return Double.compare(totalBandwidth, that.totalBandwidth) == 0 && shares.equals(that.shares);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shares, totalBandwidth);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Allocation[budget=%.2f, allocated=%.2f]:%n", totalBandwidth, getTotalAllocated()));
        for (var entry : shares.entrySet()) {
            sb.append("  ").append(entry.getKey()).append(": ")
              .append(String.format("%.2f", entry.getValue())).append(System.lineSeparator());
        }
        return sb.toString();
    }
}
