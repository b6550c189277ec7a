package org.homenet.bandwidth.history;

import org.homenet.bandwidth.model.Device;
import org.homenet.bandwidth.model.HistoricalSnapshot;

import java.time.Instant;
import java.util.*;

/**
 * Summaries over a sequence of snapshots, for display.
 */
public class HistoryAnalyzer {

    /**
     * Highest summed device usage seen in one snapshot.
     */
    public record PeakUsage(Instant timestamp, double totalUsage) {}

    /**
     * Usage and allocation statistics for one device name, rounded to 2 decimals.
     */
    public record DeviceStatistics(
        String deviceName,
        int samples,
        double meanUsage,
        double maxUsage,
        double meanAllocated,
        double maxAllocated
    ) {}

    /**
     * Find the snapshot with the highest total usage. The earliest wins ties.
     */
    public Optional<PeakUsage> peakUsage(List<HistoricalSnapshot> snapshots) {
        PeakUsage peak = null;
        for (HistoricalSnapshot snapshot : snapshots) {
            double total = snapshot.getTotalUsage();
            if (peak == null || total > peak.totalUsage()) {
                peak = new PeakUsage(snapshot.getTimestamp(), total);
            }
        }
        return Optional.ofNullable(peak);
    }

    /**
     * Per-device statistics keyed by device name, in first-seen order.
     */
    public Map<String, DeviceStatistics> deviceStatistics(List<HistoricalSnapshot> snapshots) {
        Map<String, Accumulator> accumulators = new LinkedHashMap<>();
        for (HistoricalSnapshot snapshot : snapshots) {
            for (Device device : snapshot.getDevices()) {
                accumulators.computeIfAbsent(device.getName(), k -> new Accumulator())
                    .add(device.getUsage(), snapshot.getAllocation().getShare(device.getName()));
            }
        }

        Map<String, DeviceStatistics> stats = new LinkedHashMap<>();
        for (var entry : accumulators.entrySet()) {
            stats.put(entry.getKey(), entry.getValue().toStatistics(entry.getKey()));
        }
        return stats;
    }

    /**
     * Mean of total usage across snapshots.
     */
    public double averageTotalUsage(List<HistoricalSnapshot> snapshots) {
        return snapshots.stream().mapToDouble(HistoricalSnapshot::getTotalUsage).average().orElse(0);
    }

    private static final class Accumulator {
        private int samples;
        private double usageSum;
        private double usageMax;
        private double allocatedSum;
        private double allocatedMax;

        void add(double usage, double allocated) {
            samples++;
            usageSum += usage;
            allocatedSum += allocated;
            usageMax = Math.max(usageMax, usage);
            allocatedMax = Math.max(allocatedMax, allocated);
        }

        DeviceStatistics toStatistics(String name) {
            return new DeviceStatistics(name, samples,
                round2(usageSum / samples), round2(usageMax),
                round2(allocatedSum / samples), round2(allocatedMax));
        }
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
