package org.homenet.bandwidth.mechanism;

import org.homenet.bandwidth.model.ActivityType;
import org.homenet.bandwidth.model.Allocation;
import org.homenet.bandwidth.model.Device;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Priority-weighted greedy bandwidth allocation.
 *
 * Formulation:
 *   pᵢ = priorityᵢ · m(activityᵢ) · signalᵢ / 100     (adjusted priority)
 *   rank devices by pᵢ descending, then usageᵢ descending
 *   walking the ranking with R = B remaining:
 *     aᵢ = 0                         if R ≤ 0
 *     aᵢ = min(usageᵢ · pᵢ, R)       otherwise, R ← R − aᵢ
 *
 * Where:
 *   m = activity multiplier (VideoCall 1.5 ... IoT 0.5, unknown 1.0)
 *   B = total bandwidth budget, clamped to ≥ 0
 *
 * Properties:
 * - Σᵢ aᵢ ≤ B and every aᵢ ≥ 0
 * - Ties on both keys keep input order (the sort is stable)
 * - Shares are rounded to 2 decimals before being charged against R,
 *   so the rounded total never exceeds the budget
 *
 * The allocator holds no state. It sets each input device's adjusted
 * priority and otherwise leaves the inputs untouched, including their order.
 */
public class BandwidthAllocator {

    private static final int SCALE = 2;

    /** Higher adjusted priority first, then higher usage. */
    public static final Comparator<Device> RANKING =
        Comparator.comparingDouble(Device::getAdjustedPriority).reversed()
            .thenComparing(Comparator.comparingDouble(Device::getUsage).reversed());

    /**
     * Compute the adjusted priority used for ranking.
     */
    public static double adjustedPriority(Device device) {
        return device.getPriority()
            * ActivityType.multiplierOf(device.getActivity())
            * (device.getSignalStrength() / 100.0);
    }

    /**
     * Split {@code totalBandwidth} among {@code devices}.
     *
     * @param devices devices to serve, in registry order
     * @param totalBandwidth budget in Mbps; negative or NaN is treated as 0
     * @return shares keyed by device name, iterating in ranking order
     */
    public Allocation allocate(List<Device> devices, double totalBandwidth) {
        double budget = Double.isNaN(totalBandwidth) ? 0.0 : Math.max(0.0, totalBandwidth);

        for (Device device : devices) {
            device.setAdjustedPriority(adjustedPriority(device));
        }

        List<Device> ranked = new ArrayList<>(devices);
        ranked.sort(RANKING);

        Map<String, Double> shares = new LinkedHashMap<>();
        BigDecimal remaining = BigDecimal.valueOf(budget);

        for (Device device : ranked) {
            if (remaining.signum() <= 0) {
                shares.put(device.getName(), 0.0);
                continue;
            }
            BigDecimal demand = BigDecimal.valueOf(device.getUsage() * device.getAdjustedPriority());
            BigDecimal share = demand.min(remaining).setScale(SCALE, RoundingMode.HALF_UP);
            if (share.compareTo(remaining) > 0) {
                share = remaining.setScale(SCALE, RoundingMode.FLOOR);
            }
            shares.put(device.getName(), share.doubleValue());
            remaining = remaining.subtract(share);
        }

        return new Allocation(shares, budget);
    }
}
