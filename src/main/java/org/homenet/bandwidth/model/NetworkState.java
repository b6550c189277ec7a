package org.homenet.bandwidth.model;

import java.time.Instant;
import java.util.List;

/**
 * Consistent read of the registry: device copies and the allocation
 * committed with them. The timestamp is null until the first commit.
 */
public record NetworkState(Instant timestamp, List<Device> devices, Allocation allocation) {

    public NetworkState {
        devices = List.copyOf(devices);
    }

    public double totalUsage() {
        return devices.stream().mapToDouble(Device::getUsage).sum();
    }

    /**
     * Demanded usage as a percentage of the budget, rounded to one decimal.
     */
    public double utilizationPercent(double totalBandwidth) {
        if (totalBandwidth <= 0) return 0.0;
        return Math.round(totalUsage() / totalBandwidth * 1000.0) / 10.0;
    }

    public long activeDeviceCount() {
        return devices.stream().filter(Device::isActive).count();
    }

    /**
     * Devices at the highest static priority.
     */
    public List<Device> priorityDevices() {
        return devices.stream()
            .filter(d -> d.getPriority() == Device.MAX_PRIORITY)
            .toList();
    }

    public double totalAllocated() {
        return allocation.getTotalAllocated();
    }
}
