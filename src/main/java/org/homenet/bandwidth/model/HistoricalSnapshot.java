package org.homenet.bandwidth.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Devices and allocation as they stood at the end of one simulation tick.
 * Immutable: devices are copied on the way in and on the way out.
 */
public final class HistoricalSnapshot {

    private final Instant timestamp;
    private final List<Device> devices;
    private final Allocation allocation;

    public HistoricalSnapshot(Instant timestamp, List<Device> devices, Allocation allocation) {
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        this.allocation = Objects.requireNonNull(allocation, "Allocation cannot be null");
        List<Device> copies = new ArrayList<>(devices.size());
        for (Device device : devices) {
            copies.add(device.copy());
        }
        this.devices = copies;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Copies of the recorded devices, in registry order.
     */
    public List<Device> getDevices() {
        List<Device> copies = new ArrayList<>(devices.size());
        for (Device device : devices) {
            copies.add(device.copy());
        }
        return copies;
    }

    public Allocation getAllocation() {
        return allocation;
    }

    public int getDeviceCount() {
        return devices.size();
    }

    public double getTotalUsage() {
        return devices.stream().mapToDouble(Device::getUsage).sum();
    }

    @Override
    public String toString() {
        return String.format("HistoricalSnapshot[%s, devices=%d, usage=%.1f, allocated=%.1f]",
            timestamp, devices.size(), getTotalUsage(), allocation.getTotalAllocated());
    }
}
