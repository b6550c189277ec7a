package org.homenet.bandwidth.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A network client whose live metrics are tracked by the registry.
 *
 * Each device has:
 * - Display name, used as the allocation key
 * - Demanded bandwidth (usage) in Mbps
 * - Static priority (1..3, 3 highest) and current activity
 * - Signal strength and cumulative data transferred
 * - The adjusted priority computed by the most recent allocation pass
 *
 * Setters clamp to the documented ranges instead of rejecting values.
 */
public class Device {

    public static final double MIN_USAGE = 0.0;
    public static final double MAX_USAGE = 1000.0;
    public static final double MIN_SIGNAL = 50.0;
    public static final double MAX_SIGNAL = 100.0;
    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 3;

    private final String name;
    private final int priority;
    private final String ipAddress;
    private final Instant connectedSince;
    private double usage;
    private ActivityType activity;
    private double signalStrength;
    private double dataTransferred;
    private double adjustedPriority;

    public Device(String name, double usage, int priority, ActivityType activity,
                  double signalStrength, double dataTransferred) {
        this(name, usage, priority, activity, signalStrength, dataTransferred, null, null);
    }

    public Device(String name, double usage, int priority, ActivityType activity,
                  double signalStrength, double dataTransferred,
                  String ipAddress, Instant connectedSince) {
        this.name = Objects.requireNonNull(name, "Device name cannot be null");
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException(
                "Priority must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY + ", got " + priority);
        }
        this.priority = priority;
        this.activity = activity;
        this.ipAddress = ipAddress;
        this.connectedSince = connectedSince;
        setUsage(usage);
        setSignalStrength(signalStrength);
        this.dataTransferred = Math.max(0.0, dataTransferred);
    }

    /**
     * Deep copy, including the last adjusted priority.
     */
    public Device copy() {
        Device copy = new Device(name, usage, priority, activity, signalStrength,
            dataTransferred, ipAddress, connectedSince);
        copy.adjustedPriority = adjustedPriority;
        return copy;
    }

    // ========================================================================
    // Identity
    // ========================================================================

    public String getName() {
        return name;
    }

    public int getPriority() {
        return priority;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public Instant getConnectedSince() {
        return connectedSince;
    }

    // ========================================================================
    // Live Metrics
    // ========================================================================

    public double getUsage() {
        return usage;
    }

    public void setUsage(double usage) {
        this.usage = clamp(usage, MIN_USAGE, MAX_USAGE);
    }

    public ActivityType getActivity() {
        return activity;
    }

    public void setActivity(ActivityType activity) {
        this.activity = activity;
    }

    public double getSignalStrength() {
        return signalStrength;
    }

    public void setSignalStrength(double signalStrength) {
        this.signalStrength = clamp(signalStrength, MIN_SIGNAL, MAX_SIGNAL);
    }

    public double getDataTransferred() {
        return dataTransferred;
    }

    /**
     * Add to the cumulative transfer counter. Negative amounts are ignored.
     */
    public void addDataTransferred(double gigabytes) {
        if (gigabytes > 0) {
            dataTransferred += gigabytes;
        }
    }

    public double getAdjustedPriority() {
        return adjustedPriority;
    }

    public void setAdjustedPriority(double adjustedPriority) {
        this.adjustedPriority = adjustedPriority;
    }

    public boolean isActive() {
        return usage > 0;
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) return min;
        return Math.max(min, Math.min(max, value));
    }

    // ========================================================================
    // Object Methods
    // ========================================================================

    @Override
    public String toString() {
        return String.format("Device[%s, usage=%.1f, priority=%d, activity=%s, signal=%.0f%%, data=%.2fGB]",
            name, usage, priority, activity, signalStrength, dataTransferred);
    }
}
