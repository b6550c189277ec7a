package org.homenet.bandwidth.config;

import org.homenet.bandwidth.model.Device;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Settings supplied by the surrounding application.
 *
 * Ranges:
 * - totalBandwidth: 100..1000 Mbps (default 500)
 * - tickPeriod: 1s..60s (default 1s)
 * - retentionWindow: positive (default 24h)
 * - generator seed and device count bounds (default 42, 8..15)
 * - optional explicit initial devices, used instead of the generator
 */
public final class NetworkConfig {

    public static final double MIN_BANDWIDTH = 100.0;
    public static final double MAX_BANDWIDTH = 1000.0;
    public static final Duration MIN_TICK_PERIOD = Duration.ofSeconds(1);
    public static final Duration MAX_TICK_PERIOD = Duration.ofSeconds(60);

    private final double totalBandwidth;
    private final Duration tickPeriod;
    private final Duration retentionWindow;
    private final long generatorSeed;
    private final int minDevices;
    private final int maxDevices;
    private final List<Device> initialDevices;

    private NetworkConfig(Builder builder) {
        this.totalBandwidth = builder.totalBandwidth;
        this.tickPeriod = builder.tickPeriod;
        this.retentionWindow = builder.retentionWindow;
        this.generatorSeed = builder.generatorSeed;
        this.minDevices = builder.minDevices;
        this.maxDevices = builder.maxDevices;
        this.initialDevices = Collections.unmodifiableList(new ArrayList<>(builder.initialDevices));
    }

    public static NetworkConfig defaults() {
        return new Builder().build();
    }

    public double getTotalBandwidth() { return totalBandwidth; }
    public Duration getTickPeriod() { return tickPeriod; }
    public Duration getRetentionWindow() { return retentionWindow; }
    public long getGeneratorSeed() { return generatorSeed; }
    public int getMinDevices() { return minDevices; }
    public int getMaxDevices() { return maxDevices; }

    /**
     * Explicit devices from configuration; empty means "use the generator".
     */
    public List<Device> getInitialDevices() { return initialDevices; }

    public boolean hasInitialDevices() {
        return !initialDevices.isEmpty();
    }

    public Builder toBuilder() {
        return new Builder()
            .totalBandwidth(totalBandwidth)
            .tickPeriod(tickPeriod)
            .retentionWindow(retentionWindow)
            .generatorSeed(generatorSeed)
            .deviceCountBounds(minDevices, maxDevices)
            .initialDevices(initialDevices);
    }

    @Override
    public String toString() {
        return String.format("NetworkConfig[bandwidth=%.0f Mbps, tick=%s, retention=%s, seed=%d, devices=%s]",
            totalBandwidth, tickPeriod, retentionWindow, generatorSeed,
            hasInitialDevices() ? initialDevices.size() + " explicit" : minDevices + ".." + maxDevices);
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private double totalBandwidth = 500.0;
        private Duration tickPeriod = Duration.ofSeconds(1);
        private Duration retentionWindow = Duration.ofHours(24);
        private long generatorSeed = 42L;
        private int minDevices = 8;
        private int maxDevices = 15;
        private List<Device> initialDevices = new ArrayList<>();

        public Builder totalBandwidth(double totalBandwidth) {
            this.totalBandwidth = totalBandwidth;
            return this;
        }

        public Builder tickPeriod(Duration tickPeriod) {
            this.tickPeriod = tickPeriod;
            return this;
        }

        public Builder retentionWindow(Duration retentionWindow) {
            this.retentionWindow = retentionWindow;
            return this;
        }

        public Builder generatorSeed(long seed) {
            this.generatorSeed = seed;
            return this;
        }

        public Builder deviceCountBounds(int min, int max) {
            this.minDevices = min;
            this.maxDevices = max;
            return this;
        }

        public Builder initialDevices(List<Device> devices) {
            this.initialDevices = new ArrayList<>(devices);
            return this;
        }

        public NetworkConfig build() {
            if (Double.isNaN(totalBandwidth) || totalBandwidth < MIN_BANDWIDTH || totalBandwidth > MAX_BANDWIDTH) {
                throw new IllegalArgumentException(String.format(
                    "totalBandwidth must be between %.0f and %.0f Mbps, got %s",
                    MIN_BANDWIDTH, MAX_BANDWIDTH, totalBandwidth));
            }
            Objects.requireNonNull(tickPeriod, "tickPeriod cannot be null");
            if (tickPeriod.compareTo(MIN_TICK_PERIOD) < 0 || tickPeriod.compareTo(MAX_TICK_PERIOD) > 0) {
                throw new IllegalArgumentException(
                    "tickPeriod must be between 1s and 60s, got " + tickPeriod);
            }
            Objects.requireNonNull(retentionWindow, "retentionWindow cannot be null");
            if (retentionWindow.isNegative() || retentionWindow.isZero()) {
                throw new IllegalArgumentException("retentionWindow must be positive, got " + retentionWindow);
            }
            if (minDevices < 0 || maxDevices < minDevices) {
                throw new IllegalArgumentException(
                    "Invalid device count bounds: " + minDevices + ".." + maxDevices);
            }
            return new NetworkConfig(this);
        }
    }
}
