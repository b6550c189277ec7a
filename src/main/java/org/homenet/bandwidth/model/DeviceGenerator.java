package org.homenet.bandwidth.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Mock device source for demos and tests.
 *
 * Generated devices look like a busy household network:
 * - "Manufacturer DeviceType" names drawn from fixed lists
 * - Random usage, priority, activity and signal strength
 * - A connection time within the last day and a 192.168.1.x address
 *
 * The same seed and clock always produce the same devices.
 */
public class DeviceGenerator {

    static final List<String> DEVICE_TYPES = List.of(
        "Smartphone", "Laptop", "Smart TV", "Gaming Console", "Tablet",
        "Security Camera", "Smart Speaker", "Desktop PC");

    static final List<String> MANUFACTURERS = List.of(
        "Apple", "Samsung", "Sony", "Microsoft", "Google", "Amazon", "LG", "Dell");

    private final Random random;
    private final long seed;
    private final Clock clock;

    private int minDevices = 8;
    private int maxDevices = 15;

    public DeviceGenerator(long seed, Clock clock) {
        this.seed = seed;
        this.random = new Random(seed);
        this.clock = clock;
    }

    /**
     * Create a generator with the default seed (42) and the system clock.
     */
    public DeviceGenerator() {
        this(42L, Clock.systemUTC());
    }

    // ========================================================================
    // Configuration Methods
    // ========================================================================

    /**
     * Set the inclusive bounds on how many devices {@link #generate()} returns.
     */
    public DeviceGenerator setDeviceCountBounds(int min, int max) {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Invalid device count bounds: " + min + ".." + max);
        }
        this.minDevices = min;
        this.maxDevices = max;
        return this;
    }

    public long getSeed() {
        return seed;
    }

    // ========================================================================
    // Generation
    // ========================================================================

    /**
     * Generate a random number of devices within the configured bounds.
     */
    public List<Device> generate() {
        int count = minDevices + random.nextInt(maxDevices - minDevices + 1);
        return generate(count);
    }

    /**
     * Generate exactly {@code count} devices.
     */
    public List<Device> generate(int count) {
        Instant now = clock.instant();
        List<Device> devices = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            devices.add(generateDevice(now));
        }
        return devices;
    }

    private Device generateDevice(Instant now) {
        String type = pick(DEVICE_TYPES);
        String manufacturer = pick(MANUFACTURERS);
        ActivityType[] activities = ActivityType.values();
        ActivityType activity = activities[random.nextInt(activities.length)];

        double usage = 1 + random.nextInt(1000);
        int priority = Device.MIN_PRIORITY + random.nextInt(Device.MAX_PRIORITY);
        Instant connectedSince = now.minus(Duration.ofHours(1 + random.nextInt(24)));
        String ipAddress = "192.168.1." + (2 + random.nextInt(253));
        double signal = 50 + random.nextInt(51);
        double data = BigDecimal.valueOf(0.1 + random.nextDouble() * 9.9)
            .setScale(2, RoundingMode.HALF_UP)
            .doubleValue();

        return new Device(manufacturer + " " + type, usage, priority, activity,
            signal, data, ipAddress, connectedSince);
    }

    private String pick(List<String> options) {
        return options.get(random.nextInt(options.size()));
    }

    @Override
    public String toString() {
        return String.format("DeviceGenerator[seed=%d, devices=%d..%d]", seed, minDevices, maxDevices);
    }
}
