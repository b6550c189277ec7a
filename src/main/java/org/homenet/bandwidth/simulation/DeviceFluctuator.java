package org.homenet.bandwidth.simulation;

import org.homenet.bandwidth.model.ActivityType;
import org.homenet.bandwidth.model.Device;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Applies one tick of random drift to each device.
 *
 * Per device, in this order of draws:
 * - usage += U(-50, 50), clamped to [0, 1000]
 * - signal += U(-5, 5), clamped to [50, 100]
 * - dataTransferred += U(0.01, 0.1) rounded to 2 decimals
 * - with probability 0.10, activity becomes a uniformly chosen value
 */
public class DeviceFluctuator {

    public static final double USAGE_JITTER = 50.0;
    public static final double SIGNAL_JITTER = 5.0;
    public static final double MIN_TRANSFER = 0.01;
    public static final double MAX_TRANSFER = 0.1;
    public static final double ACTIVITY_CHANGE_PROBABILITY = 0.10;

    /**
     * An activity reassignment made during a tick. The new activity may equal
     * the old one, since the draw is over all activities.
     */
    public record ActivityChange(String deviceName, ActivityType previous, ActivityType current) {}

    private final Random random;

    public DeviceFluctuator(Random random) {
        this.random = Objects.requireNonNull(random, "Random source cannot be null");
    }

    /**
     * Mutate the devices in place.
     *
     * @return activity reassignments, in device order
     */
    public List<ActivityChange> fluctuate(List<Device> devices) {
        ActivityType[] activities = ActivityType.values();
        List<ActivityChange> changes = new ArrayList<>();

        for (Device device : devices) {
            device.setUsage(device.getUsage() + uniform(-USAGE_JITTER, USAGE_JITTER));
            device.setSignalStrength(device.getSignalStrength() + uniform(-SIGNAL_JITTER, SIGNAL_JITTER));
            device.addDataTransferred(round2(uniform(MIN_TRANSFER, MAX_TRANSFER)));

            if (random.nextDouble() < ACTIVITY_CHANGE_PROBABILITY) {
                ActivityType previous = device.getActivity();
                ActivityType next = activities[random.nextInt(activities.length)];
                device.setActivity(next);
                changes.add(new ActivityChange(device.getName(), previous, next));
            }
        }
        return changes;
    }

    private double uniform(double min, double max) {
        return min + (max - min) * random.nextDouble();
    }

    private static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
