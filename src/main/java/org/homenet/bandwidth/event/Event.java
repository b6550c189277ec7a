package org.homenet.bandwidth.event;

import org.homenet.bandwidth.model.ActivityType;

import java.time.Instant;

/**
 * Base interface for events published by the simulation loop.
 */
public sealed interface Event permits
        Event.SimulationStartedEvent,
        Event.SimulationStoppedEvent,
        Event.SimulationTickEvent,
        Event.ActivityChangedEvent,
        Event.HistoryPrunedEvent {

    Instant timestamp();
    String eventType();

    // ========================================================================
    // Event Types
    // ========================================================================

    /**
     * Loop moved from stopped to running.
     */
    record SimulationStartedEvent(
            Instant timestamp,
            int deviceCount,
            double totalBandwidth,
            long tickPeriodMs
    ) implements Event {
        public String eventType() { return "SIMULATION_STARTED"; }
    }

    /**
     * Loop moved from running to stopped.
     */
    record SimulationStoppedEvent(
            Instant timestamp,
            long ticksCompleted
    ) implements Event {
        public String eventType() { return "SIMULATION_STOPPED"; }
    }

    /**
     * One tick finished and its snapshot was recorded.
     */
    record SimulationTickEvent(
            Instant timestamp,
            long tickNumber,
            int deviceCount,
            double totalUsage,
            double totalAllocated
    ) implements Event {
        public String eventType() { return "SIMULATION_TICK"; }
    }

    /**
     * A device switched activity during a tick.
     */
    record ActivityChangedEvent(
            Instant timestamp,
            String deviceName,
            ActivityType previous,
            ActivityType current
    ) implements Event {
        public String eventType() { return "ACTIVITY_CHANGED"; }
    }

    /**
     * Snapshots older than the retention window were evicted.
     */
    record HistoryPrunedEvent(
            Instant timestamp,
            Instant cutoff,
            int evicted
    ) implements Event {
        public String eventType() { return "HISTORY_PRUNED"; }
    }
}
