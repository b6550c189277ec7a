package org.homenet.bandwidth.simulation;

import org.homenet.bandwidth.config.NetworkConfig;
import org.homenet.bandwidth.event.Event;
import org.homenet.bandwidth.event.EventBus;
import org.homenet.bandwidth.history.HistoryStore;
import org.homenet.bandwidth.mechanism.BandwidthAllocator;
import org.homenet.bandwidth.model.Allocation;
import org.homenet.bandwidth.model.DeviceRegistry;
import org.homenet.bandwidth.model.HistoricalSnapshot;
import org.homenet.bandwidth.model.NetworkState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic actor that drives the device simulation.
 *
 * Each tick:
 * 1. Drifts every device's usage, signal, transfer counter and activity
 * 2. Re-runs the allocator and commits devices and allocation together
 * 3. Appends a snapshot to the history store, which prunes old entries
 * 4. Publishes tick events
 *
 * The loop is the registry's only writer. {@link #start()} claims the
 * registry for the whole run and a manual {@link #tick()} on a stopped loop
 * claims it for that tick, so a second loop can neither run nor step against
 * it concurrently. {@link #stop()} waits for an in-flight tick before
 * releasing the registry.
 *
 * <pre>
 * SimulationLoop loop = new SimulationLoop.Builder()
 *     .registry(registry)
 *     .config(config)
 *     .eventBus(bus)
 *     .build();
 * loop.start();
 * NetworkState state = loop.currentState();
 * loop.stop();
 * </pre>
 */
public class SimulationLoop {

    private static final Logger log = LoggerFactory.getLogger(SimulationLoop.class);

    public enum State { STOPPED, RUNNING }

    private final DeviceRegistry registry;
    private final BandwidthAllocator allocator;
    private final HistoryStore history;
    private final DeviceFluctuator fluctuator;
    private final EventBus eventBus;
    private final Clock clock;
    private final Duration tickPeriod;
    private final Duration stopTimeout;
    private final AtomicLong tickCount;
    private final Object tickLock;

    private volatile double totalBandwidth;
    private volatile State state;
    private volatile Thread loopThread;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickFuture;

    private SimulationLoop(Builder builder) {
        this.registry = builder.registry;
        this.allocator = builder.allocator;
        this.history = builder.history != null ? builder.history : new HistoryStore(builder.retentionWindow);
        this.fluctuator = new DeviceFluctuator(builder.random);
        this.eventBus = builder.eventBus;
        this.clock = builder.clock;
        this.tickPeriod = builder.tickPeriod;
        this.stopTimeout = builder.stopTimeout;
        this.totalBandwidth = builder.totalBandwidth;
        this.tickCount = new AtomicLong();
        this.tickLock = new Object();
        this.state = State.STOPPED;
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    /**
     * Start ticking. The first tick runs immediately.
     *
     * @return true if the loop was started, false if it was already running
     * @throws IllegalStateException if another loop owns the registry
     */
    public synchronized boolean start() {
        if (state == State.RUNNING) {
            return false;
        }
        // Waits out a manual tick that holds a temporary claim
        synchronized (tickLock) {
            if (!registry.claim(this)) {
                log.warn("Refusing to start: registry is already driven by another simulation loop");
                throw new IllegalStateException("Registry is already owned by another simulation loop");
            }

            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "simulation-loop");
                thread.setDaemon(true);
                loopThread = thread;
                return thread;
            });
            state = State.RUNNING;
            tickFuture = scheduler.scheduleAtFixedRate(
                this::scheduledTick, 0, tickPeriod.toMillis(), TimeUnit.MILLISECONDS);
        }

        log.info("Simulation started: {} devices, {} Mbps, tick every {} ms",
            registry.size(), totalBandwidth, tickPeriod.toMillis());
        eventBus.publish(new Event.SimulationStartedEvent(
            clock.instant(), registry.size(), totalBandwidth, tickPeriod.toMillis()));
        return true;
    }

    /**
     * Stop ticking. Once this returns no further tick will touch the registry,
     * unless it is called from the loop's own thread, where the current tick
     * finishes first.
     * <p>
     * If an in-flight tick outlasts the stop timeout even after an interrupt,
     * the loop keeps its claim on the registry so no other loop can write
     * while that tick may still be running. Starting and stopping this loop
     * again releases it.
     *
     * @return true if the loop was stopped, false if it was not running
     */
    public synchronized boolean stop() {
        if (state == State.STOPPED) {
            return false;
        }
        state = State.STOPPED;
        tickFuture.cancel(false);
        scheduler.shutdown();

        boolean terminated = Thread.currentThread() == loopThread || awaitTickCompletion();
        if (terminated) {
            registry.release(this);
        } else {
            log.error("In-flight tick did not finish after interrupt; keeping the registry claimed");
        }
        log.info("Simulation stopped after {} ticks", tickCount.get());
        eventBus.publish(new Event.SimulationStoppedEvent(clock.instant(), tickCount.get()));
        return true;
    }

    private boolean awaitTickCompletion() {
        long waitMs = Math.max(tickPeriod.toMillis(), stopTimeout.toMillis());
        try {
            if (scheduler.awaitTermination(waitMs, TimeUnit.MILLISECONDS)) {
                return true;
            }
            log.warn("Tick did not finish within {} ms, interrupting", waitMs);
            scheduler.shutdownNow();
            return scheduler.awaitTermination(waitMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return scheduler.isTerminated();
        }
    }

    public State getState() {
        return state;
    }

    public boolean isRunning() {
        return state == State.RUNNING;
    }

    // ========================================================================
    // Tick
    // ========================================================================

    private void scheduledTick() {
        if (state != State.RUNNING) return;
        try {
            tick();
        } catch (Exception e) {
            // Keep the schedule alive; a thrown exception would cancel it.
            log.error("Simulation tick {} failed", tickCount.get() + 1, e);
        }
    }

    /**
     * Run one tick on the calling thread. Used by the scheduler, and directly
     * by callers that step the simulation by hand. A loop that does not hold
     * the registry claims it for the duration of the tick.
     *
     * @return the snapshot recorded for this tick
     * @throws IllegalStateException if another loop owns the registry
     */
    public HistoricalSnapshot tick() {
        synchronized (tickLock) {
            boolean temporaryClaim = !registry.isOwnedBy(this);
            if (temporaryClaim && !registry.claim(this)) {
                throw new IllegalStateException("Registry is owned by another simulation loop");
            }
            try {
                return runTick();
            } finally {
                // A handler may have started this loop during the tick
                if (temporaryClaim && state != State.RUNNING) {
                    registry.release(this);
                }
            }
        }
    }

    private HistoricalSnapshot runTick() {
        Instant now = clock.instant();
        double budget = totalBandwidth;
        List<DeviceFluctuator.ActivityChange> changes = new ArrayList<>();

        NetworkState committed = registry.update(devices -> {
            changes.addAll(fluctuator.fluctuate(devices));
            return allocator.allocate(devices, budget);
        }, now);

        HistoricalSnapshot snapshot =
            new HistoricalSnapshot(now, committed.devices(), committed.allocation());
        int evicted = history.append(snapshot);
        long tickNumber = tickCount.incrementAndGet();

        for (DeviceFluctuator.ActivityChange change : changes) {
            eventBus.publish(new Event.ActivityChangedEvent(
                now, change.deviceName(), change.previous(), change.current()));
        }
        if (evicted > 0) {
            eventBus.publish(new Event.HistoryPrunedEvent(
                now, now.minus(history.getRetentionWindow()), evicted));
        }
        eventBus.publish(new Event.SimulationTickEvent(
            now, tickNumber, committed.devices().size(),
            committed.totalUsage(), committed.totalAllocated()));

        log.debug("Tick {}: usage={} Mbps, allocated={} of {} Mbps, history={}",
            tickNumber, String.format("%.1f", committed.totalUsage()),
            String.format("%.2f", committed.totalAllocated()), budget, history.size());
        return snapshot;
    }

    // ========================================================================
    // Reads
    // ========================================================================

    /**
     * Devices and allocation from the latest committed tick.
     */
    public NetworkState currentState() {
        return registry.currentState();
    }

    /**
     * Allocate the current devices against the configured budget without
     * touching the registry.
     */
    public Allocation allocateCurrent() {
        return allocator.allocate(registry.snapshot(), totalBandwidth);
    }

    /**
     * Snapshots with {@code from <= timestamp <= to}; null bounds are open.
     */
    public List<HistoricalSnapshot> history(Instant from, Instant to) {
        return history.query(from, to);
    }

    public HistoryStore getHistoryStore() {
        return history;
    }

    public DeviceRegistry getRegistry() {
        return registry;
    }

    public long getTickCount() {
        return tickCount.get();
    }

    public double getTotalBandwidth() {
        return totalBandwidth;
    }

    /**
     * Change the budget used from the next tick on.
     */
    public void setTotalBandwidth(double totalBandwidth) {
        this.totalBandwidth = Math.max(0.0, totalBandwidth);
    }

    public Duration getTickPeriod() {
        return tickPeriod;
    }

    @Override
    public String toString() {
        return String.format("SimulationLoop[%s, ticks=%d, bandwidth=%.0f, period=%s]",
            state, tickCount.get(), totalBandwidth, tickPeriod);
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private DeviceRegistry registry;
        private BandwidthAllocator allocator = new BandwidthAllocator();
        private HistoryStore history;
        private EventBus eventBus = new EventBus();
        private Random random = new Random();
        private Clock clock = Clock.systemUTC();
        private double totalBandwidth = 500.0;
        private Duration tickPeriod = Duration.ofSeconds(1);
        private Duration retentionWindow = HistoryStore.DEFAULT_RETENTION;
        private Duration stopTimeout = Duration.ofSeconds(5);

        public Builder registry(DeviceRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Take bandwidth, tick period and retention from configuration.
         */
        public Builder config(NetworkConfig config) {
            this.totalBandwidth = config.getTotalBandwidth();
            this.tickPeriod = config.getTickPeriod();
            this.retentionWindow = config.getRetentionWindow();
            return this;
        }

        public Builder allocator(BandwidthAllocator allocator) {
            this.allocator = allocator;
            return this;
        }

        /**
         * Use an existing store; its own retention window applies.
         */
        public Builder historyStore(HistoryStore history) {
            this.history = history;
            return this;
        }

        public Builder eventBus(EventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        /**
         * Random source for device drift. Pass a seeded instance for repeatable runs.
         */
        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

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

        /**
         * How long {@link SimulationLoop#stop()} waits for an in-flight tick,
         * once before and once after interrupting it.
         */
        public Builder stopTimeout(Duration stopTimeout) {
            this.stopTimeout = stopTimeout;
            return this;
        }

        public SimulationLoop build() {
            Objects.requireNonNull(registry, "registry is required");
            Objects.requireNonNull(allocator, "allocator cannot be null");
            Objects.requireNonNull(eventBus, "eventBus cannot be null");
            Objects.requireNonNull(random, "random cannot be null");
            Objects.requireNonNull(clock, "clock cannot be null");
            Objects.requireNonNull(tickPeriod, "tickPeriod cannot be null");
            Objects.requireNonNull(stopTimeout, "stopTimeout cannot be null");
            if (tickPeriod.toMillis() < 1) {
                throw new IllegalArgumentException("tickPeriod must be at least 1 ms, got " + tickPeriod);
            }
            totalBandwidth = Math.max(0.0, totalBandwidth);
            return new SimulationLoop(this);
        }
    }
}
