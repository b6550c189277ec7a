package org.homenet.bandwidth.simulation;

import org.homenet.bandwidth.MutableClock;
import org.homenet.bandwidth.config.NetworkConfig;
import org.homenet.bandwidth.event.Event;
import org.homenet.bandwidth.event.EventBus;
import org.homenet.bandwidth.history.HistoryStore;
import org.homenet.bandwidth.model.ActivityType;
import org.homenet.bandwidth.model.Device;
import org.homenet.bandwidth.model.DeviceGenerator;
import org.homenet.bandwidth.model.DeviceRegistry;
import org.homenet.bandwidth.model.HistoricalSnapshot;
import org.homenet.bandwidth.model.NetworkState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SimulationLoop - tick semantics, retention, and start/stop lifecycle.
 */
class SimulationLoopTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private MutableClock clock;
    private DeviceRegistry registry;
    private EventBus bus;
    private final List<SimulationLoop> started = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        List<Device> devices = new DeviceGenerator(42L, Clock.fixed(T0, ZoneOffset.UTC)).generate(10);
        registry = new DeviceRegistry(devices);
        bus = new EventBus();
    }

    @AfterEach
    void tearDown() {
        started.forEach(SimulationLoop::stop);
    }

    private SimulationLoop.Builder builder() {
        return new SimulationLoop.Builder()
            .registry(registry)
            .eventBus(bus)
            .clock(clock)
            .random(new Random(1))
            .totalBandwidth(500);
    }

    private SimulationLoop track(SimulationLoop loop) {
        started.add(loop);
        return loop;
    }

    // ========================================================================
    // Manual ticks
    // ========================================================================

    @Test
    void tickCommitsAllocationAndRecordsSnapshot() {
        SimulationLoop loop = builder().build();

        HistoricalSnapshot snapshot = loop.tick();

        NetworkState state = loop.currentState();
        assertEquals(T0, state.timestamp());
        assertEquals(T0, snapshot.getTimestamp());
        assertEquals(10, snapshot.getDeviceCount());
        assertEquals(state.allocation(), snapshot.getAllocation());
        assertTrue(state.totalAllocated() <= 500.0 + 1e-9);
        assertEquals(1, loop.history(null, null).size());
        assertEquals(1, loop.getTickCount());
        state.devices().forEach(d -> assertTrue(d.getAdjustedPriority() > 0));
    }

    @Test
    void historyNeverHoldsEntriesOlderThanRetention() {
        SimulationLoop loop = builder().retentionWindow(Duration.ofMinutes(1)).build();

        for (int i = 0; i < 300; i++) {
            loop.tick();
            Instant cutoff = clock.instant().minus(Duration.ofMinutes(1));
            loop.history(null, null).forEach(s -> assertFalse(s.getTimestamp().isBefore(cutoff)));
            clock.advance(Duration.ofSeconds(1));
        }

        // One per second over a closed one-minute window
        assertEquals(61, loop.getHistoryStore().size());
    }

    @Test
    void defaultRetentionIsTwentyFourHours() {
        SimulationLoop loop = builder().build();
        List<Event.HistoryPrunedEvent> pruned = new CopyOnWriteArrayList<>();
        bus.subscribe(Event.HistoryPrunedEvent.class, pruned::add);

        // Two days at one tick per ten minutes
        for (int i = 0; i < 288; i++) {
            loop.tick();
            clock.advance(Duration.ofMinutes(10));
        }

        HistoryStore history = loop.getHistoryStore();
        Instant newest = history.latest().orElseThrow().getTimestamp();
        assertEquals(Duration.ofHours(24), history.getRetentionWindow());
        assertFalse(history.oldest().orElseThrow().getTimestamp().isBefore(newest.minus(Duration.ofHours(24))));
        assertEquals(145, history.size());
        assertFalse(pruned.isEmpty());
    }

    @Test
    void metricsStayInRangeAcrossTicks() {
        SimulationLoop loop = builder().build();
        List<Device> previous = registry.snapshot();

        for (int i = 0; i < 500; i++) {
            loop.tick();
            clock.advance(Duration.ofSeconds(1));
            List<Device> current = registry.snapshot();
            for (int d = 0; d < current.size(); d++) {
                Device device = current.get(d);
                assertTrue(device.getUsage() >= 0 && device.getUsage() <= 1000);
                assertTrue(device.getSignalStrength() >= 50 && device.getSignalStrength() <= 100);
                assertTrue(device.getDataTransferred() >= previous.get(d).getDataTransferred());
            }
            previous = current;
        }
    }

    @Test
    void seededLoopsProduceIdenticalHistories() {
        List<Device> devices = registry.snapshot();
        SimulationLoop first = builder().registry(new DeviceRegistry(devices)).random(new Random(77)).build();
        SimulationLoop second = builder().registry(new DeviceRegistry(devices)).random(new Random(77)).build();

        for (int i = 0; i < 20; i++) {
            assertEquals(first.tick().getAllocation(), second.tick().getAllocation());
        }
    }

    @Test
    void tickPublishesEvents() {
        List<Event> events = new CopyOnWriteArrayList<>();
        bus.subscribeAll(events::add);
        SimulationLoop loop = builder().build();

        for (int i = 0; i < 50; i++) {
            loop.tick();
        }

        List<Event.SimulationTickEvent> ticks = events.stream()
            .filter(Event.SimulationTickEvent.class::isInstance)
            .map(Event.SimulationTickEvent.class::cast)
            .toList();
        assertEquals(50, ticks.size());
        assertEquals(50, ticks.get(49).tickNumber());
        // 10 devices over 50 ticks at p=0.1: a reassignment is all but certain
        assertTrue(events.stream().anyMatch(Event.ActivityChangedEvent.class::isInstance));
    }

    @Test
    void budgetChangeAppliesToNextTick() {
        SimulationLoop loop = builder().build();
        loop.setTotalBandwidth(100);

        HistoricalSnapshot snapshot = loop.tick();

        assertEquals(100.0, snapshot.getAllocation().getTotalBandwidth());
        assertTrue(snapshot.getAllocation().getTotalAllocated() <= 100.0 + 1e-9);
    }

    @Test
    void allocateCurrentLeavesRegistryUntouched() {
        SimulationLoop loop = builder().build();
        loop.tick();
        NetworkState before = loop.currentState();

        loop.allocateCurrent();

        assertEquals(before.allocation(), loop.currentState().allocation());
        assertEquals(before.timestamp(), loop.currentState().timestamp());
    }

    @Test
    void configSuppliesBudgetPeriodAndRetention() {
        NetworkConfig config = new NetworkConfig.Builder()
            .totalBandwidth(250)
            .tickPeriod(Duration.ofSeconds(3))
            .retentionWindow(Duration.ofHours(2))
            .build();

        SimulationLoop loop = builder().config(config).build();

        assertEquals(250.0, loop.getTotalBandwidth());
        assertEquals(Duration.ofSeconds(3), loop.getTickPeriod());
        assertEquals(Duration.ofHours(2), loop.getHistoryStore().getRetentionWindow());
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    @Test
    @Timeout(10)
    void secondStartIsNoOp() throws InterruptedException {
        SimulationLoop loop = track(builder().clock(Clock.systemUTC()).tickPeriod(Duration.ofMillis(50)).build());

        assertTrue(loop.start());
        assertFalse(loop.start());
        assertEquals(SimulationLoop.State.RUNNING, loop.getState());

        awaitTicks(loop, 3);
        assertTrue(loop.stop());
        assertFalse(loop.stop());
        assertEquals(SimulationLoop.State.STOPPED, loop.getState());
    }

    @Test
    @Timeout(10)
    void secondLoopOnSameRegistryIsRejected() {
        SimulationLoop first = track(builder().tickPeriod(Duration.ofMillis(50)).build());
        SimulationLoop second = track(builder().tickPeriod(Duration.ofMillis(50)).build());

        first.start();
        assertThrows(IllegalStateException.class, second::start);
        assertEquals(SimulationLoop.State.STOPPED, second.getState());

        first.stop();
        assertTrue(second.start());
    }

    @Test
    @Timeout(10)
    void nonOwningLoopCannotTickWhileAnotherRuns() throws InterruptedException {
        SimulationLoop first = track(builder().clock(Clock.systemUTC()).tickPeriod(Duration.ofMillis(50)).build());
        SimulationLoop second = track(builder().build());

        first.start();
        awaitTicks(first, 1);
        assertThrows(IllegalStateException.class, second::start);
        assertThrows(IllegalStateException.class, second::tick);

        assertEquals(0, second.getTickCount());
        assertEquals(0, second.getHistoryStore().size());
        assertTrue(registry.isOwnedBy(first));

        first.stop();
        assertFalse(registry.isClaimed());
        second.tick();
        assertEquals(1, second.getTickCount());
        assertFalse(registry.isClaimed());
    }

    @Test
    void manualTickHoldsRegistryOnlyForItsDuration() {
        SimulationLoop loop = builder().build();
        SimulationLoop other = builder().build();
        List<Boolean> ownedDuringTick = new CopyOnWriteArrayList<>();
        List<Class<?>> rejected = new CopyOnWriteArrayList<>();
        bus.subscribe(Event.SimulationTickEvent.class, e -> {
            ownedDuringTick.add(registry.isOwnedBy(loop));
            try {
                other.tick();
            } catch (IllegalStateException ex) {
                rejected.add(ex.getClass());
            }
        });

        loop.tick();

        assertEquals(List.of(true), ownedDuringTick);
        assertEquals(1, rejected.size());
        assertEquals(0, other.getTickCount());
        assertFalse(registry.isClaimed());
    }

    @Test
    @Timeout(10)
    void stuckTickKeepsRegistryClaimedAfterStop() throws InterruptedException {
        AtomicBoolean blocking = new AtomicBoolean(true);
        CountDownLatch entered = new CountDownLatch(1);
        bus.subscribe(Event.SimulationTickEvent.class, e -> {
            entered.countDown();
            while (blocking.get()) {
                try {
                    Thread.sleep(5);
                } catch (InterruptedException ignored) {
                    // Simulates work that does not respond to interrupts
                }
            }
        });
        SimulationLoop loop = track(builder()
            .clock(Clock.systemUTC())
            .tickPeriod(Duration.ofMillis(20))
            .stopTimeout(Duration.ofMillis(100))
            .build());
        SimulationLoop other = track(builder().build());

        loop.start();
        entered.await();
        assertTrue(loop.stop());

        assertEquals(SimulationLoop.State.STOPPED, loop.getState());
        assertTrue(registry.isOwnedBy(loop));
        assertThrows(IllegalStateException.class, other::start);
        assertThrows(IllegalStateException.class, other::tick);

        blocking.set(false);
        assertTrue(loop.start());
        awaitTicks(loop, 2);
        assertTrue(loop.stop());
        assertFalse(registry.isClaimed());
    }

    @Test
    @Timeout(10)
    void noMutationAfterStop() throws InterruptedException {
        SimulationLoop loop = track(builder().clock(Clock.systemUTC()).tickPeriod(Duration.ofMillis(20)).build());
        loop.start();
        awaitTicks(loop, 5);

        loop.stop();
        long ticks = loop.getTickCount();
        NetworkState state = loop.currentState();
        int historySize = loop.getHistoryStore().size();

        Thread.sleep(200);

        assertEquals(ticks, loop.getTickCount());
        assertEquals(state.timestamp(), loop.currentState().timestamp());
        assertEquals(state.allocation(), loop.currentState().allocation());
        assertEquals(historySize, loop.getHistoryStore().size());
        assertEquals(state.devices().get(0).getUsage(), loop.currentState().devices().get(0).getUsage());
    }

    @Test
    @Timeout(10)
    void loopCanRestartAfterStop() throws InterruptedException {
        List<Event> lifecycle = new CopyOnWriteArrayList<>();
        bus.subscribe(Event.SimulationStartedEvent.class, lifecycle::add);
        bus.subscribe(Event.SimulationStoppedEvent.class, lifecycle::add);
        SimulationLoop loop = track(builder().clock(Clock.systemUTC()).tickPeriod(Duration.ofMillis(20)).build());

        loop.start();
        awaitTicks(loop, 2);
        loop.stop();
        long afterFirstRun = loop.getTickCount();

        loop.start();
        awaitTicks(loop, afterFirstRun + 2);
        loop.stop();

        assertEquals(4, lifecycle.size());
        assertFalse(registry.isClaimed());
    }

    @Test
    @Timeout(10)
    void stopFromTickHandlerEndsLoop() throws InterruptedException {
        SimulationLoop loop = track(builder().clock(Clock.systemUTC()).tickPeriod(Duration.ofMillis(20)).build());
        bus.subscribe(Event.SimulationTickEvent.class, e -> {
            if (e.tickNumber() == 3) loop.stop();
        });

        loop.start();
        while (loop.isRunning()) {
            Thread.sleep(10);
        }
        Thread.sleep(100);

        assertEquals(3, loop.getTickCount());
    }

    @Test
    @Timeout(10)
    void readsDuringRunSeeConsistentState() throws InterruptedException {
        Device only = new Device("Only", 500, 3, ActivityType.VIDEO_CALL, 100, 0);
        registry = new DeviceRegistry(List.of(only));
        SimulationLoop loop = track(builder().clock(Clock.systemUTC()).tickPeriod(Duration.ofMillis(5)).build());

        loop.start();
        awaitTicks(loop, 1);
        for (int i = 0; i < 200; i++) {
            NetworkState state = loop.currentState();
            Device device = state.devices().get(0);
            double expected = Math.min(500.0, Math.round(device.getUsage() * device.getAdjustedPriority() * 100) / 100.0);
            assertEquals(expected, state.allocation().getShare("Only"), 0.011);
            Thread.sleep(1);
        }
        loop.stop();
    }

    private static void awaitTicks(SimulationLoop loop, long ticks) throws InterruptedException {
        while (loop.getTickCount() < ticks) {
            Thread.sleep(5);
        }
    }
}
