package org.homenet.bandwidth;

import org.homenet.bandwidth.config.NetworkConfig;
import org.homenet.bandwidth.config.NetworkConfigLoader;
import org.homenet.bandwidth.event.Event;
import org.homenet.bandwidth.event.EventBus;
import org.homenet.bandwidth.history.HistoryAnalyzer;
import org.homenet.bandwidth.model.Device;
import org.homenet.bandwidth.model.DeviceGenerator;
import org.homenet.bandwidth.model.DeviceRegistry;
import org.homenet.bandwidth.model.HistoricalSnapshot;
import org.homenet.bandwidth.model.NetworkState;
import org.homenet.bandwidth.simulation.SimulationLoop;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Runs the monitor for a few seconds against generated devices and prints
 * the live state and a history summary.
 *
 * Usage: {@code NetworkMonitorDemo [--config file.yaml] [--duration seconds] [--bandwidth mbps] [--verbose]}
 */
public class NetworkMonitorDemo {

    private static final DateTimeFormatter TIME =
        DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneId.systemDefault());

    public static void main(String[] args) throws IOException, InterruptedException {
        Path configFile = null;
        long durationSec = 5;
        Double bandwidth = null;
        boolean verbose = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config", "-c" -> configFile = Path.of(args[++i]);
                case "--duration", "-d" -> durationSec = Long.parseLong(args[++i]);
                case "--bandwidth", "-b" -> bandwidth = Double.parseDouble(args[++i]);
                case "--verbose", "-v" -> verbose = true;
                default -> System.err.println("Ignoring unknown argument: " + args[i]);
            }
        }

        NetworkConfigLoader loader = new NetworkConfigLoader();
        NetworkConfig config = configFile != null ? loader.loadFromFile(configFile) : loader.loadDefault();
        if (bandwidth != null) {
            config = config.toBuilder().totalBandwidth(bandwidth).build();
        }

        List<Device> devices = config.hasInitialDevices()
            ? config.getInitialDevices()
            : new DeviceGenerator(config.getGeneratorSeed(), Clock.systemUTC())
                .setDeviceCountBounds(config.getMinDevices(), config.getMaxDevices())
                .generate();

        EventBus bus = new EventBus();
        if (verbose) {
            bus.subscribe(Event.SimulationTickEvent.class, e -> System.out.printf(
                "  Tick %d: usage=%.1f Mbps, allocated=%.2f Mbps%n",
                e.tickNumber(), e.totalUsage(), e.totalAllocated()));
            bus.subscribe(Event.ActivityChangedEvent.class, e -> System.out.printf(
                "  %s: %s -> %s%n", e.deviceName(), e.previous(), e.current()));
        }

        SimulationLoop loop = new SimulationLoop.Builder()
            .registry(new DeviceRegistry(devices))
            .config(config)
            .eventBus(bus)
            .random(new Random(config.getGeneratorSeed()))
            .build();

        System.out.println("══════════════════════════════════════════════════════════════════");
        System.out.println("HOME NETWORK BANDWIDTH MONITOR");
        System.out.println("══════════════════════════════════════════════════════════════════");
        System.out.println("  " + config);
        System.out.println();

        loop.start();
        Thread.sleep(Duration.ofSeconds(durationSec).toMillis());
        loop.stop();

        printState(loop.currentState(), config.getTotalBandwidth());
        printHistory(loop.history(null, null));
    }

    private static void printState(NetworkState state, double totalBandwidth) {
        System.out.println();
        System.out.println("Network Status:");
        System.out.printf("  Bandwidth usage: %.1f%% (%.1f Mbps)%n",
            state.utilizationPercent(totalBandwidth), state.totalUsage());
        System.out.printf("  Active devices: %d of %d%n", state.activeDeviceCount(), state.devices().size());
        System.out.printf("  Priority devices: %d%n", state.priorityDevices().size());
        System.out.println();
        System.out.printf("  %-28s %-18s %10s %10s %7s %9s%n",
            "Device", "Activity", "Usage", "Allocated", "Signal", "Data(GB)");
        for (Device device : state.devices()) {
            System.out.printf("  %-28s %-18s %10.1f %10.1f %6.0f%% %9.2f%n",
                device.getName(), device.getActivity(), device.getUsage(),
                state.allocation().getShare(device.getName()),
                device.getSignalStrength(), device.getDataTransferred());
        }
    }

    private static void printHistory(List<HistoricalSnapshot> history) {
        HistoryAnalyzer analyzer = new HistoryAnalyzer();
        System.out.println();
        System.out.println("History (" + history.size() + " snapshots):");
        analyzer.peakUsage(history).ifPresent(peak -> System.out.printf(
            "  Peak network usage: %.1f Mbps at %s%n", peak.totalUsage(), TIME.format(peak.timestamp())));

        Map<String, HistoryAnalyzer.DeviceStatistics> stats = analyzer.deviceStatistics(history);
        System.out.printf("  %-28s %10s %10s %10s %10s%n", "Device", "MeanUse", "MaxUse", "MeanAlloc", "MaxAlloc");
        for (HistoryAnalyzer.DeviceStatistics s : stats.values()) {
            System.out.printf("  %-28s %10.2f %10.2f %10.2f %10.2f%n",
                s.deviceName(), s.meanUsage(), s.maxUsage(), s.meanAllocated(), s.maxAllocated());
        }
    }
}
