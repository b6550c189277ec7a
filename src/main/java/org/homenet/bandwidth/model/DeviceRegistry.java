package org.homenet.bandwidth.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Holds the current device set and the allocation committed with it.
 *
 * Access discipline:
 * - Readers get deep copies taken under the read lock, so they never see a
 *   device halfway through a tick
 * - The single writer mutates the live devices and commits the matching
 *   allocation inside one write-locked {@link #update} call
 * - At most one owner (a running simulation loop) may hold the registry
 */
public class DeviceRegistry {

    private final List<Device> devices;
    private final ReadWriteLock lock;
    private final AtomicReference<Object> owner;
    private Allocation allocation;
    private Instant lastUpdated;

    public DeviceRegistry(Collection<Device> initialDevices) {
        Objects.requireNonNull(initialDevices, "Initial devices cannot be null");
        this.devices = new ArrayList<>(initialDevices.size());
        for (Device device : initialDevices) {
            devices.add(device.copy());
        }
        this.lock = new ReentrantReadWriteLock();
        this.owner = new AtomicReference<>();
        this.allocation = Allocation.empty();
    }

    // ========================================================================
    // Reads
    // ========================================================================

    /**
     * Copies of all devices in registration order.
     */
    public List<Device> snapshot() {
        lock.readLock().lock();
        try {
            return copyDevices();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Devices and allocation from the same commit.
     */
    public NetworkState currentState() {
        lock.readLock().lock();
        try {
            return new NetworkState(lastUpdated, copyDevices(), allocation);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Device> getDevice(String name) {
        lock.readLock().lock();
        try {
            for (Device device : devices) {
                if (device.getName().equals(name)) {
                    return Optional.of(device.copy());
                }
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Allocation getAllocation() {
        lock.readLock().lock();
        try {
            return allocation;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return devices.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<Device> copyDevices() {
        List<Device> copies = new ArrayList<>(devices.size());
        for (Device device : devices) {
            copies.add(device.copy());
        }
        return copies;
    }

    // ========================================================================
    // Writes
    // ========================================================================

    /**
     * Run one mutation against the live devices and commit the allocation it
     * returns, all under the write lock.
     *
     * @param mutation mutates the devices in place and returns their new allocation
     * @param timestamp commit time
     * @return the committed state, as a reader would see it
     */
    public NetworkState update(Function<List<Device>, Allocation> mutation, Instant timestamp) {
        lock.writeLock().lock();
        try {
            Allocation next = mutation.apply(devices);
            this.allocation = Objects.requireNonNull(next, "Mutation must return an allocation");
            this.lastUpdated = timestamp;
            return new NetworkState(timestamp, copyDevices(), allocation);
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ========================================================================
    // Ownership
    // ========================================================================

    /**
     * Claim exclusive write ownership.
     *
     * @return true if the caller now owns the registry (or already did)
     */
    public boolean claim(Object candidate) {
        Objects.requireNonNull(candidate, "Owner cannot be null");
        return owner.compareAndSet(null, candidate) || owner.get() == candidate;
    }

    /**
     * Give up ownership. Ignored unless the caller is the current owner.
     */
    public void release(Object current) {
        owner.compareAndSet(current, null);
    }

    public boolean isClaimed() {
        return owner.get() != null;
    }

    public boolean isOwnedBy(Object candidate) {
        return candidate != null && owner.get() == candidate;
    }

    @Override
    public String toString() {
        lock.readLock().lock();
        try {
            return String.format("DeviceRegistry[devices=%d, allocated=%.2f, updated=%s]",
                devices.size(), allocation.getTotalAllocated(), lastUpdated);
        } finally {
            lock.readLock().unlock();
        }
    }
}
