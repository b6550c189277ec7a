package org.homenet.bandwidth.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.Consumer;

/**
 * Event bus for publish-subscribe communication.
 *
 * Provides:
 * - Type-safe subscription
 * - Synchronous dispatch on the publishing thread
 * - Optional bounded event history
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<Class<? extends Event>, List<Consumer<Event>>> subscribers;
    private final Deque<Event> eventHistory;
    private final int historyLimit;

    /**
     * Create a bus that keeps no history.
     */
    public EventBus() {
        this(0);
    }

    /**
     * @param historyLimit number of most recent events to keep; 0 disables history
     */
    public EventBus(int historyLimit) {
        if (historyLimit < 0) {
            throw new IllegalArgumentException("History limit cannot be negative");
        }
        this.subscribers = new ConcurrentHashMap<>();
        this.eventHistory = new ArrayDeque<>();
        this.historyLimit = historyLimit;
    }

    // ========================================================================
    // Subscription
    // ========================================================================

    /**
     * Subscribe to a specific event type.
     */
    @SuppressWarnings("unchecked")
    public <T extends Event> void subscribe(Class<T> eventType, Consumer<T> handler) {
        subscribers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>())
            .add(event -> handler.accept((T) event));
    }

    /**
     * Subscribe to all events.
     */
    public void subscribeAll(Consumer<Event> handler) {
        subscribe(Event.SimulationStartedEvent.class, handler::accept);
        subscribe(Event.SimulationStoppedEvent.class, handler::accept);
        subscribe(Event.SimulationTickEvent.class, handler::accept);
        subscribe(Event.ActivityChangedEvent.class, handler::accept);
        subscribe(Event.HistoryPrunedEvent.class, handler::accept);
    }

    // ========================================================================
    // Publishing
    // ========================================================================

    /**
     * Publish an event to all subscribers. A failing handler is logged and
     * does not stop delivery to the others.
     */
    public void publish(Event event) {
        if (historyLimit > 0) {
            synchronized (eventHistory) {
                eventHistory.addLast(event);
                while (eventHistory.size() > historyLimit) {
                    eventHistory.removeFirst();
                }
            }
        }

        List<Consumer<Event>> handlers = subscribers.get(event.getClass());
        if (handlers != null) {
            for (Consumer<Event> handler : handlers) {
                try {
                    handler.accept(event);
                } catch (Exception e) {
                    log.warn("Error in handler for {}", event.eventType(), e);
                }
            }
        }
    }

    // ========================================================================
    // History Management
    // ========================================================================

    /**
     * Get all recorded events, oldest first.
     */
    public List<Event> getHistory() {
        synchronized (eventHistory) {
            return new ArrayList<>(eventHistory);
        }
    }

    /**
     * Get recorded events of a specific type.
     */
    public <T extends Event> List<T> getHistory(Class<T> eventType) {
        List<T> filtered = new ArrayList<>();
        for (Event event : getHistory()) {
            if (eventType.isInstance(event)) {
                filtered.add(eventType.cast(event));
            }
        }
        return filtered;
    }

    public void clearHistory() {
        synchronized (eventHistory) {
            eventHistory.clear();
        }
    }

    public void clearSubscribers() {
        subscribers.clear();
    }

    @Override
    public String toString() {
        return String.format("EventBus[subscribers=%d, history=%d events]",
            subscribers.values().stream().mapToInt(List::size).sum(),
            getHistory().size());
    }
}
