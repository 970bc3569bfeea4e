package org.carma.allocation.event;

import java.util.*;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Delivers engine events to typed listeners and files them in a per-round journal.
 *
 * Events published between rounds (submissions, releases) are filed under the
 * round that will consume them. A listener registered for a supertype, such as
 * {@code Event.class}, receives every event assignable to it.
 *
 * Dispatch is synchronous on the publishing thread, so a listener runs while
 * the engine is still inside the phase that produced the event.
 */
public class EventBus {

    /**
     * Handle for a registered listener.
     */
    public interface Subscription {
        void cancel();
    }

    private record Listener<T extends Event>(Class<T> type, Consumer<? super T> handler) {
        void deliver(Event event) {
            if (type.isInstance(event)) {
                handler.accept(type.cast(event));
            }
        }
    }

    private final List<Listener<?>> listeners;
    private final NavigableMap<Integer, List<Event>> journal;
    private final boolean keepJournal;
    private final AtomicInteger openRound;
    private final AtomicLong handlerFailures;

    public EventBus() {
        this(true);
    }

    public EventBus(boolean keepJournal) {
        this.listeners = new CopyOnWriteArrayList<>();
        this.journal = new ConcurrentSkipListMap<>();
        this.keepJournal = keepJournal;
        this.openRound = new AtomicInteger(1);
        this.handlerFailures = new AtomicLong();
    }

    // ========================================================================
    // Listeners
    // ========================================================================

    public <T extends Event> Subscription subscribe(Class<T> type, Consumer<? super T> handler) {
        Listener<T> listener = new Listener<>(type, handler);
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Deliver an event to every matching listener. A listener that throws is
     * reported and counted; the others still receive the event.
     */
    public void publish(Event event) {
        if (keepJournal) {
            journal.computeIfAbsent(openRound.get(), r -> new CopyOnWriteArrayList<>()).add(event);
        }
        for (Listener<?> listener : listeners) {
            try {
                listener.deliver(event);
            } catch (RuntimeException e) {
                handlerFailures.incrementAndGet();
                System.err.println("Listener failed on " + event.eventType() + ": " + e.getMessage());
            }
        }
    }

    // ========================================================================
    // Rounds
    // ========================================================================

    /**
     * Called by the engine when a round ends, committed or aborted. Later
     * events are filed under the next round.
     */
    public void closeRound(int round) {
        openRound.set(round + 1);
    }

    public int getOpenRound() {
        return openRound.get();
    }

    // ========================================================================
    // Journal
    // ========================================================================

    public List<Event> getRoundEvents(int round) {
        return List.copyOf(journal.getOrDefault(round, List.of()));
    }

    public List<Event> getEvents() {
        List<Event> all = new ArrayList<>();
        journal.values().forEach(all::addAll);
        return all;
    }

    public <T extends Event> List<T> getEvents(Class<T> type) {
        List<T> matching = new ArrayList<>();
        for (List<Event> events : journal.values()) {
            for (Event event : events) {
                if (type.isInstance(event)) {
                    matching.add(type.cast(event));
                }
            }
        }
        return matching;
    }

    public int count(Class<? extends Event> type) {
        return getEvents(type).size();
    }

    public int size() {
        return journal.values().stream().mapToInt(List::size).sum();
    }

    public long getHandlerFailures() {
        return handlerFailures.get();
    }

    @Override
    public String toString() {
        return String.format("EventBus[listeners=%d, rounds=%d, events=%d]",
            listeners.size(), journal.size(), size());
    }
}
