package com.ryuqq.unifiedstate.application.event;

import com.ryuqq.unifiedstate.core.model.StateEvent;
import com.ryuqq.unifiedstate.core.model.StateType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only, in-memory event log keyed by (stateType, stateId).
 *
 * <p>Events are appended into per-key buckets named {@code "{type}:{id}"}. Each bucket is
 * capacity-bounded; once a bucket exceeds {@link EventStoreConfig#maxEventsPerKey()} the
 * oldest entries are evicted from both the bucket and the ID index.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>buckets:</strong> LinkedHashMap&lt;String, Deque&lt;StateEvent&gt;&gt; - Per-key events in append order</li>
 *   <li><strong>eventsById:</strong> HashMap&lt;String, StateEvent&gt; - O(1) lookup by event ID</li>
 * </ul>
 *
 * <p><strong>Retention:</strong></p>
 * <p>{@link #start()} schedules {@link #purgeExpired()} on a dedicated daemon thread every
 * {@link EventStoreConfig#cleanupInterval()}. The purge drops events older than
 * {@link EventStoreConfig#retention()} and removes buckets left empty. The cleanup thread
 * and this store's lock are independent of the state manager, so a purge never contends
 * with registry access.</p>
 *
 * <p><strong>Ordering:</strong></p>
 * <ul>
 *   <li>{@link #getEvents}: most recent {@code limit} events of one key, oldest first</li>
 *   <li>{@link #getEventsSince} and {@link #getEventsByType}: sorted by timestamp explicitly;
 *       ties keep bucket creation order, then append order</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Cross-key queries are linear scans</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StateEventStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StateEventStore.class);

    private final EventStoreConfig config;
    private final Clock clock;
    private final Map<String, Deque<StateEvent>> buckets;
    private final Map<String, StateEvent> eventsById;
    private final ReadWriteLock lock;

    private ScheduledExecutorService cleanupScheduler;

    /**
     * Creates a store with default configuration and the system UTC clock.
     */
    public StateEventStore() {
        this(new EventStoreConfig());
    }

    /**
     * Creates a store with the system UTC clock.
     *
     * @param config store configuration
     */
    public StateEventStore(EventStoreConfig config) {
        this(config, Clock.systemUTC());
    }

    /**
     * Creates a store.
     *
     * @param config store configuration
     * @param clock clock used to compute the retention cutoff
     * @throws IllegalArgumentException if config or clock is null
     */
    public StateEventStore(EventStoreConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.buckets = new LinkedHashMap<>();
        this.eventsById = new HashMap<>();
        this.lock = new ReentrantReadWriteLock();
    }

    /**
     * Starts the background cleanup task. Calling it again has no effect.
     */
    public synchronized void start() {
        if (cleanupScheduler != null) {
            return;
        }
        cleanupScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "state-event-store-cleanup");
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = config.cleanupInterval().toMillis();
        cleanupScheduler.scheduleAtFixedRate(this::scheduledPurge, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("StateEventStore cleanup started: interval={}, retention={}",
            config.cleanupInterval(), config.retention());
    }

    /**
     * Stops the background cleanup task. Stored events remain readable.
     */
    @Override
    public synchronized void close() {
        if (cleanupScheduler == null) {
            return;
        }
        cleanupScheduler.shutdownNow();
        cleanupScheduler = null;
        log.info("StateEventStore cleanup stopped");
    }

    /**
     * Reports whether the background cleanup task is scheduled.
     *
     * @return true between {@link #start()} and {@link #close()}
     */
    public synchronized boolean isRunning() {
        return cleanupScheduler != null;
    }

    /**
     * Appends an event to its bucket, evicting the oldest entries beyond capacity.
     *
     * @param event event to append
     * @throws IllegalArgumentException if event is null
     */
    public void append(StateEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }

        lock.writeLock().lock();
        try {
            Deque<StateEvent> bucket = buckets.computeIfAbsent(event.bucketKey(), key -> new ArrayDeque<>());
            bucket.addLast(event);
            eventsById.put(event.id(), event);

            while (bucket.size() > config.maxEventsPerKey()) {
                StateEvent evicted = bucket.removeFirst();
                eventsById.remove(evicted.id());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the most recent {@code limit} events of one key, oldest first.
     *
     * @param stateType state type
     * @param stateId state ID
     * @param limit maximum number of events
     * @return events (may be empty)
     * @throws IllegalArgumentException if limit is not positive
     */
    public List<StateEvent> getEvents(StateType stateType, String stateId, int limit) {
        if (stateType == null) {
            throw new IllegalArgumentException("stateType cannot be null");
        }
        if (stateId == null) {
            throw new IllegalArgumentException("stateId cannot be null");
        }
        requirePositive(limit);

        lock.readLock().lock();
        try {
            Deque<StateEvent> bucket = buckets.get(StateEvent.bucketKey(stateType, stateId));
            if (bucket == null) {
                return List.of();
            }
            List<StateEvent> all = new ArrayList<>(bucket);
            int from = Math.max(0, all.size() - limit);
            return List.copyOf(all.subList(from, all.size()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Looks up an event by ID.
     *
     * @param eventId event ID
     * @return event, or empty if unknown or already evicted
     */
    public Optional<StateEvent> getEventById(String eventId) {
        if (eventId == null) {
            throw new IllegalArgumentException("eventId cannot be null");
        }

        lock.readLock().lock();
        try {
            return Optional.ofNullable(eventsById.get(eventId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns every event whose timestamp is at or after {@code since}, in timestamp order.
     *
     * @param since lower bound (inclusive)
     * @return events (may be empty)
     */
    public List<StateEvent> getEventsSince(Instant since) {
        if (since == null) {
            throw new IllegalArgumentException("since cannot be null");
        }

        lock.readLock().lock();
        try {
            List<StateEvent> result = new ArrayList<>();
            for (Deque<StateEvent> bucket : buckets.values()) {
                for (StateEvent event : bucket) {
                    if (!event.timestamp().isBefore(since)) {
                        result.add(event);
                    }
                }
            }
            result.sort(Comparator.comparing(StateEvent::timestamp));
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns up to {@code limit} events of one state type, oldest first.
     *
     * @param stateType state type
     * @param limit maximum number of events
     * @return events (may be empty)
     * @throws IllegalArgumentException if limit is not positive
     */
    public List<StateEvent> getEventsByType(StateType stateType, int limit) {
        if (stateType == null) {
            throw new IllegalArgumentException("stateType cannot be null");
        }
        requirePositive(limit);

        String prefix = stateType.id() + ":";
        lock.readLock().lock();
        try {
            List<StateEvent> result = new ArrayList<>();
            for (Map.Entry<String, Deque<StateEvent>> entry : buckets.entrySet()) {
                if (entry.getKey().startsWith(prefix)) {
                    result.addAll(entry.getValue());
                }
            }
            result.sort(Comparator.comparing(StateEvent::timestamp));
            return result.size() <= limit ? result : new ArrayList<>(result.subList(0, limit));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes every event older than the retention window and drops empty buckets.
     *
     * @return number of events removed
     */
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(config.retention());
        int purged = 0;

        lock.writeLock().lock();
        try {
            Iterator<Map.Entry<String, Deque<StateEvent>>> bucketIterator = buckets.entrySet().iterator();
            while (bucketIterator.hasNext()) {
                Deque<StateEvent> bucket = bucketIterator.next().getValue();
                Iterator<StateEvent> eventIterator = bucket.iterator();
                while (eventIterator.hasNext()) {
                    StateEvent event = eventIterator.next();
                    if (event.timestamp().isBefore(cutoff)) {
                        eventIterator.remove();
                        eventsById.remove(event.id());
                        purged++;
                    }
                }
                if (bucket.isEmpty()) {
                    bucketIterator.remove();
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (purged > 0) {
            log.info("StateEventStore purged {} events older than {}", purged, cutoff);
        }
        return purged;
    }

    /**
     * Returns the number of stored events.
     *
     * @return event count across all buckets
     */
    public int size() {
        lock.readLock().lock();
        try {
            return eventsById.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the configuration of this store.
     *
     * @return config
     */
    public EventStoreConfig config() {
        return config;
    }

    private void scheduledPurge() {
        try {
            purgeExpired();
        } catch (RuntimeException e) {
            // an exception escaping here would cancel the schedule
            log.error("StateEventStore scheduled purge failed", e);
        }
    }

    private static void requirePositive(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, but was: " + limit);
        }
    }
}
