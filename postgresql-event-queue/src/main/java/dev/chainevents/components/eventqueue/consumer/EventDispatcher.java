package dev.chainevents.components.eventqueue.consumer;

import dev.chainevents.components.common.Lifecycle;
import dev.chainevents.components.eventqueue.*;
import dk.cloudcreate.essentials.shared.concurrent.ThreadFactoryBuilder;
import org.slf4j.*;

import java.time.Duration;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Runs the matching {@link EventHandler} for unprocessed events and marks each event processed after its handler
 * completed successfully.<br>
 * Scan requests (from the poll fallback, the notification listener or a store error retry) are coalesced and executed
 * on a single dispatcher thread, so events are dispatched one at a time and in ascending id order within a scan.
 * <br>
 * Two kinds of scans exist:
 * <ul>
 *     <li>A full scan starts from {@link EventId#NONE} and visits every unprocessed event, including events whose handler
 *     failed earlier and events that committed after events with a higher id</li>
 *     <li>An incremental scan, triggered by a notification, starts after the dispatcher's cursor. A notification
 *     carrying an id at or below the cursor rewinds the next incremental scan to just before the notified id</li>
 * </ul>
 * The cursor only advances over a contiguous run of events that ended up processed. A handler failure is logged,
 * leaves the event unprocessed and pins the cursor just before the failed event, while the remaining events of the scan
 * are still dispatched.<br>
 * A store failure aborts the scan and schedules a full scan after a {@link BackoffPolicy} delay.
 */
public class EventDispatcher implements Lifecycle, EventNotificationListener.Callback {
    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final EventQueue                      eventQueue;
    private final EventHandlers                   eventHandlers;
    private final EventQueueConsumerConfiguration configuration;
    private final ConsumerName                    consumerName;

    private final AtomicBoolean fullScanRequested        = new AtomicBoolean();
    private final AtomicBoolean incrementalScanRequested = new AtomicBoolean();
    private final AtomicBoolean drainScheduled           = new AtomicBoolean();
    /**
     * Lowest id (exclusive) the next incremental scan must start from because of a notification at or below {@link #cursor}
     */
    private final AtomicLong    rewindTo                 = new AtomicLong(Long.MAX_VALUE);

    private volatile ScheduledExecutorService scheduler;
    private volatile boolean                  started;
    private volatile boolean                  stopping;

    /**
     * Every event with an id at or below the cursor has been processed, as far as this dispatcher knows.
     * Only accessed from the dispatcher thread
     */
    private EventId cursor = EventId.NONE;
    /**
     * Number of consecutive scans that failed because of a store error. Only accessed from the dispatcher thread
     */
    private int     consecutiveStoreFailures;

    public EventDispatcher(EventQueue eventQueue,
                           EventHandlers eventHandlers,
                           EventQueueConsumerConfiguration configuration) {
        this.eventQueue = requireNonNull(eventQueue, "No eventQueue provided");
        this.eventHandlers = requireNonNull(eventHandlers, "No eventHandlers provided");
        this.configuration = requireNonNull(configuration, "No configuration provided");
        this.consumerName = configuration.consumerName;
    }

    @Override
    public void start() {
        if (!started) {
            log.info("[{}] Starting EventDispatcher with batchSize {}", consumerName, configuration.batchSize);
            stopping = false;
            scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                                                                           .nameFormat("EventQueue-" + consumerName + "-Dispatcher-%d")
                                                                           .daemon(true)
                                                                           .build());
            started = true;
        }
    }

    @Override
    public void stop() {
        if (started) {
            log.info("[{}] Stopping EventDispatcher", consumerName);
            stopping = true;
            started = false;
            scheduler.shutdownNow();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("[{}] EventDispatcher thread didn't terminate within 5 seconds", consumerName);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            drainScheduled.set(false);
            log.info("[{}] EventDispatcher stopped", consumerName);
        }
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    /**
     * Request a scan of every unprocessed event. Requests that arrive while a full scan is pending are coalesced
     */
    public void requestFullScan() {
        fullScanRequested.set(true);
        scheduleDrain();
    }

    @Override
    public void onEventNotification(EventId eventId) {
        requireNonNull(eventId, "No eventId provided");
        log.trace("[{}] Received notification for event '{}'", consumerName, eventId);
        rewindTo.accumulateAndGet(eventId.longValue() - 1, Math::min);
        incrementalScanRequested.set(true);
        scheduleDrain();
    }

    @Override
    public void onSubscribed(boolean resubscribed) {
        if (resubscribed) {
            log.info("[{}] Notification subscription was re-established. Requesting catch-up scan", consumerName);
        } else {
            log.debug("[{}] Notification subscription established. Requesting catch-up scan", consumerName);
        }
        requestFullScan();
    }

    private void scheduleDrain() {
        var currentScheduler = scheduler;
        if (!started || stopping || currentScheduler == null) {
            return;
        }
        if (drainScheduled.compareAndSet(false, true)) {
            try {
                currentScheduler.execute(this::drain);
            } catch (RejectedExecutionException e) {
                drainScheduled.set(false);
                log.debug("[{}] Ignoring scan request as the EventDispatcher is shutting down", consumerName);
            }
        }
    }

    private void drain() {
        drainScheduled.set(false);
        while (!stopping) {
            boolean fullScan        = fullScanRequested.getAndSet(false);
            boolean incrementalScan = incrementalScanRequested.getAndSet(false);
            if (!fullScan && !incrementalScan) {
                return;
            }
            EventId scanFrom;
            var     rewind = rewindTo.getAndSet(Long.MAX_VALUE);
            if (fullScan) {
                scanFrom = EventId.NONE;
            } else {
                scanFrom = rewind < cursor.longValue() ? EventId.of(Math.max(rewind, 0)) : cursor;
            }
            try {
                scan(scanFrom, fullScan);
                consecutiveStoreFailures = 0;
            } catch (Exception e) {
                if (stopping) {
                    return;
                }
                var retryDelay = configuration.storeErrorBackoff.calculateNextDelay(Math.min(consecutiveStoreFailures, 1000));
                consecutiveStoreFailures++;
                log.error(msg("[{}] Failed to scan for unprocessed events after '{}'. Retrying with a full scan in {}",
                              consumerName,
                              scanFrom,
                              retryDelay), e);
                scheduleFullScanRetry(retryDelay);
                return;
            }
        }
    }

    private void scheduleFullScanRetry(Duration retryDelay) {
        try {
            scheduler.schedule(() -> {
                fullScanRequested.set(true);
                drain();
            }, retryDelay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("[{}] Not scheduling retry as the EventDispatcher is shutting down", consumerName);
        }
    }

    private void scan(EventId scanFrom, boolean fullScan) {
        log.trace("[{}] Starting {} scan after '{}'", consumerName, fullScan ? "full" : "incremental", scanFrom);
        var     afterId      = scanFrom;
        EventId firstFailure = null;
        try {
            while (!stopping) {
                var events = eventQueue.fetchUnprocessed(afterId, configuration.batchSize);
                for (var event : events) {
                    if (stopping) {
                        return;
                    }
                    var processed = dispatch(event);
                    if (!processed && firstFailure == null) {
                        firstFailure = event.id;
                    }
                    if (firstFailure == null && event.id.isAfter(cursor)) {
                        cursor = event.id;
                    }
                    afterId = event.id;
                }
                if (events.size() < configuration.batchSize) {
                    return;
                }
            }
        } finally {
            if (firstFailure != null && !firstFailure.isAfter(cursor)) {
                cursor = EventId.of(firstFailure.longValue() - 1);
            }
        }
    }

    /**
     * @return true if the event ended up processed (by this or a competing consumer)
     */
    private boolean dispatch(QueuedEvent event) {
        var handler = eventHandlers.handlerFor(event.eventType);
        log.debug("[{}:{}] Dispatching {} event", consumerName, event.id, event.eventType);
        try {
            handler.handle(event);
        } catch (Throwable e) {
            // Nothing a handler throws may escape the dispatcher thread
            log.error(msg("[{}:{}] EventHandler failed to handle {} event. The event stays unprocessed and will be retried",
                          consumerName,
                          event.id,
                          event.eventType), e);
            return false;
        }

        if (stopping) {
            log.debug("[{}:{}] Not marking event as processed since the EventDispatcher is stopping", consumerName, event.id);
            return false;
        }

        var result = eventQueue.markProcessed(event.id);
        switch (result) {
            case SUCCESS:
                log.debug("[{}:{}] Event handled and marked as processed", consumerName, event.id);
                return true;
            case ALREADY_PROCESSED:
                log.debug("[{}:{}] Event handled, but it had already been marked as processed by another consumer", consumerName, event.id);
                return true;
            case NOT_FOUND:
                log.warn("[{}:{}] Event handled, but it no longer exists in the event queue", consumerName, event.id);
                return true;
            default:
                throw new EventQueueException(msg("Unsupported MarkProcessedResult {}", result), event.id);
        }
    }
}
