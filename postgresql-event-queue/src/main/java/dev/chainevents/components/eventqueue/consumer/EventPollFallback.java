package dev.chainevents.components.eventqueue.consumer;

import dev.chainevents.components.common.Lifecycle;
import dev.chainevents.components.eventqueue.ConsumerName;
import dk.cloudcreate.essentials.shared.concurrent.ThreadFactoryBuilder;
import org.slf4j.*;

import java.time.Duration;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Periodically requests a full scan from the {@link EventDispatcher}, regardless of notification activity.<br>
 * This bounds the delivery latency of events whose notification was lost, and retries events whose handler failed.
 * <br>
 * Each poll sweeps from {@link dev.chainevents.components.eventqueue.EventId#NONE} instead of from the dispatcher's
 * cursor. Ids are assigned at insert but become visible at commit, so a transaction that commits late can make an
 * event appear below an already advanced cursor; only a sweep from the beginning is guaranteed to find it. The sweep is
 * paged by the configured batch size and only reads unprocessed rows (served by the partial index on unprocessed ids),
 * so its cost is proportional to the backlog rather than to the table size.
 */
public class EventPollFallback implements Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(EventPollFallback.class);

    private final ConsumerName    consumerName;
    private final Duration        pollingInterval;
    private final EventDispatcher eventDispatcher;

    private volatile ScheduledExecutorService scheduler;
    private volatile boolean                  started;

    public EventPollFallback(ConsumerName consumerName,
                             Duration pollingInterval,
                             EventDispatcher eventDispatcher) {
        this.consumerName = requireNonNull(consumerName, "No consumerName provided");
        this.pollingInterval = requireNonNull(pollingInterval, "No pollingInterval provided");
        this.eventDispatcher = requireNonNull(eventDispatcher, "No eventDispatcher provided");
    }

    @Override
    public void start() {
        if (!started) {
            log.info("[{}] Starting EventPollFallback with polling interval {}", consumerName, pollingInterval);
            scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                                                                           .nameFormat("EventQueue-" + consumerName + "-Polling-%d")
                                                                           .daemon(true)
                                                                           .build());
            scheduler.scheduleAtFixedRate(this::poll,
                                          pollingInterval.toMillis(),
                                          pollingInterval.toMillis(),
                                          TimeUnit.MILLISECONDS);
            started = true;
        }
    }

    @Override
    public void stop() {
        if (started) {
            log.info("[{}] Stopping EventPollFallback", consumerName);
            scheduler.shutdownNow();
            started = false;
            log.info("[{}] EventPollFallback stopped", consumerName);
        }
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    private void poll() {
        log.trace("[{}] Poll fallback requesting full scan", consumerName);
        try {
            eventDispatcher.requestFullScan();
        } catch (Exception e) {
            // An exception escaping here would cancel the fixed rate schedule
            log.error(msg("[{}] Failed to request full scan", consumerName), e);
        }
    }
}
