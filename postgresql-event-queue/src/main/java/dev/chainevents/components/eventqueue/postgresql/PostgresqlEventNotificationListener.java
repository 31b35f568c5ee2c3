package dev.chainevents.components.eventqueue.postgresql;

import dev.chainevents.components.eventqueue.*;
import dk.cloudcreate.essentials.shared.concurrent.ThreadFactoryBuilder;
import org.jdbi.v3.core.*;
import org.postgresql.PGConnection;
import org.slf4j.*;

import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link EventNotificationListener} that uses PostgreSQL <code>LISTEN</code> on a dedicated connection.<br>
 * The connection is polled for notifications by a single daemon thread, which blocks for at most
 * {@link EventQueueConsumerConfiguration#notificationWaitTimeout} per call so it notices shutdown promptly.
 * If the connection fails, or fails validation after {@link EventQueueConsumerConfiguration#connectionValidationInterval}
 * without notifications, the listener closes it, waits according to the
 * {@link EventQueueConsumerConfiguration#reconnectBackoff} and subscribes again.<br>
 * The connection is <code>UNLISTEN</code>'ed before it is closed, since a pooled connection returns to the pool
 * still subscribed otherwise. Every successful subscription is reported
 * through {@link Callback#onSubscribed(boolean)}, since notifications published while the listener wasn't subscribed are lost.
 * <br>
 * A payload that isn't an event id is reported as {@link EventId#NONE}, i.e. as a hint to rescan from the beginning.
 */
public class PostgresqlEventNotificationListener implements EventNotificationListener {
    private static final Logger log                                   = LoggerFactory.getLogger(PostgresqlEventNotificationListener.class);
    private static final int    CONNECTION_VALIDATION_TIMEOUT_SECONDS = 5;

    private final Jdbi          jdbi;
    private final String        channelName;
    private final ConsumerName  consumerName;
    private final Duration      notificationWaitTimeout;
    private final Duration      connectionValidationInterval;
    private final BackoffPolicy reconnectBackoff;
    private final Callback      callback;

    private volatile ExecutorService executor;
    private volatile boolean         started;
    private volatile boolean         stopping;
    private volatile boolean         paused;

    /**
     * Only accessed from the listener thread
     */
    private          Handle       handle;
    private volatile PGConnection pgConnection;

    public PostgresqlEventNotificationListener(Jdbi jdbi,
                                               String channelName,
                                               EventQueueConsumerConfiguration consumerConfiguration,
                                               Callback callback) {
        requireNonNull(consumerConfiguration, "No consumerConfiguration provided");
        this.jdbi = requireNonNull(jdbi, "No jdbi instance provided");
        this.channelName = requireNonNull(channelName, "No channelName provided");
        this.callback = requireNonNull(callback, "No callback provided");
        this.consumerName = consumerConfiguration.consumerName;
        this.notificationWaitTimeout = consumerConfiguration.notificationWaitTimeout;
        this.connectionValidationInterval = consumerConfiguration.connectionValidationInterval;
        this.reconnectBackoff = consumerConfiguration.reconnectBackoff;
    }

    @Override
    public void start() {
        if (!started) {
            log.info("[{}] Starting notification listener on channel '{}'", consumerName, channelName);
            stopping = false;
            executor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                                                                 .nameFormat("EventQueue-" + consumerName + "-Listener-%d")
                                                                 .daemon(true)
                                                                 .build());
            executor.execute(this::listen);
            started = true;
        }
    }

    @Override
    public void stop() {
        if (started) {
            log.info("[{}] Stopping notification listener on channel '{}'", consumerName, channelName);
            stopping = true;
            started = false;
            executor.shutdownNow();
            try {
                if (!executor.awaitTermination(notificationWaitTimeout.toMillis() + 5000, TimeUnit.MILLISECONDS)) {
                    log.warn("[{}] Notification listener thread didn't terminate in time", consumerName);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            log.info("[{}] Notification listener stopped", consumerName);
        }
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    /**
     * Close the subscription and keep it closed until {@link #resume()} is called
     */
    void pause() {
        log.info("[{}] Pausing notification listener", consumerName);
        paused = true;
    }

    void resume() {
        log.info("[{}] Resuming notification listener", consumerName);
        paused = false;
    }

    boolean isSubscribed() {
        return pgConnection != null;
    }

    private void listen() {
        var subscribedBefore    = false;
        var consecutiveFailures = 0;
        var lastSignOfLife      = System.nanoTime();
        while (!stopping) {
            if (paused) {
                if (handle != null) {
                    log.debug("[{}] Closing subscription since the listener is paused", consumerName);
                    closeSubscription();
                }
                if (!sleep(notificationWaitTimeout)) {
                    break;
                }
                continue;
            }
            try {
                if (pgConnection == null) {
                    subscribe();
                    consecutiveFailures = 0;
                    lastSignOfLife = System.nanoTime();
                    callback.onSubscribed(subscribedBefore);
                    subscribedBefore = true;
                }
                var notifications = pgConnection.getNotifications((int) notificationWaitTimeout.toMillis());
                if (notifications == null || notifications.length == 0) {
                    if (System.nanoTime() - lastSignOfLife >= connectionValidationInterval.toNanos()) {
                        validateConnection();
                        lastSignOfLife = System.nanoTime();
                    }
                    continue;
                }
                lastSignOfLife = System.nanoTime();
                for (var notification : notifications) {
                    if (!channelName.equals(notification.getName())) {
                        continue;
                    }
                    callback.onEventNotification(resolveEventId(notification.getParameter()));
                }
            } catch (SQLException | RuntimeException e) {
                if (stopping) {
                    break;
                }
                var delay = reconnectBackoff.calculateNextDelay(Math.min(consecutiveFailures, 1000));
                consecutiveFailures++;
                log.warn(msg("[{}] Lost subscription to channel '{}'. Reconnecting in {}", consumerName, channelName, delay), e);
                closeSubscription();
                if (!sleep(delay)) {
                    break;
                }
            }
        }
        closeSubscription();
        log.debug("[{}] Notification listener thread exiting", consumerName);
    }

    private void subscribe() throws SQLException {
        log.debug("[{}] Subscribing to channel '{}'", consumerName, channelName);
        handle = jdbi.open();
        try {
            handle.execute("LISTEN " + channelName);
            pgConnection = handle.getConnection().unwrap(PGConnection.class);
        } catch (SQLException | RuntimeException e) {
            closeSubscription();
            throw e;
        }
        log.info("[{}] Subscribed to channel '{}'", consumerName, channelName);
    }

    private void validateConnection() throws SQLException {
        log.trace("[{}] No notifications received within {}. Validating the listener connection", consumerName, connectionValidationInterval);
        if (!handle.getConnection().isValid(CONNECTION_VALIDATION_TIMEOUT_SECONDS)) {
            throw new SQLException(msg("Listener connection for channel '{}' failed validation", channelName));
        }
    }

    private EventId resolveEventId(String payload) {
        try {
            return EventId.parse(payload);
        } catch (RuntimeException e) {
            log.warn("[{}] Received notification with unexpected payload '{}' on channel '{}'. Treating it as a rescan hint",
                     consumerName,
                     payload,
                     channelName);
            return EventId.NONE;
        }
    }

    /**
     * Unsubscribe (if the connection still works) and close the handle. {@link #isSubscribed()} only turns false once
     * the connection has been released
     */
    private void closeSubscription() {
        if (handle == null) {
            pgConnection = null;
            return;
        }
        try {
            unlisten();
            handle.close();
        } catch (RuntimeException e) {
            log.debug(msg("[{}] Failed to close the listener connection", consumerName), e);
        } finally {
            handle = null;
            pgConnection = null;
        }
    }

    private void unlisten() {
        try {
            if (handle.getConnection().isValid(1)) {
                handle.execute("UNLISTEN " + channelName);
                log.debug("[{}] Unsubscribed from channel '{}'", consumerName, channelName);
            } else {
                log.debug("[{}] Skipping UNLISTEN on channel '{}' as the connection is no longer valid", consumerName, channelName);
            }
        } catch (SQLException | RuntimeException e) {
            log.debug(msg("[{}] Failed to UNLISTEN channel '{}'", consumerName, channelName), e);
        }
    }

    /**
     * @return false if the thread was interrupted
     */
    private boolean sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
