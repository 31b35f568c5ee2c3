package dev.chainevents.components.eventqueue;

import java.time.Duration;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Configuration of an {@link EventQueueConsumer}.<br>
 * Use {@link #builder(ConsumerName)} and override only what differs from the defaults:
 * <ul>
 *     <li>pollingInterval: 5 seconds</li>
 *     <li>batchSize: 100</li>
 *     <li>listenForNotifications: true</li>
 *     <li>notificationWaitTimeout: 500 milliseconds</li>
 *     <li>connectionValidationInterval: 30 seconds</li>
 *     <li>reconnectBackoff: exponential from 100 milliseconds up to 30 seconds</li>
 *     <li>storeErrorBackoff: exponential from 500 milliseconds up to 1 minute</li>
 * </ul>
 */
public class EventQueueConsumerConfiguration {
    public static final Duration DEFAULT_POLLING_INTERVAL           = Duration.ofSeconds(5);
    public static final int      DEFAULT_BATCH_SIZE                 = 100;
    public static final Duration DEFAULT_NOTIFICATION_WAIT_TIMEOUT  = Duration.ofMillis(500);
    public static final Duration DEFAULT_CONNECTION_VALIDATION_INTERVAL = Duration.ofSeconds(30);

    public final ConsumerName  consumerName;
    /**
     * Interval between two poll fallback sweeps, independent of notification activity
     */
    public final Duration      pollingInterval;
    /**
     * Maximum number of events fetched per store round-trip
     */
    public final int           batchSize;
    /**
     * Should the consumer subscribe to the notification channel (when the {@link EventQueue} supports it)
     */
    public final boolean       listenForNotifications;
    /**
     * How long the notification listener blocks waiting for notifications before checking for shutdown
     */
    public final Duration      notificationWaitTimeout;
    /**
     * How long the notification listener may go without receiving a notification before it validates its connection.
     * A silently dropped connection delivers no notifications and raises no error, so it is only detected this way
     */
    public final Duration      connectionValidationInterval;
    public final BackoffPolicy reconnectBackoff;
    public final BackoffPolicy storeErrorBackoff;

    public EventQueueConsumerConfiguration(ConsumerName consumerName,
                                           Duration pollingInterval,
                                           int batchSize,
                                           boolean listenForNotifications,
                                           Duration notificationWaitTimeout,
                                           Duration connectionValidationInterval,
                                           BackoffPolicy reconnectBackoff,
                                           BackoffPolicy storeErrorBackoff) {
        this.consumerName = requireNonNull(consumerName, "No consumerName provided");
        this.pollingInterval = requireNonNull(pollingInterval, "No pollingInterval provided");
        this.notificationWaitTimeout = requireNonNull(notificationWaitTimeout, "No notificationWaitTimeout provided");
        this.connectionValidationInterval = requireNonNull(connectionValidationInterval, "No connectionValidationInterval provided");
        this.reconnectBackoff = requireNonNull(reconnectBackoff, "No reconnectBackoff provided");
        this.storeErrorBackoff = requireNonNull(storeErrorBackoff, "No storeErrorBackoff provided");
        requireTrue(pollingInterval.toMillis() > 0, "pollingInterval must be positive");
        requireTrue(batchSize >= 1, "batchSize must be >= 1");
        requireTrue(notificationWaitTimeout.toMillis() > 0, "notificationWaitTimeout must be positive");
        requireTrue(notificationWaitTimeout.toMillis() <= Integer.MAX_VALUE, "notificationWaitTimeout is too large");
        requireTrue(connectionValidationInterval.toMillis() > 0, "connectionValidationInterval must be positive");
        this.batchSize = batchSize;
        this.listenForNotifications = listenForNotifications;
    }

    public static Builder builder(ConsumerName consumerName) {
        return new Builder(consumerName);
    }

    @Override
    public String toString() {
        return "EventQueueConsumerConfiguration{" +
                "consumerName=" + consumerName +
                ", pollingInterval=" + pollingInterval +
                ", batchSize=" + batchSize +
                ", listenForNotifications=" + listenForNotifications +
                ", notificationWaitTimeout=" + notificationWaitTimeout +
                ", connectionValidationInterval=" + connectionValidationInterval +
                ", reconnectBackoff=" + reconnectBackoff +
                ", storeErrorBackoff=" + storeErrorBackoff +
                '}';
    }

    public static final class Builder {
        private final ConsumerName  consumerName;
        private       Duration      pollingInterval         = DEFAULT_POLLING_INTERVAL;
        private       int           batchSize               = DEFAULT_BATCH_SIZE;
        private       boolean       listenForNotifications  = true;
        private       Duration      notificationWaitTimeout = DEFAULT_NOTIFICATION_WAIT_TIMEOUT;
        private       Duration      connectionValidationInterval = DEFAULT_CONNECTION_VALIDATION_INTERVAL;
        private       BackoffPolicy reconnectBackoff        = BackoffPolicy.exponentialBackoff(Duration.ofMillis(100),
                                                                                               Duration.ofMillis(100),
                                                                                               2.0d,
                                                                                               Duration.ofSeconds(30));
        private       BackoffPolicy storeErrorBackoff       = BackoffPolicy.exponentialBackoff(Duration.ofMillis(500),
                                                                                               Duration.ofMillis(500),
                                                                                               2.0d,
                                                                                               Duration.ofMinutes(1));

        private Builder(ConsumerName consumerName) {
            this.consumerName = requireNonNull(consumerName, "No consumerName provided");
        }

        public Builder pollingInterval(Duration pollingInterval) {
            this.pollingInterval = pollingInterval;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder listenForNotifications(boolean listenForNotifications) {
            this.listenForNotifications = listenForNotifications;
            return this;
        }

        public Builder notificationWaitTimeout(Duration notificationWaitTimeout) {
            this.notificationWaitTimeout = notificationWaitTimeout;
            return this;
        }

        public Builder connectionValidationInterval(Duration connectionValidationInterval) {
            this.connectionValidationInterval = connectionValidationInterval;
            return this;
        }

        public Builder reconnectBackoff(BackoffPolicy reconnectBackoff) {
            this.reconnectBackoff = reconnectBackoff;
            return this;
        }

        public Builder storeErrorBackoff(BackoffPolicy storeErrorBackoff) {
            this.storeErrorBackoff = storeErrorBackoff;
            return this;
        }

        public EventQueueConsumerConfiguration build() {
            return new EventQueueConsumerConfiguration(consumerName,
                                                       pollingInterval,
                                                       batchSize,
                                                       listenForNotifications,
                                                       notificationWaitTimeout,
                                                       connectionValidationInterval,
                                                       reconnectBackoff,
                                                       storeErrorBackoff);
        }
    }
}
