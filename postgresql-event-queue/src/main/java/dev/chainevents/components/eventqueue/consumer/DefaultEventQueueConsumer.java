package dev.chainevents.components.eventqueue.consumer;

import dev.chainevents.components.eventqueue.*;
import org.slf4j.*;

import java.util.*;
import java.util.function.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Assembles an {@link EventDispatcher}, an {@link EventPollFallback} and an optional {@link EventNotificationListener}
 * into a single {@link EventQueueConsumer}.<br>
 * Starting the consumer requests an initial full scan, so events appended while no consumer was running are picked up
 * without waiting for a notification or the first poll.
 */
public class DefaultEventQueueConsumer implements EventQueueConsumer {
    private static final Logger log = LoggerFactory.getLogger(DefaultEventQueueConsumer.class);

    private final ConsumerName                        consumerName;
    private final EventDispatcher                     eventDispatcher;
    private final EventPollFallback                   eventPollFallback;
    private final Optional<EventNotificationListener> eventNotificationListener;
    private final Consumer<EventQueueConsumer>        onCancel;

    private volatile boolean started;

    /**
     * @param consumerName              the name of the consumer
     * @param eventDispatcher           the dispatcher that runs the handlers
     * @param eventPollFallback         the poll fallback that feeds the <code>eventDispatcher</code>
     * @param eventNotificationListener optional listener that feeds the <code>eventDispatcher</code>
     * @param onCancel                  callback invoked when the consumer is {@link #cancel()}'ed
     */
    public DefaultEventQueueConsumer(ConsumerName consumerName,
                                     EventDispatcher eventDispatcher,
                                     EventPollFallback eventPollFallback,
                                     Optional<EventNotificationListener> eventNotificationListener,
                                     Consumer<EventQueueConsumer> onCancel) {
        this.consumerName = requireNonNull(consumerName, "No consumerName provided");
        this.eventDispatcher = requireNonNull(eventDispatcher, "No eventDispatcher provided");
        this.eventPollFallback = requireNonNull(eventPollFallback, "No eventPollFallback provided");
        this.eventNotificationListener = requireNonNull(eventNotificationListener, "No eventNotificationListener option provided");
        this.onCancel = requireNonNull(onCancel, "No onCancel callback provided");
    }

    /**
     * Create a consumer (not started) that dispatches events from <code>eventQueue</code>
     *
     * @param eventQueue                       the event queue
     * @param configuration                    the consumer configuration
     * @param eventHandlers                    the event handlers
     * @param notificationListenerFactory      creates the notification listener for the dispatcher - return {@link Optional#empty()} to rely on polling alone
     * @param onCancel                         callback invoked when the consumer is {@link #cancel()}'ed
     * @return the consumer
     */
    public static DefaultEventQueueConsumer create(EventQueue eventQueue,
                                                   EventQueueConsumerConfiguration configuration,
                                                   EventHandlers eventHandlers,
                                                   Function<EventNotificationListener.Callback, Optional<EventNotificationListener>> notificationListenerFactory,
                                                   Consumer<EventQueueConsumer> onCancel) {
        requireNonNull(configuration, "No configuration provided");
        requireNonNull(notificationListenerFactory, "No notificationListenerFactory provided");
        var dispatcher = new EventDispatcher(eventQueue, eventHandlers, configuration);
        var poller     = new EventPollFallback(configuration.consumerName, configuration.pollingInterval, dispatcher);
        return new DefaultEventQueueConsumer(configuration.consumerName,
                                             dispatcher,
                                             poller,
                                             notificationListenerFactory.apply(dispatcher),
                                             onCancel);
    }

    @Override
    public void start() {
        if (!started) {
            log.info("[{}] Starting EventQueueConsumer (notifications {})",
                     consumerName,
                     eventNotificationListener.isPresent() ? "enabled" : "disabled");
            eventDispatcher.start();
            eventNotificationListener.ifPresent(EventNotificationListener::start);
            eventPollFallback.start();
            started = true;
            eventDispatcher.requestFullScan();
        }
    }

    @Override
    public void stop() {
        if (started) {
            log.info("[{}] Stopping EventQueueConsumer", consumerName);
            started = false;
            eventPollFallback.stop();
            eventNotificationListener.ifPresent(EventNotificationListener::stop);
            eventDispatcher.stop();
            log.info("[{}] EventQueueConsumer stopped", consumerName);
        }
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    @Override
    public ConsumerName consumerName() {
        return consumerName;
    }

    @Override
    public void cancel() {
        stop();
        onCancel.accept(this);
    }

    @Override
    public String toString() {
        return "DefaultEventQueueConsumer{" +
                "consumerName=" + consumerName +
                ", started=" + started +
                '}';
    }
}
