package dev.chainevents.components.eventqueue;

import dev.chainevents.components.common.Lifecycle;

/**
 * A running consumer of an {@link EventQueue}
 */
public interface EventQueueConsumer extends Lifecycle {
    ConsumerName consumerName();

    /**
     * Stop the consumer and detach it from the {@link EventQueue} that created it
     */
    void cancel();
}
