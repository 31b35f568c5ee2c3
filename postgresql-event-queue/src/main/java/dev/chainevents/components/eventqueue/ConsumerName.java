package dev.chainevents.components.eventqueue;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

/**
 * Name of an {@link EventQueueConsumer}. Used to tell concurrently running consumers apart in logs and thread names
 */
public class ConsumerName extends CharSequenceType<ConsumerName> {
    public ConsumerName(CharSequence value) {
        super(value);
    }

    public static ConsumerName of(CharSequence value) {
        return new ConsumerName(value);
    }

    public static ConsumerName random() {
        return new ConsumerName("consumer-" + UUID.randomUUID());
    }
}
