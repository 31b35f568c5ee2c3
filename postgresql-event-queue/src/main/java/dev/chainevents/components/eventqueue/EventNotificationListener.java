package dev.chainevents.components.eventqueue;

import dev.chainevents.components.common.Lifecycle;

/**
 * Long-lived subscription to the channel on which the store publishes the id of every committed event.<br>
 * Notifications are best-effort hints: an implementation reports every (re)subscription through
 * {@link Callback#onSubscribed(boolean)}, as anything published while it wasn't subscribed is lost.
 */
public interface EventNotificationListener extends Lifecycle {
    interface Callback {
        /**
         * A notification arrived. The event may already be processed or not yet be visible
         *
         * @param eventId the id carried by the notification
         */
        void onEventNotification(EventId eventId);

        /**
         * The listener (re)subscribed to the channel
         *
         * @param resubscribed true if this subscription replaces one that was lost
         */
        void onSubscribed(boolean resubscribed);
    }
}
