package dev.chainevents.components.eventqueue.consumer;

import dev.chainevents.components.eventqueue.*;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.*;

import static org.assertj.core.api.Assertions.assertThat;

class EventDispatcherTest {
    private InMemoryEventQueue    eventQueue;
    private RecordingEventHandler eventHandler;
    private List<EventDispatcher> dispatchers;

    @BeforeEach
    void setup() {
        eventQueue = new InMemoryEventQueue();
        eventHandler = new RecordingEventHandler();
        dispatchers = new ArrayList<>();
    }

    @AfterEach
    void cleanup() {
        dispatchers.forEach(EventDispatcher::stop);
    }

    private EventDispatcher startDispatcher(String consumerName, BackoffPolicy storeErrorBackoff, EventHandler handler) {
        var configuration = EventQueueConsumerConfiguration.builder(ConsumerName.of(consumerName))
                                                           .batchSize(10)
                                                           .storeErrorBackoff(storeErrorBackoff)
                                                           .build();
        var dispatcher = new EventDispatcher(eventQueue, EventHandlers.forAllEventTypes(handler), configuration);
        dispatcher.start();
        dispatchers.add(dispatcher);
        return dispatcher;
    }

    private EventDispatcher startDispatcher(String consumerName) {
        return startDispatcher(consumerName, BackoffPolicy.fixedBackoff(Duration.ofMillis(50)), eventHandler);
    }

    private List<EventId> appendEvents(int numberOfEvents) {
        return IntStream.range(0, numberOfEvents)
                        .mapToObj(i -> eventQueue.append(EventType.values()[i % EventType.values().length], "{\"index\":" + i + "}"))
                        .collect(Collectors.toList());
    }

    @Test
    void full_scan_dispatches_every_unprocessed_event_in_ascending_id_order_across_batches() {
        // Given
        var eventIds   = appendEvents(35);
        var dispatcher = startDispatcher("Consumer");

        // When
        dispatcher.requestFullScan();

        // Then
        Awaitility.waitAtMost(Duration.ofSeconds(5))
                  .untilAsserted(() -> assertThat(eventHandler.handled).hasSize(35));
        assertThat(eventHandler.handled).containsExactlyElementsOf(eventIds);
        assertThat(eventQueue.getTotalUnprocessedEvents()).isZero();
    }

    @Test
    void notification_triggers_delivery_of_the_notified_event() {
        // Given
        var dispatcher = startDispatcher("Consumer");
        var eventId    = eventQueue.append(EventType.BLOCK, "{\"number\":1}");

        // When
        dispatcher.onEventNotification(eventId);

        // Then
        Awaitility.waitAtMost(Duration.ofSeconds(2))
                  .untilAsserted(() -> assertThat(eventHandler.handled).containsExactly(eventId));
        assertThat(eventQueue.getEvent(eventId).get().isProcessed).isTrue();
    }

    @Test
    void failing_handler_does_not_block_other_events_and_the_event_is_retried_later() {
        // Given
        var eventIds = appendEvents(3);
        eventHandler.failFor.add(eventIds.get(1));
        var dispatcher = startDispatcher("Consumer");

        // When
        dispatcher.requestFullScan();

        // Then
        Awaitility.waitAtMost(Duration.ofSeconds(2))
                  .untilAsserted(() -> assertThat(eventHandler.handled).containsExactly(eventIds.get(0), eventIds.get(2)));
        assertThat(eventQueue.getEvent(eventIds.get(1)).get().isProcessed).isFalse();

        // And When
        eventHandler.failFor.clear();
        dispatcher.requestFullScan();

        // Then
        Awaitility.waitAtMost(Duration.ofSeconds(2))
                  .untilAsserted(() -> assertThat(eventQueue.getTotalUnprocessedEvents()).isZero());
        assertThat(eventHandler.invocationsFor(eventIds.get(1))).isEqualTo(2);
    }

    @Test
    void handler_throwing_an_error_leaves_the_event_unprocessed_and_the_dispatcher_running() {
        // Given
        var eventIds     = appendEvents(3);
        var throwError   = new AtomicBoolean(true);
        var handled      = new CopyOnWriteArrayList<EventId>();
        var dispatcher   = startDispatcher("Consumer", BackoffPolicy.fixedBackoff(Duration.ofMillis(50)), event -> {
            if (event.id.equals(eventIds.get(1)) && throwError.get()) {
                throw new AssertionError("Simulated handler error for " + event.id);
            }
            handled.add(event.id);
        });

        // When
        dispatcher.requestFullScan();

        // Then
        Awaitility.waitAtMost(Duration.ofSeconds(2))
                  .untilAsserted(() -> assertThat(handled).containsExactly(eventIds.get(0), eventIds.get(2)));
        assertThat(eventQueue.getEvent(eventIds.get(1)).get().isProcessed).isFalse();

        // And When
        throwError.set(false);
        dispatcher.onEventNotification(eventIds.get(1));

        // Then
        Awaitility.waitAtMost(Duration.ofSeconds(2))
                  .untilAsserted(() -> assertThat(eventQueue.getTotalUnprocessedEvents()).isZero());
        assertThat(handled).containsExactly(eventIds.get(0), eventIds.get(2), eventIds.get(1));
    }

    @Test
    void failed_event_pins_the_cursor_so_the_next_notification_retries_it() {
        // Given
        var eventIds = appendEvents(2);
        eventHandler.failFor.add(eventIds.get(0));
        var dispatcher = startDispatcher("Consumer");
        dispatcher.onEventNotification(eventIds.get(1));
        Awaitility.waitAtMost(Duration.ofSeconds(2))
                  .untilAsserted(() -> assertThat(eventHandler.handled).containsExactly(eventIds.get(1)));
        assertThat(eventHandler.invocationsFor(eventIds.get(0))).isEqualTo(1);

        // When
        eventHandler.failFor.clear();
        var eventId3 = eventQueue.append(EventType.ACCOUNT, "{}");
        dispatcher.onEventNotification(eventId3);

        // Then
        Awaitility.waitAtMost(Duration.ofSeconds(2))
                  .untilAsserted(() -> assertThat(eventHandler.handled).containsExactly(eventIds.get(1), eventIds.get(0), eventId3));
        assertThat(eventQueue.getTotalUnprocessedEvents()).isZero();
    }

    @Test
    void store_failures_are_retried_with_a_full_scan() {
        // Given
        var eventIds = appendEvents(5);
        eventQueue.fetchFailuresToSimulate.set(3);
        var dispatcher = startDispatcher("Consumer");

        // When
        dispatcher.requestFullScan();

        // Then
        Awaitility.waitAtMost(Duration.ofSeconds(5))
                  .untilAsserted(() -> assertThat(eventHandler.handled).containsExactlyElementsOf(eventIds));
        assertThat(eventQueue.fetchFailuresToSimulate.get()).isZero();
    }

    @Test
    void crash_between_handler_success_and_marking_redelivers_the_event_exactly_once_more_after_restart() {
        // Given
        var eventId = eventQueue.append(EventType.TRANSACTION, "{\"hash\":\"0xabc\"}");
        eventQueue.failMarkProcessedOnce.add(eventId);
        var noRetry           = BackoffPolicy.fixedBackoff(Duration.ofHours(1));
        var crashedDispatcher = startDispatcher("Consumer", noRetry, eventHandler);
        crashedDispatcher.requestFullScan();
        Awaitility.waitAtMost(Duration.ofSeconds(2))
                  .untilAsserted(() -> assertThat(eventHandler.invocationsFor(eventId)).isEqualTo(1));
        crashedDispatcher.stop();
        assertThat(eventQueue.getEvent(eventId).get().isProcessed).isFalse();

        // When
        var restartedDispatcher = startDispatcher("Consumer", noRetry, eventHandler);
        restartedDispatcher.requestFullScan();

        // Then
        Awaitility.waitAtMost(Duration.ofSeconds(2))
                  .untilAsserted(() -> assertThat(eventQueue.getEvent(eventId).get().isProcessed).isTrue());
        restartedDispatcher.requestFullScan();
        Awaitility.await()
                  .during(Duration.ofMillis(300))
                  .atMost(Duration.ofSeconds(2))
                  .untilAsserted(() -> assertThat(eventHandler.invocationsFor(eventId)).isEqualTo(2));
        assertThat(eventQueue.successfulMarksFor(eventId)).isEqualTo(1);
    }

    @Test
    void competing_dispatchers_mark_each_event_processed_exactly_once() {
        // Given
        var eventIds    = appendEvents(200);
        var dispatcher1 = startDispatcher("Consumer1");
        var dispatcher2 = startDispatcher("Consumer2");

        // When
        dispatcher1.requestFullScan();
        dispatcher2.requestFullScan();

        // Then
        Awaitility.waitAtMost(Duration.ofSeconds(5))
                  .untilAsserted(() -> assertThat(eventQueue.getTotalUnprocessedEvents()).isZero());
        for (var eventId : eventIds) {
            assertThat(eventQueue.successfulMarksFor(eventId)).as("SUCCESS results for %s", eventId).isEqualTo(1);
        }
    }

    @Test
    void event_whose_handler_is_running_during_shutdown_is_left_unprocessed() throws Exception {
        // Given
        var eventId        = eventQueue.append(EventType.BLOCK, "{}");
        var handlerStarted = new CountDownLatch(1);
        var releaseHandler = new AtomicBoolean();
        var dispatcher   = startDispatcher("Consumer", BackoffPolicy.fixedBackoff(Duration.ofMillis(50)), event -> {
            handlerStarted.countDown();
            while (!releaseHandler.get()) {
                Thread.onSpinWait();
            }
        });
        dispatcher.requestFullScan();
        assertThat(handlerStarted.await(2, TimeUnit.SECONDS)).isTrue();

        // When
        var stopping = CompletableFuture.runAsync(dispatcher::stop);
        Awaitility.waitAtMost(Duration.ofSeconds(2))
                  .untilAsserted(() -> assertThat(dispatcher.isStarted()).isFalse());
        releaseHandler.set(true);
        stopping.get(10, TimeUnit.SECONDS);

        // Then
        assertThat(eventQueue.getEvent(eventId).get().isProcessed).isFalse();
        assertThat(eventQueue.markResults).isEmpty();
    }
}
