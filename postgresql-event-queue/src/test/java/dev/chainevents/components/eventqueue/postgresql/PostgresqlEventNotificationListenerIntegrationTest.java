package dev.chainevents.components.eventqueue.postgresql;

import dev.chainevents.components.eventqueue.*;
import dev.chainevents.components.eventqueue.serializer.json.JacksonJSONSerializer;
import dev.chainevents.components.eventqueue.transaction.EventQueueManagedUnitOfWorkFactory;
import org.awaitility.Awaitility;
import org.jdbi.v3.core.*;
import org.junit.jupiter.api.*;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.*;

import java.lang.reflect.*;
import java.sql.*;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.*;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class PostgresqlEventNotificationListenerIntegrationTest {
    @Container
    private static final PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:15")
            .withDatabaseName("event-queue-db")
            .withUsername("test-user")
            .withPassword("secret-password");

    private Jdbi                                jdbi;
    private EventQueueManagedUnitOfWorkFactory  unitOfWorkFactory;
    private PostgresqlEventQueue                eventQueue;
    private RecordingCallback                   callback;
    private PostgresqlEventNotificationListener listener;

    @BeforeEach
    void setup() {
        jdbi = Jdbi.create(postgreSQLContainer.getJdbcUrl(),
                           postgreSQLContainer.getUsername(),
                           postgreSQLContainer.getPassword());
        jdbi.useHandle(handle -> handle.execute("DROP TABLE IF EXISTS events"));
        unitOfWorkFactory = new EventQueueManagedUnitOfWorkFactory(jdbi);
        eventQueue = new PostgresqlEventQueue(jdbi,
                                              unitOfWorkFactory,
                                              PostgresqlEventQueueConfiguration.defaultConfiguration(),
                                              new JacksonJSONSerializer());
        callback = new RecordingCallback();
        var configuration = EventQueueConsumerConfiguration.builder(ConsumerName.of("ListenerTest"))
                                                           .notificationWaitTimeout(Duration.ofMillis(100))
                                                           .reconnectBackoff(BackoffPolicy.fixedBackoff(Duration.ofMillis(100)))
                                                           .build();
        listener = new PostgresqlEventNotificationListener(jdbi,
                                                           PostgresqlEventQueueConfiguration.DEFAULT_CHANNEL_NAME,
                                                           configuration,
                                                           callback);
    }

    @AfterEach
    void cleanup() {
        if (listener != null) {
            listener.stop();
        }
    }

    private EventId append(EventType eventType) {
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> eventQueue.append(eventType, Map.of("type", eventType.name())));
    }

    @Test
    void committed_events_are_notified_with_their_id() {
        // Given
        listener.start();
        Awaitility.waitAtMost(Duration.ofSeconds(5))
                  .untilAsserted(() -> assertThat(callback.subscriptions).containsExactly(false));

        // When
        var eventId1 = append(EventType.BLOCK);
        var eventId2 = append(EventType.TRANSACTION);

        // Then
        Awaitility.waitAtMost(Duration.ofSeconds(5))
                  .untilAsserted(() -> assertThat(callback.notifications).containsExactly(eventId1, eventId2));
    }

    @Test
    void rolled_back_events_are_never_notified() {
        // Given
        listener.start();
        Awaitility.waitAtMost(Duration.ofSeconds(5))
                  .untilAsserted(() -> assertThat(listener.isSubscribed()).isTrue());

        // When
        assertThatThrownBy(() -> unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            eventQueue.append(EventType.ACCOUNT, Map.of("address", "0x1"));
            throw new IllegalStateException("Rollback");
        })).isInstanceOf(IllegalStateException.class);
        var committedEventId = append(EventType.BLOCK);

        // Then
        Awaitility.waitAtMost(Duration.ofSeconds(5))
                  .untilAsserted(() -> assertThat(callback.notifications).containsExactly(committedEventId));
    }

    @Test
    void unexpected_payload_is_reported_as_a_rescan_hint() {
        // Given
        listener.start();
        Awaitility.waitAtMost(Duration.ofSeconds(5))
                  .untilAsserted(() -> assertThat(listener.isSubscribed()).isTrue());

        // When
        jdbi.useHandle(handle -> handle.execute("NOTIFY event_channel, 'not-an-id'"));

        // Then
        Awaitility.waitAtMost(Duration.ofSeconds(5))
                  .untilAsserted(() -> assertThat(callback.notifications).containsExactly(EventId.NONE));
    }

    @Test
    void resubscribing_after_a_pause_is_reported() {
        // Given
        listener.start();
        Awaitility.waitAtMost(Duration.ofSeconds(5))
                  .untilAsserted(() -> assertThat(listener.isSubscribed()).isTrue());

        // When
        listener.pause();
        Awaitility.waitAtMost(Duration.ofSeconds(5))
                  .untilAsserted(() -> assertThat(listener.isSubscribed()).isFalse());
        var missedEventId = append(EventType.BLOCK);
        listener.resume();

        // Then
        Awaitility.waitAtMost(Duration.ofSeconds(5))
                  .untilAsserted(() -> assertThat(callback.subscriptions).containsExactly(false, true));
        assertThat(callback.notifications).doesNotContain(missedEventId);
    }

    @Test
    void listener_reconnects_after_its_connection_is_terminated() {
        // Given
        listener.start();
        Awaitility.waitAtMost(Duration.ofSeconds(5))
                  .untilAsserted(() -> assertThat(callback.subscriptions).containsExactly(false));

        // When
        jdbi.useHandle(handle -> handle.createQuery("SELECT pg_terminate_backend(pid) FROM pg_stat_activity\n" +
                                                            " WHERE query ILIKE 'LISTEN%' AND pid <> pg_backend_pid()")
                                       .mapTo(Boolean.class)
                                       .list());

        // Then
        Awaitility.waitAtMost(Duration.ofSeconds(10))
                  .untilAsserted(() -> assertThat(callback.subscriptions).containsExactly(false, true));
        var eventId = append(EventType.ACCOUNT);
        Awaitility.waitAtMost(Duration.ofSeconds(5))
                  .untilAsserted(() -> assertThat(callback.notifications).contains(eventId));
    }

    @Test
    void stop_closes_the_subscription() {
        listener.start();
        Awaitility.waitAtMost(Duration.ofSeconds(5))
                  .untilAsserted(() -> assertThat(listener.isSubscribed()).isTrue());

        listener.stop();

        assertThat(listener.isStarted()).isFalse();
        assertThat(listener.isSubscribed()).isFalse();
    }

    @Test
    void a_reused_connection_is_released_without_a_channel_subscription() throws SQLException {
        try (var sharedConnection = openConnection()) {
            // Given
            var reusingJdbi = Jdbi.create(new ConnectionFactory() {
                @Override
                public Connection openConnection() {
                    return sharedConnection;
                }

                @Override
                public void closeConnection(Connection connection) {
                    // Kept open and handed out again, like a pooled connection
                }
            });
            listener = new PostgresqlEventNotificationListener(reusingJdbi,
                                                               PostgresqlEventQueueConfiguration.DEFAULT_CHANNEL_NAME,
                                                               EventQueueConsumerConfiguration.builder(ConsumerName.of("ReusedConnectionTest"))
                                                                                              .notificationWaitTimeout(Duration.ofMillis(100))
                                                                                              .build(),
                                                               callback);
            listener.start();
            Awaitility.waitAtMost(Duration.ofSeconds(5))
                      .untilAsserted(() -> assertThat(callback.subscriptions).containsExactly(false));
            var eventId = append(EventType.BLOCK);
            Awaitility.waitAtMost(Duration.ofSeconds(5))
                      .untilAsserted(() -> assertThat(callback.notifications).containsExactly(eventId));

            // When
            listener.pause();
            Awaitility.waitAtMost(Duration.ofSeconds(5))
                      .untilAsserted(() -> assertThat(listener.isSubscribed()).isFalse());

            // Then
            assertThat(listeningChannels(reusingJdbi)).isEmpty();

            // And When
            listener.resume();
            Awaitility.waitAtMost(Duration.ofSeconds(5))
                      .untilAsserted(() -> assertThat(callback.subscriptions).containsExactly(false, true));
            listener.stop();

            // Then
            assertThat(listeningChannels(reusingJdbi)).isEmpty();
        }
    }

    @Test
    void a_silently_dropped_connection_is_detected_and_replaced() {
        // Given
        var droppedSilently   = new AtomicBoolean();
        var openedConnections = new AtomicInteger();
        var droppableJdbi = Jdbi.create(() -> {
            var connectionNumber = openedConnections.incrementAndGet();
            return silentlyDroppable(openConnection(), () -> connectionNumber == 1 && droppedSilently.get());
        });
        listener = new PostgresqlEventNotificationListener(droppableJdbi,
                                                           PostgresqlEventQueueConfiguration.DEFAULT_CHANNEL_NAME,
                                                           EventQueueConsumerConfiguration.builder(ConsumerName.of("DroppedConnectionTest"))
                                                                                          .notificationWaitTimeout(Duration.ofMillis(100))
                                                                                          .connectionValidationInterval(Duration.ofMillis(300))
                                                                                          .reconnectBackoff(BackoffPolicy.fixedBackoff(Duration.ofMillis(100)))
                                                                                          .build(),
                                                           callback);
        listener.start();
        Awaitility.waitAtMost(Duration.ofSeconds(5))
                  .untilAsserted(() -> assertThat(callback.subscriptions).containsExactly(false));

        // When
        droppedSilently.set(true);

        // Then
        Awaitility.waitAtMost(Duration.ofSeconds(10))
                  .untilAsserted(() -> assertThat(callback.subscriptions).containsExactly(false, true));
        assertThat(openedConnections.get()).isEqualTo(2);
        var eventId = append(EventType.TRANSACTION);
        Awaitility.waitAtMost(Duration.ofSeconds(5))
                  .untilAsserted(() -> assertThat(callback.notifications).contains(eventId));
    }

    private static Connection openConnection() throws SQLException {
        return DriverManager.getConnection(postgreSQLContainer.getJdbcUrl(),
                                           postgreSQLContainer.getUsername(),
                                           postgreSQLContainer.getPassword());
    }

    private static List<String> listeningChannels(Jdbi jdbi) {
        return jdbi.withHandle(handle -> handle.createQuery("SELECT pg_listening_channels()")
                                               .mapTo(String.class)
                                               .list());
    }

    /**
     * Wraps the connection so it reports itself as invalid once <code>dropped</code> is true, while every other call
     * still succeeds and simply delivers no notifications
     */
    private static Connection silentlyDroppable(Connection connection, BooleanSupplier dropped) {
        return (Connection) Proxy.newProxyInstance(PostgresqlEventNotificationListenerIntegrationTest.class.getClassLoader(),
                                                   new Class<?>[]{Connection.class},
                                                   (proxy, method, args) -> {
                                                       if (method.getName().equals("isValid") && dropped.getAsBoolean()) {
                                                           return false;
                                                       }
                                                       try {
                                                           return method.invoke(connection, args);
                                                       } catch (InvocationTargetException e) {
                                                           throw e.getCause();
                                                       }
                                                   });
    }

    private static class RecordingCallback implements EventNotificationListener.Callback {
        final List<EventId> notifications = new CopyOnWriteArrayList<>();
        final List<Boolean> subscriptions = new CopyOnWriteArrayList<>();

        @Override
        public void onEventNotification(EventId eventId) {
            notifications.add(eventId);
        }

        @Override
        public void onSubscribed(boolean resubscribed) {
            subscriptions.add(resubscribed);
        }
    }
}
