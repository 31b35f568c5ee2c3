package dev.chainevents.components.eventqueue.postgresql;

import dev.chainevents.components.common.Lifecycle;
import dev.chainevents.components.eventqueue.*;
import dev.chainevents.components.eventqueue.consumer.DefaultEventQueueConsumer;
import dev.chainevents.components.eventqueue.serializer.json.*;
import dev.chainevents.components.eventqueue.transaction.*;
import org.jdbi.v3.core.*;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.NamedArgumentBinding.arg;
import static dk.cloudcreate.essentials.shared.MessageFormatter.*;

/**
 * PostgreSQL implementation of the {@link EventQueue}.<br>
 * Events are stored in a single table (see {@link EventQueueSchema}) and every committed insert publishes the new
 * event's id on the configured notification channel. Consumers created through {@link #consume(EventQueueConsumerConfiguration, EventHandlers)}
 * listen on that channel (when enabled) and additionally poll the table, so no event is lost if notifications are.
 * <br>
 * Example:
 * <pre>{@code
 * var unitOfWorkFactory = new EventQueueManagedUnitOfWorkFactory(jdbi);
 * var eventQueue = new PostgresqlEventQueue(jdbi,
 *                                           unitOfWorkFactory,
 *                                           PostgresqlEventQueueConfiguration.defaultConfiguration(),
 *                                           new JacksonJSONSerializer());
 * unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
 *     // business changes using unitOfWork.handle()
 *     eventQueue.append(EventType.BLOCK, Map.of("number", 42));
 * });
 * }</pre>
 */
public class PostgresqlEventQueue implements EventQueue, Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(PostgresqlEventQueue.class);

    private final Jdbi                              jdbi;
    private final EventQueueUnitOfWorkFactory       unitOfWorkFactory;
    private final PostgresqlEventQueueConfiguration configuration;
    private final JSONSerializer                    jsonSerializer;
    private final QueuedEventRowMapper              queuedEventRowMapper;
    private final Map<ConsumerName, EventQueueConsumer> consumers = new ConcurrentHashMap<>();

    private final String insertSql;
    private final String fetchUnprocessedSql;
    private final String getEventSql;

    private volatile boolean started;

    /**
     * Create an event queue using the default configuration, an {@link EventQueueManagedUnitOfWorkFactory} and a
     * {@link JacksonJSONSerializer}
     *
     * @param jdbi the jdbi instance
     */
    public PostgresqlEventQueue(Jdbi jdbi) {
        this(jdbi,
             new EventQueueManagedUnitOfWorkFactory(jdbi),
             PostgresqlEventQueueConfiguration.defaultConfiguration(),
             new JacksonJSONSerializer());
    }

    /**
     * @param jdbi              the jdbi instance. Notification listeners open their own dedicated handles from it
     * @param unitOfWorkFactory the unit of work factory that controls the transactions events are appended in
     * @param configuration     names of the database objects and the schema initialization mode
     * @param jsonSerializer    the serializer used for <code>event_data</code>
     * @throws EventQueueException if the configuration uses {@link SchemaInitialization#VERIFY_ONLY} and the schema is missing
     */
    public PostgresqlEventQueue(Jdbi jdbi,
                                EventQueueUnitOfWorkFactory unitOfWorkFactory,
                                PostgresqlEventQueueConfiguration configuration,
                                JSONSerializer jsonSerializer) {
        this.jdbi = requireNonNull(jdbi, "No jdbi instance provided");
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.configuration = requireNonNull(configuration, "No configuration provided");
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
        this.queuedEventRowMapper = new QueuedEventRowMapper(jsonSerializer);

        insertSql = bind("INSERT INTO {:tableName} (event_type, event_data)\n" +
                                 "VALUES (CAST(:eventType AS {:eventTypeName}), CAST(:eventData AS jsonb))",
                         arg("tableName", configuration.tableName),
                         arg("eventTypeName", configuration.eventTypeName));
        fetchUnprocessedSql = bind("SELECT id, event_type, event_data, is_processed FROM {:tableName}\n" +
                                           " WHERE is_processed = false AND id > :afterId\n" +
                                           " ORDER BY id ASC\n" +
                                           " LIMIT :limit",
                                   arg("tableName", configuration.tableName));
        getEventSql = bind("SELECT id, event_type, event_data, is_processed FROM {:tableName} WHERE id = :id",
                           arg("tableName", configuration.tableName));

        initializeSchema();
    }

    protected void initializeSchema() {
        var schema = new EventQueueSchema(configuration);
        log.info("Initializing event queue schema using {}", configuration);
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            if (configuration.schemaInitialization == SchemaInitialization.CREATE_IF_MISSING) {
                schema.createIfMissing(unitOfWork.handle());
            }
            schema.verify(unitOfWork.handle());
        });
    }

    public PostgresqlEventQueueConfiguration getConfiguration() {
        return configuration;
    }

    public EventQueueUnitOfWorkFactory getUnitOfWorkFactory() {
        return unitOfWorkFactory;
    }

    @Override
    public EventId append(EventType eventType, Object eventData) {
        requireNonNull(eventType, "No eventType provided");
        requireNonNull(eventData, "No eventData provided");
        var unitOfWork = unitOfWorkFactory.getRequiredUnitOfWork();
        var data       = EventData.of(eventData, jsonSerializer);
        try {
            var eventId = EventId.of(unitOfWork.handle()
                                               .createUpdate(insertSql)
                                               .bind("eventType", eventType.name())
                                               .bind("eventData", data.getJson())
                                               .executeAndReturnGeneratedKeys("id")
                                               .mapTo(Long.class)
                                               .one());
            unitOfWork.registerEventAppended(eventId, eventType);
            log.debug("[{}] Appended {} event", eventId, eventType);
            return eventId;
        } catch (JdbiException e) {
            throw new EventQueueException(msg("Failed to append {} event to table '{}'", eventType, configuration.tableName), e);
        }
    }

    @Override
    public List<QueuedEvent> fetchUnprocessed(EventId afterId, int limit) {
        requireNonNull(afterId, "No afterId provided");
        requireTrue(limit >= 1, "limit must be >= 1");
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> {
            try {
                return unitOfWork.handle()
                                 .createQuery(fetchUnprocessedSql)
                                 .bind("afterId", afterId.longValue())
                                 .bind("limit", limit)
                                 .map(queuedEventRowMapper)
                                 .list();
            } catch (JdbiException e) {
                throw new EventQueueException(msg("Failed to fetch unprocessed events after '{}' from table '{}'", afterId, configuration.tableName), e);
            }
        });
    }

    @Override
    public MarkProcessedResult markProcessed(EventId eventId) {
        requireNonNull(eventId, "No eventId provided");
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> {
            try {
                var handle = unitOfWork.handle();
                var rowsUpdated = handle.createUpdate(bind("UPDATE {:tableName} SET is_processed = true WHERE id = :id AND is_processed = false",
                                                           arg("tableName", configuration.tableName)))
                                        .bind("id", eventId.longValue())
                                        .execute();
                if (rowsUpdated == 1) {
                    return MarkProcessedResult.SUCCESS;
                }
                var exists = handle.createQuery(bind("SELECT count(*) FROM {:tableName} WHERE id = :id",
                                                     arg("tableName", configuration.tableName)))
                                   .bind("id", eventId.longValue())
                                   .mapTo(Long.class)
                                   .one() > 0;
                return exists ? MarkProcessedResult.ALREADY_PROCESSED : MarkProcessedResult.NOT_FOUND;
            } catch (JdbiException e) {
                throw new EventQueueException("Failed to mark event as processed", e, eventId);
            }
        });
    }

    @Override
    public Optional<QueuedEvent> getEvent(EventId eventId) {
        requireNonNull(eventId, "No eventId provided");
        return unitOfWorkFactory.withHandle(handle -> handle.createQuery(getEventSql)
                                                            .bind("id", eventId.longValue())
                                                            .map(queuedEventRowMapper)
                                                            .findOne());
    }

    @Override
    public long getTotalUnprocessedEvents() {
        return unitOfWorkFactory.withHandle(handle -> handle.createQuery(bind("SELECT count(*) FROM {:tableName} WHERE is_processed = false",
                                                                              arg("tableName", configuration.tableName)))
                                                            .mapTo(Long.class)
                                                            .one());
    }

    @Override
    public int deleteProcessedEvents() {
        int deleted = unitOfWorkFactory.withHandle(handle -> handle.createUpdate(bind("DELETE FROM {:tableName} WHERE is_processed = true",
                                                                                      arg("tableName", configuration.tableName)))
                                                                   .execute());
        log.debug("Deleted {} processed event(s) from table '{}'", deleted, configuration.tableName);
        return deleted;
    }

    @Override
    public EventQueueConsumer consume(EventQueueConsumerConfiguration consumerConfiguration, EventHandlers eventHandlers) {
        requireNonNull(consumerConfiguration, "No consumerConfiguration provided");
        requireNonNull(eventHandlers, "No eventHandlers provided");
        var consumer = DefaultEventQueueConsumer.create(this,
                                                        consumerConfiguration,
                                                        eventHandlers,
                                                        callback -> {
                                                            if (!consumerConfiguration.listenForNotifications) {
                                                                return Optional.empty();
                                                            }
                                                            return Optional.of(new PostgresqlEventNotificationListener(jdbi,
                                                                                                                       configuration.channelName,
                                                                                                                       consumerConfiguration,
                                                                                                                       callback));
                                                        },
                                                        this::removeConsumer);
        if (consumers.putIfAbsent(consumerConfiguration.consumerName, consumer) != null) {
            throw new IllegalArgumentException(msg("There's already a consumer named '{}'", consumerConfiguration.consumerName));
        }
        consumer.start();
        return consumer;
    }

    void removeConsumer(EventQueueConsumer consumer) {
        requireNonNull(consumer, "No consumer provided");
        if (consumers.remove(consumer.consumerName(), consumer)) {
            log.debug("Removed consumer '{}'", consumer.consumerName());
        }
    }

    public Collection<EventQueueConsumer> getConsumers() {
        return Collections.unmodifiableCollection(consumers.values());
    }

    @Override
    public void start() {
        if (!started) {
            log.info("Starting PostgresqlEventQueue for table '{}'", configuration.tableName);
            started = true;
        }
    }

    /**
     * Stops and removes every consumer created by this event queue
     */
    @Override
    public void stop() {
        if (started || !consumers.isEmpty()) {
            log.info("Stopping PostgresqlEventQueue for table '{}' with {} consumer(s)", configuration.tableName, consumers.size());
            consumers.values().forEach(EventQueueConsumer::cancel);
            started = false;
        }
    }

    @Override
    public boolean isStarted() {
        return started;
    }
}
