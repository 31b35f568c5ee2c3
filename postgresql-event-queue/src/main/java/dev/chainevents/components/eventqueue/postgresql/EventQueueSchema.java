package dev.chainevents.components.eventqueue.postgresql;

import dev.chainevents.components.eventqueue.*;
import org.jdbi.v3.core.Handle;
import org.slf4j.*;

import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.NamedArgumentBinding.arg;
import static dk.cloudcreate.essentials.shared.MessageFormatter.*;

/**
 * Provisions and verifies the database objects behind a {@link PostgresqlEventQueue}:
 * <ul>
 *     <li>the enum type holding the closed set of {@link EventType}'s</li>
 *     <li>the events table and a partial index over its unprocessed events</li>
 *     <li>a <code>BEFORE INSERT</code> guard trigger that rejects events inserted as already processed</li>
 *     <li>the <code>AFTER INSERT</code> trigger that publishes the new event's id on the notification channel</li>
 * </ul>
 * Every step checks before it creates, so provisioning can run on every startup without re-locking an existing table.
 */
public class EventQueueSchema {
    private static final Logger log = LoggerFactory.getLogger(EventQueueSchema.class);

    private final PostgresqlEventQueueConfiguration configuration;

    public EventQueueSchema(PostgresqlEventQueueConfiguration configuration) {
        this.configuration = requireNonNull(configuration, "No configuration provided");
    }

    public String notifyFunctionName() {
        return "notify_" + configuration.channelName;
    }

    public String notifyTriggerName() {
        return "notify_" + configuration.tableName + "_listener";
    }

    public String guardFunctionName() {
        return configuration.tableName + "_reject_processed_insert";
    }

    /**
     * Create all missing database objects using the provided handle (which should be part of a transaction)
     */
    public void createIfMissing(Handle handle) {
        requireNonNull(handle, "No handle provided");
        createEventTypeEnum(handle);
        createEventsTable(handle);
        createUnprocessedIndex(handle);
        createGuardTrigger(handle);
        createNotifyTrigger(handle);
    }

    /**
     * Verify that the events table and its notification trigger exist
     *
     * @throws EventQueueException if the table or the notification trigger is missing
     */
    public void verify(Handle handle) {
        requireNonNull(handle, "No handle provided");
        Optional<String> eventsTable = handle.select("SELECT to_regclass(?)::text", configuration.tableName)
                                             .mapTo(String.class)
                                             .findOne();
        if (eventsTable.isEmpty()) {
            throw new EventQueueException(msg("Event queue table '{}' doesn't exist", configuration.tableName));
        }
        if (!hasNotifyTrigger(handle)) {
            throw new EventQueueException(msg("Event queue table '{}' has no trigger publishing on channel '{}'",
                                              configuration.tableName,
                                              configuration.channelName));
        }
        log.info("Verified event queue table '{}' and its notification trigger on channel '{}'",
                 configuration.tableName,
                 configuration.channelName);
    }

    private void createEventTypeEnum(Handle handle) {
        var labels = Arrays.stream(EventType.values())
                           .map(eventType -> "'" + eventType.name() + "'")
                           .collect(Collectors.joining(", "));
        handle.execute(bind("DO $$\n" +
                                    "BEGIN\n" +
                                    "    CREATE TYPE {:eventTypeName} AS ENUM ({:labels});\n" +
                                    "EXCEPTION\n" +
                                    "    WHEN duplicate_object THEN NULL;\n" +
                                    "END\n" +
                                    "$$",
                            arg("eventTypeName", configuration.eventTypeName),
                            arg("labels", labels)));
        log.debug("Ensured enum type '{}' with labels {}", configuration.eventTypeName, labels);
    }

    private void createEventsTable(Handle handle) {
        Optional<String> eventsTable = handle.select("SELECT to_regclass(?)::text", configuration.tableName)
                                             .mapTo(String.class)
                                             .findOne();
        if (eventsTable.isPresent()) {
            log.debug("Event queue table '{}' already exists", configuration.tableName);
            return;
        }
        handle.execute(bind("CREATE TABLE IF NOT EXISTS {:tableName} (\n" +
                                    "    id BIGSERIAL PRIMARY KEY,\n" +
                                    "    event_type {:eventTypeName} NOT NULL,\n" +
                                    "    event_data jsonb NOT NULL,\n" +
                                    "    is_processed BOOLEAN NOT NULL DEFAULT false\n" +
                                    ")",
                            arg("tableName", configuration.tableName),
                            arg("eventTypeName", configuration.eventTypeName)));
        log.info("Created event queue table '{}'", configuration.tableName);
    }

    private void createUnprocessedIndex(Handle handle) {
        handle.execute(bind("CREATE INDEX IF NOT EXISTS {:tableName}_unprocessed_idx ON {:tableName} (id) WHERE is_processed = false",
                            arg("tableName", configuration.tableName)));
        log.debug("Ensured index '{}_unprocessed_idx'", configuration.tableName);
    }

    private void createGuardTrigger(Handle handle) {
        handle.execute(bind("CREATE OR REPLACE FUNCTION {:functionName}() RETURNS TRIGGER AS $$\n" +
                                    "BEGIN\n" +
                                    "    IF NEW.is_processed THEN\n" +
                                    "        RAISE EXCEPTION 'Events must be inserted as unprocessed (table {:tableName}, id %)', NEW.id\n" +
                                    "            USING ERRCODE = 'check_violation';\n" +
                                    "    END IF;\n" +
                                    "    RETURN NEW;\n" +
                                    "END;\n" +
                                    "$$ LANGUAGE plpgsql",
                            arg("functionName", guardFunctionName()),
                            arg("tableName", configuration.tableName)));
        if (hasTrigger(handle, guardFunctionName())) {
            log.debug("Insert guard trigger '{}' on table '{}' already exists", guardFunctionName(), configuration.tableName);
            return;
        }
        createTrigger(handle, guardFunctionName(), "BEFORE", guardFunctionName());
        log.info("Created insert guard trigger '{}' on table '{}'", guardFunctionName(), configuration.tableName);
    }

    private void createNotifyTrigger(Handle handle) {
        handle.execute(bind("CREATE OR REPLACE FUNCTION {:functionName}() RETURNS TRIGGER AS $$\n" +
                                    "BEGIN\n" +
                                    "    PERFORM pg_notify('{:channelName}', NEW.id::text);\n" +
                                    "    RETURN NULL;\n" +
                                    "END;\n" +
                                    "$$ LANGUAGE plpgsql",
                            arg("functionName", notifyFunctionName()),
                            arg("channelName", configuration.channelName)));
        if (hasNotifyTrigger(handle)) {
            log.debug("Table '{}' already has a trigger publishing on channel '{}'", configuration.tableName, configuration.channelName);
            return;
        }
        createTrigger(handle, notifyTriggerName(), "AFTER", notifyFunctionName());
        log.info("Created notification trigger '{}' on table '{}' publishing on channel '{}'",
                 notifyTriggerName(),
                 configuration.tableName,
                 configuration.channelName);
    }

    /**
     * Creating a trigger locks the table exclusively, so it's only done when the trigger is missing.
     * A concurrent startup that created it first is tolerated
     */
    private void createTrigger(Handle handle, String triggerName, String timing, String functionName) {
        handle.execute(bind("DO $$\n" +
                                    "BEGIN\n" +
                                    "    CREATE TRIGGER {:triggerName}\n" +
                                    "        {:timing} INSERT ON {:tableName}\n" +
                                    "        FOR EACH ROW EXECUTE PROCEDURE {:functionName}();\n" +
                                    "EXCEPTION\n" +
                                    "    WHEN duplicate_object THEN NULL;\n" +
                                    "END\n" +
                                    "$$",
                            arg("triggerName", triggerName),
                            arg("timing", timing),
                            arg("tableName", configuration.tableName),
                            arg("functionName", functionName)));
    }

    private boolean hasTrigger(Handle handle, String triggerName) {
        return handle.createQuery("SELECT count(*) FROM pg_trigger\n" +
                                          " WHERE tgrelid = to_regclass(:tableName)\n" +
                                          "   AND tgname = :triggerName\n" +
                                          "   AND NOT tgisinternal")
                     .bind("tableName", configuration.tableName)
                     .bind("triggerName", triggerName)
                     .mapTo(Long.class)
                     .one() > 0;
    }

    /**
     * A trigger on the table whose function publishes on the channel counts, whatever its name
     */
    private boolean hasNotifyTrigger(Handle handle) {
        return handle.createQuery("SELECT count(*) FROM pg_trigger t\n" +
                                          "  JOIN pg_proc p ON p.oid = t.tgfoid\n" +
                                          " WHERE t.tgrelid = to_regclass(:tableName)\n" +
                                          "   AND NOT t.tgisinternal\n" +
                                          "   AND p.prosrc LIKE :notifyPattern")
                     .bind("tableName", configuration.tableName)
                     .bind("notifyPattern", "%pg_notify%'" + configuration.channelName + "'%")
                     .mapTo(Long.class)
                     .one() > 0;
    }
}
