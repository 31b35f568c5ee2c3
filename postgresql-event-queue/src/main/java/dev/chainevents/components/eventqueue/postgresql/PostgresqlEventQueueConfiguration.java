package dev.chainevents.components.eventqueue.postgresql;

import java.util.regex.Pattern;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Names of the database objects used by the {@link PostgresqlEventQueue}.<br>
 * The names are spliced into SQL statements and are therefore restricted to plain SQL identifiers. They're stored
 * in lower case, which is how PostgreSQL folds unquoted identifiers, so <code>LISTEN</code> and <code>pg_notify</code>
 * always agree on the channel name.
 */
public class PostgresqlEventQueueConfiguration {
    public static final String DEFAULT_TABLE_NAME      = "events";
    public static final String DEFAULT_EVENT_TYPE_NAME = "event_type";
    public static final String DEFAULT_CHANNEL_NAME    = "event_channel";

    private static final Pattern VALID_IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]{0,62}");

    public final String               tableName;
    public final String               eventTypeName;
    public final String               channelName;
    public final SchemaInitialization schemaInitialization;

    public PostgresqlEventQueueConfiguration(String tableName,
                                             String eventTypeName,
                                             String channelName,
                                             SchemaInitialization schemaInitialization) {
        this.tableName = validateIdentifier(tableName, "tableName");
        this.eventTypeName = validateIdentifier(eventTypeName, "eventTypeName");
        this.channelName = validateIdentifier(channelName, "channelName");
        this.schemaInitialization = requireNonNull(schemaInitialization, "No schemaInitialization provided");
    }

    public static PostgresqlEventQueueConfiguration defaultConfiguration() {
        return new PostgresqlEventQueueConfiguration(DEFAULT_TABLE_NAME,
                                                     DEFAULT_EVENT_TYPE_NAME,
                                                     DEFAULT_CHANNEL_NAME,
                                                     SchemaInitialization.CREATE_IF_MISSING);
    }

    public PostgresqlEventQueueConfiguration withTableName(String tableName) {
        return new PostgresqlEventQueueConfiguration(tableName, eventTypeName, channelName, schemaInitialization);
    }

    public PostgresqlEventQueueConfiguration withEventTypeName(String eventTypeName) {
        return new PostgresqlEventQueueConfiguration(tableName, eventTypeName, channelName, schemaInitialization);
    }

    public PostgresqlEventQueueConfiguration withChannelName(String channelName) {
        return new PostgresqlEventQueueConfiguration(tableName, eventTypeName, channelName, schemaInitialization);
    }

    public PostgresqlEventQueueConfiguration withSchemaInitialization(SchemaInitialization schemaInitialization) {
        return new PostgresqlEventQueueConfiguration(tableName, eventTypeName, channelName, schemaInitialization);
    }

    private static String validateIdentifier(String identifier, String description) {
        requireNonNull(identifier, msg("No {} provided", description));
        if (!VALID_IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException(msg("{} '{}' is not a valid SQL identifier", description, identifier));
        }
        return identifier.toLowerCase();
    }

    @Override
    public String toString() {
        return "PostgresqlEventQueueConfiguration{" +
                "tableName='" + tableName + '\'' +
                ", eventTypeName='" + eventTypeName + '\'' +
                ", channelName='" + channelName + '\'' +
                ", schemaInitialization=" + schemaInitialization +
                '}';
    }
}
