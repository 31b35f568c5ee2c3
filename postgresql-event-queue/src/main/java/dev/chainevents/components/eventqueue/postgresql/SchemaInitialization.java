package dev.chainevents.components.eventqueue.postgresql;

/**
 * How the {@link PostgresqlEventQueue} treats the database schema when it's created
 */
public enum SchemaInitialization {
    /**
     * Idempotently create the enum type, the events table, its index and triggers (the default)
     */
    CREATE_IF_MISSING,
    /**
     * The schema is provisioned by an external migration. Fail fast if the events table or its notification
     * trigger is missing
     */
    VERIFY_ONLY
}
