package dev.chainevents.components.common.transaction;

/**
 * A unit of work wraps a single database transaction. Everything performed through the same {@link UnitOfWork}
 * is committed or rolled back together, which is what lets a writer append an event atomically with the business
 * change that caused it.
 */
public interface UnitOfWork {
    /**
     * Begin the underlying transaction
     */
    void start();

    /**
     * Commit the underlying transaction - see {@link UnitOfWorkStatus#Committed}
     */
    void commit();

    /**
     * Roll back the underlying transaction - see {@link UnitOfWorkStatus#RolledBack}
     *
     * @param cause the cause of the rollback (may be null)
     */
    void rollback(Exception cause);

    /**
     * Roll back using the cause registered with {@link #markAsRollbackOnly(Exception)} (if any)
     */
    default void rollback() {
        rollback(getCauseOfRollback());
    }

    UnitOfWorkStatus status();

    /**
     * The cause of a rollback or of a {@link #markAsRollbackOnly(Exception)}
     */
    Exception getCauseOfRollback();

    default void markAsRollbackOnly() {
        markAsRollbackOnly(null);
    }

    void markAsRollbackOnly(Exception cause);
}
