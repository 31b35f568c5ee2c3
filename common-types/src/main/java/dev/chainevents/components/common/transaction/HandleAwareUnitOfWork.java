package dev.chainevents.components.common.transaction;

import org.jdbi.v3.core.Handle;

/**
 * {@link UnitOfWork} backed by a Jdbi {@link Handle}
 */
public interface HandleAwareUnitOfWork extends UnitOfWork {
    /**
     * @return the Jdbi handle bound to the transaction
     * @throws UnitOfWorkException if the transaction isn't active
     */
    Handle handle();
}
