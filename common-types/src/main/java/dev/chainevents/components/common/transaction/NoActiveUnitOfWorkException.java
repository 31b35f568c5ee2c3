package dev.chainevents.components.common.transaction;

/**
 * Thrown by {@link UnitOfWorkFactory#getRequiredUnitOfWork()} when the calling thread isn't inside a {@link UnitOfWork}
 */
public class NoActiveUnitOfWorkException extends UnitOfWorkException {
    public NoActiveUnitOfWorkException() {
        super("No active UnitOfWork");
    }

    public NoActiveUnitOfWorkException(String message) {
        super(message);
    }
}
