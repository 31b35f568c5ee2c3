package dev.chainevents.components.common.transaction;

/**
 * Thrown when a {@link UnitOfWork} can't be started, completed or when the work performed inside it failed
 */
public class UnitOfWorkException extends RuntimeException {
    public UnitOfWorkException(String message) {
        super(message);
    }

    public UnitOfWorkException(String message, Throwable cause) {
        super(message, cause);
    }

    public UnitOfWorkException(Throwable cause) {
        super(cause);
    }
}
