package dev.chainevents.components.common.transaction;

/**
 * The status of a {@link UnitOfWork}
 */
public enum UnitOfWorkStatus {
    /**
     * Created, but the underlying transaction hasn't begun
     */
    Ready(false),
    /**
     * The underlying transaction has begun
     */
    Started(false),
    Committed(true),
    RolledBack(true),
    /**
     * The {@link UnitOfWork} MUST be rolled back when the owner completes it
     */
    MarkedForRollbackOnly(false);

    public final boolean isCompleted;

    UnitOfWorkStatus(boolean isCompleted) {
        this.isCompleted = isCompleted;
    }

    public boolean isCompleted() {
        return isCompleted;
    }

    /**
     * @return true if work may still be performed in the {@link UnitOfWork}, i.e. it is {@link #Started} or
     * {@link #MarkedForRollbackOnly}
     */
    public boolean isActive() {
        return this == Started || this == MarkedForRollbackOnly;
    }
}
