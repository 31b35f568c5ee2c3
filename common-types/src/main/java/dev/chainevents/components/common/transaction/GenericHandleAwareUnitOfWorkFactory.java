package dev.chainevents.components.common.transaction;

import org.jdbi.v3.core.*;
import org.slf4j.*;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link HandleAwareUnitOfWorkFactory} that manages the underlying Jdbi transaction itself.<br>
 * The active {@link UnitOfWork} is bound to the calling thread.
 *
 * @param <UOW> the {@link HandleAwareUnitOfWork} type handed out, usually implemented by a {@link GenericHandleAwareUnitOfWork} subclass
 */
public abstract class GenericHandleAwareUnitOfWorkFactory<UOW extends HandleAwareUnitOfWork> implements HandleAwareUnitOfWorkFactory<UOW> {
    private static final Logger log = LoggerFactory.getLogger(GenericHandleAwareUnitOfWorkFactory.class);

    private final Jdbi             jdbi;
    private final ThreadLocal<UOW> unitOfWorks = new ThreadLocal<>();

    protected GenericHandleAwareUnitOfWorkFactory(Jdbi jdbi) {
        this.jdbi = requireNonNull(jdbi, "No jdbi instance provided");
    }

    public Jdbi getJdbi() {
        return jdbi;
    }

    @Override
    public UOW getRequiredUnitOfWork() {
        var unitOfWork = unitOfWorks.get();
        if (unitOfWork == null) {
            throw new NoActiveUnitOfWorkException();
        }
        return unitOfWork;
    }

    @Override
    public UOW getOrCreateNewUnitOfWork() {
        var unitOfWork = unitOfWorks.get();
        if (unitOfWork == null) {
            log.trace("Creating a new UnitOfWork");
            unitOfWork = createNewUnitOfWorkInstance(this);
            unitOfWork.start();
            unitOfWorks.set(unitOfWork);
        }
        return unitOfWork;
    }

    @Override
    public Optional<UOW> getCurrentUnitOfWork() {
        return Optional.ofNullable(unitOfWorks.get());
    }

    protected void removeUnitOfWork() {
        log.trace("Removing the UnitOfWork bound to the current thread");
        unitOfWorks.remove();
    }

    protected abstract UOW createNewUnitOfWorkInstance(GenericHandleAwareUnitOfWorkFactory<UOW> unitOfWorkFactory);

    /**
     * {@link HandleAwareUnitOfWork} that opens its own Jdbi {@link Handle} on {@link #start()} and closes it again when
     * the transaction is committed or rolled back.<br>
     * Subclasses can hook into the transaction boundary using {@link #beforeCommitting()}, {@link #afterCommitting()}
     * and {@link #afterRollback(Exception)}
     */
    public static class GenericHandleAwareUnitOfWork implements HandleAwareUnitOfWork {
        private final GenericHandleAwareUnitOfWorkFactory<?> unitOfWorkFactory;
        private       Handle                                 handle;
        private       UnitOfWorkStatus                       status;
        private       Exception                              causeOfRollback;

        public GenericHandleAwareUnitOfWork(GenericHandleAwareUnitOfWorkFactory<?> unitOfWorkFactory) {
            this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
            status = UnitOfWorkStatus.Ready;
        }

        @Override
        public void start() {
            if (status == UnitOfWorkStatus.Started) {
                log.warn("The UnitOfWork was already started");
                return;
            }
            if (status != UnitOfWorkStatus.Ready && !status.isCompleted()) {
                throw new UnitOfWorkException(msg("Cannot start a UnitOfWork with status {}", status));
            }
            log.trace("Opening Jdbi handle and beginning the transaction");
            handle = unitOfWorkFactory.jdbi.open();
            handle.begin();
            status = UnitOfWorkStatus.Started;
        }

        @Override
        public void commit() {
            if (status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                rollback(causeOfRollback);
                return;
            }
            if (status != UnitOfWorkStatus.Started) {
                throw new UnitOfWorkException(msg("Cannot commit a UnitOfWork with status {}", status));
            }
            try {
                beforeCommitting();
                handle.commit();
            } catch (RuntimeException e) {
                if (status == UnitOfWorkStatus.Started) {
                    rollback(e);
                }
                throw e instanceof UnitOfWorkException ? e : new UnitOfWorkException("Failed to commit the UnitOfWork", e);
            }
            status = UnitOfWorkStatus.Committed;
            close();
            afterCommitting();
        }

        @Override
        public void rollback(Exception cause) {
            if (status != UnitOfWorkStatus.Started && status != UnitOfWorkStatus.MarkedForRollbackOnly) {
                log.debug("Ignoring rollback of a UnitOfWork with status {}", status);
                return;
            }
            causeOfRollback = cause != null ? cause : causeOfRollback;
            log.debug("Rolling back the UnitOfWork{}", causeOfRollback != null ? " due to " + causeOfRollback.getMessage() : "");
            try {
                handle.rollback();
            } finally {
                status = UnitOfWorkStatus.RolledBack;
                close();
            }
            afterRollback(causeOfRollback);
        }

        @Override
        public UnitOfWorkStatus status() {
            return status;
        }

        @Override
        public Exception getCauseOfRollback() {
            return causeOfRollback;
        }

        @Override
        public void markAsRollbackOnly(Exception cause) {
            if (status.isActive()) {
                status = UnitOfWorkStatus.MarkedForRollbackOnly;
                causeOfRollback = cause;
            } else {
                log.debug("Ignoring markAsRollbackOnly for a UnitOfWork with status {}", status);
            }
        }

        @Override
        public Handle handle() {
            if (handle == null) {
                throw new UnitOfWorkException("No active transaction");
            }
            return handle;
        }

        private void close() {
            try {
                if (handle != null) {
                    handle.close();
                }
            } catch (RuntimeException e) {
                log.error("Failed to close the Jdbi handle", e);
            } finally {
                handle = null;
                unitOfWorkFactory.removeUnitOfWork();
            }
        }

        protected void beforeCommitting() {
        }

        protected void afterCommitting() {
        }

        protected void afterRollback(Exception cause) {
        }
    }
}
