package dev.chainevents.components.eventqueue.postgresql.spring;

import dev.chainevents.components.common.transaction.*;
import dev.chainevents.components.eventqueue.*;
import dev.chainevents.components.eventqueue.transaction.*;
import org.jdbi.v3.core.*;
import org.jdbi.v3.core.config.Handles;
import org.slf4j.*;
import org.springframework.jdbc.datasource.TransactionAwareDataSourceProxy;
import org.springframework.transaction.*;
import org.springframework.transaction.support.*;

import javax.sql.DataSource;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link UnitOfWorkFactory} variant where the {@link EventQueue} {@link UnitOfWork}'s underlying transaction is
 * managed by Spring.<br>
 * Inside a Spring managed transaction (e.g. a <code>@Transactional</code> method) the {@link UnitOfWork} joins that
 * transaction, so {@link EventQueue#append(EventType, Object)} commits or rolls back together with the caller's other
 * changes. Outside a Spring managed transaction a new Spring transaction is started and committed by the {@link UnitOfWork}.
 * <br>
 * The {@link Jdbi} instance must be created over a {@link TransactionAwareDataSourceProxy}, which
 * {@link #SpringManagedUnitOfWorkFactory(DataSource, PlatformTransactionManager)} takes care of.
 */
public class SpringManagedUnitOfWorkFactory implements EventQueueUnitOfWorkFactory {
    private static final Logger log = LoggerFactory.getLogger(SpringManagedUnitOfWorkFactory.class);

    private final Jdbi                               jdbi;
    private final PlatformTransactionManager         transactionManager;
    private final List<AppendedEventsCommitCallback> callbacks;
    private final DefaultTransactionDefinition       defaultTransactionDefinition;

    /**
     * @param dataSource         the (non proxied) data source the <code>transactionManager</code> manages
     * @param transactionManager the Spring transaction manager
     */
    public SpringManagedUnitOfWorkFactory(DataSource dataSource,
                                          PlatformTransactionManager transactionManager) {
        this(createJdbi(dataSource), transactionManager);
    }

    /**
     * @param jdbi               a jdbi instance created using {@link #createJdbi(DataSource)}
     * @param transactionManager the Spring transaction manager
     */
    public SpringManagedUnitOfWorkFactory(Jdbi jdbi,
                                          PlatformTransactionManager transactionManager) {
        this.jdbi = requireNonNull(jdbi, "No jdbi instance provided");
        this.transactionManager = requireNonNull(transactionManager, "No transactionManager provided");
        callbacks = new CopyOnWriteArrayList<>();
        defaultTransactionDefinition = new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRED);
        defaultTransactionDefinition.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
    }

    /**
     * Create a {@link Jdbi} instance whose handles use the connection bound to the current Spring transaction
     *
     * @param dataSource the (non proxied) data source
     * @return the jdbi instance
     */
    public static Jdbi createJdbi(DataSource dataSource) {
        requireNonNull(dataSource, "No dataSource provided");
        var jdbi = Jdbi.create(new TransactionAwareDataSourceProxy(dataSource));
        // Spring commits or rolls back the transaction, not the Jdbi handle
        jdbi.getConfig(Handles.class).setForceEndTransactions(false);
        return jdbi;
    }

    public Jdbi getJdbi() {
        return jdbi;
    }

    @Override
    public EventQueueUnitOfWork getRequiredUnitOfWork() {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new NoActiveUnitOfWorkException();
        }
        return getOrCreateNewUnitOfWork();
    }

    @Override
    public EventQueueUnitOfWork getOrCreateNewUnitOfWork() {
        SpringManagedUnitOfWork unitOfWork;
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            log.debug("Manually starting a new Spring Managed Transaction and associating it with a new UnitOfWork");
            var transaction = transactionManager.getTransaction(defaultTransactionDefinition);
            unitOfWork = new SpringManagedUnitOfWork(Optional.of(transaction));
            bind(unitOfWork);
        } else {
            unitOfWork = (SpringManagedUnitOfWork) TransactionSynchronizationManager.getResource(SpringManagedUnitOfWork.class);
            if (unitOfWork == null) {
                log.debug("Creating a new UnitOfWork and associating it with an existing Spring Transaction");
                unitOfWork = new SpringManagedUnitOfWork(Optional.empty());
                bind(unitOfWork);
            }
        }
        return unitOfWork;
    }

    private void bind(SpringManagedUnitOfWork unitOfWork) {
        unitOfWork.start();
        TransactionSynchronizationManager.bindResource(SpringManagedUnitOfWork.class, unitOfWork);
        log.trace("Registering a {} for the UnitOfWork", SpringManagedUnitOfWorkSynchronization.class.getName());
        TransactionSynchronizationManager.registerSynchronization(new SpringManagedUnitOfWorkSynchronization(unitOfWork));
    }

    @Override
    public Optional<EventQueueUnitOfWork> getCurrentUnitOfWork() {
        return Optional.ofNullable((SpringManagedUnitOfWork) TransactionSynchronizationManager.getResource(SpringManagedUnitOfWork.class));
    }

    @Override
    public EventQueueUnitOfWorkFactory registerAppendedEventsCommitCallback(AppendedEventsCommitCallback callback) {
        callbacks.add(requireNonNull(callback, "No callback provided"));
        return this;
    }

    private void removeUnitOfWork() {
        log.trace("Removing Spring Managed UnitOfWork");
        if (TransactionSynchronizationManager.hasResource(SpringManagedUnitOfWork.class)) {
            TransactionSynchronizationManager.unbindResource(SpringManagedUnitOfWork.class);
        }
    }

    private class SpringManagedUnitOfWork implements EventQueueUnitOfWork {
        private final Optional<TransactionStatus> manuallyStartedSpringTransaction;
        private final List<EventId>               appendedEvents;
        private       UnitOfWorkStatus            status;
        private       Handle                      handle;
        private       Exception                   causeOfRollback;

        SpringManagedUnitOfWork(Optional<TransactionStatus> manuallyStartedSpringTransaction) {
            this.manuallyStartedSpringTransaction = requireNonNull(manuallyStartedSpringTransaction, "No manuallyStartedSpringTransaction option provided");
            appendedEvents = new ArrayList<>();
            status = UnitOfWorkStatus.Ready;
        }

        @Override
        public void start() {
            if (status == UnitOfWorkStatus.Ready || status.isCompleted()) {
                log.debug("Starting Spring Managed UnitOfWork with initial status {}", status);
                handle = jdbi.open();
                status = UnitOfWorkStatus.Started;
            } else if (status == UnitOfWorkStatus.Started) {
                log.warn("The Spring Managed UnitOfWork was already started");
            } else {
                throw new UnitOfWorkException(msg("Cannot start a Spring Managed UnitOfWork with status {}", status));
            }
        }

        @Override
        public void commit() {
            if (status == UnitOfWorkStatus.Started && manuallyStartedSpringTransaction.isPresent()) {
                log.debug("Committing the manually started Spring Transaction associated with this UnitOfWork");
                transactionManager.commit(manuallyStartedSpringTransaction.get());
            } else {
                log.debug("Ignoring call to commit the fully Spring Managed UnitOfWork with status {}", status);
            }
        }

        @Override
        public void rollback(Exception cause) {
            var correctStatus = status.isActive();
            causeOfRollback = cause != null ? cause : causeOfRollback;
            if (correctStatus && manuallyStartedSpringTransaction.isPresent()) {
                log.debug("Rolling back the manually started Spring Transaction associated with this UnitOfWork{}",
                          causeOfRollback != null ? " due to " + causeOfRollback.getMessage() : "");
                transactionManager.rollback(manuallyStartedSpringTransaction.get());
            } else if (correctStatus) {
                log.debug("Marking the fully Spring Managed UnitOfWork as rollback only. The exception decides the outcome of the Spring Transaction");
                status = UnitOfWorkStatus.MarkedForRollbackOnly;
            }
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
                log.debug("Marking the Spring Managed UnitOfWork as rollback only{}", cause != null ? " due to " + cause.getMessage() : "");
                status = UnitOfWorkStatus.MarkedForRollbackOnly;
                causeOfRollback = cause;
            } else {
                log.debug("Ignoring call to mark the Spring Managed UnitOfWork as rollbackOnly. Current status {}", status);
            }
        }

        @Override
        public void registerEventAppended(EventId eventId, EventType eventType) {
            requireNonNull(eventId, "No eventId provided");
            log.trace("Registering {} event '{}' appended in this UnitOfWork", eventType, eventId);
            appendedEvents.add(eventId);
        }

        @Override
        public List<EventId> appendedEvents() {
            return Collections.unmodifiableList(appendedEvents);
        }

        @Override
        public Handle handle() {
            if (handle == null) {
                throw new UnitOfWorkException("No active transaction");
            }
            return handle;
        }

        private void close() {
            if (handle == null) {
                return;
            }
            try {
                handle.close();
            } catch (RuntimeException e) {
                log.error("Failed to close Jdbi handle", e);
            } finally {
                handle = null;
            }
        }
    }

    private class SpringManagedUnitOfWorkSynchronization implements TransactionSynchronization {
        private final SpringManagedUnitOfWork unitOfWork;

        SpringManagedUnitOfWorkSynchronization(SpringManagedUnitOfWork unitOfWork) {
            this.unitOfWork = requireNonNull(unitOfWork, "No unitOfWork provided");
        }

        @Override
        public void afterCommit() {
            unitOfWork.status = UnitOfWorkStatus.Committed;
            if (unitOfWork.appendedEvents.isEmpty()) {
                return;
            }
            var committed = List.copyOf(unitOfWork.appendedEvents);
            for (var callback : callbacks) {
                try {
                    log.trace("AfterCommit AppendedEvents for {} with {} appended events", callback.getClass().getName(), committed.size());
                    callback.afterCommit(unitOfWork, committed);
                } catch (RuntimeException e) {
                    log.error(msg("{} failed during afterCommit AppendedEvents", callback.getClass().getName()), e);
                }
            }
        }

        @Override
        public void afterCompletion(int status) {
            try {
                if (status == TransactionSynchronization.STATUS_ROLLED_BACK) {
                    unitOfWork.status = UnitOfWorkStatus.RolledBack;
                    if (!unitOfWork.appendedEvents.isEmpty()) {
                        var discarded = List.copyOf(unitOfWork.appendedEvents);
                        for (var callback : callbacks) {
                            try {
                                log.trace("AfterRollback AppendedEvents for {} with {} discarded events", callback.getClass().getName(), discarded.size());
                                callback.afterRollback(unitOfWork, discarded);
                            } catch (RuntimeException e) {
                                log.error(msg("{} failed during afterRollback AppendedEvents", callback.getClass().getName()), e);
                            }
                        }
                    }
                }
            } finally {
                unitOfWork.close();
                removeUnitOfWork();
            }
        }
    }
}
