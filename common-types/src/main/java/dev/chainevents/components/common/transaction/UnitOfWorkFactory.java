package dev.chainevents.components.common.transaction;

import dk.cloudcreate.essentials.shared.functional.*;
import org.slf4j.*;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Creates and tracks the {@link UnitOfWork} associated with the calling thread
 *
 * @param <UOW> the {@link UnitOfWork} sub-type returned by the {@link UnitOfWorkFactory}
 */
public interface UnitOfWorkFactory<UOW extends UnitOfWork> {
    Logger unitOfWorkLog = LoggerFactory.getLogger(UnitOfWorkFactory.class);

    /**
     * Get the active {@link UnitOfWork}
     *
     * @return the active {@link UnitOfWork}
     * @throws NoActiveUnitOfWorkException if the calling thread isn't inside a {@link UnitOfWork}
     */
    UOW getRequiredUnitOfWork();

    /**
     * Get the active {@link UnitOfWork} or start a new one
     *
     * @return a started {@link UnitOfWork}
     */
    UOW getOrCreateNewUnitOfWork();

    Optional<UOW> getCurrentUnitOfWork();

    /**
     * Run <code>unitOfWorkConsumer</code> inside the active {@link UnitOfWork}, or inside a new {@link UnitOfWork}
     * which is committed afterwards (or rolled back if <code>unitOfWorkConsumer</code> throws).<br>
     * A joined {@link UnitOfWork} is never committed here, it is only marked as rollback only on failure.
     *
     * @param unitOfWorkConsumer the work to perform
     */
    default void usingUnitOfWork(CheckedConsumer<UOW> unitOfWorkConsumer) {
        requireNonNull(unitOfWorkConsumer, "No unitOfWorkConsumer provided");
        withUnitOfWork(unitOfWork -> {
            unitOfWorkConsumer.accept(unitOfWork);
            return null;
        });
    }

    /**
     * Same as {@link #usingUnitOfWork(CheckedConsumer)} but returns the result of <code>unitOfWorkFunction</code>
     *
     * @param unitOfWorkFunction the work to perform
     * @param <R>                the result type
     * @return the result of <code>unitOfWorkFunction</code>
     */
    default <R> R withUnitOfWork(CheckedFunction<UOW, R> unitOfWorkFunction) {
        requireNonNull(unitOfWorkFunction, "No unitOfWorkFunction provided");
        var existingUnitOfWork = getCurrentUnitOfWork();
        var ownsUnitOfWork     = existingUnitOfWork.isEmpty();
        var unitOfWork         = existingUnitOfWork.orElseGet(this::getOrCreateNewUnitOfWork);
        if (ownsUnitOfWork) {
            unitOfWorkLog.trace("Created a new UnitOfWork as there wasn't an existing UnitOfWork");
        } else {
            unitOfWorkLog.trace("NestedUnitOfWork: Joining the existing UnitOfWork");
        }

        R result;
        try {
            result = unitOfWorkFunction.apply(unitOfWork);
        } catch (Exception e) {
            if (ownsUnitOfWork) {
                unitOfWorkLog.debug("Rolling back the UnitOfWork due to {}", e.getMessage());
                unitOfWork.rollback(e);
            } else {
                unitOfWorkLog.debug("NestedUnitOfWork: Marking the joined UnitOfWork as rollback only due to {}", e.getMessage());
                unitOfWork.markAsRollbackOnly(e);
            }
            if (e instanceof RuntimeException) {
                throw (RuntimeException) e;
            }
            throw new UnitOfWorkException(e);
        }

        if (ownsUnitOfWork) {
            if (unitOfWork.status() == UnitOfWorkStatus.MarkedForRollbackOnly) {
                unitOfWorkLog.debug("Rolling back the UnitOfWork as it was marked as rollback only");
                unitOfWork.rollback();
            } else {
                unitOfWork.commit();
            }
        }
        return result;
    }
}
