package dev.chainevents.components.common.transaction;

import dk.cloudcreate.essentials.shared.functional.CheckedFunction;
import org.jdbi.v3.core.Handle;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * {@link UnitOfWorkFactory} that creates and maintains {@link HandleAwareUnitOfWork}'s
 */
public interface HandleAwareUnitOfWorkFactory<UOW extends HandleAwareUnitOfWork> extends UnitOfWorkFactory<UOW> {
    /**
     * Run <code>handleFunction</code> with the {@link Handle} of the current {@link UnitOfWork}, or of a new one that is
     * committed afterwards. Same semantics as {@link #withUnitOfWork(CheckedFunction)}
     *
     * @param handleFunction the function to run
     * @param <R>            the result type
     * @return the result of <code>handleFunction</code>
     */
    default <R> R withHandle(CheckedFunction<Handle, R> handleFunction) {
        requireNonNull(handleFunction, "No handleFunction provided");
        return withUnitOfWork(unitOfWork -> handleFunction.apply(unitOfWork.handle()));
    }
}
