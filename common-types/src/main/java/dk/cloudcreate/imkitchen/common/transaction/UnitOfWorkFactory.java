package dk.cloudcreate.imkitchen.common.transaction;

import dk.cloudcreate.essentials.shared.functional.*;
import org.slf4j.*;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Creates {@link UnitOfWork}'s and keeps track of the {@link UnitOfWork} associated with the calling thread.<br>
 * <br>
 * {@link #usingUnitOfWork(CheckedConsumer)} and {@link #withUnitOfWork(CheckedFunction)} join an existing {@link UnitOfWork}
 * if the calling thread already has one, otherwise they create, commit or roll back their own.<br>
 * Runtime exceptions are rethrown unchanged after the rollback, so domain errors, concurrency conflicts and uniqueness violations
 * reach the caller with their own type. Checked exceptions are wrapped in a {@link UnitOfWorkException}.
 *
 * @param <UOW> the {@link UnitOfWork} sub-type returned by the {@link UnitOfWorkFactory}
 */
public interface UnitOfWorkFactory<UOW extends UnitOfWork> {
    Logger unitOfWorkLog = LoggerFactory.getLogger(UnitOfWorkFactory.class);

    /**
     * Get a required active {@link UnitOfWork}
     *
     * @return the active {@link UnitOfWork}
     * @throws NoActiveUnitOfWorkException if there is no active {@link UnitOfWork}
     */
    UOW getRequiredUnitOfWork();

    /**
     * Get the current {@link UnitOfWork} or create and start a new {@link UnitOfWork}
     * if one is missing
     *
     * @return a started {@link UnitOfWork}
     */
    UOW getOrCreateNewUnitOfWork();

    Optional<UOW> getCurrentUnitOfWork();

    default void usingUnitOfWork(CheckedConsumer<UOW> unitOfWorkConsumer) {
        requireNonNull(unitOfWorkConsumer, "No unitOfWorkConsumer provided");
        withUnitOfWork(unitOfWork -> {
            unitOfWorkConsumer.accept(unitOfWork);
            return null;
        });
    }

    default <R> R withUnitOfWork(CheckedFunction<UOW, R> unitOfWorkFunction) {
        requireNonNull(unitOfWorkFunction, "No unitOfWorkFunction provided");
        var existingUnitOfWork = getCurrentUnitOfWork();
        var unitOfWork = existingUnitOfWork.orElseGet(() -> {
            unitOfWorkLog.trace("Creating a new UnitOfWork as the current thread doesn't have one");
            return getOrCreateNewUnitOfWork();
        });
        existingUnitOfWork.ifPresent(uow -> unitOfWorkLog.trace("NestedUnitOfWork: Reusing the UnitOfWork of the current thread"));
        try {
            var result = unitOfWorkFunction.apply(unitOfWork);
            if (existingUnitOfWork.isEmpty()) {
                unitOfWorkLog.trace("Committing the UnitOfWork created by this call");
                unitOfWork.commit();
            }
            return result;
        } catch (Exception e) {
            if (existingUnitOfWork.isEmpty()) {
                unitOfWorkLog.trace("Rolling back the UnitOfWork created by this call");
                if (!unitOfWork.status().isCompleted()) {
                    unitOfWork.rollback(e);
                }
            } else {
                unitOfWorkLog.trace("NestedUnitOfWork: Marking the UnitOfWork as rollback only as it wasn't created by this call");
                unitOfWork.markAsRollbackOnly(e);
            }
            if (e instanceof RuntimeException) {
                throw (RuntimeException) e;
            }
            throw new UnitOfWorkException(e);
        }
    }
}
