package dk.cloudcreate.imkitchen.projections;

import dk.cloudcreate.imkitchen.eventstore.EventStore;
import dk.cloudcreate.imkitchen.eventstore.eventstream.PersistedEvent;
import dk.cloudcreate.imkitchen.eventstore.types.GlobalEventOrder;
import org.slf4j.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Delivers events to a {@link ProjectionSubscription} in global order. Shared by the {@link ProjectionRunner} and the {@link ProjectionDrainer}.<br>
 * <br>
 * Every event the handler is interested in is applied in its own transaction, which
 * <ol>
 *     <li>locks the subscription's cursor row</li>
 *     <li>verifies the cursor still has the value the batch was loaded from (otherwise another delivery got there first and the batch is abandoned)</li>
 *     <li>applies the event</li>
 *     <li>advances the cursor to the event's global order</li>
 * </ol>
 * and then commits, so read model rows and cursor commit atomically and an event is never applied twice by successful deliveries.
 * Events the handler isn't interested in are skipped: the cursor moves past them together with the next applied event, or at the end of the batch.
 */
public class ProjectionDelivery {
    private static final Logger log = LoggerFactory.getLogger(ProjectionDelivery.class);

    private final EventStore        eventStore;
    private final ProjectionCursors cursors;

    public ProjectionDelivery(EventStore eventStore, ProjectionCursors cursors) {
        this.eventStore = requireNonNull(eventStore, "No eventStore provided");
        this.cursors = requireNonNull(cursors, "No cursors provided");
    }

    /**
     * Deliver every event that was committed for the subscription's aggregate type when the call started
     *
     * @return the number of events applied
     * @throws ProjectionApplyException if the handler fails. Events applied before the failing one stay committed
     */
    public int deliverPendingEvents(ProjectionSubscription subscription, DeliveryMode mode, int batchSize) {
        requireNonNull(subscription, "No subscription provided");
        var target = eventStore.highestGlobalEventOrder(subscription.aggregateType);
        var total  = 0;
        while (true) {
            var result = deliverNextBatch(subscription, mode, batchSize, target);
            total += result.appliedEvents;
            if (!result.morePending || (result.contended && mode == DeliveryMode.CONTINUOUS)) {
                return total;
            }
        }
    }

    /**
     * Deliver at most one batch of events following the subscription's cursor
     *
     * @param upToInclusive don't deliver events with a higher global order (null for no upper bound)
     */
    public BatchResult deliverNextBatch(ProjectionSubscription subscription, DeliveryMode mode, int batchSize, GlobalEventOrder upToInclusive) {
        requireNonNull(subscription, "No subscription provided");
        requireNonNull(mode, "No mode provided");
        requireTrue(batchSize > 0, "batchSize must be > 0");

        var unitOfWorkFactory = eventStore.getUnitOfWorkFactory();
        var cursor            = unitOfWorkFactory.withUnitOfWork(unitOfWork -> cursors.read(unitOfWork.handle(), subscription));
        if (upToInclusive != null && cursor.longValue() >= upToInclusive.longValue()) {
            return new BatchResult(0, cursor, false, false);
        }
        var events = eventStore.loadEventsAfterGlobalOrder(subscription.aggregateType, cursor, batchSize);
        if (events.isEmpty()) {
            log.trace("[{}] No events after global order {}", subscription, cursor);
            return new BatchResult(0, cursor, false, false);
        }

        var interestedEventTypes = subscription.handler.interestedEventTypes();
        var applied              = 0;
        var skipTo               = cursor;
        var reachedUpperBound    = false;
        for (var event : events) {
            if (upToInclusive != null && event.globalEventOrder().longValue() > upToInclusive.longValue()) {
                reachedUpperBound = true;
                break;
            }
            if (!interestedEventTypes.contains(event.eventType())) {
                log.trace("[{}] Skipping '{}' with global order {}", subscription, event.eventType(), event.globalEventOrder());
                skipTo = event.globalEventOrder();
                continue;
            }
            if (!advanceCursor(subscription, mode, cursor, event.globalEventOrder(), event)) {
                return new BatchResult(applied, cursor, true, true);
            }
            cursor = event.globalEventOrder();
            skipTo = cursor;
            applied++;
        }
        if (skipTo.longValue() > cursor.longValue()) {
            if (!advanceCursor(subscription, mode, cursor, skipTo, null)) {
                return new BatchResult(applied, cursor, true, true);
            }
            cursor = skipTo;
        }
        var morePending = !reachedUpperBound &&
                events.size() == batchSize &&
                (upToInclusive == null || cursor.longValue() < upToInclusive.longValue());
        if (applied > 0) {
            log.debug("[{}] Applied {} event(s), cursor is now at {}", subscription, applied, cursor);
        }
        return new BatchResult(applied, cursor, morePending, false);
    }

    /**
     * @param eventToApply the event to apply before moving the cursor, or null to only move the cursor
     * @return false if the cursor was locked (continuous mode) or no longer had the expected value
     */
    private boolean advanceCursor(ProjectionSubscription subscription,
                                  DeliveryMode mode,
                                  GlobalEventOrder expectedCursor,
                                  GlobalEventOrder newCursor,
                                  PersistedEvent eventToApply) {
        return eventStore.getUnitOfWorkFactory().withUnitOfWork(unitOfWork -> {
            var handle       = unitOfWork.handle();
            var lockedCursor = cursors.lock(handle, subscription, mode.skipLockedCursors());
            if (lockedCursor.isEmpty()) {
                log.debug("[{}] Cursor is locked by another delivery, backing off", subscription);
                return false;
            }
            if (!lockedCursor.get().equals(expectedCursor)) {
                log.debug("[{}] Cursor moved from {} to {} by another delivery, abandoning the batch",
                          subscription, expectedCursor, lockedCursor.get());
                return false;
            }
            if (eventToApply != null) {
                try {
                    subscription.handler.apply(unitOfWork, eventToApply);
                } catch (ProjectionApplyException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw new ProjectionApplyException(subscription.projectionName(),
                                                       subscription.aggregateType,
                                                       eventToApply.globalEventOrder(),
                                                       eventToApply.eventType(),
                                                       e);
                }
            }
            cursors.advance(handle, subscription, newCursor);
            return true;
        });
    }

    public static final class BatchResult {
        /**
         * Number of events applied to the handler
         */
        public final int              appliedEvents;
        public final GlobalEventOrder cursor;
        /**
         * True if more events may be pending
         */
        public final boolean          morePending;
        /**
         * True if the batch was abandoned because another delivery held or moved the cursor
         */
        public final boolean          contended;

        BatchResult(int appliedEvents, GlobalEventOrder cursor, boolean morePending, boolean contended) {
            this.appliedEvents = appliedEvents;
            this.cursor = cursor;
            this.morePending = morePending;
            this.contended = contended;
        }

        @Override
        public String toString() {
            return "BatchResult{" +
                    "appliedEvents=" + appliedEvents +
                    ", cursor=" + cursor +
                    ", morePending=" + morePending +
                    ", contended=" + contended +
                    '}';
        }
    }
}
