package dk.cloudcreate.imkitchen.projections;

import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Synchronously delivers the backlog of one or more projections, i.e. every event committed before the drain started.<br>
 * Intended for tests and tooling: after {@link #drainAll()} returns, every read model reflects all previously committed events.
 * Errors are not retried but rethrown as {@link ProjectionApplyException}.<br>
 * A drain isn't allowed while a {@link ProjectionRunner} is started for the same {@link ProjectionRegistry}, since their deliveries would compete.
 */
public class ProjectionDrainer {
    private static final Logger log = LoggerFactory.getLogger(ProjectionDrainer.class);

    public static final int DEFAULT_BATCH_SIZE = 500;

    private final ProjectionRegistry registry;
    private final ProjectionDelivery delivery;
    private final int                batchSize;

    public ProjectionDrainer(ProjectionRegistry registry, int batchSize) {
        this.registry = requireNonNull(registry, "No registry provided");
        requireTrue(batchSize > 0, "batchSize must be > 0");
        this.batchSize = batchSize;
        this.delivery = new ProjectionDelivery(registry.eventStore(), registry.cursors());
    }

    public ProjectionDrainer(ProjectionRegistry registry) {
        this(registry, DEFAULT_BATCH_SIZE);
    }

    /**
     * Drain the named projections in the given order
     *
     * @throws ProjectionApplyException if a handler fails
     * @throws ProjectionException      if a {@link ProjectionRunner} is started or a projection isn't registered
     */
    public DrainResult drain(String... projectionNames) {
        requireNonNull(projectionNames, "No projectionNames provided");
        var subscriptions = new ArrayList<ProjectionSubscription>();
        for (var projectionName : projectionNames) {
            subscriptions.addAll(registry.subscriptionsOf(projectionName));
        }
        return drain(subscriptions);
    }

    /**
     * Drain every registered projection
     */
    public DrainResult drainAll() {
        return drain(registry.subscriptions());
    }

    private DrainResult drain(List<ProjectionSubscription> subscriptions) {
        if (registry.isContinuousDeliveryActive()) {
            throw new ProjectionException("Cannot drain projections while the ProjectionRunner is started");
        }
        var applied = new LinkedHashMap<ProjectionSubscription, Integer>();
        for (var subscription : subscriptions) {
            var count = delivery.deliverPendingEvents(subscription, DeliveryMode.DRAIN, batchSize);
            applied.merge(subscription, count, Integer::sum);
            log.debug("[{}] Drained {} event(s)", subscription, count);
        }
        var result = new DrainResult(applied);
        log.debug("Drained {} event(s) across {} subscription(s)", result.totalAppliedEvents(), subscriptions.size());
        return result;
    }

    @Override
    public String toString() {
        return "ProjectionDrainer{batchSize=" + batchSize + "}";
    }
}
