package dk.cloudcreate.imkitchen.projections;

import dk.cloudcreate.imkitchen.eventstore.EventStore;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The {@link ProjectionHandler}'s known to this process.<br>
 * Registering a handler creates its read model tables and its cursors (one per aggregate type), so both the
 * {@link ProjectionRunner} and the {@link ProjectionDrainer} can deliver to it right away.
 */
public class ProjectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProjectionRegistry.class);

    private final EventStore                    eventStore;
    private final ProjectionCursors             cursors;
    private final List<ProjectionHandler>       handlers                 = new CopyOnWriteArrayList<>();
    private final AtomicBoolean                 continuousDeliveryActive = new AtomicBoolean();

    public ProjectionRegistry(EventStore eventStore, ProjectionCursors cursors) {
        this.eventStore = requireNonNull(eventStore, "No eventStore provided");
        this.cursors = requireNonNull(cursors, "No cursors provided");
        eventStore.getUnitOfWorkFactory().usingUnitOfWork(unitOfWork -> cursors.createCursorTable(unitOfWork.handle()));
    }

    public ProjectionRegistry(EventStore eventStore) {
        this(eventStore, new ProjectionCursors());
    }

    public EventStore eventStore() {
        return eventStore;
    }

    public ProjectionCursors cursors() {
        return cursors;
    }

    /**
     * @throws ProjectionException if a handler with the same name is registered or continuous delivery is active
     */
    public synchronized ProjectionRegistry register(ProjectionHandler handler) {
        requireNonNull(handler, "No handler provided");
        requireNonNull(handler.projectionName(), "No projectionName provided");
        requireTrue(!handler.aggregateTypes().isEmpty(), msg("[{}] The projection must consume at least one aggregate type", handler.projectionName()));
        if (continuousDeliveryActive.get()) {
            throw new ProjectionException(msg("[{}] Cannot register a projection while the ProjectionRunner is started", handler.projectionName()));
        }
        if (findHandler(handler.projectionName()).isPresent()) {
            throw new ProjectionException(msg("A projection named '{}' is already registered", handler.projectionName()));
        }
        // Fails fast if an aggregate type isn't configured with the event store
        handler.aggregateTypes().forEach(eventStore::getAggregateTypeConfiguration);

        eventStore.getUnitOfWorkFactory().usingUnitOfWork(unitOfWork -> {
            handler.initializeReadModel(unitOfWork.handle());
            handler.aggregateTypes().forEach(aggregateType -> cursors.ensureCursorExists(unitOfWork.handle(),
                                                                                           new ProjectionSubscription(handler, aggregateType)));
        });
        handlers.add(handler);
        log.info("[{}] Registered projection consuming {}", handler.projectionName(), handler.aggregateTypes());
        return this;
    }

    public List<ProjectionHandler> handlers() {
        return List.copyOf(handlers);
    }

    public Optional<ProjectionHandler> findHandler(String projectionName) {
        return handlers.stream()
                       .filter(handler -> handler.projectionName().equals(projectionName))
                       .findFirst();
    }

    public ProjectionHandler getHandler(String projectionName) {
        return findHandler(projectionName).orElseThrow(() -> new ProjectionException(msg("No projection named '{}' is registered", projectionName)));
    }

    /**
     * All subscriptions in registration order, with the aggregate types of each handler sorted by name
     */
    public List<ProjectionSubscription> subscriptions() {
        return handlers.stream()
                       .flatMap(handler -> subscriptionsOf(handler).stream())
                       .collect(Collectors.toList());
    }

    public List<ProjectionSubscription> subscriptionsOf(String projectionName) {
        return subscriptionsOf(getHandler(projectionName));
    }

    private static List<ProjectionSubscription> subscriptionsOf(ProjectionHandler handler) {
        return handler.aggregateTypes()
                      .stream()
                      .sorted(Comparator.comparing(Object::toString))
                      .map(aggregateType -> new ProjectionSubscription(handler, aggregateType))
                      .collect(Collectors.toList());
    }

    void continuousDeliveryStarted() {
        if (!continuousDeliveryActive.compareAndSet(false, true)) {
            throw new ProjectionException("Another ProjectionRunner is already started for this registry");
        }
    }

    void continuousDeliveryStopped() {
        continuousDeliveryActive.set(false);
    }

    public boolean isContinuousDeliveryActive() {
        return continuousDeliveryActive.get();
    }
}
