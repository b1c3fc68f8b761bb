package dk.cloudcreate.imkitchen.projections;

import dk.cloudcreate.imkitchen.common.Lifecycle;
import dk.cloudcreate.imkitchen.common.transaction.UnitOfWork;
import dk.cloudcreate.imkitchen.eventstore.eventstream.PersistedEvent;
import dk.cloudcreate.imkitchen.eventstore.transaction.PersistedEventsCommitLifecycleCallback;
import dk.cloudcreate.essentials.shared.concurrent.ThreadFactoryBuilder;
import org.slf4j.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Continuous, background delivery of events to every {@link ProjectionSubscription} of a {@link ProjectionRegistry}.<br>
 * <br>
 * Each subscription is polled by its own scheduled task with {@link ProjectionRunnerConfiguration#pollingInterval} between polls.
 * When a unit of work in this process commits events, the affected subscriptions are woken up right away instead of waiting for
 * the next poll. A failing subscription is retried according to the {@link ProjectionRetryPolicy} while the other subscriptions
 * keep running; its failures are exposed through {@link #status()}.<br>
 * <br>
 * Several instances (processes) may run against the same database: the cursor row lock ensures that only one of them delivers
 * to a given subscription at a time.
 */
public class ProjectionRunner implements Lifecycle, PersistedEventsCommitLifecycleCallback {
    private static final Logger log = LoggerFactory.getLogger(ProjectionRunner.class);

    private final ProjectionRegistry                                   registry;
    private final ProjectionDelivery                                   delivery;
    private final ProjectionRunnerConfiguration                        configuration;
    private final Clock                                                clock;
    private final ConcurrentMap<ProjectionSubscription, SubscriptionState> subscriptionStates = new ConcurrentHashMap<>();

    private volatile ScheduledExecutorService scheduler;
    private volatile boolean                  started;

    public ProjectionRunner(ProjectionRegistry registry, ProjectionRunnerConfiguration configuration, Clock clock) {
        this.registry = requireNonNull(registry, "No registry provided");
        this.configuration = requireNonNull(configuration, "No configuration provided");
        this.clock = requireNonNull(clock, "No clock provided");
        this.delivery = new ProjectionDelivery(registry.eventStore(), registry.cursors());
        registry.eventStore().getUnitOfWorkFactory().registerPersistedEventsCommitLifeCycleCallback(this);
    }

    public ProjectionRunner(ProjectionRegistry registry, ProjectionRunnerConfiguration configuration) {
        this(registry, configuration, Clock.systemUTC());
    }

    @Override
    public synchronized void start() {
        if (started) {
            log.debug("ProjectionRunner was already started");
            return;
        }
        registry.continuousDeliveryStarted();
        var subscriptions = registry.subscriptions();
        log.info("Starting ProjectionRunner for {} subscription(s) with {}", subscriptions.size(), configuration);
        var executor = new ScheduledThreadPoolExecutor(Math.max(1, subscriptions.size()),
                                                       new ThreadFactoryBuilder()
                                                               .nameFormat(configuration.threadNamePrefix + "-%d")
                                                               .daemon(true)
                                                               .build());
        // Pending retries are dropped on shutdown, only running deliveries are awaited
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        scheduler = executor;
        started = true;
        for (var subscription : subscriptions) {
            var state = subscriptionStates.computeIfAbsent(subscription, SubscriptionState::new);
            scheduler.scheduleWithFixedDelay(() -> poll(state),
                                             0,
                                             configuration.pollingInterval.toMillis(),
                                             TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Stop scheduling new deliveries and wait up to {@link ProjectionRunnerConfiguration#shutdownTimeout} for in-flight deliveries
     */
    @Override
    public synchronized void stop() {
        if (!started) {
            return;
        }
        log.info("Stopping ProjectionRunner");
        started = false;
        subscriptionStates.values().forEach(SubscriptionState::cancelRetry);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(configuration.shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Deliveries were still in progress after {}, interrupting them", configuration.shutdownTimeout);
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        } finally {
            registry.continuousDeliveryStopped();
        }
        log.info("ProjectionRunner stopped");
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    @Override
    public void afterCommit(UnitOfWork unitOfWork, List<PersistedEvent> persistedEvents) {
        if (!started) {
            return;
        }
        var aggregateTypes = persistedEvents.stream()
                                            .map(PersistedEvent::aggregateType)
                                            .collect(Collectors.toSet());
        subscriptionStates.values()
                          .stream()
                          .filter(state -> aggregateTypes.contains(state.subscription.aggregateType))
                          .forEach(this::wakeUp);
    }

    private void wakeUp(SubscriptionState state) {
        var currentScheduler = scheduler;
        if (!started || currentScheduler == null) {
            return;
        }
        state.wakeUpRequested.set(true);
        try {
            currentScheduler.execute(() -> poll(state));
        } catch (RejectedExecutionException e) {
            log.trace("[{}] Wake up rejected, the runner is stopping", state.subscription);
        }
    }

    private void poll(SubscriptionState state) {
        if (!started) {
            return;
        }
        if (!state.deliveryLock.tryLock()) {
            // The running delivery picks up the wake up request when it finishes
            return;
        }
        try {
            do {
                state.wakeUpRequested.set(false);
                if (state.isBackingOff(clock.instant())) {
                    log.trace("[{}] Backing off until {}", state.subscription, state.nextAttemptAt);
                    return;
                }
                deliver(state);
            } while (started && state.wakeUpRequested.get() && state.consecutiveFailures == 0);
        } finally {
            state.deliveryLock.unlock();
        }
    }

    private void deliver(SubscriptionState state) {
        try {
            delivery.deliverPendingEvents(state.subscription, DeliveryMode.CONTINUOUS, configuration.batchSize);
            if (state.consecutiveFailures > 0) {
                log.info("[{}] Recovered after {} failed attempt(s)", state.subscription, state.consecutiveFailures);
            }
            state.recordSuccess();
        } catch (RuntimeException e) {
            var failures   = state.consecutiveFailures + 1;
            var retryDelay = configuration.retryPolicy.calculateRetryDelay(failures);
            var generation = state.recordFailure(e, clock.instant(), retryDelay);
            log.error(msg("[{}] Delivery failed ({} consecutive failure(s)), retrying in {}", state.subscription, failures, retryDelay), e);
            scheduleRetry(state, retryDelay, generation);
        }
    }

    private void scheduleRetry(SubscriptionState state, Duration retryDelay, long generation) {
        var currentScheduler = scheduler;
        if (!started || currentScheduler == null) {
            return;
        }
        try {
            state.replaceRetry(currentScheduler.schedule(() -> retry(state, generation),
                                                         retryDelay.toMillis(),
                                                         TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            log.trace("[{}] Retry rejected, the runner is stopping", state.subscription);
        }
    }

    private void retry(SubscriptionState state, long generation) {
        if (!started) {
            return;
        }
        // Waits for a running delivery; if that delivery fails, the generation check below skips this retry
        state.deliveryLock.lock();
        try {
            if (!state.endBackoff(generation)) {
                log.trace("[{}] Skipping retry of failure #{}, a newer failure has its own retry", state.subscription, generation);
                return;
            }
            poll(state);
        } finally {
            state.deliveryLock.unlock();
        }
    }

    /**
     * @return the status of every subscription of the registry
     */
    public List<ProjectionStatus> status() {
        var unitOfWorkFactory = registry.eventStore().getUnitOfWorkFactory();
        return registry.subscriptions()
                       .stream()
                       .map(subscription -> {
                           var state  = subscriptionStates.get(subscription);
                           var cursor = unitOfWorkFactory.withUnitOfWork(unitOfWork -> registry.cursors().read(unitOfWork.handle(), subscription));
                           return new ProjectionStatus(subscription.projectionName(),
                                                       subscription.aggregateType,
                                                       cursor,
                                                       registry.eventStore().highestGlobalEventOrder(subscription.aggregateType),
                                                       state != null ? state.consecutiveFailures : 0,
                                                       state != null ? state.lastError : null,
                                                       state != null ? state.lastFailureAt : null);
                       })
                       .collect(Collectors.toList());
    }

    /**
     * Rebuild a projection from the first event: its read model is reset and its cursors are moved back to the start in one transaction,
     * after which all events are delivered again (in the background if the runner is started, otherwise before this method returns)
     *
     * @return the number of events applied, if the redelivery ran before returning
     */
    public int rebuild(String projectionName) {
        var handler       = registry.getHandler(projectionName);
        var subscriptions = registry.subscriptionsOf(projectionName);
        var states = subscriptions.stream()
                                  .map(subscription -> subscriptionStates.computeIfAbsent(subscription, SubscriptionState::new))
                                  .collect(Collectors.toList());
        log.info("[{}] Rebuilding projection", projectionName);
        states.forEach(state -> state.deliveryLock.lock());
        try {
            registry.eventStore().getUnitOfWorkFactory().usingUnitOfWork(unitOfWork -> {
                // Lock the cursors first so deliveries from other instances wait for the reset
                subscriptions.forEach(subscription -> registry.cursors().lock(unitOfWork.handle(), subscription, false));
                handler.resetReadModel(unitOfWork.handle());
                registry.cursors().reset(unitOfWork.handle(), projectionName);
            });
            states.forEach(SubscriptionState::recordSuccess);
        } finally {
            states.forEach(state -> state.deliveryLock.unlock());
        }

        if (started) {
            states.forEach(this::wakeUp);
            return 0;
        }
        var applied = 0;
        for (var subscription : subscriptions) {
            applied += delivery.deliverPendingEvents(subscription, DeliveryMode.DRAIN, configuration.batchSize);
        }
        log.info("[{}] Rebuilt projection from {} event(s)", projectionName, applied);
        return applied;
    }

    static class SubscriptionState {
        final ProjectionSubscription subscription;
        final ReentrantLock          deliveryLock    = new ReentrantLock();
        final AtomicBoolean          wakeUpRequested = new AtomicBoolean();

        volatile int     consecutiveFailures;
        volatile String  lastError;
        volatile Instant lastFailureAt;
        volatile Instant nextAttemptAt;

        private long               failureGeneration;
        private ScheduledFuture<?> pendingRetry;

        SubscriptionState(ProjectionSubscription subscription) {
            this.subscription = subscription;
        }

        boolean isBackingOff(Instant now) {
            var next = nextAttemptAt;
            return next != null && now.isBefore(next);
        }

        void recordSuccess() {
            consecutiveFailures = 0;
            nextAttemptAt = null;
        }

        /**
         * @return the generation of this failure, which only the retry scheduled for it may end the backoff of
         */
        synchronized long recordFailure(Exception cause, Instant now, Duration retryDelay) {
            consecutiveFailures++;
            lastError = cause.getClass().getSimpleName() + ": " + cause.getMessage();
            lastFailureAt = now;
            nextAttemptAt = now.plus(retryDelay);
            return ++failureGeneration;
        }

        /**
         * End the backoff of the failure with the given generation
         *
         * @return false if a newer failure has happened since, in which case its backoff stays in place
         */
        synchronized boolean endBackoff(long generation) {
            if (generation != failureGeneration) {
                return false;
            }
            nextAttemptAt = null;
            return true;
        }

        synchronized void replaceRetry(ScheduledFuture<?> retry) {
            if (pendingRetry != null) {
                pendingRetry.cancel(false);
            }
            pendingRetry = retry;
        }

        synchronized void cancelRetry() {
            if (pendingRetry != null) {
                pendingRetry.cancel(false);
                pendingRetry = null;
            }
        }
    }
}
