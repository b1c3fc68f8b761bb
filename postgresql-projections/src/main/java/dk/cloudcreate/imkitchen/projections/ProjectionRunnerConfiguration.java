package dk.cloudcreate.imkitchen.projections;

import java.time.Duration;

import static dk.cloudcreate.essentials.shared.FailFast.*;

public class ProjectionRunnerConfiguration {
    public static final Duration DEFAULT_POLLING_INTERVAL = Duration.ofSeconds(1);
    public static final int      DEFAULT_BATCH_SIZE       = 100;
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    /**
     * Idle wait between polls of a subscription that is caught up
     */
    public final Duration              pollingInterval;
    public final int                   batchSize;
    public final ProjectionRetryPolicy retryPolicy;
    /**
     * How long {@link ProjectionRunner#stop()} waits for in-flight deliveries
     */
    public final Duration              shutdownTimeout;
    public final String                threadNamePrefix;

    public ProjectionRunnerConfiguration(Duration pollingInterval,
                                         int batchSize,
                                         ProjectionRetryPolicy retryPolicy,
                                         Duration shutdownTimeout,
                                         String threadNamePrefix) {
        this.pollingInterval = requireNonNull(pollingInterval, "You must specify a pollingInterval");
        requireTrue(!pollingInterval.isNegative() && !pollingInterval.isZero(), "pollingInterval must be positive");
        requireTrue(batchSize > 0, "batchSize must be > 0");
        this.batchSize = batchSize;
        this.retryPolicy = requireNonNull(retryPolicy, "You must specify a retryPolicy");
        this.shutdownTimeout = requireNonNull(shutdownTimeout, "You must specify a shutdownTimeout");
        this.threadNamePrefix = requireNonNull(threadNamePrefix, "You must specify a threadNamePrefix");
    }

    public static ProjectionRunnerConfiguration defaultConfiguration() {
        return new ProjectionRunnerConfiguration(DEFAULT_POLLING_INTERVAL,
                                                 DEFAULT_BATCH_SIZE,
                                                 ProjectionRetryPolicy.exponentialBackoff(Duration.ofMillis(100), 2.0d, Duration.ofSeconds(30)),
                                                 DEFAULT_SHUTDOWN_TIMEOUT,
                                                 "Projection");
    }

    public ProjectionRunnerConfiguration withPollingInterval(Duration pollingInterval) {
        return new ProjectionRunnerConfiguration(pollingInterval, batchSize, retryPolicy, shutdownTimeout, threadNamePrefix);
    }

    public ProjectionRunnerConfiguration withBatchSize(int batchSize) {
        return new ProjectionRunnerConfiguration(pollingInterval, batchSize, retryPolicy, shutdownTimeout, threadNamePrefix);
    }

    public ProjectionRunnerConfiguration withRetryPolicy(ProjectionRetryPolicy retryPolicy) {
        return new ProjectionRunnerConfiguration(pollingInterval, batchSize, retryPolicy, shutdownTimeout, threadNamePrefix);
    }

    @Override
    public String toString() {
        return "ProjectionRunnerConfiguration{" +
                "pollingInterval=" + pollingInterval +
                ", batchSize=" + batchSize +
                ", retryPolicy=" + retryPolicy +
                ", shutdownTimeout=" + shutdownTimeout +
                ", threadNamePrefix='" + threadNamePrefix + '\'' +
                '}';
    }
}
