package dk.cloudcreate.imkitchen.projections;

import java.time.Duration;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * How long the {@link ProjectionRunner} waits before delivering to a subscription again after consecutive failures.<br>
 * Failing subscriptions are retried indefinitely; the delay never exceeds {@link #maximumRetryDelay}.
 */
public class ProjectionRetryPolicy {
    public enum Backoff {
        FIXED,
        LINEAR,
        EXPONENTIAL
    }

    public final Backoff  backoff;
    public final Duration initialRetryDelay;
    public final double   retryDelayMultiplier;
    public final Duration maximumRetryDelay;

    public ProjectionRetryPolicy(Backoff backoff,
                                 Duration initialRetryDelay,
                                 double retryDelayMultiplier,
                                 Duration maximumRetryDelay) {
        this.backoff = requireNonNull(backoff, "You must specify a backoff");
        this.initialRetryDelay = requireNonNull(initialRetryDelay, "You must specify an initialRetryDelay");
        this.maximumRetryDelay = requireNonNull(maximumRetryDelay, "You must specify a maximumRetryDelay");
        requireTrue(retryDelayMultiplier >= 1.0d, "retryDelayMultiplier must be >= 1.0");
        requireTrue(maximumRetryDelay.compareTo(initialRetryDelay) >= 0, "maximumRetryDelay must be >= initialRetryDelay");
        this.retryDelayMultiplier = retryDelayMultiplier;
    }

    /**
     * @param consecutiveFailures the number of failed deliveries in a row (at least 1)
     */
    public Duration calculateRetryDelay(int consecutiveFailures) {
        requireTrue(consecutiveFailures >= 1, "consecutiveFailures must be 1 or larger");
        double delayMillis;
        switch (backoff) {
            case LINEAR:
                delayMillis = (double) initialRetryDelay.toMillis() * consecutiveFailures;
                break;
            case EXPONENTIAL:
                delayMillis = initialRetryDelay.toMillis() * Math.pow(retryDelayMultiplier, consecutiveFailures - 1);
                break;
            default:
                delayMillis = initialRetryDelay.toMillis();
        }
        if (delayMillis >= maximumRetryDelay.toMillis()) {
            return maximumRetryDelay;
        }
        return Duration.ofMillis((long) delayMillis);
    }

    public static ProjectionRetryPolicy fixedBackoff(Duration retryDelay) {
        return new ProjectionRetryPolicy(Backoff.FIXED, retryDelay, 1.0d, retryDelay);
    }

    public static ProjectionRetryPolicy linearBackoff(Duration retryDelay, Duration maximumRetryDelay) {
        return new ProjectionRetryPolicy(Backoff.LINEAR, retryDelay, 1.0d, maximumRetryDelay);
    }

    public static ProjectionRetryPolicy exponentialBackoff(Duration initialRetryDelay,
                                                           double retryDelayMultiplier,
                                                           Duration maximumRetryDelay) {
        return new ProjectionRetryPolicy(Backoff.EXPONENTIAL, initialRetryDelay, retryDelayMultiplier, maximumRetryDelay);
    }

    @Override
    public String toString() {
        return "ProjectionRetryPolicy{" +
                "backoff=" + backoff +
                ", initialRetryDelay=" + initialRetryDelay +
                ", retryDelayMultiplier=" + retryDelayMultiplier +
                ", maximumRetryDelay=" + maximumRetryDelay +
                '}';
    }
}
