package dk.cloudcreate.imkitchen.projections;

import dk.cloudcreate.imkitchen.projections.test_data.PantryStockProjection;
import org.junit.jupiter.api.Test;

import java.time.*;

import static dk.cloudcreate.imkitchen.projections.test_data.PantryEvents.PANTRIES;
import static org.assertj.core.api.Assertions.assertThat;

class SubscriptionBackoffTest {
    private static final Instant NOW = Instant.parse("2025-01-03T10:00:00Z");

    private final ProjectionRunner.SubscriptionState state =
            new ProjectionRunner.SubscriptionState(new ProjectionSubscription(new PantryStockProjection(), PANTRIES));

    @Test
    void the_retry_of_the_latest_failure_ends_the_backoff() {
        var generation = state.recordFailure(new IllegalStateException("boom"), NOW, Duration.ofSeconds(5));
        assertThat(state.isBackingOff(NOW)).isTrue();

        assertThat(state.endBackoff(generation)).isTrue();

        assertThat(state.isBackingOff(NOW)).isFalse();
        assertThat(state.consecutiveFailures).isEqualTo(1);
    }

    @Test
    void a_stale_retry_keeps_the_backoff_of_a_newer_failure() {
        // Given
        var firstFailure = state.recordFailure(new IllegalStateException("boom"), NOW, Duration.ofSeconds(1));
        var secondFailure = state.recordFailure(new IllegalStateException("boom again"), NOW.plusSeconds(1), Duration.ofSeconds(30));

        // When
        var ended = state.endBackoff(firstFailure);

        // Then
        assertThat(ended).isFalse();
        assertThat(state.isBackingOff(NOW.plusSeconds(2))).isTrue();
        assertThat(state.nextAttemptAt).isEqualTo(NOW.plusSeconds(31));
        assertThat(state.endBackoff(secondFailure)).isTrue();
    }
}
