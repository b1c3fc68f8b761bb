package dk.cloudcreate.imkitchen.projections;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class ProjectionRetryPolicyTest {
    @Test
    void fixed_backoff_always_waits_the_same_delay() {
        var policy = ProjectionRetryPolicy.fixedBackoff(Duration.ofMillis(200));

        assertThat(policy.calculateRetryDelay(1)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.calculateRetryDelay(10)).isEqualTo(Duration.ofMillis(200));
    }

    @Test
    void linear_backoff_grows_with_every_failure_up_to_the_maximum() {
        var policy = ProjectionRetryPolicy.linearBackoff(Duration.ofMillis(100), Duration.ofMillis(350));

        assertThat(policy.calculateRetryDelay(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.calculateRetryDelay(3)).isEqualTo(Duration.ofMillis(300));
        assertThat(policy.calculateRetryDelay(4)).isEqualTo(Duration.ofMillis(350));
    }

    @Test
    void exponential_backoff_multiplies_the_delay_up_to_the_maximum() {
        var policy = ProjectionRetryPolicy.exponentialBackoff(Duration.ofMillis(100), 2.0d, Duration.ofSeconds(1));

        assertThat(policy.calculateRetryDelay(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.calculateRetryDelay(2)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.calculateRetryDelay(4)).isEqualTo(Duration.ofMillis(800));
        assertThat(policy.calculateRetryDelay(5)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.calculateRetryDelay(1000)).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void invalid_policies_are_rejected() {
        assertThatThrownBy(() -> ProjectionRetryPolicy.exponentialBackoff(Duration.ofMillis(100), 0.5d, Duration.ofSeconds(1)))
                .isExactlyInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ProjectionRetryPolicy.linearBackoff(Duration.ofSeconds(2), Duration.ofSeconds(1)))
                .isExactlyInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ProjectionRetryPolicy.fixedBackoff(Duration.ofMillis(100)).calculateRetryDelay(0))
                .isExactlyInstanceOf(IllegalArgumentException.class);
    }
}
