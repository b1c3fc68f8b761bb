package dk.cloudcreate.imkitchen.mealplanning;

import dk.cloudcreate.imkitchen.mealplanning.readmodel.*;
import dk.cloudcreate.imkitchen.mealplanning.types.UserId;
import dk.cloudcreate.imkitchen.mealplanning.user.UserCommands;
import dk.cloudcreate.imkitchen.projections.*;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.*;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.*;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

@Testcontainers(disabledWithoutDocker = true)
class MealPlanningCoreTest {
    @Container
    private final PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:latest")
            .withDatabaseName("meal-planning-core")
            .withUsername("test-user")
            .withPassword("secret-password");

    private Jdbi             jdbi;
    private MealPlanningCore core;

    @BeforeEach
    void setup() {
        jdbi = Jdbi.create(postgreSQLContainer.getJdbcUrl(),
                           postgreSQLContainer.getUsername(),
                           postgreSQLContainer.getPassword());
        core = new MealPlanningCore(jdbi, MealPlanningConfiguration.defaultConfiguration()
                                                                   .withProjectionRunnerConfiguration(ProjectionRunnerConfiguration.defaultConfiguration()
                                                                                                                                   .withPollingInterval(Duration.ofMillis(200))));
        core.start();
    }

    @AfterEach
    void cleanup() {
        if (core != null) {
            core.stop();
        }
    }

    @Test
    void every_projection_is_registered_with_a_cursor_per_stream() {
        assertThat(core.projectionRegistry().handlers())
                .extracting(ProjectionHandler::projectionName)
                .containsExactlyInAnyOrder(UserProjection.NAME,
                                           RecipeListProjection.NAME,
                                           MealPlanProjection.NAME,
                                           DashboardProjection.NAME,
                                           ShoppingListProjection.NAME);
        assertThat(core.projectionRegistry().subscriptionsOf(DashboardProjection.NAME)).hasSize(2);
        assertThat(core.projectionRunner().isStarted()).isTrue();
    }

    @Test
    void the_read_models_are_updated_in_the_background() {
        UserId userId = core.commandBus().send(new UserCommands.RegisterUser("bob@example.com"));

        await().atMost(Duration.ofSeconds(10))
               .untilAsserted(() -> assertThat(jdbi.withHandle(handle -> handle.createQuery("SELECT count(*) FROM users WHERE id = :id")
                                                                               .bind("id", userId.toString())
                                                                               .mapTo(Integer.class)
                                                                               .one()))
                       .isEqualTo(1));
        await().atMost(Duration.ofSeconds(10))
               .untilAsserted(() -> assertThat(core.projectionRunner().status())
                       .allSatisfy(status -> assertThat(status.lag()).isZero()));
    }

    @Test
    void draining_is_refused_while_the_runner_is_started() {
        assertThatThrownBy(() -> core.projectionDrainer().drainAll())
                .isInstanceOf(ProjectionException.class);

        core.stop();
        assertThat(core.isStarted()).isFalse();
        assertThat(core.projectionDrainer().drainAll().totalAppliedEvents()).isZero();
    }
}
