package dk.cloudcreate.imkitchen.mealplanning.readmodel;

import dk.cloudcreate.imkitchen.eventstore.eventstream.*;
import dk.cloudcreate.imkitchen.eventstore.types.EventType;
import dk.cloudcreate.imkitchen.mealplanning.mealplan.*;
import dk.cloudcreate.imkitchen.mealplanning.types.*;
import dk.cloudcreate.imkitchen.projections.TypedProjectionHandler;
import org.jdbi.v3.core.Handle;

import java.time.LocalDate;
import java.util.Set;

/**
 * Maintains the calendar read model: <code>meal_plans</code> and the <code>meal_assignments</code> of the active plans.<br>
 * An archived plan keeps its <code>meal_plans</code> row, but its assignments are removed.
 */
public class MealPlanProjection extends TypedProjectionHandler<MealPlanEvent> implements MealPlanEventVisitor<Handle, Void> {
    public static final String NAME             = "meal_plan_projection";
    public static final String MEAL_PLANS       = "meal_plans";
    public static final String MEAL_ASSIGNMENTS = "meal_assignments";

    public MealPlanProjection() {
        super(MealPlanEvent.class);
    }

    /**
     * Deterministic id of an assignment row
     */
    public static String assignmentId(MealPlanId mealPlanId, LocalDate date, CourseType courseType) {
        return mealPlanId + ":" + date + ":" + courseType.name();
    }

    @Override
    public String projectionName() {
        return NAME;
    }

    @Override
    public Set<AggregateType> aggregateTypes() {
        return Set.of(MealPlan.MEAL_PLANS);
    }

    @Override
    public Set<EventType> interestedEventTypes() {
        return Set.of(EventType.of("MealPlanGenerated"),
                      EventType.of("MealReplaced"),
                      EventType.of("MealPlanArchived"));
    }

    @Override
    public void initializeReadModel(Handle handle) {
        handle.execute("CREATE TABLE IF NOT EXISTS " + MEAL_PLANS + " (\n" +
                               "    id           text PRIMARY KEY,\n" +
                               "    user_id      text NOT NULL,\n" +
                               "    start_date   date NOT NULL,\n" +
                               "    end_date     date NOT NULL,\n" +
                               "    weeks        integer NOT NULL,\n" +
                               "    status       text NOT NULL,\n" +
                               "    generated_at timestamptz NOT NULL,\n" +
                               "    archived_at  timestamptz\n" +
                               ")");
        handle.execute("CREATE INDEX IF NOT EXISTS idx_" + MEAL_PLANS + "_user ON " + MEAL_PLANS + " (user_id)");
        handle.execute("CREATE TABLE IF NOT EXISTS " + MEAL_ASSIGNMENTS + " (\n" +
                               "    id                   text PRIMARY KEY,\n" +
                               "    meal_plan_id         text NOT NULL,\n" +
                               "    user_id              text NOT NULL,\n" +
                               "    week_number          integer NOT NULL,\n" +
                               "    date                 date NOT NULL,\n" +
                               "    course_type          text NOT NULL,\n" +
                               "    recipe_id            text NOT NULL,\n" +
                               "    prep_required        boolean NOT NULL,\n" +
                               "    assignment_reasoning text NOT NULL\n" +
                               ")");
        handle.execute("CREATE INDEX IF NOT EXISTS idx_" + MEAL_ASSIGNMENTS + "_user_date ON " + MEAL_ASSIGNMENTS + " (user_id, date)");
    }

    @Override
    public void resetReadModel(Handle handle) {
        handle.execute("TRUNCATE " + MEAL_PLANS + ", " + MEAL_ASSIGNMENTS);
    }

    @Override
    protected void handle(Handle handle, PersistedEvent persistedEvent, MealPlanEvent event) {
        event.accept(this, handle);
    }

    @Override
    public Void on(MealPlanEvent.MealPlanGenerated event, Handle handle) {
        handle.createUpdate("INSERT INTO " + MEAL_PLANS + " (id, user_id, start_date, end_date, weeks, status, generated_at, archived_at)\n" +
                                    "VALUES (:id, :userId, :startDate, :endDate, :weeks, :status, :generatedAt, NULL)\n" +
                                    "ON CONFLICT (id) DO UPDATE SET user_id = EXCLUDED.user_id, start_date = EXCLUDED.start_date,\n" +
                                    "    end_date = EXCLUDED.end_date, weeks = EXCLUDED.weeks, status = EXCLUDED.status,\n" +
                                    "    generated_at = EXCLUDED.generated_at, archived_at = NULL")
              .bind("id", event.mealPlanId.toString())
              .bind("userId", event.userId.toString())
              .bind("startDate", event.startDate)
              .bind("endDate", event.endDate())
              .bind("weeks", event.weeks.size())
              .bind("status", MealPlanState.Status.ACTIVE.name())
              .bind("generatedAt", event.generatedAt)
              .execute();

        var batch = handle.prepareBatch("INSERT INTO " + MEAL_ASSIGNMENTS + " (id, meal_plan_id, user_id, week_number, date, course_type,\n" +
                                                "    recipe_id, prep_required, assignment_reasoning)\n" +
                                                "VALUES (:id, :mealPlanId, :userId, :weekNumber, :date, :courseType, :recipeId, :prepRequired, :reasoning)\n" +
                                                "ON CONFLICT (id) DO UPDATE SET recipe_id = EXCLUDED.recipe_id, prep_required = EXCLUDED.prep_required,\n" +
                                                "    assignment_reasoning = EXCLUDED.assignment_reasoning");
        for (var week : event.weeks) {
            for (var assignment : week.assignments) {
                batch.bind("id", assignmentId(event.mealPlanId, assignment.date, assignment.courseType))
                     .bind("mealPlanId", event.mealPlanId.toString())
                     .bind("userId", event.userId.toString())
                     .bind("weekNumber", week.weekNumber)
                     .bind("date", assignment.date)
                     .bind("courseType", assignment.courseType.name())
                     .bind("recipeId", assignment.recipeId.toString())
                     .bind("prepRequired", assignment.prepRequired)
                     .bind("reasoning", assignment.reasoning)
                     .add();
            }
        }
        if (batch.size() > 0) {
            batch.execute();
        }
        return null;
    }

    @Override
    public Void on(MealPlanEvent.MealReplaced event, Handle handle) {
        handle.createUpdate("UPDATE " + MEAL_ASSIGNMENTS + " SET recipe_id = :recipeId, prep_required = :prepRequired, assignment_reasoning = :reasoning\n" +
                                    "WHERE id = :id")
              .bind("id", assignmentId(event.mealPlanId, event.date, event.courseType))
              .bind("recipeId", event.newRecipeId.toString())
              .bind("prepRequired", event.prepRequired)
              .bind("reasoning", MealAssignment.REPLACED_BY_USER)
              .execute();
        return null;
    }

    @Override
    public Void on(MealPlanEvent.MealPlanArchived event, Handle handle) {
        handle.createUpdate("UPDATE " + MEAL_PLANS + " SET status = :status, archived_at = :archivedAt WHERE id = :id")
              .bind("id", event.mealPlanId.toString())
              .bind("status", MealPlanState.Status.ARCHIVED.name())
              .bind("archivedAt", event.archivedAt)
              .execute();
        handle.createUpdate("DELETE FROM " + MEAL_ASSIGNMENTS + " WHERE meal_plan_id = :mealPlanId")
              .bind("mealPlanId", event.mealPlanId.toString())
              .execute();
        return null;
    }
}
