package dk.cloudcreate.imkitchen.mealplanning;

import dk.cloudcreate.imkitchen.projections.DrainResult;
import org.jdbi.v3.core.HandleCallback;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Sends commands through the {@link MealPlanningCore} and brings every read model up to date before returning, so a test reads
 * the read models only after the events of its commands have been projected
 */
public class ProjectionTestHarness {
    private final MealPlanningCore core;

    public ProjectionTestHarness(MealPlanningCore core) {
        this.core = requireNonNull(core, "No core provided");
    }

    /**
     * Send the command and drain every projection. A rejected command is rethrown without draining
     *
     * @return the id returned by the command handler
     */
    public <ID> ID execute(Object command) {
        ID result = core.commandBus().send(command);
        drain();
        return result;
    }

    public DrainResult drain() {
        return core.projectionDrainer().drainAll();
    }

    public <R> R read(HandleCallback<R, RuntimeException> query) {
        return core.unitOfWorkFactory().getJdbi().withHandle(query);
    }

    public int countRows(String table, String whereClause, Object... arguments) {
        return read(handle -> {
            var query = handle.createQuery("SELECT count(*) FROM " + table + (whereClause.isEmpty() ? "" : " WHERE " + whereClause));
            for (var i = 0; i < arguments.length; i++) {
                query.bind(i, arguments[i]);
            }
            return query.mapTo(Integer.class).one();
        });
    }

    public int countRows(String table) {
        return countRows(table, "");
    }
}
