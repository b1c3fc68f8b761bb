package dk.cloudcreate.imkitchen.projections;

import dk.cloudcreate.imkitchen.eventstore.eventstream.AggregateType;
import dk.cloudcreate.imkitchen.eventstore.types.GlobalEventOrder;
import org.jdbi.v3.core.Handle;
import org.slf4j.*;

import java.time.*;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.NamedArgumentBinding.arg;
import static dk.cloudcreate.essentials.shared.MessageFormatter.bind;

/**
 * Durable position of each {@link ProjectionSubscription} in its aggregate type's global event order:
 * <pre>
 * projection_name   text
 * aggregate_type    text
 * last_global_order bigint      -- global order of the last event applied (or skipped), 0 before the first event
 * updated_at        timestamptz
 * PRIMARY KEY (projection_name, aggregate_type)
 * </pre>
 * The cursor row doubles as the delivery lock of the subscription: every delivery transaction locks it with
 * <code>SELECT ... FOR UPDATE</code> before applying an event and updates it in the same transaction.
 */
public class ProjectionCursors {
    public static final String DEFAULT_CURSOR_TABLE_NAME = "projection_cursors";

    private static final Logger log = LoggerFactory.getLogger(ProjectionCursors.class);

    private final String tableName;
    private final Clock  clock;

    public ProjectionCursors(String tableName, Clock clock) {
        this.tableName = requireNonNull(tableName, "No tableName provided");
        this.clock = requireNonNull(clock, "No clock provided");
    }

    public ProjectionCursors() {
        this(DEFAULT_CURSOR_TABLE_NAME, Clock.systemUTC());
    }

    public String tableName() {
        return tableName;
    }

    public void createCursorTable(Handle handle) {
        handle.execute(bind("CREATE TABLE IF NOT EXISTS {:tableName} (\n" +
                                    "    projection_name   text NOT NULL,\n" +
                                    "    aggregate_type    text NOT NULL,\n" +
                                    "    last_global_order bigint NOT NULL DEFAULT 0,\n" +
                                    "    updated_at        timestamptz NOT NULL,\n" +
                                    "    PRIMARY KEY (projection_name, aggregate_type)\n" +
                                    ")",
                            arg("tableName", tableName)));
    }

    /**
     * Create the cursor row of the subscription at {@link GlobalEventOrder#NONE} unless it already exists
     */
    public void ensureCursorExists(Handle handle, ProjectionSubscription subscription) {
        var created = handle.createUpdate(bind("INSERT INTO {:tableName} (projection_name, aggregate_type, last_global_order, updated_at)\n" +
                                                       "VALUES (:projectionName, :aggregateType, 0, :updatedAt)\n" +
                                                       "ON CONFLICT (projection_name, aggregate_type) DO NOTHING",
                                               arg("tableName", tableName)))
                            .bind("projectionName", subscription.projectionName())
                            .bind("aggregateType", subscription.aggregateType.toString())
                            .bind("updatedAt", now())
                            .execute();
        if (created == 1) {
            log.info("[{}] Created cursor", subscription);
        }
    }

    public GlobalEventOrder read(Handle handle, ProjectionSubscription subscription) {
        return handle.createQuery(bind("SELECT last_global_order FROM {:tableName} WHERE projection_name = :projectionName AND aggregate_type = :aggregateType",
                                       arg("tableName", tableName)))
                     .bind("projectionName", subscription.projectionName())
                     .bind("aggregateType", subscription.aggregateType.toString())
                     .mapTo(Long.class)
                     .findOne()
                     .map(GlobalEventOrder::of)
                     .orElseThrow(() -> new ProjectionException("[" + subscription + "] Cursor doesn't exist"));
    }

    /**
     * Lock the cursor row for the rest of the transaction and return its value
     *
     * @param skipLocked if true and another transaction holds the lock, return {@link Optional#empty()} instead of waiting
     */
    public Optional<GlobalEventOrder> lock(Handle handle, ProjectionSubscription subscription, boolean skipLocked) {
        var sql = "SELECT last_global_order FROM {:tableName} WHERE projection_name = :projectionName AND aggregate_type = :aggregateType FOR UPDATE" +
                (skipLocked ? " SKIP LOCKED" : "");
        var cursor = handle.createQuery(bind(sql, arg("tableName", tableName)))
                           .bind("projectionName", subscription.projectionName())
                           .bind("aggregateType", subscription.aggregateType.toString())
                           .mapTo(Long.class)
                           .findOne()
                           .map(GlobalEventOrder::of);
        if (cursor.isEmpty() && !skipLocked) {
            throw new ProjectionException("[" + subscription + "] Cursor doesn't exist");
        }
        return cursor;
    }

    public void advance(Handle handle, ProjectionSubscription subscription, GlobalEventOrder lastGlobalOrder) {
        var updated = handle.createUpdate(bind("UPDATE {:tableName} SET last_global_order = :lastGlobalOrder, updated_at = :updatedAt\n" +
                                                       "WHERE projection_name = :projectionName AND aggregate_type = :aggregateType",
                                               arg("tableName", tableName)))
                            .bind("lastGlobalOrder", lastGlobalOrder.longValue())
                            .bind("updatedAt", now())
                            .bind("projectionName", subscription.projectionName())
                            .bind("aggregateType", subscription.aggregateType.toString())
                            .execute();
        if (updated != 1) {
            throw new ProjectionException("[" + subscription + "] Cursor doesn't exist");
        }
    }

    /**
     * Move all cursors of the projection back to {@link GlobalEventOrder#NONE}
     */
    public int reset(Handle handle, String projectionName) {
        return handle.createUpdate(bind("UPDATE {:tableName} SET last_global_order = 0, updated_at = :updatedAt WHERE projection_name = :projectionName",
                                        arg("tableName", tableName)))
                     .bind("updatedAt", now())
                     .bind("projectionName", projectionName)
                     .execute();
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
