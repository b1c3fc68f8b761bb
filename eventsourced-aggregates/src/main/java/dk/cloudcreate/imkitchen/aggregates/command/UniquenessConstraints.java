package dk.cloudcreate.imkitchen.aggregates.command;

import org.jdbi.v3.core.Handle;
import org.slf4j.*;

import java.time.*;
import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.NamedArgumentBinding.arg;
import static dk.cloudcreate.essentials.shared.MessageFormatter.*;

/**
 * Write side uniqueness checks that can't be decided from a single aggregate's events (e.g. one account per email).<br>
 * A key is claimed in a side table inside the same transaction as the events that depend on it, so the claim and the
 * events commit or roll back together. Each constraint table has the layout:
 * <pre>
 * unique_key text PRIMARY KEY
 * owner_id   text NOT NULL
 * claimed_at timestamptz NOT NULL
 * </pre>
 */
public final class UniquenessConstraints {
    private static final Logger log = LoggerFactory.getLogger(UniquenessConstraints.class);

    private UniquenessConstraints() {
    }

    public static void createConstraintTable(Handle handle, String table) {
        requireNonNull(handle, "No handle provided");
        handle.execute(bind("CREATE TABLE IF NOT EXISTS {:table} (\n" +
                                    "    unique_key text PRIMARY KEY,\n" +
                                    "    owner_id   text NOT NULL,\n" +
                                    "    claimed_at timestamptz NOT NULL\n" +
                                    ")",
                            arg("table", validTableName(table))));
    }

    /**
     * Claim <code>key</code> for <code>owner</code>. Claiming a key the same owner already holds is a no-op.
     *
     * @param clock supplies the <code>claimed_at</code> time
     * @throws UniquenessViolationException if another owner holds the key
     */
    public static void claim(Handle handle, String table, String key, Object owner, Clock clock) {
        requireNonNull(handle, "No handle provided");
        requireNonNull(clock, "No clock provided");
        requireNonNull(key, "No key provided");
        requireNonNull(owner, "No owner provided");
        var inserted = handle.createUpdate(bind("INSERT INTO {:table} (unique_key, owner_id, claimed_at) VALUES (:key, :owner, :claimedAt)\n" +
                                                        "ON CONFLICT (unique_key) DO NOTHING",
                                                arg("table", validTableName(table))))
                             .bind("key", key)
                             .bind("owner", owner.toString())
                             .bind("claimedAt", OffsetDateTime.now(clock))
                             .execute();
        if (inserted == 1) {
            log.debug("[{}] '{}' claimed by '{}'", table, key, owner);
            return;
        }
        var currentOwner = ownerOf(handle, table, key);
        if (currentOwner.isPresent() && currentOwner.get().equals(owner.toString())) {
            return;
        }
        throw new UniquenessViolationException(table, key);
    }

    /**
     * Release a key, e.g. when the owning aggregate is deleted
     */
    public static void release(Handle handle, String table, String key) {
        requireNonNull(handle, "No handle provided");
        handle.createUpdate(bind("DELETE FROM {:table} WHERE unique_key = :key", arg("table", validTableName(table))))
              .bind("key", requireNonNull(key, "No key provided"))
              .execute();
    }

    public static Optional<String> ownerOf(Handle handle, String table, String key) {
        return handle.createQuery(bind("SELECT owner_id FROM {:table} WHERE unique_key = :key", arg("table", validTableName(table))))
                     .bind("key", key)
                     .mapTo(String.class)
                     .findOne();
    }

    private static String validTableName(String table) {
        requireNonNull(table, "No table provided");
        requireTrue(table.matches("[a-z][a-z0-9_]*"), msg("'{}' isn't a valid constraint table name", table));
        return table;
    }
}
