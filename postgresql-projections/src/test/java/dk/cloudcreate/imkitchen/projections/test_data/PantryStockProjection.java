package dk.cloudcreate.imkitchen.projections.test_data;

import dk.cloudcreate.imkitchen.eventstore.eventstream.*;
import dk.cloudcreate.imkitchen.eventstore.types.EventType;
import dk.cloudcreate.imkitchen.projections.TypedProjectionHandler;
import org.jdbi.v3.core.Handle;

import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps <code>pantry_stock</code> up to date. Every application is also recorded in <code>pantry_stock_log</code>, whose primary key
 * is the global order, so applying the same event twice fails
 */
public class PantryStockProjection extends TypedProjectionHandler<PantryEvents> {
    public static final String NAME = "pantry_stock_projection";

    private final String        projectionName;
    private final Set<String>   poisonItems = Collections.synchronizedSet(new HashSet<>());
    public final  AtomicInteger applications = new AtomicInteger();

    public PantryStockProjection(String projectionName) {
        super(PantryEvents.class);
        this.projectionName = projectionName;
    }

    public PantryStockProjection() {
        this(NAME);
    }

    /**
     * Make the projection fail for events about the item until {@link #heal(String)} is called
     */
    public void poison(String item) {
        poisonItems.add(item);
    }

    public void heal(String item) {
        poisonItems.remove(item);
    }

    @Override
    public String projectionName() {
        return projectionName;
    }

    @Override
    public Set<AggregateType> aggregateTypes() {
        return Set.of(PantryEvents.PANTRIES);
    }

    @Override
    public Set<EventType> interestedEventTypes() {
        return Set.of(EventType.of("StockCounted"));
    }

    @Override
    public void initializeReadModel(Handle handle) {
        handle.execute("CREATE TABLE IF NOT EXISTS " + stockTable() + " (\n" +
                               "    pantry_id text NOT NULL,\n" +
                               "    item      text NOT NULL,\n" +
                               "    quantity  integer NOT NULL,\n" +
                               "    PRIMARY KEY (pantry_id, item)\n" +
                               ")");
        handle.execute("CREATE TABLE IF NOT EXISTS " + logTable() + " (\n" +
                               "    global_order bigint PRIMARY KEY\n" +
                               ")");
    }

    @Override
    public void resetReadModel(Handle handle) {
        handle.execute("TRUNCATE " + stockTable() + ", " + logTable());
    }

    @Override
    protected void handle(Handle handle, PersistedEvent persistedEvent, PantryEvents event) {
        var stockCounted = (PantryEvents.StockCounted) event;
        if (poisonItems.contains(stockCounted.item)) {
            throw new IllegalStateException("Poisoned item " + stockCounted.item);
        }
        handle.createUpdate("INSERT INTO " + stockTable() + " (pantry_id, item, quantity) VALUES (:pantryId, :item, :quantity)\n" +
                                    "ON CONFLICT (pantry_id, item) DO UPDATE SET quantity = EXCLUDED.quantity")
              .bind("pantryId", stockCounted.pantryId)
              .bind("item", stockCounted.item)
              .bind("quantity", stockCounted.quantityOnHand)
              .execute();
        handle.createUpdate("INSERT INTO " + logTable() + " (global_order) VALUES (:globalOrder)")
              .bind("globalOrder", persistedEvent.globalEventOrder().longValue())
              .execute();
        applications.incrementAndGet();
    }

    public String stockTable() {
        return projectionName + "_stock";
    }

    public String logTable() {
        return projectionName + "_log";
    }
}
