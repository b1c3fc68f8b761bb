package dk.cloudcreate.imkitchen.eventstore.test_data;

import com.fasterxml.jackson.annotation.JsonCreator;
import dk.cloudcreate.imkitchen.eventstore.eventstream.AggregateType;
import dk.cloudcreate.imkitchen.eventstore.persistence.AggregateTypeConfiguration;
import dk.cloudcreate.imkitchen.eventstore.serializer.JSONSerializer;

import java.time.Instant;
import java.util.List;

public final class PantryEvents {
    public static final AggregateType PANTRIES = AggregateType.of("Pantries");

    private PantryEvents() {
    }

    public static AggregateTypeConfiguration configuration(JSONSerializer jsonSerializer) {
        return AggregateTypeConfiguration.standardConfigurationFor(PANTRIES, jsonSerializer)
                                         .registerEventType("PantryOpened", PantryOpened.class)
                                         .registerEventType("ItemStocked", ItemStocked.class);
    }

    public static class PantryOpened {
        public final PantryId     pantryId;
        public final String       owner;
        public final List<String> shelves;
        public final Instant      openedAt;

        @JsonCreator
        public PantryOpened(PantryId pantryId, String owner, List<String> shelves, Instant openedAt) {
            this.pantryId = pantryId;
            this.owner = owner;
            this.shelves = shelves;
            this.openedAt = openedAt;
        }
    }

    public static class ItemStocked {
        public final PantryId pantryId;
        public final String   item;
        public final int      quantity;

        @JsonCreator
        public ItemStocked(PantryId pantryId, String item, int quantity) {
            this.pantryId = pantryId;
            this.item = item;
            this.quantity = quantity;
        }
    }

    /**
     * Deliberately not registered with the configuration
     */
    public static class PantryClosed {
        public final PantryId pantryId;

        public PantryClosed(PantryId pantryId) {
            this.pantryId = pantryId;
        }
    }
}
