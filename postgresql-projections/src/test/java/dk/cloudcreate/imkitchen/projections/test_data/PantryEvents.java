package dk.cloudcreate.imkitchen.projections.test_data;

import com.fasterxml.jackson.annotation.JsonCreator;
import dk.cloudcreate.imkitchen.eventstore.eventstream.AggregateType;
import dk.cloudcreate.imkitchen.eventstore.persistence.AggregateTypeConfiguration;
import dk.cloudcreate.imkitchen.eventstore.serializer.JSONSerializer;

public abstract class PantryEvents {
    public static final AggregateType PANTRIES = AggregateType.of("Pantries");

    public final String pantryId;

    protected PantryEvents(String pantryId) {
        this.pantryId = pantryId;
    }

    public static AggregateTypeConfiguration configuration(JSONSerializer jsonSerializer) {
        return AggregateTypeConfiguration.standardConfigurationFor(PANTRIES, jsonSerializer)
                                         .registerEventType("StockCounted", StockCounted.class)
                                         .registerEventType("PantryRelabeled", PantryRelabeled.class);
    }

    public static class StockCounted extends PantryEvents {
        public final String item;
        public final int    quantityOnHand;

        @JsonCreator
        public StockCounted(String pantryId, String item, int quantityOnHand) {
            super(pantryId);
            this.item = item;
            this.quantityOnHand = quantityOnHand;
        }
    }

    public static class PantryRelabeled extends PantryEvents {
        public final String label;

        @JsonCreator
        public PantryRelabeled(String pantryId, String label) {
            super(pantryId);
            this.label = label;
        }
    }
}
