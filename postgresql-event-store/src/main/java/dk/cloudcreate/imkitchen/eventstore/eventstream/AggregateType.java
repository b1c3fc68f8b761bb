package dk.cloudcreate.imkitchen.eventstore.eventstream;

import dk.cloudcreate.essentials.types.CharSequenceType;

/**
 * Groups the {@link AggregateEventStream}'s of the same kind of aggregate, e.g. all recipe streams share the aggregate type <b>Recipes</b>.<br>
 * Each {@link AggregateType} has its own event table, its own global event order and its own projection cursors.
 */
public class AggregateType extends CharSequenceType<AggregateType> {
    public AggregateType(CharSequence value) {
        super(value);
    }

    public static AggregateType of(CharSequence value) {
        return new AggregateType(value);
    }
}
