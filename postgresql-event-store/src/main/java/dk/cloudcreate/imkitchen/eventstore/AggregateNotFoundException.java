package dk.cloudcreate.imkitchen.eventstore;

import dk.cloudcreate.imkitchen.eventstore.eventstream.AggregateType;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class AggregateNotFoundException extends EventStoreException {
    public final Object        aggregateId;
    public final AggregateType aggregateType;

    public AggregateNotFoundException(Object aggregateId, AggregateType aggregateType) {
        super(msg("[{}] Couldn't find an aggregate with id '{}'", aggregateType, aggregateId));
        this.aggregateId = aggregateId;
        this.aggregateType = aggregateType;
    }
}
