package dk.cloudcreate.imkitchen.eventstore.persistence;

import dk.cloudcreate.imkitchen.eventstore.eventstream.AggregateType;
import dk.cloudcreate.imkitchen.eventstore.types.EventOrder;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The expected version supplied to an append didn't match the last committed event order of the aggregate,
 * i.e. another writer appended to the same stream in the meantime.<br>
 * Recoverable by reloading the aggregate and retrying the command.
 */
public class OptimisticAppendToStreamException extends AppendToStreamException {
    public final AggregateType aggregateType;
    public final String        aggregateId;
    public final EventOrder    expectedVersion;
    public final EventOrder    actualVersion;

    public OptimisticAppendToStreamException(AggregateType aggregateType,
                                             String aggregateId,
                                             EventOrder expectedVersion,
                                             EventOrder actualVersion,
                                             Throwable cause) {
        super(msg("[{}] Concurrent modification of aggregate '{}'. Expected version {} but the stream is at version {}",
                  aggregateType,
                  aggregateId,
                  expectedVersion,
                  actualVersion != null ? actualVersion : "unknown"),
              cause);
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}
