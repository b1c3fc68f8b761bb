package dk.cloudcreate.imkitchen.aggregates.command;

/**
 * Handles a single command type: load the aggregate, decide, append.<br>
 * {@link #handle(Object)} is called by the {@link CommandBus} inside an active unit of work, so everything the handler
 * writes (events and side tables) commits or rolls back together.
 *
 * @param <COMMAND> the command type
 * @param <ID>      the id of the aggregate the command targets or creates
 */
public interface CommandHandler<COMMAND, ID> {
    Class<COMMAND> commandType();

    /**
     * @return the id of the aggregate affected by the command
     * @throws dk.cloudcreate.imkitchen.aggregates.DomainException                                 if a business rule rejects the command
     * @throws dk.cloudcreate.imkitchen.eventstore.persistence.OptimisticAppendToStreamException if a concurrent append won
     * @throws UniquenessViolationException                                                          if a unique key is already claimed
     */
    ID handle(COMMAND command);
}
