package dk.cloudcreate.imkitchen.aggregates.command;

/**
 * Marker for commands that are safe to execute again after a concurrency conflict, because the handler re-reads
 * the aggregate and decides again. The {@link CommandBus} only retries commands that implement this interface.
 */
public interface IdempotentCommand {
}
