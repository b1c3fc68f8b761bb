package dk.cloudcreate.imkitchen.aggregates.command;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class NoCommandHandlerFoundException extends CommandBusException {
    public NoCommandHandlerFoundException(Class<?> commandType) {
        super(msg("No CommandHandler registered for command type {}", commandType.getName()));
    }
}
