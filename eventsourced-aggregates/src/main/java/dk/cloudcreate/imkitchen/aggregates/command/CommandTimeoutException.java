package dk.cloudcreate.imkitchen.aggregates.command;

import java.time.Duration;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The command didn't complete within the configured timeout.<br>
 * The outcome is unknown: the unit of work may still commit after the caller gave up waiting.
 */
public class CommandTimeoutException extends CommandBusException {
    public final Object   command;
    public final Duration timeout;

    public CommandTimeoutException(Object command, Duration timeout) {
        super(msg("Command {} didn't complete within {}. The outcome is unknown", command.getClass().getSimpleName(), timeout));
        this.command = command;
        this.timeout = timeout;
    }
}
