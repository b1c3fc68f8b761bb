package dk.cloudcreate.imkitchen.aggregates.command;

import java.time.Duration;

import static dk.cloudcreate.essentials.shared.FailFast.*;

public class CommandBusConfiguration {
    public static final Duration DEFAULT_COMMAND_TIMEOUT         = Duration.ofSeconds(30);
    public static final int      DEFAULT_MAX_CONCURRENCY_RETRIES = 3;

    /**
     * How long {@link CommandBus#send(Object)} waits for a command to complete. {@link Duration#ZERO} disables the timeout
     * and runs the command on the calling thread
     */
    public final Duration commandTimeout;
    /**
     * How many times an {@link IdempotentCommand} is re-executed after a concurrency conflict
     */
    public final int      maxConcurrencyRetries;
    public final String   threadNamePrefix;

    public CommandBusConfiguration(Duration commandTimeout,
                                   int maxConcurrencyRetries,
                                   String threadNamePrefix) {
        this.commandTimeout = requireNonNull(commandTimeout, "You must specify a commandTimeout");
        requireTrue(!commandTimeout.isNegative(), "commandTimeout must not be negative");
        requireTrue(maxConcurrencyRetries >= 0, "maxConcurrencyRetries must be 0 or larger");
        this.maxConcurrencyRetries = maxConcurrencyRetries;
        this.threadNamePrefix = requireNonNull(threadNamePrefix, "You must specify a threadNamePrefix");
    }

    public static CommandBusConfiguration defaultConfiguration() {
        return new CommandBusConfiguration(DEFAULT_COMMAND_TIMEOUT, DEFAULT_MAX_CONCURRENCY_RETRIES, "CommandBus");
    }

    public CommandBusConfiguration withCommandTimeout(Duration commandTimeout) {
        return new CommandBusConfiguration(commandTimeout, maxConcurrencyRetries, threadNamePrefix);
    }

    public CommandBusConfiguration withMaxConcurrencyRetries(int maxConcurrencyRetries) {
        return new CommandBusConfiguration(commandTimeout, maxConcurrencyRetries, threadNamePrefix);
    }

    @Override
    public String toString() {
        return "CommandBusConfiguration{" +
                "commandTimeout=" + commandTimeout +
                ", maxConcurrencyRetries=" + maxConcurrencyRetries +
                ", threadNamePrefix='" + threadNamePrefix + '\'' +
                '}';
    }
}
