package dk.cloudcreate.imkitchen.aggregates.command;

import dk.cloudcreate.imkitchen.common.Lifecycle;
import dk.cloudcreate.imkitchen.eventstore.EventStoreUnavailableException;
import dk.cloudcreate.imkitchen.eventstore.persistence.OptimisticAppendToStreamException;
import dk.cloudcreate.imkitchen.eventstore.transaction.EventStoreUnitOfWorkFactory;
import dk.cloudcreate.essentials.shared.concurrent.ThreadFactoryBuilder;
import org.jdbi.v3.core.ConnectionException;
import org.slf4j.*;

import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Routes commands to the {@link CommandHandler} registered for the command's type.<br>
 * <br>
 * Each command runs in its own unit of work: the handler's reads, event appends and side table writes commit
 * together or not at all. Errors reach the caller with their own type:
 * <ul>
 *     <li>{@link dk.cloudcreate.imkitchen.aggregates.DomainException} - rejected by a business rule, nothing was written</li>
 *     <li>{@link OptimisticAppendToStreamException} - a concurrent append won. Commands implementing {@link IdempotentCommand}
 *     are re-executed up to {@link CommandBusConfiguration#maxConcurrencyRetries} times first</li>
 *     <li>{@link UniquenessViolationException}</li>
 *     <li>{@link EventStoreUnavailableException} - the database couldn't be reached</li>
 *     <li>{@link CommandTimeoutException} - the command didn't complete within {@link CommandBusConfiguration#commandTimeout},
 *     the outcome is unknown</li>
 * </ul>
 */
public class CommandBus implements Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(CommandBus.class);

    private final EventStoreUnitOfWorkFactory                       unitOfWorkFactory;
    private final CommandBusConfiguration                           configuration;
    private final ConcurrentMap<Class<?>, CommandHandler<?, ?>>     commandHandlers = new ConcurrentHashMap<>();
    private       ExecutorService                                   commandExecutor;
    private volatile boolean                                        started;

    public CommandBus(EventStoreUnitOfWorkFactory unitOfWorkFactory, CommandBusConfiguration configuration) {
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.configuration = requireNonNull(configuration, "No configuration provided");
    }

    public CommandBus(EventStoreUnitOfWorkFactory unitOfWorkFactory) {
        this(unitOfWorkFactory, CommandBusConfiguration.defaultConfiguration());
    }

    public CommandBus addCommandHandler(CommandHandler<?, ?> commandHandler) {
        requireNonNull(commandHandler, "No commandHandler provided");
        var existing = commandHandlers.putIfAbsent(commandHandler.commandType(), commandHandler);
        if (existing != null && existing != commandHandler) {
            throw new CommandBusException(msg("A CommandHandler for {} is already registered: {}",
                                              commandHandler.commandType().getName(),
                                              existing.getClass().getName()));
        }
        log.debug("Registered {} for command type {}", commandHandler.getClass().getSimpleName(), commandHandler.commandType().getSimpleName());
        return this;
    }

    @Override
    public synchronized void start() {
        if (started) {
            log.debug("CommandBus was already started");
            return;
        }
        log.info("Starting CommandBus with {}", configuration);
        if (!configuration.commandTimeout.isZero()) {
            commandExecutor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                                                                    .nameFormat(configuration.threadNamePrefix + "-%d")
                                                                    .daemon(true)
                                                                    .build());
        }
        started = true;
    }

    @Override
    public synchronized void stop() {
        if (!started) {
            return;
        }
        log.info("Stopping CommandBus");
        started = false;
        if (commandExecutor != null) {
            commandExecutor.shutdown();
            try {
                if (!commandExecutor.awaitTermination(configuration.commandTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Commands were still running after {}", configuration.commandTimeout);
                    commandExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                commandExecutor.shutdownNow();
            }
            commandExecutor = null;
        }
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    /**
     * Execute the command and wait for its outcome
     *
     * @return the id returned by the {@link CommandHandler}
     * @throws NoCommandHandlerFoundException if no handler is registered for the command type
     */
    @SuppressWarnings("unchecked")
    public <ID> ID send(Object command) {
        requireNonNull(command, "No command provided");
        if (!started) {
            throw new CommandBusException("The CommandBus isn't started");
        }
        var commandHandler = (CommandHandler<Object, ID>) commandHandlers.get(command.getClass());
        if (commandHandler == null) {
            throw new NoCommandHandlerFoundException(command.getClass());
        }
        if (commandExecutor == null) {
            return handleWithRetries(commandHandler, command);
        }
        var result = commandExecutor.submit(() -> handleWithRetries(commandHandler, command));
        try {
            return result.get(configuration.commandTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Command {} didn't complete within {}", command.getClass().getSimpleName(), configuration.commandTimeout);
            throw new CommandTimeoutException(command, configuration.commandTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CommandBusException(msg("Interrupted while waiting for {}", command.getClass().getSimpleName()), e);
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new CommandBusException(msg("{} failed", command.getClass().getSimpleName()), cause);
        }
    }

    private <ID> ID handleWithRetries(CommandHandler<Object, ID> commandHandler, Object command) {
        var attempt = 0;
        while (true) {
            try {
                return handleInUnitOfWork(commandHandler, command);
            } catch (OptimisticAppendToStreamException e) {
                if (!(command instanceof IdempotentCommand) || attempt >= configuration.maxConcurrencyRetries) {
                    throw e;
                }
                attempt++;
                log.debug("[{}] Concurrency conflict on '{}', retrying {} (attempt {} of {})",
                          e.aggregateType,
                          e.aggregateId,
                          command.getClass().getSimpleName(),
                          attempt,
                          configuration.maxConcurrencyRetries);
            }
        }
    }

    private <ID> ID handleInUnitOfWork(CommandHandler<Object, ID> commandHandler, Object command) {
        log.trace("Handling {} using {}", command.getClass().getSimpleName(), commandHandler.getClass().getSimpleName());
        try {
            return unitOfWorkFactory.withUnitOfWork(unitOfWork -> commandHandler.handle(command));
        } catch (ConnectionException e) {
            throw new EventStoreUnavailableException(msg("Couldn't connect to the database while handling {}", command.getClass().getSimpleName()), e);
        }
    }
}
