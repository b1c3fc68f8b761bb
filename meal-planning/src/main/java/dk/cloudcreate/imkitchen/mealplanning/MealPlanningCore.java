package dk.cloudcreate.imkitchen.mealplanning;

import dk.cloudcreate.imkitchen.aggregates.command.*;
import dk.cloudcreate.imkitchen.common.Lifecycle;
import dk.cloudcreate.imkitchen.eventstore.PostgresqlEventStore;
import dk.cloudcreate.imkitchen.eventstore.persistence.*;
import dk.cloudcreate.imkitchen.eventstore.serializer.*;
import dk.cloudcreate.imkitchen.eventstore.transaction.EventStoreManagedUnitOfWorkFactory;
import dk.cloudcreate.imkitchen.mealplanning.mealplan.*;
import dk.cloudcreate.imkitchen.mealplanning.readmodel.*;
import dk.cloudcreate.imkitchen.mealplanning.recipe.*;
import dk.cloudcreate.imkitchen.mealplanning.shopping.*;
import dk.cloudcreate.imkitchen.mealplanning.types.*;
import dk.cloudcreate.imkitchen.mealplanning.user.*;
import dk.cloudcreate.imkitchen.projections.*;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.*;

import java.util.stream.Stream;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Wires the meal planning domain together on top of a {@link Jdbi} instance:
 * <ul>
 *     <li>the {@link PostgresqlEventStore} with the Users, Recipes, MealPlans and ShoppingLists aggregate types</li>
 *     <li>the command side tables and the {@link CommandBus} with every command handler</li>
 *     <li>the {@link ProjectionRegistry} with every read model projection and the {@link ProjectionRunner}</li>
 * </ul>
 * Commands are sent through {@link #commandBus()}. The read models are updated in the background while the core is started
 * with {@link MealPlanningConfiguration#continuousProjections}, and can always be brought up to date explicitly
 * through {@link #projectionDrainer()} when the runner isn't started.
 */
public class MealPlanningCore implements Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(MealPlanningCore.class);

    private final MealPlanningConfiguration                                                   configuration;
    private final EventStoreManagedUnitOfWorkFactory                                          unitOfWorkFactory;
    private final PostgresqlEventStore                                                        eventStore;
    private final EventSourcedRepository<UserId, UserEvent, UserState>                         users;
    private final EventSourcedRepository<RecipeId, RecipeEvent, RecipeState>                   recipes;
    private final EventSourcedRepository<MealPlanId, MealPlanEvent, MealPlanState>             mealPlans;
    private final EventSourcedRepository<ShoppingListId, ShoppingListEvent, ShoppingListState> shoppingLists;
    private final CommandBus                                                                  commandBus;
    private final ProjectionRegistry                                                          projectionRegistry;
    private final ProjectionRunner                                                            projectionRunner;
    private final ProjectionDrainer                                                           projectionDrainer;

    public MealPlanningCore(Jdbi jdbi, MealPlanningConfiguration configuration) {
        requireNonNull(jdbi, "No jdbi provided");
        this.configuration = requireNonNull(configuration, "No configuration provided");
        jdbi.setSqlLogger(new EventStoreSqlLogger());

        unitOfWorkFactory = new EventStoreManagedUnitOfWorkFactory(jdbi);
        eventStore = new PostgresqlEventStore(unitOfWorkFactory,
                                              new SeparateTablePerAggregateTypePersistenceStrategy(unitOfWorkFactory, configuration.clock));
        var jsonSerializer = new JacksonJSONSerializer();
        eventStore.addAggregateTypeConfiguration(User.aggregateTypeConfiguration(jsonSerializer));
        eventStore.addAggregateTypeConfiguration(Recipe.aggregateTypeConfiguration(jsonSerializer));
        eventStore.addAggregateTypeConfiguration(MealPlan.aggregateTypeConfiguration(jsonSerializer));
        eventStore.addAggregateTypeConfiguration(ShoppingList.aggregateTypeConfiguration(jsonSerializer));

        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            UserCommandHandlers.createSideTables(unitOfWork.handle());
            RecipeCommandHandlers.createSideTables(unitOfWork.handle());
            MealPlanCommandHandlers.createSideTables(unitOfWork.handle());
        });

        users = new EventSourcedRepository<>(eventStore, new User());
        recipes = new EventSourcedRepository<>(eventStore, new Recipe());
        mealPlans = new EventSourcedRepository<>(eventStore, new MealPlan());
        shoppingLists = new EventSourcedRepository<>(eventStore, new ShoppingList());

        commandBus = new CommandBus(unitOfWorkFactory, configuration.commandBusConfiguration);
        Stream.of(new UserCommandHandlers(eventStore, users, configuration.clock).handlers(),
                  new RecipeCommandHandlers(eventStore, recipes, users, configuration.clock).handlers(),
                  new MealPlanCommandHandlers(eventStore, mealPlans, users, configuration.clock).handlers(),
                  new ShoppingListCommandHandlers(shoppingLists, mealPlans, recipes, configuration.clock).handlers())
              .flatMap(handlers -> handlers.stream())
              .forEach(commandBus::addCommandHandler);

        projectionRegistry = new ProjectionRegistry(eventStore);
        projectionRegistry.register(new UserProjection())
                          .register(new RecipeListProjection())
                          .register(new MealPlanProjection())
                          .register(new DashboardProjection())
                          .register(new ShoppingListProjection());
        projectionRunner = new ProjectionRunner(projectionRegistry, configuration.projectionRunnerConfiguration, configuration.clock);
        projectionDrainer = new ProjectionDrainer(projectionRegistry);
        log.info("Created MealPlanningCore with {}", configuration);
    }

    public MealPlanningCore(Jdbi jdbi) {
        this(jdbi, MealPlanningConfiguration.defaultConfiguration());
    }

    @Override
    public synchronized void start() {
        commandBus.start();
        if (configuration.continuousProjections) {
            projectionRunner.start();
        }
    }

    @Override
    public synchronized void stop() {
        projectionRunner.stop();
        commandBus.stop();
    }

    @Override
    public boolean isStarted() {
        return commandBus.isStarted();
    }

    public CommandBus commandBus() {
        return commandBus;
    }

    public PostgresqlEventStore eventStore() {
        return eventStore;
    }

    public EventStoreManagedUnitOfWorkFactory unitOfWorkFactory() {
        return unitOfWorkFactory;
    }

    public ProjectionRegistry projectionRegistry() {
        return projectionRegistry;
    }

    public ProjectionRunner projectionRunner() {
        return projectionRunner;
    }

    public ProjectionDrainer projectionDrainer() {
        return projectionDrainer;
    }

    public EventSourcedRepository<UserId, UserEvent, UserState> users() {
        return users;
    }

    public EventSourcedRepository<RecipeId, RecipeEvent, RecipeState> recipes() {
        return recipes;
    }

    public EventSourcedRepository<MealPlanId, MealPlanEvent, MealPlanState> mealPlans() {
        return mealPlans;
    }

    public EventSourcedRepository<ShoppingListId, ShoppingListEvent, ShoppingListState> shoppingLists() {
        return shoppingLists;
    }
}
