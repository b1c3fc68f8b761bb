package dk.cloudcreate.imkitchen.aggregates.command;

import dk.cloudcreate.imkitchen.aggregates.*;
import dk.cloudcreate.imkitchen.aggregates.order.*;
import dk.cloudcreate.imkitchen.eventstore.*;
import dk.cloudcreate.imkitchen.eventstore.persistence.*;
import dk.cloudcreate.imkitchen.eventstore.serializer.JacksonJSONSerializer;
import dk.cloudcreate.imkitchen.eventstore.transaction.EventStoreManagedUnitOfWorkFactory;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.*;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static dk.cloudcreate.imkitchen.aggregates.order.OrderEvent.ORDERS;
import static org.assertj.core.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class CommandBusTest {
    private static final String ORDER_NUMBER_UNIQUENESS = "order_number_uniqueness";
    private static final Clock  CLOCK                   = Clock.fixed(Instant.parse("2025-01-03T10:15:30Z"), ZoneOffset.UTC);

    @Container
    private final PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:latest")
            .withDatabaseName("command-bus")
            .withUsername("test-user")
            .withPassword("secret-password");

    private EventStoreManagedUnitOfWorkFactory                      unitOfWorkFactory;
    private PostgresqlEventStore                                    eventStore;
    private EventSourcedRepository<OrderId, OrderEvent, OrderState> orders;
    private CommandBus                                              commandBus;
    private final AtomicInteger                                     addProductAttempts = new AtomicInteger();
    private final AtomicInteger                                     acceptAttempts     = new AtomicInteger();

    @BeforeEach
    void setup() {
        var jdbi = Jdbi.create(postgreSQLContainer.getJdbcUrl(),
                               postgreSQLContainer.getUsername(),
                               postgreSQLContainer.getPassword());
        unitOfWorkFactory = new EventStoreManagedUnitOfWorkFactory(jdbi);
        eventStore = new PostgresqlEventStore(unitOfWorkFactory,
                                              new SeparateTablePerAggregateTypePersistenceStrategy(unitOfWorkFactory, Clock.systemUTC()));
        eventStore.addAggregateTypeConfiguration(OrderEvent.configuration(new JacksonJSONSerializer()));
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> UniquenessConstraints.createConstraintTable(unitOfWork.handle(), ORDER_NUMBER_UNIQUENESS));
        orders = new EventSourcedRepository<>(eventStore, new Order());

        commandBus = new CommandBus(unitOfWorkFactory, CommandBusConfiguration.defaultConfiguration().withCommandTimeout(Duration.ofSeconds(2)));
        commandBus.addCommandHandler(new CreateOrderHandler())
                  .addCommandHandler(new AddProductHandler())
                  .addCommandHandler(new AcceptOrderHandler())
                  .addCommandHandler(new SlowCommandHandler());
        commandBus.start();
    }

    @AfterEach
    void cleanup() {
        if (commandBus != null) {
            commandBus.stop();
        }
    }

    @Test
    void a_successful_command_appends_its_events_and_returns_the_aggregate_id() {
        // Given
        var orderId = OrderId.random();

        // When
        OrderId result = commandBus.send(new CreateOrder(orderId, "alice", 1001));
        commandBus.send(new AddProduct(orderId, "flour", 2, false));

        // Then
        assertThat((CharSequence) result).isEqualTo(orderId);
        var order = unitOfWorkFactory.withUnitOfWork(unitOfWork -> orders.load(orderId));
        assertThat(order.eventOrder.longValue()).isEqualTo(2);
        assertThat(order.state.productAndQuantity).containsEntry("flour", 2);
    }

    @Test
    void a_rejected_command_appends_no_events() {
        // Given
        var orderId = OrderId.random();
        commandBus.send(new CreateOrder(orderId, "alice", 1002));
        commandBus.send(new AcceptOrder(orderId, false));

        // When / Then
        assertThatThrownBy(() -> commandBus.send(new AddProduct(orderId, "salt", 1, false)))
                .isExactlyInstanceOf(InvalidStateException.class);
        assertThat(eventStore.fetchStream(ORDERS, orderId).get().eventList()).hasSize(2);
    }

    @Test
    void a_uniqueness_violation_rolls_back_the_events_of_the_command() {
        // Given
        commandBus.send(new CreateOrder(OrderId.random(), "alice", 1003));
        var secondOrderId = OrderId.random();

        // When / Then
        assertThatThrownBy(() -> commandBus.send(new CreateOrder(secondOrderId, "bob", 1003)))
                .isExactlyInstanceOf(UniquenessViolationException.class);
        assertThat(eventStore.fetchStream(ORDERS, secondOrderId)).isEmpty();
    }

    @Test
    void a_uniqueness_claim_is_timestamped_by_the_clock() {
        // When
        commandBus.send(new CreateOrder(OrderId.random(), "alice", 1004));

        // Then
        var claimedAt = unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                                 .createQuery("SELECT claimed_at FROM " + ORDER_NUMBER_UNIQUENESS + " WHERE unique_key = :key")
                                                                                 .bind("key", "1004")
                                                                                 .mapTo(OffsetDateTime.class)
                                                                                 .one());
        assertThat(claimedAt.toInstant()).isEqualTo(CLOCK.instant());
    }

    @Test
    void an_idempotent_command_is_retried_after_a_concurrency_conflict() {
        // Given
        var orderId = OrderId.random();
        commandBus.send(new CreateOrder(orderId, "alice", 1004));

        // When
        commandBus.send(new AddProduct(orderId, "rice", 1, true));

        // Then
        assertThat(addProductAttempts.get()).isEqualTo(2);
        var order = unitOfWorkFactory.withUnitOfWork(unitOfWork -> orders.load(orderId));
        assertThat(order.state.productAndQuantity).containsEntry("rice", 1).containsEntry("interloper", 1);
    }

    @Test
    void a_non_idempotent_command_surfaces_the_concurrency_conflict() {
        // Given
        var orderId = OrderId.random();
        commandBus.send(new CreateOrder(orderId, "alice", 1005));

        // When / Then
        assertThatThrownBy(() -> commandBus.send(new AcceptOrder(orderId, true)))
                .isExactlyInstanceOf(OptimisticAppendToStreamException.class);
        assertThat(acceptAttempts.get()).isEqualTo(1);
        var order = unitOfWorkFactory.withUnitOfWork(unitOfWork -> orders.load(orderId));
        assertThat(order.state.accepted).isFalse();
    }

    @Test
    void a_command_exceeding_the_timeout_has_an_unknown_outcome() {
        assertThatThrownBy(() -> commandBus.send(new SlowCommand(Duration.ofSeconds(5))))
                .isExactlyInstanceOf(CommandTimeoutException.class);
    }

    @Test
    void sending_a_command_without_a_handler_fails() {
        assertThatThrownBy(() -> commandBus.send("not a command"))
                .isExactlyInstanceOf(NoCommandHandlerFoundException.class);
    }

    @Test
    void loading_an_unknown_aggregate_fails_with_AggregateNotFoundException() {
        assertThatThrownBy(() -> unitOfWorkFactory.withUnitOfWork(unitOfWork -> orders.load(OrderId.random())))
                .isExactlyInstanceOf(AggregateNotFoundException.class);
    }

    /**
     * Appends an event to the order from another thread (and transaction) while the current command has the order loaded
     */
    private void appendConcurrently(OrderId orderId) {
        var executor = Executors.newSingleThreadExecutor();
        try {
            executor.submit(() -> unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
                var order = orders.load(orderId);
                orders.append(order, order.state.addProduct("interloper", 1));
            })).get(10, TimeUnit.SECONDS);
        } catch (Exception e) {
            throw new IllegalStateException("Concurrent append failed", e);
        } finally {
            executor.shutdownNow();
        }
    }

    // ---------------------------------------------------------------------------------------

    static class CreateOrder {
        final OrderId orderId;
        final String  customer;
        final long    orderNumber;

        CreateOrder(OrderId orderId, String customer, long orderNumber) {
            this.orderId = orderId;
            this.customer = customer;
            this.orderNumber = orderNumber;
        }
    }

    static class AddProduct implements IdempotentCommand {
        final OrderId orderId;
        final String  product;
        final int     quantity;
        final boolean causeConflictOnFirstAttempt;

        AddProduct(OrderId orderId, String product, int quantity, boolean causeConflictOnFirstAttempt) {
            this.orderId = orderId;
            this.product = product;
            this.quantity = quantity;
            this.causeConflictOnFirstAttempt = causeConflictOnFirstAttempt;
        }
    }

    static class AcceptOrder {
        final OrderId orderId;
        final boolean causeConflict;

        AcceptOrder(OrderId orderId, boolean causeConflict) {
            this.orderId = orderId;
            this.causeConflict = causeConflict;
        }
    }

    static class SlowCommand {
        final Duration duration;

        SlowCommand(Duration duration) {
            this.duration = duration;
        }
    }

    class CreateOrderHandler implements CommandHandler<CreateOrder, OrderId> {
        @Override
        public Class<CreateOrder> commandType() {
            return CreateOrder.class;
        }

        @Override
        public OrderId handle(CreateOrder command) {
            var order = orders.loadOrInitial(command.orderId);
            orders.append(order, order.state.create(command.orderId, command.customer, command.orderNumber));
            UniquenessConstraints.claim(unitOfWorkFactory.getRequiredUnitOfWork().handle(),
                                        ORDER_NUMBER_UNIQUENESS,
                                        String.valueOf(command.orderNumber),
                                        command.orderId,
                                        CLOCK);
            return command.orderId;
        }
    }

    class AddProductHandler implements CommandHandler<AddProduct, OrderId> {
        @Override
        public Class<AddProduct> commandType() {
            return AddProduct.class;
        }

        @Override
        public OrderId handle(AddProduct command) {
            var attempt = addProductAttempts.incrementAndGet();
            var order   = orders.load(command.orderId);
            if (command.causeConflictOnFirstAttempt && attempt == 1) {
                appendConcurrently(command.orderId);
            }
            orders.append(order, order.state.addProduct(command.product, command.quantity));
            return command.orderId;
        }
    }

    class AcceptOrderHandler implements CommandHandler<AcceptOrder, OrderId> {
        @Override
        public Class<AcceptOrder> commandType() {
            return AcceptOrder.class;
        }

        @Override
        public OrderId handle(AcceptOrder command) {
            acceptAttempts.incrementAndGet();
            var order = orders.load(command.orderId);
            if (command.causeConflict) {
                appendConcurrently(command.orderId);
            }
            orders.append(order, order.state.accept());
            return command.orderId;
        }
    }

    static class SlowCommandHandler implements CommandHandler<SlowCommand, String> {
        @Override
        public Class<SlowCommand> commandType() {
            return SlowCommand.class;
        }

        @Override
        public String handle(SlowCommand command) {
            try {
                Thread.sleep(command.duration.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "done";
        }
    }
}
