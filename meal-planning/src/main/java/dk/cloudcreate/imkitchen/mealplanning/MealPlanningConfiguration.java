package dk.cloudcreate.imkitchen.mealplanning;

import dk.cloudcreate.imkitchen.aggregates.command.CommandBusConfiguration;
import dk.cloudcreate.imkitchen.projections.ProjectionRunnerConfiguration;

import java.time.Clock;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

public class MealPlanningConfiguration {
    public final CommandBusConfiguration       commandBusConfiguration;
    public final ProjectionRunnerConfiguration projectionRunnerConfiguration;
    public final Clock                         clock;
    /**
     * If true {@link MealPlanningCore#start()} also starts the {@link dk.cloudcreate.imkitchen.projections.ProjectionRunner},
     * otherwise the read models are only updated when drained explicitly
     */
    public final boolean                       continuousProjections;

    public MealPlanningConfiguration(CommandBusConfiguration commandBusConfiguration,
                                     ProjectionRunnerConfiguration projectionRunnerConfiguration,
                                     Clock clock,
                                     boolean continuousProjections) {
        this.commandBusConfiguration = requireNonNull(commandBusConfiguration, "You must specify a commandBusConfiguration");
        this.projectionRunnerConfiguration = requireNonNull(projectionRunnerConfiguration, "You must specify a projectionRunnerConfiguration");
        this.clock = requireNonNull(clock, "You must specify a clock");
        this.continuousProjections = continuousProjections;
    }

    public static MealPlanningConfiguration defaultConfiguration() {
        return new MealPlanningConfiguration(CommandBusConfiguration.defaultConfiguration(),
                                             ProjectionRunnerConfiguration.defaultConfiguration(),
                                             Clock.systemUTC(),
                                             true);
    }

    public MealPlanningConfiguration withCommandBusConfiguration(CommandBusConfiguration commandBusConfiguration) {
        return new MealPlanningConfiguration(commandBusConfiguration, projectionRunnerConfiguration, clock, continuousProjections);
    }

    public MealPlanningConfiguration withProjectionRunnerConfiguration(ProjectionRunnerConfiguration projectionRunnerConfiguration) {
        return new MealPlanningConfiguration(commandBusConfiguration, projectionRunnerConfiguration, clock, continuousProjections);
    }

    public MealPlanningConfiguration withClock(Clock clock) {
        return new MealPlanningConfiguration(commandBusConfiguration, projectionRunnerConfiguration, clock, continuousProjections);
    }

    public MealPlanningConfiguration withContinuousProjections(boolean continuousProjections) {
        return new MealPlanningConfiguration(commandBusConfiguration, projectionRunnerConfiguration, clock, continuousProjections);
    }

    @Override
    public String toString() {
        return "MealPlanningConfiguration{" +
                "commandBusConfiguration=" + commandBusConfiguration +
                ", projectionRunnerConfiguration=" + projectionRunnerConfiguration +
                ", clock=" + clock +
                ", continuousProjections=" + continuousProjections +
                '}';
    }
}
