package dk.cloudcreate.imkitchen.eventstore.persistence;

import org.jdbi.v3.core.statement.*;
import org.slf4j.*;

import java.sql.SQLException;
import java.time.Duration;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Jdbi {@link SqlLogger} that logs statement timings at trace level and failed statements at debug level.<br>
 * Failures are only logged at debug because every failure is rethrown to (and reported by) the caller.
 */
public class EventStoreSqlLogger implements SqlLogger {
    private static final Logger log = LoggerFactory.getLogger("EventStore.Sql");

    @Override
    public void logAfterExecution(StatementContext context) {
        if (log.isTraceEnabled()) {
            log.trace("Execution time: {} ms - {}",
                      Duration.between(context.getExecutionMoment(), context.getCompletionMoment()).toMillis(),
                      context.getRenderedSql());
        }
    }

    @Override
    public void logException(StatementContext context, SQLException ex) {
        if (log.isDebugEnabled()) {
            log.debug(msg("Failed Execution time: {} ms - {}",
                          Duration.between(context.getExecutionMoment(), context.getExceptionMoment()).toMillis(),
                          context.getRenderedSql()),
                      ex);
        }
    }
}
