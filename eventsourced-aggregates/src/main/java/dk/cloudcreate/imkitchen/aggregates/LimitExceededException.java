package dk.cloudcreate.imkitchen.aggregates;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * A quota would be exceeded, e.g. the maximum number of recipes for a subscription tier
 */
public class LimitExceededException extends DomainException {
    public final String limitName;
    public final long   limit;

    public LimitExceededException(String limitName, long limit) {
        super(msg("Limit '{}' of {} exceeded", limitName, limit));
        this.limitName = limitName;
        this.limit = limit;
    }

    public LimitExceededException(String limitName, long limit, String message) {
        super(message);
        this.limitName = limitName;
        this.limit = limit;
    }
}
