package dk.cloudcreate.imkitchen.aggregates.command;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * A unique key (e.g. a user's email) has already been claimed by another aggregate
 */
public class UniquenessViolationException extends RuntimeException {
    public final String constraintTable;
    public final String key;

    public UniquenessViolationException(String constraintTable, String key) {
        super(msg("[{}] '{}' is already taken", constraintTable, key));
        this.constraintTable = constraintTable;
        this.key = key;
    }
}
