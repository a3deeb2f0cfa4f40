package com.example.rls.policy;

import java.util.Locale;

/**
 * Category of a policy's contribution to an access decision.
 */
public enum DecisionType {
    /**
     * Grants access when the predicate matches.
     */
    ALLOW,

    /**
     * Blocks access when the predicate matches.
     */
    DENY,

    /**
     * Contributes WHERE conditions to read queries.
     */
    FILTER,

    /**
     * Checks a create/update payload; a false result rejects the write.
     */
    VALIDATE;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isAccessDecision() {
        return this == ALLOW || this == DENY;
    }
}
