package com.example.rls.context;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Operations a policy can be attached to.
 */
public enum Operation {
    CREATE,
    READ,
    UPDATE,
    DELETE,

    /**
     * Wildcard: a policy declared for ALL applies to every concrete operation.
     */
    ALL;

    /**
     * The concrete (non-wildcard) operations.
     */
    public static Set<Operation> concrete() {
        return EnumSet.of(CREATE, READ, UPDATE, DELETE);
    }

    public boolean isWrite() {
        return this == CREATE || this == UPDATE;
    }

    public boolean isMutation() {
        return this == CREATE || this == UPDATE || this == DELETE;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
