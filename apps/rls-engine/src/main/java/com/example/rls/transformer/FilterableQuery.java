package com.example.rls.transformer;

/**
 * Minimal view of an immutable read-query builder: every call returns a new
 * builder with one more predicate ANDed into its WHERE clause.
 *
 * @param <Q> concrete builder type
 */
public interface FilterableQuery<Q extends FilterableQuery<Q>> {

    String OP_EQUALS = "=";
    String OP_IN = "in";
    String OP_IS = "is";

    Q where(String column, String operator, Object value);

    /**
     * Adds a predicate that matches no row.
     */
    Q whereFalse();
}
