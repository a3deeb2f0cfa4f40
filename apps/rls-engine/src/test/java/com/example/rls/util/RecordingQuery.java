package com.example.rls.util;

import com.example.rls.transformer.FilterableQuery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable in-memory query builder that records every predicate it is given.
 */
public final class RecordingQuery implements FilterableQuery<RecordingQuery> {

    public record Predicate(String column, String operator, Object value) {
    }

    public static final Predicate FALSE = new Predicate("1", "=", 0);

    private final List<Predicate> predicates;

    private RecordingQuery(List<Predicate> predicates) {
        this.predicates = Collections.unmodifiableList(predicates);
    }

    public static RecordingQuery selectFrom() {
        return new RecordingQuery(List.of());
    }

    @Override
    public RecordingQuery where(String column, String operator, Object value) {
        List<Predicate> next = new ArrayList<>(predicates);
        next.add(new Predicate(column, operator, value));
        return new RecordingQuery(next);
    }

    @Override
    public RecordingQuery whereFalse() {
        List<Predicate> next = new ArrayList<>(predicates);
        next.add(FALSE);
        return new RecordingQuery(next);
    }

    public List<Predicate> predicates() {
        return predicates;
    }
}
