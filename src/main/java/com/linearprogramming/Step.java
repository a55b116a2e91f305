package com.linearprogramming;

import java.util.Objects;
import java.util.Optional;

/** One recorded entry of a solve trace. Immutable. */
public final class Step {
    private final String title;
    private final String explanation;
    private final TableSnapshot table;   // nullable
    private final Geometry geometry;     // nullable

    Step(String title, String explanation, TableSnapshot table, Geometry geometry) {
        this.title = Objects.requireNonNull(title);
        this.explanation = Objects.requireNonNull(explanation);
        this.table = table;
        this.geometry = geometry;
    }

    public String title() { return title; }
    public String explanation() { return explanation; }
    public Optional<TableSnapshot> table() { return Optional.ofNullable(table); }
    public Optional<Geometry> geometry() { return Optional.ofNullable(geometry); }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Step)) return false;
        Step o = (Step) obj;
        return title.equals(o.title) && explanation.equals(o.explanation) && Objects.equals(table, o.table)
                && Objects.equals(geometry, o.geometry);
    }

    @Override public int hashCode() { return Objects.hash(title, explanation, table, geometry); }

    @Override public String toString() { return title; }
}
