package com.linearprogramming;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Append-only, ordered recorder of {@link Step}s, owned by a single solve. */
final class StepTrace {
    private final List<Step> steps = new ArrayList<>();

    StepTrace record(String title, String explanation) {
        return add(new Step(title, explanation, null, null));
    }

    StepTrace record(String title, String explanation, TableSnapshot table) {
        return add(new Step(title, explanation, table, null));
    }

    StepTrace record(String title, String explanation, Geometry geometry) {
        return add(new Step(title, explanation, null, geometry));
    }

    StepTrace record(String title, String explanation, TableSnapshot table, Geometry geometry) {
        return add(new Step(title, explanation, table, geometry));
    }

    private StepTrace add(Step s) {
        steps.add(s);
        return this;
    }

    int size() { return steps.size(); }

    /** Frozen copy handed over to the {@link Result}. */
    List<Step> freeze() { return Collections.unmodifiableList(new ArrayList<>(steps)); }
}
