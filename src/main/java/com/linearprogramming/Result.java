package com.linearprogramming;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Outcome of one solve: the verdict, the optimal assignment when there is
 * one, and the ordered trace of steps that led there.
 */
public final class Result {
    private final Method method;
    private final SolveStatus status;
    private final Map<String, Double> variables;
    private final Double objectiveValue;   // null unless optimal
    private final String message;          // null when optimal
    private final boolean degenerate;
    private final List<Step> steps;
    private final SolveStats stats;

    private Result(Method method, SolveStatus status, Map<String, Double> variables, Double objectiveValue,
                   String message, boolean degenerate, List<Step> steps, SolveStats stats) {
        this.method = method;
        this.status = status;
        this.variables = variables;
        this.objectiveValue = objectiveValue;
        this.message = message;
        this.degenerate = degenerate;
        this.steps = steps;
        this.stats = stats.copy();
    }

    static Result optimal(Method method, Map<String, Double> variables, double objectiveValue,
                          boolean degenerate, StepTrace trace, SolveStats stats) {
        Map<String, Double> copy = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        return new Result(method, SolveStatus.OPTIMAL, copy, objectiveValue, null, degenerate, trace.freeze(), stats);
    }

    static Result unbounded(Method method, String message, StepTrace trace, SolveStats stats) {
        return terminal(method, SolveStatus.UNBOUNDED, message, trace, stats);
    }

    static Result infeasible(Method method, String message, StepTrace trace, SolveStats stats) {
        return terminal(method, SolveStatus.INFEASIBLE, message, trace, stats);
    }

    static Result error(Method method, String message, StepTrace trace, SolveStats stats) {
        return terminal(method, SolveStatus.ERROR, message, trace, stats);
    }

    private static Result terminal(Method method, SolveStatus status, String message, StepTrace trace, SolveStats stats) {
        return new Result(method, status, Collections.emptyMap(), null, message, false, trace.freeze(), stats);
    }

    public Method method() { return method; }
    public SolveStatus status() { return status; }
    public boolean isOptimal() { return status == SolveStatus.OPTIMAL; }

    /** Decision variables by name ({@code x1, x2, ...}); empty unless optimal. */
    public Map<String, Double> variables() { return variables; }

    public double value(String variable) {
        Double v = variables.get(variable);
        if (v == null) throw new IllegalStateException("No value for " + variable + " (status " + status + ")");
        return v;
    }

    public OptionalDouble objectiveValue() {
        return objectiveValue == null ? OptionalDouble.empty() : OptionalDouble.of(objectiveValue);
    }

    public Optional<String> message() { return Optional.ofNullable(message); }

    /** Optimal with at least one basic variable sitting at zero. */
    public boolean isDegenerate() { return degenerate; }

    public List<Step> steps() { return steps; }
    /** A copy of the counters; changing it does not affect this result. */
    public SolveStats stats() { return stats.copy(); }

    @Override public String toString() {
        StringBuilder sb = new StringBuilder("Result{").append(method).append(' ').append(status);
        if (objectiveValue != null) sb.append(", Z=").append(Formats.number(objectiveValue)).append(", ").append(variables);
        if (message != null) sb.append(", ").append(message);
        return sb.append(", steps=").append(steps.size()).append('}').toString();
    }
}
