package com.linearprogramming;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Plain-text rendering of a {@link Result}: the step list followed by the outcome. */
public final class ResultWriter {

    private final PrintWriter out;
    private final boolean withSteps;

    public ResultWriter(PrintWriter out, boolean withSteps) {
        this.out = out;
        this.withSteps = withSteps;
    }

    public void write(Result result) {
        if (withSteps) {
            List<Step> steps = result.steps();
            for (int i = 0; i < steps.size(); i++) writeStep(i + 1, steps.get(i));
        }
        writeOutcome(result);
        out.println(result.stats());
        out.flush();
    }

    void writeStep(int number, Step step) {
        out.printf("Step %d: %s%n", number, step.title());
        for (String line : step.explanation().split("\n")) out.println("  " + line);
        step.table().ifPresent(t -> {
            out.println();
            out.print(t);
        });
        step.geometry().ifPresent(g -> {
            if (!g.vertices().isEmpty()) out.println("  corner points: " + g.vertices());
        });
        out.println();
    }

    void writeOutcome(Result result) {
        out.println("Final Solution (" + result.method().displayName() + ")");
        out.println("status: " + result.status().label());
        if (result.isOptimal()) {
            for (Map.Entry<String, Double> e : result.variables().entrySet()) {
                out.printf(Locale.ROOT, "%s = %.4f%n", e.getKey(), e.getValue());
            }
            out.printf(Locale.ROOT, "Z = %.4f%n", result.objectiveValue().getAsDouble());
            if (result.isDegenerate()) out.println("(degenerate solution)");
        }
        result.message().ifPresent(m -> out.println("message: " + m));
    }
}
