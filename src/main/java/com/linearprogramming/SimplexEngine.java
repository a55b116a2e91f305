package com.linearprogramming;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tableau simplex for problems whose constraints are all {@code <=} once
 * negative right-hand sides are flipped, so the slack basis is feasible.
 * The pivot loop {@link #iterate} is shared with {@link BigMEngine}.
 */
public final class SimplexEngine implements LpEngine {
    private static final Logger logger = Logger.getLogger(SimplexEngine.class.getName());

    private final SolverSettings settings;

    public SimplexEngine(SolverSettings settings) {
        this.settings = Objects.requireNonNull(settings);
    }

    public SimplexEngine() { this(SolverSettings.defaults()); }

    @Override public Method method() { return Method.SIMPLEX; }

    @Override
    public Result solve(Problem problem) {
        Method.SIMPLEX.checkApplicable(problem);

        SolveStats stats = new SolveStats();
        StepTrace trace = new StepTrace();

        StandardForm sf = StandardForm.build(problem, settings, false);
        stats.slackVariables = sf.count(Tableau.ColumnKind.SLACK);
        trace.record("Standard Form", "Every constraint becomes an equation with one slack variable.\n" + sf.describe());

        Tableau t = sf.tableau();
        trace.record("Initial Tableau",
                "The slack variables form the starting basis, decision variables start at zero. "
                        + "The Z row holds the negated objective coefficients.", t.snapshot());

        Iteration it = iterate(t, trace, settings);
        stats.pivots = t.pivots();
        return interpret(Method.SIMPLEX, sf, t, it, trace, stats, settings);
    }

    // ---- shared pivot loop ----

    /** Outcome of {@link #iterate}: the stopping status and, when unbounded, the blocked column. */
    static final class Iteration {
        final Tableau.Status status;
        final int column;

        Iteration(Tableau.Status status, int column) {
            this.status = status;
            this.column = column;
        }
    }

    /**
     * Pivots until optimal, unbounded, or the iteration limit. Records one
     * step per pivot with the tableau after it, plus a final verdict step.
     */
    static Iteration iterate(Tableau t, StepTrace trace, SolverSettings settings) {
        final int limit = settings.iterationLimit(t.k(), t.m());
        int iteration = 0;
        while (true) {
            int e = t.enteringColumn();
            if (e < 0) {
                trace.record("Optimality Check",
                        "No entry of the Z row is negative, so no variable can improve the objective. "
                                + "The current tableau is optimal.");
                return new Iteration(Tableau.Status.OPTIMAL, -1);
            }
            int r = t.leavingRow(e);
            if (r < 0) {
                trace.record("Unbounded Direction",
                        t.label(e) + " has reduced cost " + Formats.number(t.reducedCost(e))
                                + " but no positive entry in its column, so it can increase without any "
                                + "basic variable reaching zero.", t.snapshot());
                return new Iteration(Tableau.Status.UNBOUNDED, e);
            }
            if (iteration >= limit) {
                trace.record("Iteration Limit",
                        "Stopped after " + iteration + " pivots without reaching optimality; "
                                + "the problem is likely cycling on a degenerate basis.");
                return new Iteration(Tableau.Status.ITERATION_LIMIT, -1);
            }

            String entering = t.label(e);
            String leaving = t.label(t.basicColumn(r));
            String explanation = pivotExplanation(t, e, r);
            t.pivot(r, e);
            iteration++;
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("pivot " + iteration + ": enter " + entering + ", leave " + leaving
                        + ", Z=" + Formats.number(t.objectiveValue()));
            }
            trace.record("Pivot " + iteration + ": enter " + entering + ", leave " + leaving,
                    explanation, t.snapshot());
        }
    }

    private static String pivotExplanation(Tableau t, int e, int r) {
        StringBuilder sb = new StringBuilder();
        sb.append("Entering variable ").append(t.label(e)).append(": its Z-row entry ")
          .append(Formats.number(t.reducedCost(e)))
          .append(t.pivotRule() == SolverSettings.PivotRule.BLAND
                  ? " is the first negative one (Bland's rule).\n"
                  : " is the most negative.\n");
        sb.append("Ratio test on column ").append(t.label(e)).append(":");
        for (int row = 0; row < t.m(); row++) {
            double ratio = t.ratio(row, e);
            sb.append("\n  ").append(t.label(t.basicColumn(row))).append(": ");
            if (Double.isNaN(ratio)) {
                sb.append("entry ").append(Formats.number(t.get(row, e))).append(" is not positive, skipped");
            } else {
                sb.append(Formats.number(t.rhs(row))).append(" / ").append(Formats.number(t.get(row, e)))
                  .append(" = ").append(Formats.number(ratio));
                if (row == r) sb.append("  (minimum)");
            }
        }
        sb.append("\nLeaving variable ").append(t.label(t.basicColumn(r)))
          .append("; pivot element ").append(Formats.number(t.get(r, e)))
          .append(". The pivot row is divided by it and column ").append(t.label(e))
          .append(" is eliminated from every other row.");
        return sb.toString();
    }

    /** Turns the loop outcome into a {@link Result}. Artificial columns are never reported. */
    static Result interpret(Method method, StandardForm sf, Tableau t, Iteration it,
                            StepTrace trace, SolveStats stats, SolverSettings settings) {
        Problem p = sf.problem();
        switch (it.status) {
            case UNBOUNDED: {
                String label = t.label(it.column);
                String msg = "The objective can be " + (p.isMaximize() ? "increased" : "decreased")
                        + " without limit by increasing " + label;
                logger.fine(msg);
                return Result.unbounded(method, msg, trace, stats);
            }
            case ITERATION_LIMIT:
                return Result.error(method, "Iteration limit exceeded after " + t.pivots() + " pivots",
                        trace, stats);
            default:
                break;
        }

        double[] x = sf.decisionValues(t);
        for (int j = 0; j < x.length; j++) {
            if (Math.abs(x[j]) <= settings.feasibilityTolerance) x[j] = 0.0;
        }
        Map<String, Double> vars = new LinkedHashMap<>();
        for (int j = 0; j < x.length; j++) vars.put(p.variableName(j), x[j]);
        double z = p.evaluate(x);

        StringBuilder sb = new StringBuilder();
        sb.append("Basic variables take the RHS value of their row, all others are zero:\n");
        for (int j = 0; j < x.length; j++) {
            sb.append("  ").append(p.variableName(j)).append(" = ").append(Formats.number(x[j])).append('\n');
        }
        sb.append("Z = ").append(Formats.number(z));
        if (!p.isMaximize()) sb.append(" (the tableau maximized -Z = ").append(Formats.number(-z)).append(')');
        boolean degenerate = t.isDegenerate();
        if (degenerate) {
            sb.append("\nThe solution is degenerate: at least one basic variable is zero.");
        }
        trace.record("Optimal Solution", sb.toString(), t.snapshot());
        return Result.optimal(method, vars, z, degenerate, trace, stats);
    }
}
