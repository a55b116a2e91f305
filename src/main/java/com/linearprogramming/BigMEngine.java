package com.linearprogramming;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Big M method: artificial variables give every row a feasible starting
 * basic variable, and a large penalty M in the objective drives them out.
 * When an artificial survives the Big M loop, or an unbounded direction
 * would raise one, feasibility is settled by a two-phase solve instead.
 */
public final class BigMEngine implements LpEngine {
    private static final Logger logger = Logger.getLogger(BigMEngine.class.getName());

    private final SolverSettings settings;

    public BigMEngine(SolverSettings settings) {
        this.settings = Objects.requireNonNull(settings);
    }

    public BigMEngine() { this(SolverSettings.defaults()); }

    @Override public Method method() { return Method.BIG_M; }

    @Override
    public Result solve(Problem problem) {
        Method.BIG_M.checkApplicable(problem);

        SolveStats stats = new SolveStats();
        StepTrace trace = new StepTrace();

        StandardForm sf = StandardForm.build(problem, settings, true);
        stats.slackVariables = sf.count(Tableau.ColumnKind.SLACK);
        stats.surplusVariables = sf.count(Tableau.ColumnKind.SURPLUS);
        stats.artificialVariables = sf.count(Tableau.ColumnKind.ARTIFICIAL);
        trace.record("Standard Form",
                "Slack, surplus and artificial variables turn every constraint into an equation.\n" + sf.describe());

        Tableau t = sf.tableau();
        trace.record("Initial Tableau",
                "Slack and artificial variables form the starting basis. The Z row holds the negated "
                        + "objective coefficients and the penalty M under each artificial column.", t.snapshot());

        int[] artificialRows = sf.artificialRows();
        if (artificialRows.length > 0) {
            StringBuilder sb = new StringBuilder();
            sb.append("Basic artificial columns must have a zero Z-row entry, so the Z row is reduced:");
            for (int row : artificialRows) {
                double factor = t.priceOut(row);
                sb.append("\n  Z row - ").append(Formats.number(factor)).append(" x row of ")
                  .append(t.label(t.basicColumn(row)));
            }
            trace.record("Price Out Artificial Variables", sb.toString(), t.snapshot());
        }

        SimplexEngine.Iteration it = SimplexEngine.iterate(t, trace, settings);
        stats.pivots = t.pivots();
        if (artificialRows.length == 0 || it.status == Tableau.Status.ITERATION_LIMIT) {
            return SimplexEngine.interpret(Method.BIG_M, sf, t, it, trace, stats, settings);
        }

        List<String> positive = positiveArtificials(t);
        if (positive.isEmpty() && !(it.status == Tableau.Status.UNBOUNDED && rayRaisesArtificial(t, it.column))) {
            if (it.status == Tableau.Status.OPTIMAL) {
                trace.record("Artificial Variables", artificialValues(t)
                        + "Every artificial variable is zero, so the solution is feasible for the original problem.");
            }
            return SimplexEngine.interpret(Method.BIG_M, sf, t, it, trace, stats, settings);
        }

        // M was not large enough to settle feasibility: decide it without the penalty.
        String why = positive.isEmpty()
                ? "The improving direction would make an artificial variable positive"
                : "Artificial " + String.join(", ", positive) + (positive.size() == 1 ? " is" : " are")
                        + " still positive";
        logger.fine(why + "; switching to a two-phase solve");
        return twoPhase(problem, why, trace, stats);
    }

    /**
     * Phase one maximizes minus the sum of the artificials from a fresh tableau.
     * A positive optimum proves infeasibility; otherwise the artificials leave the
     * basis and phase two optimizes the original objective with them blocked.
     */
    private Result twoPhase(Problem problem, String why, StepTrace trace, SolveStats stats) {
        StandardForm sf = StandardForm.build(problem, settings, true);
        Tableau t = sf.tableau();
        t.setObjectiveRow(sf.phaseOneRow());
        for (int row = 0; row < t.m(); row++) t.priceOut(row);
        trace.record("Phase One",
                why + ", so feasibility is decided without the penalty: the objective becomes "
                        + "maximize -(sum of artificial variables), priced out over the starting basis.",
                t.snapshot());

        SimplexEngine.Iteration it = SimplexEngine.iterate(t, trace, settings);
        stats.pivots += t.pivots();
        if (it.status == Tableau.Status.ITERATION_LIMIT) {
            return SimplexEngine.interpret(Method.BIG_M, sf, t, it, trace, stats, settings);
        }

        List<String> positive = positiveArtificials(t);
        if (!positive.isEmpty()) {
            trace.record("Feasibility Check", artificialValues(t) + "The sum of the artificial variables cannot "
                    + "reach zero, so the original constraints cannot all hold.", t.snapshot());
            String msg = "No solution satisfies all constraints (artificial "
                    + String.join(", ", positive) + " remains positive)";
            logger.fine(msg);
            return Result.infeasible(Method.BIG_M, msg, trace, stats);
        }

        int before = t.pivots();
        for (int row = 0; row < t.m(); row++) {
            if (t.kind(t.basicColumn(row)) == Tableau.ColumnKind.ARTIFICIAL && !t.driveOut(row)) {
                logger.fine("Row " + (row + 1) + " is redundant; its artificial stays basic at zero");
            }
        }
        stats.pivots += t.pivots() - before;
        trace.record("Feasibility Check", artificialValues(t) + "Every artificial variable is zero, so the "
                + "basis is feasible for the original problem. Artificial columns may no longer enter.");

        before = t.pivots();
        t.setObjectiveRow(sf.costRow());
        for (int row = 0; row < t.m(); row++) t.priceOut(row);
        t.block(Tableau.ColumnKind.ARTIFICIAL);
        trace.record("Phase Two", "The original objective replaces the phase-one row and is priced out "
                + "over the feasible basis.", t.snapshot());

        it = SimplexEngine.iterate(t, trace, settings);
        stats.pivots += t.pivots() - before;
        return SimplexEngine.interpret(Method.BIG_M, sf, t, it, trace, stats, settings);
    }

    private List<String> positiveArtificials(Tableau t) {
        List<String> positive = new ArrayList<>();
        for (int col = 0; col < t.k(); col++) {
            if (t.kind(col) == Tableau.ColumnKind.ARTIFICIAL && t.value(col) > settings.feasibilityTolerance) {
                positive.add(t.label(col));
            }
        }
        return positive;
    }

    /** True when moving along the unbounded column makes some artificial grow. */
    private boolean rayRaisesArtificial(Tableau t, int column) {
        if (t.kind(column) == Tableau.ColumnKind.ARTIFICIAL) return true;
        for (int row = 0; row < t.m(); row++) {
            if (t.kind(t.basicColumn(row)) == Tableau.ColumnKind.ARTIFICIAL
                    && t.get(row, column) < -settings.pivotTolerance) {
                return true;
            }
        }
        return false;
    }

    private static String artificialValues(Tableau t) {
        StringBuilder sb = new StringBuilder();
        for (int col = 0; col < t.k(); col++) {
            if (t.kind(col) != Tableau.ColumnKind.ARTIFICIAL) continue;
            sb.append(t.label(col)).append(" = ").append(Formats.number(t.value(col))).append('\n');
        }
        return sb.toString();
    }
}
