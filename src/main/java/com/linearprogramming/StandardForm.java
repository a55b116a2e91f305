package com.linearprogramming;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds the initial simplex tableau of a {@link Problem}:
 * <ul>
 *   <li>rows with a negative RHS are multiplied by -1 (relation flips);</li>
 *   <li>each {@code <=} row gets a slack {@code s_i}, each {@code >=} row a surplus
 *       {@code e_i} and an artificial {@code a_i}, each {@code =} row an artificial only;</li>
 *   <li>a free variable {@code x_j} is split into {@code x_j+ - x_j-};</li>
 *   <li>the objective row holds {@code -c} of the maximize form, and {@code +M}
 *       under every artificial column (not yet priced out).</li>
 * </ul>
 * Columns are ordered decision, slack/surplus (by row), artificial (by row).
 * The starting basis is the slack or artificial of each row.
 */
final class StandardForm {

    private final Problem problem;
    private final Tableau tableau;
    private final int[][] decisionColumns;   // [j] = {plus, minus}, minus = -1 when x_j >= 0
    private final boolean[] flipped;         // row multiplied by -1
    private final Constraint.Relation[] relations; // relation after the flip
    private final int[] artificialRows;      // rows whose starting basic variable is artificial
    private final double bigM;               // 0 when no artificials were added
    private final double[] costRow;          // objective row without the penalty

    private StandardForm(Problem problem, Tableau tableau, int[][] decisionColumns, boolean[] flipped,
                         Constraint.Relation[] relations, int[] artificialRows, double bigM, double[] costRow) {
        this.problem = problem;
        this.tableau = tableau;
        this.decisionColumns = decisionColumns;
        this.flipped = flipped;
        this.relations = relations;
        this.artificialRows = artificialRows;
        this.bigM = bigM;
        this.costRow = costRow;
    }

    /**
     * @param withArtificials false for the plain simplex method, which then
     *                        requires every row to be {@code <=} after the flip
     */
    static StandardForm build(Problem p, SolverSettings settings, boolean withArtificials) {
        final int n = p.variableCount();
        final int m = p.constraintCount();

        boolean[] flipped = new boolean[m];
        Constraint[] rows = new Constraint[m];
        Constraint.Relation[] relations = new Constraint.Relation[m];
        for (int i = 0; i < m; i++) {
            Constraint c = p.constraint(i);
            flipped[i] = c.rhs() < 0;
            rows[i] = flipped[i] ? c.negated() : c;
            relations[i] = rows[i].relation();
            if (!withArtificials && relations[i] != Constraint.Relation.LESS_EQUAL) {
                throw new ValidationException("Constraint " + (i + 1) + " is a " + relations[i].symbol()
                        + " row after sign normalization; an all-slack starting basis is not feasible");
            }
        }

        // ---- column layout ----
        List<String> labels = new ArrayList<>();
        List<Tableau.ColumnKind> kinds = new ArrayList<>();
        int[][] decisionColumns = new int[n][2];
        for (int j = 0; j < n; j++) {
            String name = p.variableName(j);
            if (p.isNonNegative()) {
                decisionColumns[j][0] = add(labels, kinds, name, Tableau.ColumnKind.DECISION);
                decisionColumns[j][1] = -1;
            } else {
                decisionColumns[j][0] = add(labels, kinds, name + "+", Tableau.ColumnKind.DECISION);
                decisionColumns[j][1] = add(labels, kinds, name + "-", Tableau.ColumnKind.DECISION);
            }
        }
        int[] slackColumn = new int[m];
        for (int i = 0; i < m; i++) {
            switch (relations[i]) {
                case LESS_EQUAL:
                    slackColumn[i] = add(labels, kinds, "s" + (i + 1), Tableau.ColumnKind.SLACK);
                    break;
                case GREATER_EQUAL:
                    slackColumn[i] = add(labels, kinds, "e" + (i + 1), Tableau.ColumnKind.SURPLUS);
                    break;
                default:
                    slackColumn[i] = -1;
            }
        }
        int[] artificialColumn = new int[m];
        List<Integer> artificialRows = new ArrayList<>();
        for (int i = 0; i < m; i++) {
            if (relations[i] == Constraint.Relation.LESS_EQUAL) {
                artificialColumn[i] = -1;
            } else {
                artificialColumn[i] = add(labels, kinds, "a" + (i + 1), Tableau.ColumnKind.ARTIFICIAL);
                artificialRows.add(i);
            }
        }

        // ---- numbers ----
        final int k = labels.size();
        double[][] T = new double[m + 1][k + 1];
        int[] basis = new int[m];
        for (int i = 0; i < m; i++) {
            for (int j = 0; j < n; j++) {
                double a = rows[i].coefficient(j);
                T[i][decisionColumns[j][0]] = a;
                if (decisionColumns[j][1] >= 0) T[i][decisionColumns[j][1]] = -a;
            }
            if (slackColumn[i] >= 0) {
                T[i][slackColumn[i]] = relations[i] == Constraint.Relation.LESS_EQUAL ? 1.0 : -1.0;
            }
            if (artificialColumn[i] >= 0) T[i][artificialColumn[i]] = 1.0;
            T[i][k] = rows[i].rhs();
            basis[i] = artificialColumn[i] >= 0 ? artificialColumn[i] : slackColumn[i];
        }

        // objective row: reduced costs of "maximize c'x" where c' = c (max) or -c (min)
        double sign = p.isMaximize() ? 1.0 : -1.0;
        for (int j = 0; j < n; j++) {
            double c = sign * p.objectiveCoefficient(j);
            T[m][decisionColumns[j][0]] = -c;
            if (decisionColumns[j][1] >= 0) T[m][decisionColumns[j][1]] = c;
        }
        double[] costRow = Arrays.copyOf(T[m], k + 1);
        double bigM = 0.0;
        if (!artificialRows.isEmpty()) {
            bigM = penalty(p, settings);
            for (int i : artificialRows) T[m][artificialColumn[i]] = bigM;
        }

        Tableau t = new Tableau(T, basis, labels.toArray(new String[0]),
                kinds.toArray(new Tableau.ColumnKind[0]), settings);
        if (!t.isFeasible()) {
            throw new IllegalStateException("Starting basis is infeasible after sign normalization");
        }
        int[] artRows = artificialRows.stream().mapToInt(Integer::intValue).toArray();
        return new StandardForm(p, t, decisionColumns, flipped, relations, artRows, bigM, costRow);
    }

    /** M = factor * max |c_j|, at least the factor itself. */
    static double penalty(Problem p, SolverSettings settings) {
        double largest = 1.0;
        for (double c : p.objective()) largest = Math.max(largest, Math.abs(c));
        return settings.bigMFactor * largest;
    }

    private static int add(List<String> labels, List<Tableau.ColumnKind> kinds, String label, Tableau.ColumnKind kind) {
        labels.add(label);
        kinds.add(kind);
        return labels.size() - 1;
    }

    Problem problem() { return problem; }
    Tableau tableau() { return tableau; }
    int[] artificialRows() { return Arrays.copyOf(artificialRows, artificialRows.length); }

    /** The {@code -c} objective row with zeros under the artificial columns. */
    double[] costRow() { return Arrays.copyOf(costRow, costRow.length); }

    /** Objective row of the phase-one problem: maximize minus the sum of the artificials. */
    double[] phaseOneRow() {
        double[] row = new double[costRow.length];
        for (int c = 0; c < tableau.k(); c++) {
            if (tableau.kind(c) == Tableau.ColumnKind.ARTIFICIAL) row[c] = 1.0;
        }
        return row;
    }

    int count(Tableau.ColumnKind kind) {
        int c = 0;
        for (int j = 0; j < tableau.k(); j++) if (tableau.kind(j) == kind) c++;
        return c;
    }

    /** Decision variable values {@code x_j = x_j+ - x_j-} read off the tableau's current basis. */
    double[] decisionValues(Tableau t) {
        double[] x = new double[decisionColumns.length];
        for (int j = 0; j < x.length; j++) {
            x[j] = t.value(decisionColumns[j][0]);
            if (decisionColumns[j][1] >= 0) x[j] -= t.value(decisionColumns[j][1]);
        }
        return x;
    }

    /** Human-readable account of the conversion, one line per row. */
    String describe() {
        StringBuilder sb = new StringBuilder();
        if (!problem.isMaximize()) {
            sb.append("Minimization is solved as maximization of -Z; the reported value is negated back.\n");
        }
        if (!problem.isNonNegative()) {
            sb.append("Each unrestricted variable xj is written as xj+ - xj- with both parts >= 0.\n");
        }
        String[] names = tableau.columnLabels().toArray(new String[0]);
        for (int i = 0; i < relations.length; i++) {
            sb.append("Constraint ").append(i + 1).append(": ");
            if (flipped[i]) sb.append("multiplied by -1 for a non-negative RHS, ");
            switch (relations[i]) {
                case LESS_EQUAL: sb.append("add slack s").append(i + 1); break;
                case GREATER_EQUAL: sb.append("subtract surplus e").append(i + 1)
                        .append(" and add artificial a").append(i + 1); break;
                default: sb.append("add artificial a").append(i + 1);
            }
            double[] row = new double[names.length];
            for (int c = 0; c < names.length; c++) row[c] = tableau.get(i, c);
            sb.append(": ").append(Formats.expression(row, names))
              .append(" = ").append(Formats.number(tableau.rhs(i))).append('\n');
        }
        if (bigM > 0) {
            sb.append("Artificial variables are penalized with M = ").append(Formats.number(bigM))
              .append(" in the objective.\n");
        }
        return sb.toString();
    }
}
