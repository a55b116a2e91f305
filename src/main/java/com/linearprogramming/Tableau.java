package com.linearprogramming;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Dense simplex tableau in maximize form.
 * Rows {@code 0..m-1} are constraints, row {@code m} is the objective row
 * (reduced costs, with the current objective value in the RHS cell); columns
 * {@code 0..k-1} are variables, column {@code k} is the RHS.
 * After every pivot each basic column is a unit vector.
 */
final class Tableau {

    enum ColumnKind { DECISION, SLACK, SURPLUS, ARTIFICIAL }

    enum Status { OPTIMAL, UNBOUNDED, ITERATION_LIMIT }

    private final int m, k;              // constraint rows, variable columns
    private final double[][] T;          // (m+1) x (k+1)
    private final int[] basis;           // basis[r] = column basic in row r
    private final String[] labels;       // column labels, length k
    private final ColumnKind[] kinds;    // length k
    private final boolean[] blocked;     // columns never chosen to enter

    private final double eps;
    private SolverSettings.PivotRule pivotRule;

    private int pivots;                  // pivots performed so far

    Tableau(double[][] tableau, int[] basis, String[] labels, ColumnKind[] kinds, SolverSettings settings) {
        this.m = tableau.length - 1;
        this.k = labels.length;
        this.T = deepCopy(tableau);
        this.basis = Arrays.copyOf(basis, basis.length);
        this.labels = Arrays.copyOf(labels, labels.length);
        this.kinds = Arrays.copyOf(kinds, kinds.length);
        this.blocked = new boolean[labels.length];
        this.eps = settings.pivotTolerance;
        this.pivotRule = settings.pivotRule;

        sanity();
    }

    // --- Accessors
    int m() { return m; }
    int k() { return k; }
    int[] basis() { return Arrays.copyOf(basis, basis.length); }
    int basicColumn(int row) { return basis[row]; }
    String label(int col) { return labels[col]; }
    ColumnKind kind(int col) { return kinds[col]; }
    List<String> columnLabels() { return List.of(labels); }
    double get(int r, int c) { return T[r][c]; }
    double rhs(int r) { return T[r][k]; }
    double reducedCost(int c) { return T[m][c]; }
    double objectiveValue() { return T[m][k]; }
    int pivots() { return pivots; }

    SolverSettings.PivotRule pivotRule() { return pivotRule; }
    void setPivotRule(SolverSettings.PivotRule rule) { this.pivotRule = Objects.requireNonNull(rule); }

    /** Keeps every column of the given kind out of the basis from now on. */
    void block(ColumnKind kind) {
        for (int c = 0; c < k; c++) if (kinds[c] == kind) blocked[c] = true;
    }

    /** Replaces the objective row (reduced costs plus RHS cell); basic columns are not priced out. */
    void setObjectiveRow(double[] row) {
        if (row.length != k + 1) throw new IllegalArgumentException("objective row length mismatch");
        T[m] = Arrays.copyOf(row, row.length);
    }

    /** Row in which {@code col} is basic, or -1. */
    int rowOfBasic(int col) {
        for (int r = 0; r < m; r++) if (basis[r] == col) return r;
        return -1;
    }

    /** Value of the variable in column {@code col} at the current basic solution. */
    double value(int col) {
        int r = rowOfBasic(col);
        return r < 0 ? 0.0 : T[r][k];
    }

    boolean isFeasible() {
        for (int r = 0; r < m; r++) if (T[r][k] < -eps) return false;
        return true;
    }

    /** No reduced cost is negative. */
    boolean isOptimal() { return enteringColumn() == -1; }

    /** Some basic variable sits at zero. */
    boolean isDegenerate() {
        for (int r = 0; r < m; r++) if (Math.abs(T[r][k]) <= eps) return true;
        return false;
    }

    /**
     * Entering column, or -1 when optimal. Dantzig: most negative reduced
     * cost, lowest index on ties. Bland: first negative reduced cost.
     */
    int enteringColumn() {
        int best = -1;
        for (int c = 0; c < k; c++) {
            if (blocked[c] || T[m][c] >= -eps) continue;
            if (pivotRule == SolverSettings.PivotRule.BLAND) return c;
            if (best == -1 || T[m][c] < T[m][best] - eps) best = c;
        }
        return best;
    }

    /**
     * Minimum-ratio leaving row for {@code enterCol}, or -1 if no entry of the
     * column is positive (the entering variable is unbounded). Ties go to the
     * lowest row, or under Bland's rule to the lowest basic column.
     */
    int leavingRow(int enterCol) {
        int arg = -1;
        double best = Double.POSITIVE_INFINITY;
        for (int r = 0; r < m; r++) {
            double a = T[r][enterCol];
            if (a <= eps) continue;
            double ratio = T[r][k] / a;
            if (arg == -1 || ratio < best - eps) {
                best = ratio;
                arg = r;
            } else if (pivotRule == SolverSettings.PivotRule.BLAND
                    && Math.abs(ratio - best) <= eps && basis[r] < basis[arg]) {
                arg = r;
            }
        }
        return arg;
    }

    /** Ratio {@code rhs / a} of row {@code r} against {@code col}, NaN when the entry is not positive. */
    double ratio(int r, int col) {
        double a = T[r][col];
        return a > eps ? T[r][k] / a : Double.NaN;
    }

    /** Gauss-Jordan pivot on (leaveRow, enterCol); restores the unit-column invariant. */
    void pivot(int leaveRow, int enterCol) {
        double piv = T[leaveRow][enterCol];
        if (Math.abs(piv) <= eps) throw new IllegalArgumentException("Pivot on zero element");

        for (int c = 0; c <= k; c++) T[leaveRow][c] /= piv;
        T[leaveRow][enterCol] = 1.0;

        for (int r = 0; r <= m; r++) {
            if (r == leaveRow) continue;
            double factor = T[r][enterCol];
            if (factor == 0.0) continue;
            for (int c = 0; c <= k; c++) {
                if (c == enterCol) T[r][c] = 0.0;
                else T[r][c] -= factor * T[leaveRow][c];
            }
        }

        basis[leaveRow] = enterCol;
        this.pivots++;
    }

    /**
     * Subtracts a multiple of constraint row {@code row} from the objective row
     * so that the basic column of {@code row} gets a zero reduced cost.
     * Returns the multiple used.
     */
    double priceOut(int row) {
        int col = basis[row];
        double factor = T[m][col];
        if (factor == 0.0) return 0.0;
        for (int c = 0; c <= k; c++) {
            T[m][c] = (c == col) ? 0.0 : T[m][c] - factor * T[row][c];
        }
        return factor;
    }

    /**
     * Replaces the artificial basic in {@code row}, whose value must be zero,
     * by the first non-artificial column with a nonzero entry in that row.
     * Returns false when there is none: the row is a combination of the others.
     */
    boolean driveOut(int row) {
        for (int c = 0; c < k; c++) {
            if (kinds[c] == ColumnKind.ARTIFICIAL || Math.abs(T[row][c]) <= eps) continue;
            T[row][k] = 0.0;
            pivot(row, c);
            return true;
        }
        return false;
    }

    TableSnapshot snapshot() {
        List<String> cols = new ArrayList<>(k + 1);
        cols.addAll(Arrays.asList(labels));
        cols.add("RHS");
        List<String> rows = new ArrayList<>(m + 1);
        for (int r = 0; r < m; r++) rows.add(labels[basis[r]]);
        rows.add("Z");
        return new TableSnapshot(cols, rows, T, basis);
    }

    private static double[][] deepCopy(double[][] a) {
        double[][] c = new double[a.length][];
        for (int i = 0; i < a.length; i++) c[i] = Arrays.copyOf(a[i], a[i].length);
        return c;
    }

    private void sanity() {
        if (m < 0) throw new IllegalArgumentException("tableau needs an objective row");
        for (double[] row : T) {
            if (row.length != k + 1) throw new IllegalArgumentException("tableau col count mismatch");
        }
        if (basis.length != m) throw new IllegalArgumentException("basis length mismatch");
        if (kinds.length != k) throw new IllegalArgumentException("column kind count mismatch");
        for (int b : basis) {
            if (b < 0 || b >= k) throw new IllegalArgumentException("basis column out of range: " + b);
        }
    }
}
