package com.linearprogramming;

import java.util.Arrays;
import java.util.List;

/**
 * Frozen copy of a tableau (or any labelled grid) at one point of a solve.
 * Constraint rows come first, the objective row (label {@code Z}) last; the
 * last column is the right-hand side.
 */
public final class TableSnapshot {
    private final List<String> columnLabels;
    private final List<String> rowLabels;
    private final double[][] cells;
    private final int[] basis;   // basis[r] = basic column of constraint row r, empty for non-tableau grids

    TableSnapshot(List<String> columnLabels, List<String> rowLabels, double[][] cells, int[] basis) {
        if (cells.length != rowLabels.size()) throw new IllegalArgumentException("row label count mismatch");
        for (double[] row : cells) {
            if (row.length != columnLabels.size()) throw new IllegalArgumentException("column label count mismatch");
        }
        this.columnLabels = List.copyOf(columnLabels);
        this.rowLabels = List.copyOf(rowLabels);
        this.cells = deepCopy(cells);
        this.basis = Arrays.copyOf(basis, basis.length);
    }

    /** Plain labelled grid with no basis, e.g. a corner-point evaluation table. */
    static TableSnapshot grid(List<String> columnLabels, List<String> rowLabels, double[][] cells) {
        return new TableSnapshot(columnLabels, rowLabels, cells, new int[0]);
    }

    public List<String> columnLabels() { return columnLabels; }
    public List<String> rowLabels() { return rowLabels; }
    public int rowCount() { return cells.length; }
    public int columnCount() { return columnLabels.size(); }
    public double get(int r, int c) { return cells[r][c]; }
    public double[] row(int r) { return cells[r].clone(); }
    public double[][] cells() { return deepCopy(cells); }
    public int[] basis() { return Arrays.copyOf(basis, basis.length); }
    public boolean hasBasis() { return basis.length > 0; }

    /** Right-hand side of row {@code r}. */
    public double rhs(int r) { return cells[r][columnLabels.size() - 1]; }

    /** True when column {@code col} is 1 in {@code row} and 0 in every other row, objective included. */
    public boolean isUnitColumn(int col, int row, double eps) {
        for (int r = 0; r < cells.length; r++) {
            double want = r == row ? 1.0 : 0.0;
            if (Math.abs(cells[r][col] - want) > eps) return false;
        }
        return true;
    }

    /** Every basic column is a unit vector in its own row. */
    public boolean basisIsCanonical(double eps) {
        for (int r = 0; r < basis.length; r++) {
            if (!isUnitColumn(basis[r], r, eps)) return false;
        }
        return true;
    }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TableSnapshot)) return false;
        TableSnapshot o = (TableSnapshot) obj;
        return columnLabels.equals(o.columnLabels)
                && rowLabels.equals(o.rowLabels)
                && Arrays.deepEquals(cells, o.cells)
                && Arrays.equals(basis, o.basis);
    }

    @Override public int hashCode() {
        return (columnLabels.hashCode() * 31 + rowLabels.hashCode()) * 31 + Arrays.deepHashCode(cells);
    }

    @Override public String toString() {
        StringBuilder sb = new StringBuilder();
        int width = 10;
        for (String c : columnLabels) width = Math.max(width, c.length() + 2);
        for (double[] row : cells) for (double v : row) width = Math.max(width, Formats.number(v).length() + 2);

        sb.append(pad("Basis", 8));
        for (String c : columnLabels) sb.append(pad(c, width));
        sb.append('\n');
        for (int r = 0; r < cells.length; r++) {
            sb.append(pad(rowLabels.get(r), 8));
            for (double v : cells[r]) sb.append(pad(Formats.number(v), width));
            sb.append('\n');
        }
        return sb.toString();
    }

    private static String pad(String s, int width) {
        StringBuilder sb = new StringBuilder(width);
        for (int i = s.length(); i < width; i++) sb.append(' ');
        return sb.append(s).toString();
    }

    private static double[][] deepCopy(double[][] a) {
        double[][] c = new double[a.length][];
        for (int i = 0; i < a.length; i++) c[i] = Arrays.copyOf(a[i], a[i].length);
        return c;
    }
}
