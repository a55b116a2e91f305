package com.linearprogramming;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * A linear program {@code max|min c·x  s.t.  A x (<=|>=|=) b}, optionally with
 * {@code x >= 0}. Immutable once built by {@link #normalize}.
 * <p>
 * Reads and writes a begin/end block format:
 * <pre>
 * * comment
 * maximize
 * begin
 * 2 2
 * 3 2
 * 2 1 &lt;= 100
 * 1 2 &lt;= 80
 * end
 * </pre>
 * A {@code free} line before {@code begin} drops the sign restriction.
 */
public final class Problem {
    public enum Direction { MAXIMIZE, MINIMIZE }

    private final Direction direction;
    private final double[] objective;
    private final List<Constraint> constraints;
    private final boolean nonNegative;

    private Problem(Direction direction, double[] objective, List<Constraint> constraints, boolean nonNegative) {
        this.direction = direction;
        this.objective = objective;
        this.constraints = constraints;
        this.nonNegative = nonNegative;
    }

    /**
     * Validates raw coefficients and builds the problem. Nothing is repaired:
     * any mismatch is reported to the caller.
     *
     * @throws ValidationException on empty input, length mismatch or a non-finite number
     */
    public static Problem normalize(Direction direction, double[] objective,
                                    List<Constraint> constraints, boolean nonNegative) {
        if (direction == null) throw new ValidationException("Direction must be given");
        if (objective == null || objective.length == 0) throw new ValidationException("Empty objective function");
        if (constraints == null || constraints.isEmpty()) throw new ValidationException("At least one constraint is required");

        for (int j = 0; j < objective.length; j++) {
            if (!Double.isFinite(objective[j])) {
                throw new ValidationException("Objective coefficient " + (j + 1) + " is not a finite number");
            }
        }
        List<Constraint> rows = new ArrayList<>(constraints.size());
        for (int i = 0; i < constraints.size(); i++) {
            Constraint c = constraints.get(i);
            if (c == null) throw new ValidationException("Constraint " + (i + 1) + " is missing");
            if (c.size() != objective.length) {
                throw new ValidationException("Constraint " + (i + 1) + " has " + c.size()
                        + " variables, expected " + objective.length);
            }
            for (int j = 0; j < c.size(); j++) {
                if (!Double.isFinite(c.coefficient(j))) {
                    throw new ValidationException("Constraint " + (i + 1) + " coefficient " + (j + 1)
                            + " is not a finite number");
                }
            }
            if (!Double.isFinite(c.rhs())) {
                throw new ValidationException("Missing or non-finite RHS value in constraint " + (i + 1));
            }
            rows.add(c);
        }
        return new Problem(direction, objective.clone(), Collections.unmodifiableList(rows), nonNegative);
    }

    public static Problem maximize(double[] objective, Constraint... constraints) {
        return normalize(Direction.MAXIMIZE, objective, List.of(constraints), true);
    }

    public static Problem minimize(double[] objective, Constraint... constraints) {
        return normalize(Direction.MINIMIZE, objective, List.of(constraints), true);
    }

    public Direction direction() { return direction; }
    public boolean isMaximize() { return direction == Direction.MAXIMIZE; }
    public double[] objective() { return objective.clone(); }
    public double objectiveCoefficient(int j) { return objective[j]; }
    public List<Constraint> constraints() { return constraints; }
    public Constraint constraint(int i) { return constraints.get(i); }
    public boolean isNonNegative() { return nonNegative; }
    public int variableCount() { return objective.length; }
    public int constraintCount() { return constraints.size(); }

    /** 1-based display name of decision variable {@code j}. */
    public String variableName(int j) { return "x" + (j + 1); }

    /** c·x in the problem's own direction. */
    public double evaluate(double[] x) {
        double z = 0.0;
        for (int j = 0; j < objective.length; j++) z += objective[j] * x[j];
        return z;
    }

    /**
     * True when every row is a {@code <=} row once negative right-hand sides
     * have been flipped, i.e. the all-slack basis is feasible.
     */
    /** {@code max(1, max |x_j|)}. */
    static double scale(double[] x) {
        double s = 1.0;
        for (double v : x) s = Math.max(s, Math.abs(v));
        return s;
    }

    public boolean isStandardForm() {
        for (Constraint c : constraints) {
            Constraint.Relation rel = c.rhs() < 0 ? c.relation().flipped() : c.relation();
            if (rel != Constraint.Relation.LESS_EQUAL) return false;
        }
        return true;
    }

    /** Feasibility up to {@code eps}, scaled by the magnitudes involved. */
    public boolean isFeasible(double[] x, double eps) {
        if (nonNegative) {
            double tol = eps * scale(x);
            for (double v : x) if (v < -tol) return false;
        }
        for (Constraint c : constraints) if (!c.isSatisfiedBy(x, eps)) return false;
        return true;
    }

    public static Problem readFromFile(String filename) throws IOException {
        try (BufferedReader br = new BufferedReader(new FileReader(filename))) {
            return read(br);
        }
    }

    public static Problem read(BufferedReader br) throws IOException {
        String line;

        // ---- header: direction / free / begin, comments and a name line are skipped ----
        Direction direction = Direction.MAXIMIZE;
        boolean nonNegative = true;
        boolean sawBegin = false;

        while ((line = br.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty()) continue;
            if (line.startsWith("*") || line.startsWith("#")) continue;

            String low = line.toLowerCase(Locale.ROOT);
            if (low.startsWith("max")) { direction = Direction.MAXIMIZE; continue; }
            if (low.startsWith("min")) { direction = Direction.MINIMIZE; continue; }
            if (low.equals("free")) { nonNegative = false; continue; }
            if (low.equals("nonnegative")) { nonNegative = true; continue; }

            if (low.equals("begin")) { sawBegin = true; break; }
        }
        if (!sawBegin) throw new IOException("No 'begin' line found");

        String[] header = nextTokens(br);
        if (header.length < 2) throw new IOException("Expected 'm n' after begin, got: " + String.join(" ", header));
        final int m, n;
        try {
            m = Integer.parseInt(header[0]);
            n = Integer.parseInt(header[1]);
        } catch (NumberFormatException e) {
            throw new IOException("Constraint and variable counts must be numeric: " + String.join(" ", header), e);
        }
        if (m < 0 || n < 0) throw new IOException("Negative dimensions: " + m + " " + n);

        String[] objTokens = nextTokens(br);
        if (objTokens.length != n) {
            throw new IOException("Expected " + n + " objective coefficients, got " + objTokens.length);
        }
        double[] objective = parseNumbers(objTokens, 0, n, "objective");

        List<Constraint> constraints = new ArrayList<>(m);
        for (int i = 0; i < m; i++) {
            String[] t = nextTokens(br);
            if (t.length != n + 2) {
                throw new IOException("Constraint " + (i + 1) + ": expected " + n
                        + " coefficients, a relation and a rhs, got: " + String.join(" ", t));
            }
            double[] a = parseNumbers(t, 0, n, "constraint " + (i + 1));
            Constraint.Relation rel;
            try {
                rel = Constraint.Relation.parse(t[n]);
            } catch (ValidationException e) {
                throw new IOException("Constraint " + (i + 1) + ": " + e.reason(), e);
            }
            double rhs = parseNumbers(t, n + 1, n + 2, "constraint " + (i + 1))[0];
            constraints.add(new Constraint(a, rel, rhs));
        }

        String[] end = nextTokens(br);
        if (end.length != 1 || !end[0].equalsIgnoreCase("end")) {
            throw new IOException("Expected 'end', got: " + String.join(" ", end));
        }
        return normalize(direction, objective, constraints, nonNegative);
    }

    /** Writes the block format read by {@link #read(BufferedReader)}. */
    public void write(PrintWriter out) {
        out.println(isMaximize() ? "maximize" : "minimize");
        if (!nonNegative) out.println("free");
        out.println("begin");
        out.printf("%d %d%n", constraints.size(), objective.length);
        StringBuilder sb = new StringBuilder();
        for (int j = 0; j < objective.length; j++) {
            if (j > 0) sb.append(' ');
            sb.append(Formats.number(objective[j]));
        }
        out.println(sb);
        for (Constraint c : constraints) {
            sb.setLength(0);
            for (int j = 0; j < c.size(); j++) sb.append(Formats.number(c.coefficient(j))).append(' ');
            sb.append(c.relation().symbol()).append(' ').append(Formats.number(c.rhs()));
            out.println(sb);
        }
        out.println("end");
    }

    @Override public String toString() { return Formats.formulation(this); }

    private static String[] nextTokens(BufferedReader br) throws IOException {
        String line;
        do {
            line = br.readLine();
            if (line == null) throw new IOException("Unexpected end of file");
            line = line.trim();
        } while (line.isEmpty() || line.startsWith("*") || line.startsWith("#"));
        return line.split("\\s+");
    }

    private static double[] parseNumbers(String[] tokens, int from, int to, String where) throws IOException {
        double[] out = new double[to - from];
        for (int k = from; k < to; k++) {
            try {
                out[k - from] = Formats.parseNumber(tokens[k]);
            } catch (NumberFormatException e) {
                throw new IOException("Invalid number format in " + where + ": " + tokens[k], e);
            }
        }
        return out;
    }
}
