package com.linearprogramming;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Corner-point method for two-variable problems: intersect every pair of
 * boundary lines, keep the intersections that satisfy all constraints, and
 * evaluate the objective at each of them.
 */
public final class GraphicalEngine implements LpEngine {
    private static final Logger logger = Logger.getLogger(GraphicalEngine.class.getName());

    /** Distance used to illustrate an unbounded ray in the trace. */
    private static final double FAR = 1e6;

    private final SolverSettings settings;

    public GraphicalEngine(SolverSettings settings) {
        this.settings = Objects.requireNonNull(settings);
    }

    public GraphicalEngine() { this(SolverSettings.defaults()); }

    @Override public Method method() { return Method.GRAPHICAL; }

    @Override
    public Result solve(Problem problem) {
        Method.GRAPHICAL.checkApplicable(problem);

        final double eps = settings.feasibilityTolerance;
        final double[] c = problem.objective();
        SolveStats stats = new SolveStats();
        StepTrace trace = new StepTrace();

        // ---- 1. boundary lines ----
        List<Geometry.Line> lines = boundaryLines(problem);
        StringBuilder sb = new StringBuilder("Each constraint is drawn as the line where it holds with equality");
        sb.append(problem.isNonNegative() ? "; non-negativity adds both axes:" : ":");
        for (Geometry.Line line : lines) sb.append("\n  ").append(line);
        trace.record("Plot Constraint Lines", sb.toString(),
                new Geometry(lines, List.of(), c, null, null));

        // ---- 2. pairwise intersections ----
        List<Geometry.Point> candidates = new ArrayList<>();
        Map<Geometry.Point, String> origin = new LinkedHashMap<>();
        for (int i = 0; i < lines.size(); i++) {
            for (int j = i + 1; j < lines.size(); j++) {
                Geometry.Point p = intersect(lines.get(i), lines.get(j));
                if (p == null) continue;
                if (contains(candidates, p, eps)) continue;
                candidates.add(p);
                origin.put(p, lines.get(i).label() + " and " + lines.get(j).label());
            }
        }
        stats.candidatePoints = candidates.size();

        // ---- 3. feasibility filter ----
        List<Geometry.Point> vertices = new ArrayList<>();
        sb.setLength(0);
        sb.append("Intersections of every pair of non-parallel lines, checked against all constraints:");
        for (int idx = 0; idx < candidates.size(); idx++) {
            Geometry.Point p = candidates.get(idx);
            String violated = firstViolated(problem, p.coordinates(), eps);
            sb.append("\n  P").append(idx + 1).append(' ').append(p)
              .append(" from ").append(origin.get(p)).append(": ")
              .append(violated == null ? "feasible" : "violates " + violated);
            if (violated == null) vertices.add(p);
        }
        if (candidates.isEmpty()) sb.append("\n  (no two lines intersect)");
        trace.record("Intersection Points", sb.toString(), new Geometry(lines, vertices, c, null, null));
        stats.vertices = vertices.size();
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(candidates.size() + " candidate points, " + vertices.size() + " feasible: " + vertices);
        }

        // ---- 4. empty region ----
        if (vertices.isEmpty()) {
            if (problem.isNonNegative()) {
                trace.record("Infeasible", "No intersection point satisfies every constraint, "
                        + "so the feasible region is empty.");
                return Result.infeasible(Method.GRAPHICAL,
                        "No solution satisfies all constraints (the feasible region is empty)", trace, stats);
            }
            trace.record("No Corner Points", "The feasible region has no corner points. Without "
                    + "non-negativity this happens when it is empty or contains a whole line.");
            return Result.error(Method.GRAPHICAL, "The feasible region has no corner points; "
                    + "use the simplex or Big M method", trace, stats);
        }

        // ---- 5. unbounded in the improving direction ----
        double[] ray = improvingRay(problem, lines);
        if (ray != null) {
            Geometry.Point from = vertices.get(0);
            double[] far = { from.x1() + FAR * ray[0], from.x2() + FAR * ray[1] };
            Geometry.Point dir = new Geometry.Point(ray[0], ray[1]);
            trace.record("Unbounded Direction",
                    "Moving from " + from + " along direction " + dir + " never leaves the feasible region "
                            + "and keeps " + (problem.isMaximize() ? "increasing" : "decreasing")
                            + " Z: at " + Formats.point(far) + " already Z = "
                            + Formats.number(problem.evaluate(far)) + ".",
                    new Geometry(lines, vertices, c, null, dir));
            return Result.unbounded(Method.GRAPHICAL, "The objective can be "
                    + (problem.isMaximize() ? "increased" : "decreased")
                    + " without limit along direction " + dir, trace, stats);
        }

        // ---- 6. evaluate corners ----
        String[] names = { problem.variableName(0), problem.variableName(1) };
        int best = -1;
        double bestZ = 0.0;
        double[][] table = new double[vertices.size()][3];
        List<String> rowLabels = new ArrayList<>();
        for (int idx = 0; idx < vertices.size(); idx++) {
            Geometry.Point v = vertices.get(idx);
            double z = problem.evaluate(v.coordinates());
            table[idx][0] = v.x1();
            table[idx][1] = v.x2();
            table[idx][2] = z;
            rowLabels.add("V" + (idx + 1));
            trace.record("Corner Point V" + (idx + 1) + " " + v,
                    "Z = " + substitution(c, v) + " = " + Formats.number(z));
            if (best == -1 || improves(problem, z, bestZ, eps)) {
                best = idx;
                bestZ = z;
            }
        }

        Geometry.Point opt = vertices.get(best);
        Map<String, Double> vars = new LinkedHashMap<>();
        vars.put(names[0], opt.x1());
        vars.put(names[1], opt.x2());
        int tight = tightCount(lines, opt, eps);
        boolean degenerate = tight > 2;
        TableSnapshot summary = TableSnapshot.grid(List.of(names[0], names[1], "Z"), rowLabels, table);
        trace.record("Optimal Corner Point",
                "The " + (problem.isMaximize() ? "largest" : "smallest") + " objective value among the corner points is Z = "
                        + Formats.number(bestZ) + " at V" + (best + 1) + " " + opt + "."
                        + (degenerate ? " " + tight + " boundary lines meet at this corner, so it is degenerate." : ""),
                summary, new Geometry(lines, vertices, c, opt, null));
        return Result.optimal(Method.GRAPHICAL, vars, bestZ, degenerate, trace, stats);
    }

    static List<Geometry.Line> boundaryLines(Problem problem) {
        List<Geometry.Line> lines = new ArrayList<>();
        for (int i = 0; i < problem.constraintCount(); i++) {
            Constraint k = problem.constraint(i);
            double a = k.coefficient(0), b = k.coefficient(1);
            if (a == 0.0 && b == 0.0) continue;   // 0 = rhs has no boundary line; feasibility still checks it
            lines.add(new Geometry.Line("C" + (i + 1), a, b, k.rhs(), k.relation(), false));
        }
        if (problem.isNonNegative()) {
            lines.add(new Geometry.Line("x1 = 0", 1.0, 0.0, 0.0, Constraint.Relation.GREATER_EQUAL, true));
            lines.add(new Geometry.Line("x2 = 0", 0.0, 1.0, 0.0, Constraint.Relation.GREATER_EQUAL, true));
        }
        return lines;
    }

    /** Cramer's rule; null when the lines are parallel. */
    Geometry.Point intersect(Geometry.Line p, Geometry.Line q) {
        double det = p.a() * q.b() - q.a() * p.b();
        if (Math.abs(det) <= settings.pivotTolerance) return null;
        double x = (p.c() * q.b() - q.c() * p.b()) / det;
        double y = (p.a() * q.c() - q.a() * p.c()) / det;
        return new Geometry.Point(clean(x), clean(y));
    }

    private double clean(double v) {
        return Math.abs(v) <= settings.feasibilityTolerance ? 0.0 : v;
    }

    private static boolean contains(List<Geometry.Point> points, Geometry.Point p, double eps) {
        for (Geometry.Point q : points) if (q.near(p, eps)) return true;
        return false;
    }

    private static String firstViolated(Problem problem, double[] x, double eps) {
        for (int i = 0; i < problem.constraintCount(); i++) {
            if (!problem.constraint(i).isSatisfiedBy(x, eps)) return "C" + (i + 1);
        }
        if (problem.isNonNegative()) {
            double tol = eps * Problem.scale(x);
            if (x[0] < -tol) return "x1 >= 0";
            if (x[1] < -tol) return "x2 >= 0";
        }
        return null;
    }

    /**
     * A direction along some boundary line that stays inside every constraint
     * and strictly improves the objective, or null. The recession cone of a
     * plane region with a corner is spanned by such boundary directions, so
     * checking them is enough.
     */
    double[] improvingRay(Problem problem, List<Geometry.Line> lines) {
        final double eps = settings.feasibilityTolerance;
        double sign = problem.isMaximize() ? 1.0 : -1.0;
        for (Geometry.Line line : lines) {
            double[] d = line.direction();
            double norm = Math.hypot(d[0], d[1]);
            for (int s = 1; s >= -1; s -= 2) {
                double[] dir = { s * d[0] / norm, s * d[1] / norm };
                if (!isRecessionDirection(problem, dir, eps)) continue;
                double gain = sign * problem.evaluate(dir);
                if (gain > eps) return new double[]{ clean(dir[0]), clean(dir[1]) };
            }
        }
        return null;
    }

    private static boolean isRecessionDirection(Problem problem, double[] d, double eps) {
        if (problem.isNonNegative() && (d[0] < -eps || d[1] < -eps)) return false;
        for (Constraint k : problem.constraints()) {
            if (!k.relation().holds(k.lhs(d), 0.0, eps)) return false;
        }
        return true;
    }

    private static boolean improves(Problem problem, double z, double best, double eps) {
        return problem.isMaximize() ? z > best + eps : z < best - eps;
    }

    private static int tightCount(List<Geometry.Line> lines, Geometry.Point p, double eps) {
        int n = 0;
        for (Geometry.Line line : lines) {
            double ax = line.a() * p.x1(), bx = line.b() * p.x2();
            double tol = eps * Math.max(Math.max(1.0, Math.abs(line.c())), Math.abs(ax) + Math.abs(bx));
            if (Math.abs(ax + bx - line.c()) <= tol) n++;
        }
        return n;
    }

    private static String substitution(double[] c, Geometry.Point v) {
        return Formats.number(c[0]) + "(" + Formats.number(v.x1()) + ") + "
                + Formats.number(c[1]) + "(" + Formats.number(v.x2()) + ")";
    }
}
