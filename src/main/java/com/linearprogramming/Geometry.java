package com.linearprogramming;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Plot data for a two-variable problem: boundary lines, feasible corner
 * points and, when known, the optimal corner or an unbounded direction.
 * Rendering is left to the caller.
 */
public final class Geometry {

    /** Boundary {@code a*x1 + b*x2 = c} of a constraint (or an axis). */
    public static final class Line {
        private final String label;
        private final double a, b, c;
        private final Constraint.Relation relation;
        private final boolean axis;

        Line(String label, double a, double b, double c, Constraint.Relation relation, boolean axis) {
            this.label = label;
            this.a = a;
            this.b = b;
            this.c = c;
            this.relation = relation;
            this.axis = axis;
        }

        public String label() { return label; }
        public double a() { return a; }
        public double b() { return b; }
        public double c() { return c; }
        public Constraint.Relation relation() { return relation; }
        public boolean isAxis() { return axis; }

        /** Direction vector along the line. */
        double[] direction() { return new double[]{ -b, a }; }

        @Override public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Line)) return false;
            Line o = (Line) obj;
            return label.equals(o.label) && Double.compare(a, o.a) == 0 && Double.compare(b, o.b) == 0
                    && Double.compare(c, o.c) == 0 && relation == o.relation && axis == o.axis;
        }

        @Override public int hashCode() { return Objects.hash(label, a, b, c, relation, axis); }

        @Override public String toString() {
            return label + ": " + Formats.expression(new double[]{a, b}, new String[]{"x1", "x2"})
                    + " " + relation.symbol() + " " + Formats.number(c);
        }
    }

    /** A point of the plane. */
    public static final class Point {
        private final double x1, x2;

        public Point(double x1, double x2) {
            this.x1 = x1;
            this.x2 = x2;
        }

        public double x1() { return x1; }
        public double x2() { return x2; }
        public double[] coordinates() { return new double[]{ x1, x2 }; }

        /** Same point up to {@code eps} relative to the larger coordinate. */
        boolean near(Point o, double eps) {
            double tol = eps * Problem.scale(new double[]{ x1, x2, o.x1, o.x2 });
            return Math.abs(x1 - o.x1) <= tol && Math.abs(x2 - o.x2) <= tol;
        }

        @Override public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Point)) return false;
            Point o = (Point) obj;
            return Double.compare(x1, o.x1) == 0 && Double.compare(x2, o.x2) == 0;
        }

        @Override public int hashCode() { return Objects.hash(x1, x2); }

        @Override public String toString() { return Formats.point(coordinates()); }
    }

    private final List<Line> lines;
    private final List<Point> vertices;
    private final double[] objective;
    private final Point optimum;          // nullable
    private final Point unboundedRay;    // nullable, a direction rather than a location

    Geometry(List<Line> lines, List<Point> vertices, double[] objective, Point optimum, Point unboundedRay) {
        this.lines = List.copyOf(lines);
        this.vertices = List.copyOf(vertices);
        this.objective = objective.clone();
        this.optimum = optimum;
        this.unboundedRay = unboundedRay;
    }

    public List<Line> lines() { return lines; }
    public List<Point> vertices() { return vertices; }
    public double[] objective() { return objective.clone(); }
    public Optional<Point> optimum() { return Optional.ofNullable(optimum); }
    public Optional<Point> unboundedRay() { return Optional.ofNullable(unboundedRay); }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Geometry)) return false;
        Geometry o = (Geometry) obj;
        return lines.equals(o.lines) && vertices.equals(o.vertices) && Arrays.equals(objective, o.objective)
                && Objects.equals(optimum, o.optimum) && Objects.equals(unboundedRay, o.unboundedRay);
    }

    @Override public int hashCode() {
        return Objects.hash(lines, vertices, Arrays.hashCode(objective), optimum, unboundedRay);
    }

    @Override public String toString() {
        return "Geometry{lines=" + lines.size() + ", vertices=" + vertices
                + (optimum != null ? ", optimum=" + optimum : "")
                + (unboundedRay != null ? ", ray=" + unboundedRay : "") + '}';
    }
}
