package com.linearprogramming;

import java.util.Arrays;
import java.util.Locale;

/** One linear constraint {@code a·x (<=|>=|=) rhs}. Immutable. */
public final class Constraint {

    public enum Relation {
        LESS_EQUAL("<="), GREATER_EQUAL(">="), EQUAL("=");

        private final String symbol;

        Relation(String symbol) { this.symbol = symbol; }

        public String symbol() { return symbol; }

        /** Relation after multiplying both sides by -1. */
        public Relation flipped() {
            switch (this) {
                case LESS_EQUAL: return GREATER_EQUAL;
                case GREATER_EQUAL: return LESS_EQUAL;
                default: return EQUAL;
            }
        }

        /** True when {@code lhs rel rhs} holds up to {@code eps}. */
        public boolean holds(double lhs, double rhs, double eps) {
            switch (this) {
                case LESS_EQUAL: return lhs <= rhs + eps;
                case GREATER_EQUAL: return lhs >= rhs - eps;
                default: return Math.abs(lhs - rhs) <= eps;
            }
        }

        public static Relation parse(String token) {
            String t = token.trim().toLowerCase(Locale.ROOT);
            switch (t) {
                case "<=": case "≤": case "=<": case "le": return LESS_EQUAL;
                case ">=": case "≥": case "=>": case "ge": return GREATER_EQUAL;
                case "=": case "==": case "eq": return EQUAL;
                default: throw new ValidationException("Unknown relation: " + token);
            }
        }
    }

    private final double[] coefficients;
    private final Relation relation;
    private final double rhs;

    public Constraint(double[] coefficients, Relation relation, double rhs) {
        if (coefficients == null) throw new ValidationException("Constraint coefficients must not be null");
        if (relation == null) throw new ValidationException("Constraint relation must not be null");
        this.coefficients = coefficients.clone();
        this.relation = relation;
        this.rhs = rhs;
    }

    public static Constraint of(Relation relation, double rhs, double... coefficients) {
        return new Constraint(coefficients, relation, rhs);
    }

    public double[] coefficients() { return coefficients.clone(); }
    public double coefficient(int j) { return coefficients[j]; }
    public int size() { return coefficients.length; }
    public Relation relation() { return relation; }
    public double rhs() { return rhs; }

    /** Same constraint with both sides negated (relation flips). */
    public Constraint negated() {
        double[] a = new double[coefficients.length];
        for (int j = 0; j < a.length; j++) a[j] = -coefficients[j];
        return new Constraint(a, relation.flipped(), -rhs);
    }

    /** Left-hand side a·x. */
    public double lhs(double[] x) {
        double s = 0.0;
        for (int j = 0; j < coefficients.length; j++) s += coefficients[j] * x[j];
        return s;
    }

    /**
     * True when {@code x} satisfies the row up to {@code eps} relative to the
     * row's magnitude, {@code max(1, |rhs|, sum |a_j x_j|)}.
     */
    public boolean isSatisfiedBy(double[] x, double eps) {
        double size = Math.max(1.0, Math.abs(rhs));
        double terms = 0.0;
        for (int j = 0; j < coefficients.length; j++) terms += Math.abs(coefficients[j] * x[j]);
        return relation.holds(lhs(x), rhs, eps * Math.max(size, terms));
    }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Constraint)) return false;
        Constraint o = (Constraint) obj;
        return relation == o.relation
                && Double.compare(rhs, o.rhs) == 0
                && Arrays.equals(coefficients, o.coefficients);
    }

    @Override public int hashCode() {
        return (Arrays.hashCode(coefficients) * 31 + relation.hashCode()) * 31 + Double.hashCode(rhs);
    }

    @Override public String toString() {
        return Arrays.toString(coefficients) + " " + relation.symbol() + " " + rhs;
    }
}
