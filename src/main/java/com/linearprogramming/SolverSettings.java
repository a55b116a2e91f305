package com.linearprogramming;

import java.util.Objects;

/**
 * Numeric tolerances and limits shared by every engine. Passed explicitly
 * into each solve; never mutated after {@link Builder#build()}.
 */
public final class SolverSettings {
    public enum PivotRule { DANTZIG, BLAND }

    public final double pivotTolerance;       // |a| below this is treated as zero
    public final double feasibilityTolerance; // slack allowed when checking a point
    public final double bigMFactor;           // M = factor * max |c_j|
    public final int iterationFactor;         // pivot limit = factor * (columns + rows)
    public final PivotRule pivotRule;

    private SolverSettings(Builder b) {
        this.pivotTolerance = b.pivotTolerance;
        this.feasibilityTolerance = b.feasibilityTolerance;
        this.bigMFactor = b.bigMFactor;
        this.iterationFactor = b.iterationFactor;
        this.pivotRule = b.pivotRule;
    }

    private static final SolverSettings DEFAULTS = new Builder().build();

    public static SolverSettings defaults() { return DEFAULTS; }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return new Builder()
                .pivotTolerance(pivotTolerance)
                .feasibilityTolerance(feasibilityTolerance)
                .bigMFactor(bigMFactor)
                .iterationFactor(iterationFactor)
                .pivotRule(pivotRule);
    }

    /** Pivot budget for a tableau of the given shape. */
    public int iterationLimit(int columns, int rows) {
        return Math.max(1, iterationFactor * (columns + rows));
    }

    public static final class Builder {
        private double pivotTolerance = 1e-9;
        private double feasibilityTolerance = 1e-9;
        private double bigMFactor = 10_000.0;
        private int iterationFactor = 50;
        private PivotRule pivotRule = PivotRule.DANTZIG;

        public Builder pivotTolerance(double v){ this.pivotTolerance = positive(v, "pivotTolerance"); return this; }
        public Builder feasibilityTolerance(double v){ this.feasibilityTolerance = positive(v, "feasibilityTolerance"); return this; }
        public Builder bigMFactor(double v){ this.bigMFactor = positive(v, "bigMFactor"); return this; }
        public Builder iterationFactor(int v){
            if (v < 1) throw new IllegalArgumentException("iterationFactor must be >= 1");
            this.iterationFactor = v; return this;
        }
        public Builder pivotRule(PivotRule r){ this.pivotRule = Objects.requireNonNull(r); return this; }
        public SolverSettings build(){ return new SolverSettings(this); }

        private static double positive(double v, String name) {
            if (!(v > 0) || Double.isInfinite(v)) throw new IllegalArgumentException(name + " must be a positive number");
            return v;
        }
    }

    @Override public String toString() {
        return "SolverSettings{pivotTolerance=" + pivotTolerance
                + ", feasibilityTolerance=" + feasibilityTolerance
                + ", bigMFactor=" + bigMFactor
                + ", iterationFactor=" + iterationFactor
                + ", pivotRule=" + pivotRule + '}';
    }
}
