package com.linearprogramming;

/** Terminal verdict of a solve. */
public enum SolveStatus {
    OPTIMAL, UNBOUNDED, INFEASIBLE, ERROR;

    /** Lower-case form used in printed output. */
    public String label() { return name().toLowerCase(java.util.Locale.ROOT); }
}
