package com.linearprogramming;

/** Counters collected during one solve; printed by the driver as a totals line. */
public final class SolveStats {
    public int pivots;
    public int slackVariables;
    public int surplusVariables;
    public int artificialVariables;
    public int candidatePoints;
    public int vertices;

    SolveStats copy() {
        SolveStats c = new SolveStats();
        c.pivots = pivots;
        c.slackVariables = slackVariables;
        c.surplusVariables = surplusVariables;
        c.artificialVariables = artificialVariables;
        c.candidatePoints = candidatePoints;
        c.vertices = vertices;
        return c;
    }

    @Override
    public String toString() {
        return "*Totals: pivots=" + pivots +
                " slack=" + slackVariables +
                " surplus=" + surplusVariables +
                " artificial=" + artificialVariables +
                " candidates=" + candidatePoints +
                " vertices=" + vertices;
    }
}
