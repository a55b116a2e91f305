package com.linearprogramming;

import java.util.Locale;

/** The closed set of solution methods and the routing rules between them. */
public enum Method {
    SIMPLEX("Simplex Method"),
    BIG_M("Big M Method"),
    GRAPHICAL("Graphical Method");

    private final String displayName;

    Method(String displayName) { this.displayName = displayName; }

    public String displayName() { return displayName; }

    public LpEngine engine(SolverSettings settings) {
        switch (this) {
            case SIMPLEX: return new SimplexEngine(settings);
            case BIG_M: return new BigMEngine(settings);
            default: return new GraphicalEngine(settings);
        }
    }

    /**
     * Rejects problems this method cannot solve.
     *
     * @throws ValidationException naming the method to use instead
     */
    public void checkApplicable(Problem problem) {
        switch (this) {
            case SIMPLEX:
                if (!problem.isStandardForm()) {
                    throw new ValidationException("The simplex method needs only <= constraints with "
                            + "non-negative right-hand sides; use the Big M method for >= and = constraints");
                }
                break;
            case GRAPHICAL:
                if (problem.variableCount() != 2) {
                    throw new ValidationException("Graphical method only supports problems with 2 variables, got "
                            + problem.variableCount());
                }
                break;
            default:
                break;
        }
    }

    /** Plain simplex when the all-slack basis is feasible, Big M otherwise. */
    public static Method recommend(Problem problem) {
        return problem.isStandardForm() ? SIMPLEX : BIG_M;
    }

    public static Method parse(String s) {
        String t = s.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        switch (t) {
            case "simplex": return SIMPLEX;
            case "bigm": return BIG_M;
            case "graphical": case "graph": return GRAPHICAL;
            default: throw new IllegalArgumentException("Unknown method: " + s);
        }
    }
}
