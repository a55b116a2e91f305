package com.linearprogramming;

/**
 * A solution method. Every engine is stateless between calls: solving the
 * same problem twice yields identical results and identical traces.
 */
public interface LpEngine {
    Method method();

    /**
     * @throws ValidationException if the problem's shape is outside what this method handles
     */
    Result solve(Problem problem);
}
