package com.linearprogramming;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

public class SimplexEngineTest {

    private static final Constraint.Relation LE = Constraint.Relation.LESS_EQUAL;
    private static final Constraint.Relation GE = Constraint.Relation.GREATER_EQUAL;
    private static final double TOL = 1e-6;

    static Problem furniture() {
        return Problem.maximize(new double[]{3, 2},
                Constraint.of(LE, 100, 2, 1),
                Constraint.of(LE, 80, 1, 2));
    }

    static Problem beale() {
        return Problem.maximize(new double[]{0.75, -20, 0.5, -6},
                Constraint.of(LE, 0, 0.25, -8, -1, 9),
                Constraint.of(LE, 0, 0.5, -12, -0.5, 3),
                Constraint.of(LE, 1, 0, 0, 1, 0));
    }

    @Test
    public void solvesTwoVariableMaximization() {
        Result r = new SimplexEngine().solve(furniture());
        assertEquals(SolveStatus.OPTIMAL, r.status());
        assertEquals(Method.SIMPLEX, r.method());
        assertEquals(40.0, r.value("x1"), TOL);
        assertEquals(20.0, r.value("x2"), TOL);
        assertEquals(160.0, r.objectiveValue().getAsDouble(), TOL);
        assertFalse(r.isDegenerate());
        assertFalse(r.message().isPresent());
        assertEquals(2, r.stats().pivots);
        assertEquals(2, r.stats().slackVariables);
    }

    @Test
    public void traceFollowsThePivots() {
        List<Step> steps = new SimplexEngine().solve(furniture()).steps();
        assertEquals("Standard Form", steps.get(0).title());
        assertEquals("Initial Tableau", steps.get(1).title());
        assertEquals("Pivot 1: enter x1, leave s1", steps.get(2).title());
        assertEquals("Pivot 2: enter x2, leave s2", steps.get(3).title());
        assertEquals("Optimality Check", steps.get(4).title());
        assertEquals("Optimal Solution", steps.get(5).title());
        assertEquals(6, steps.size());

        assertTrue(steps.get(2).explanation().contains("100 / 2 = 50  (minimum)"), steps.get(2).explanation());
        TableSnapshot initial = steps.get(1).table().orElseThrow();
        assertEquals(List.of("s1", "s2", "Z"), initial.rowLabels());
        assertEquals(-3.0, initial.get(2, 0));
    }

    @Test
    public void everyPivotLeavesACanonicalBasis() {
        for (Step s : new SimplexEngine().solve(beale()).steps()) {
            s.table().ifPresent(t -> assertTrue(t.basisIsCanonical(1e-9), s.title()));
        }
    }

    @Test
    public void minimizationReportsOriginalSign() {
        Problem p = Problem.minimize(new double[]{-3, -2},
                Constraint.of(LE, 100, 2, 1),
                Constraint.of(LE, 80, 1, 2));
        Result r = new SimplexEngine().solve(p);
        assertTrue(r.isOptimal());
        assertEquals(-160.0, r.objectiveValue().getAsDouble(), TOL);
        assertEquals(40.0, r.value("x1"), TOL);
    }

    @Test
    public void detectsUnboundedColumn() {
        Problem p = Problem.maximize(new double[]{1, 1}, Constraint.of(LE, 1, 1, -1));
        Result r = new SimplexEngine().solve(p);
        assertEquals(SolveStatus.UNBOUNDED, r.status());
        assertEquals("The objective can be increased without limit by increasing x2", r.message().get());
        assertTrue(r.variables().isEmpty());
        assertFalse(r.objectiveValue().isPresent());
        Step last = r.steps().get(r.steps().size() - 1);
        assertEquals("Unbounded Direction", last.title());
        assertTrue(last.table().isPresent());
    }

    @Test
    public void negativeRhsIsFlipped() {
        Problem p = Problem.maximize(new double[]{1, 2},
                Constraint.of(GE, -4, -1, -1),
                Constraint.of(LE, 3, 1, 0));
        Result r = new SimplexEngine().solve(p);
        assertTrue(r.isOptimal());
        assertEquals(0.0, r.value("x1"), TOL);
        assertEquals(4.0, r.value("x2"), TOL);
        assertEquals(8.0, r.objectiveValue().getAsDouble(), TOL);
        assertTrue(r.steps().get(0).explanation().contains("multiplied by -1"));
    }

    @Test
    public void freeVariablesAreSplit() {
        Problem p = Problem.normalize(Problem.Direction.MINIMIZE, new double[]{1, 1},
                List.of(Constraint.of(GE, -3, 1, 0), Constraint.of(GE, -2, 0, 1)), false);
        Result r = new SimplexEngine().solve(p);
        assertTrue(r.isOptimal());
        assertEquals(-3.0, r.value("x1"), TOL);
        assertEquals(-2.0, r.value("x2"), TOL);
        assertEquals(-5.0, r.objectiveValue().getAsDouble(), TOL);
        assertEquals(List.of("x1", "x2"), List.copyOf(r.variables().keySet()));
        TableSnapshot initial = r.steps().get(1).table().orElseThrow();
        assertEquals("x1+", initial.columnLabels().get(0));
        assertEquals("x1-", initial.columnLabels().get(1));
    }

    @Test
    public void threeVariables() {
        Problem p = Problem.maximize(new double[]{5, 4, 3},
                Constraint.of(LE, 5, 2, 3, 1),
                Constraint.of(LE, 11, 4, 1, 2),
                Constraint.of(LE, 8, 3, 4, 2));
        Result r = new SimplexEngine().solve(p);
        assertTrue(r.isOptimal());
        assertEquals(2.0, r.value("x1"), TOL);
        assertEquals(0.0, r.value("x2"), TOL);
        assertEquals(1.0, r.value("x3"), TOL);
        assertEquals(13.0, r.objectiveValue().getAsDouble(), TOL);
    }

    @Test
    public void degenerateOptimum() {
        Problem p = Problem.maximize(new double[]{1, 1},
                Constraint.of(LE, 1, 1, 0),
                Constraint.of(LE, 1, 0, 1),
                Constraint.of(LE, 2, 1, 1));
        Result r = new SimplexEngine().solve(p);
        assertTrue(r.isOptimal());
        assertEquals(2.0, r.objectiveValue().getAsDouble(), TOL);
        assertTrue(r.isDegenerate());
        Step last = r.steps().get(r.steps().size() - 1);
        assertTrue(last.explanation().contains("degenerate"));
    }

    @Test
    public void rejectsGreaterEqualRows() {
        Problem p = Problem.minimize(new double[]{2, 3},
                Constraint.of(GE, 8, 1, 2), Constraint.of(GE, 12, 3, 1));
        ValidationException e = assertThrows(ValidationException.class, () -> new SimplexEngine().solve(p));
        assertTrue(e.reason().contains("Big M"), e.reason());
    }

    @Test
    public void dantzigCyclesOnBealeExample() {
        Result r = new SimplexEngine().solve(beale());
        assertEquals(SolveStatus.ERROR, r.status());
        assertTrue(r.message().get().startsWith("Iteration limit exceeded"), r.message().get());
        assertEquals("Iteration Limit", r.steps().get(r.steps().size() - 1).title());
    }

    @Test
    public void blandTerminatesOnBealeExample() {
        SolverSettings bland = SolverSettings.builder().pivotRule(SolverSettings.PivotRule.BLAND).build();
        Result r = new SimplexEngine(bland).solve(beale());
        assertEquals(SolveStatus.OPTIMAL, r.status());
        assertEquals(1.25, r.objectiveValue().getAsDouble(), TOL);
        assertEquals(1.0, r.value("x1"), TOL);
        assertEquals(1.0, r.value("x3"), TOL);
        assertTrue(r.steps().get(2).explanation().contains("Bland's rule"));
    }

    @Test
    public void solvingTwiceGivesTheSameTrace() {
        SimplexEngine engine = new SimplexEngine();
        Result a = engine.solve(furniture());
        Result b = engine.solve(furniture());
        assertEquals(a.steps(), b.steps());
        assertThrows(UnsupportedOperationException.class, () -> a.steps().clear());
        assertThrows(IllegalStateException.class, () -> a.value("s1"));
    }
}
