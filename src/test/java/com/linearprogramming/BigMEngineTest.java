package com.linearprogramming;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

public class BigMEngineTest {

    private static final Constraint.Relation LE = Constraint.Relation.LESS_EQUAL;
    private static final Constraint.Relation GE = Constraint.Relation.GREATER_EQUAL;
    private static final Constraint.Relation EQ = Constraint.Relation.EQUAL;
    private static final double TOL = 1e-6;

    static Problem diet() {
        return Problem.minimize(new double[]{2, 3},
                Constraint.of(GE, 8, 1, 2),
                Constraint.of(GE, 12, 3, 1));
    }

    @Test
    public void solvesMinimizationWithSurplusRows() {
        Result r = new BigMEngine().solve(diet());
        assertEquals(SolveStatus.OPTIMAL, r.status());
        assertEquals(Method.BIG_M, r.method());
        assertEquals(3.2, r.value("x1"), TOL);
        assertEquals(2.4, r.value("x2"), TOL);
        assertEquals(13.6, r.objectiveValue().getAsDouble(), TOL);
        assertEquals(List.of("x1", "x2"), List.copyOf(r.variables().keySet()), "artificials are not reported");

        SolveStats stats = r.stats();
        assertEquals(2, stats.surplusVariables);
        assertEquals(2, stats.artificialVariables);
        assertEquals(0, stats.slackVariables);
        assertEquals(2, stats.pivots);
    }

    @Test
    public void traceShowsPriceOutAndArtificialCheck() {
        List<Step> steps = new BigMEngine().solve(diet()).steps();
        assertEquals("Standard Form", steps.get(0).title());
        assertEquals("Initial Tableau", steps.get(1).title());
        assertEquals("Price Out Artificial Variables", steps.get(2).title());
        assertEquals("Pivot 1: enter x1, leave a2", steps.get(3).title());
        assertEquals("Pivot 2: enter x2, leave a1", steps.get(4).title());
        assertEquals("Optimality Check", steps.get(5).title());
        assertEquals("Artificial Variables", steps.get(6).title());
        assertEquals("Optimal Solution", steps.get(7).title());

        assertTrue(steps.get(0).explanation().contains("M = 30000"), steps.get(0).explanation());

        // +M under the artificials before pricing out, zero after
        TableSnapshot before = steps.get(1).table().orElseThrow();
        TableSnapshot after = steps.get(2).table().orElseThrow();
        int a1 = before.columnLabels().indexOf("a1");
        assertEquals(30000.0, before.get(2, a1));
        assertEquals(0.0, after.get(2, a1));
        assertTrue(after.basisIsCanonical(1e-9));
    }

    @Test
    public void noArtificialStaysPositiveAtTheOptimum() {
        Result r = new BigMEngine().solve(diet());
        TableSnapshot last = r.steps().get(r.steps().size() - 1).table().orElseThrow();
        int[] basis = last.basis();
        for (int row = 0; row < basis.length; row++) {
            if (last.columnLabels().get(basis[row]).startsWith("a")) {
                assertTrue(last.rhs(row) <= 1e-9);
            }
        }
    }

    @Test
    public void positiveArtificialMeansInfeasible() {
        Problem p = Problem.minimize(new double[]{1, 1},
                Constraint.of(GE, 10, 1, 1),
                Constraint.of(LE, 5, 1, 1));
        Result r = new BigMEngine().solve(p);
        assertEquals(SolveStatus.INFEASIBLE, r.status());
        assertEquals("No solution satisfies all constraints (artificial a1 remains positive)", r.message().get());
        assertTrue(r.variables().isEmpty());
        Step last = r.steps().get(r.steps().size() - 1);
        assertEquals("Feasibility Check", last.title());
        assertTrue(last.explanation().contains("a1 = 5"), last.explanation());
    }

    @Test
    public void unboundedStopWithPositiveArtificialIsInfeasible() {
        // x2 <= 5 and x2 >= 8 conflict; the Big M loop stops on an unbounded column first
        Problem p = Problem.maximize(new double[]{1, 1},
                Constraint.of(GE, 10, 1, 1),
                Constraint.of(LE, 5, 0, 1),
                Constraint.of(GE, 8, 0, 1));
        Result r = new BigMEngine().solve(p);
        assertEquals(SolveStatus.INFEASIBLE, r.status());
        assertEquals("No solution satisfies all constraints (artificial a3 remains positive)", r.message().get());
        assertTrue(r.steps().stream().anyMatch(s -> s.title().equals("Phase One")));
        Step last = r.steps().get(r.steps().size() - 1);
        assertEquals("Feasibility Check", last.title());
        assertTrue(last.explanation().contains("a3 = 3"), last.explanation());
    }

    @Test
    public void penaltySmallAgainstConstraintScaleStillFindsOptimum() {
        // M = 10000 is below the row coefficient 100000, so the penalty alone leaves a2 basic
        Problem p = Problem.maximize(new double[]{1, 0},
                Constraint.of(LE, 100000, 1, 100000),
                Constraint.of(EQ, 1, 0, 1));
        Result r = new BigMEngine().solve(p);
        assertEquals(SolveStatus.OPTIMAL, r.status());
        assertEquals(0.0, r.value("x1"), TOL);
        assertEquals(1.0, r.value("x2"), TOL);
        assertEquals(0.0, r.objectiveValue().getAsDouble(), TOL);
        List<String> titles = r.steps().stream().map(Step::title).collect(Collectors.toList());
        assertTrue(titles.contains("Phase One"), titles.toString());
        assertTrue(titles.contains("Phase Two"), titles.toString());
        assertEquals("Optimal Solution", titles.get(titles.size() - 1));

        TableSnapshot fin = r.steps().get(r.steps().size() - 1).table().orElseThrow();
        for (int b : fin.basis()) assertFalse(fin.columnLabels().get(b).startsWith("a"), fin.toString());
    }

    @Test
    public void statsAreACopy() {
        Result r = new BigMEngine().solve(diet());
        r.stats().pivots = 99;
        r.stats().artificialVariables = 0;
        assertEquals(2, r.stats().pivots);
        assertEquals(2, r.stats().artificialVariables);
    }

    @Test
    public void equalityRow() {
        Problem p = Problem.maximize(new double[]{2, 3},
                Constraint.of(EQ, 4, 1, 1),
                Constraint.of(LE, 6, 1, 3));
        Result r = new BigMEngine().solve(p);
        assertTrue(r.isOptimal());
        assertEquals(3.0, r.value("x1"), TOL);
        assertEquals(1.0, r.value("x2"), TOL);
        assertEquals(9.0, r.objectiveValue().getAsDouble(), TOL);
        assertEquals(1, r.stats().artificialVariables);
        assertEquals(0, r.stats().surplusVariables);
    }

    @Test
    public void mixedRelations() {
        Problem p = Problem.maximize(new double[]{0.08, 0.12},
                Constraint.of(LE, 10000, 1, 1),
                Constraint.of(GE, 3000, 1, 0),
                Constraint.of(LE, 6000, 0, 1));
        Result r = new BigMEngine().solve(p);
        assertTrue(r.isOptimal());
        assertEquals(4000.0, r.value("x1"), 1e-4);
        assertEquals(6000.0, r.value("x2"), 1e-4);
        assertEquals(1040.0, r.objectiveValue().getAsDouble(), 1e-4);
    }

    @Test
    public void threeVariableEqualities() {
        Problem p = Problem.minimize(new double[]{4, 1, 1},
                Constraint.of(EQ, 4, 2, 1, 2),
                Constraint.of(EQ, 3, 3, 3, 1));
        Result r = new BigMEngine().solve(p);
        assertTrue(r.isOptimal());
        assertEquals(0.0, r.value("x1"), TOL);
        assertEquals(0.4, r.value("x2"), TOL);
        assertEquals(1.8, r.value("x3"), TOL);
        assertEquals(2.2, r.objectiveValue().getAsDouble(), TOL);
    }

    @Test
    public void standardFormProblemNeedsNoPriceOut() {
        Result r = new BigMEngine().solve(SimplexEngineTest.furniture());
        assertEquals(160.0, r.objectiveValue().getAsDouble(), TOL);
        for (Step s : r.steps()) {
            assertNotEquals("Price Out Artificial Variables", s.title());
            assertNotEquals("Artificial Variables", s.title());
        }
    }

    @Test
    public void penaltyScalesWithObjective() {
        SolverSettings s = SolverSettings.builder().bigMFactor(100).build();
        assertEquals(30000.0, StandardForm.penalty(diet(), SolverSettings.defaults()));
        assertEquals(300.0, StandardForm.penalty(diet(), s));
        Problem tiny = Problem.minimize(new double[]{0.1, 0.2}, Constraint.of(GE, 1, 1, 1));
        assertEquals(100.0, StandardForm.penalty(tiny, s), "never below the factor itself");
    }
}
