package com.linearprogramming;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

public class OptionsParserTest {
    @Test
    public void parsesBasicFlags() {
        String[] args = {
                "-method", "bigm", "-bland", "-M", "500", "-eps", "1e-7",
                "-maxiter", "20", "-quiet", "diet.lp"
        };
        OptionsParser.Parsed p = OptionsParser.parse(args);
        SolverSettings s = p.settings;
        assertEquals("diet.lp", p.inputPath);
        assertEquals(Method.BIG_M, p.method);
        assertTrue(p.quiet);
        assertEquals(SolverSettings.PivotRule.BLAND, s.pivotRule);
        assertEquals(500.0, s.bigMFactor);
        assertEquals(1e-7, s.pivotTolerance); assertEquals(1e-7, s.feasibilityTolerance);
        assertEquals(20, s.iterationFactor);
    }

    @Test
    public void defaultsToAutoMethod() {
        OptionsParser.Parsed p = OptionsParser.parse(new String[]{"furniture.lp"});
        assertNull(p.method);
        assertFalse(p.quiet);
        assertEquals(SolverSettings.PivotRule.DANTZIG, p.settings.pivotRule);

        assertNull(OptionsParser.parse(new String[]{"-method", "auto", "a.lp"}).method);
        assertEquals(Method.GRAPHICAL, OptionsParser.parse(new String[]{"-graphical", "a.lp"}).method);
        assertEquals(Method.SIMPLEX, OptionsParser.parse(new String[]{"a.lp", "-simplex"}).method);
    }

    @Test
    public void rejectsBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> OptionsParser.parse(new String[]{}));
        assertThrows(IllegalArgumentException.class, () -> OptionsParser.parse(new String[]{"-frobnicate", "a.lp"}));
        assertThrows(IllegalArgumentException.class, () -> OptionsParser.parse(new String[]{"a.lp", "b.lp"}));
        assertThrows(IllegalArgumentException.class, () -> OptionsParser.parse(new String[]{"a.lp", "-M"}));
        assertThrows(IllegalArgumentException.class, () -> OptionsParser.parse(new String[]{"-eps", "tiny", "a.lp"}));
        assertThrows(IllegalArgumentException.class, () -> OptionsParser.parse(new String[]{"-method", "dual", "a.lp"}));
    }
}
