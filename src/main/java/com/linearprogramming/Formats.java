package com.linearprogramming;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Text rendering of numbers, linear expressions and problem formulations. */
public final class Formats {

    private static final int DECIMALS = 6;

    private Formats() {}

    /** Integers print as integers, everything else with at most six decimals. */
    public static String number(double v) {
        if (Double.isNaN(v) || Double.isInfinite(v)) return Double.toString(v);
        BigDecimal bd = BigDecimal.valueOf(v).setScale(DECIMALS, RoundingMode.HALF_UP).stripTrailingZeros();
        if (bd.signum() == 0) return "0";
        return bd.scale() <= 0 ? bd.toBigInteger().toString() : bd.toPlainString();
    }

    /** Accepts plain decimals and {@code numerator/denominator} fractions. */
    public static double parseNumber(String token) {
        String t = token.trim();
        int slash = t.indexOf('/');
        if (slash > 0) {
            double num = Double.parseDouble(t.substring(0, slash));
            double den = Double.parseDouble(t.substring(slash + 1));
            if (den == 0.0) throw new NumberFormatException("Zero denominator: " + token);
            return num / den;
        }
        return Double.parseDouble(t);
    }

    /** {@code 3x1 + 2x2}, skipping zero terms. */
    public static String expression(double[] coefficients, String[] names) {
        StringBuilder sb = new StringBuilder();
        for (int j = 0; j < coefficients.length; j++) {
            double a = coefficients[j];
            if (a == 0.0) continue;
            if (sb.length() == 0) {
                if (a < 0) sb.append('-');
            } else {
                sb.append(a < 0 ? " - " : " + ");
            }
            double abs = Math.abs(a);
            if (abs != 1.0) sb.append(number(abs));
            sb.append(names[j]);
        }
        return sb.length() == 0 ? "0" : sb.toString();
    }

    public static String formulation(Problem p) {
        String[] names = new String[p.variableCount()];
        for (int j = 0; j < names.length; j++) names[j] = p.variableName(j);

        StringBuilder sb = new StringBuilder();
        sb.append(p.isMaximize() ? "Maximize" : "Minimize")
          .append(" Z = ").append(expression(p.objective(), names)).append('\n');
        sb.append("Subject to:\n");
        for (Constraint c : p.constraints()) {
            sb.append("  ").append(expression(c.coefficients(), names))
              .append(' ').append(c.relation().symbol())
              .append(' ').append(number(c.rhs())).append('\n');
        }
        if (p.isNonNegative()) {
            sb.append("  ").append(String.join(", ", names)).append(" >= 0\n");
        } else {
            sb.append("  ").append(String.join(", ", names)).append(" unrestricted\n");
        }
        return sb.toString();
    }

    public static String point(double[] x) {
        StringBuilder sb = new StringBuilder("(");
        for (int j = 0; j < x.length; j++) {
            if (j > 0) sb.append(", ");
            sb.append(number(x[j]));
        }
        return sb.append(')').toString();
    }
}
