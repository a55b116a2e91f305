package com.linearprogramming;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.logging.Logger;

public class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());

    private static void usage(PrintWriter err) {
        err.println(
                "Usage: lp-stepwise [options] <problem-file>\n" +
                        "Methods:\n" +
                        "  -method simplex|bigm|graphical|auto   [default auto]\n" +
                        "  -simplex | -bigm | -graphical          shorthands for -method\n" +
                        "Options:\n" +
                        "  -bland        Bland's pivot rule instead of most-negative reduced cost\n" +
                        "  -M F          Big M penalty factor (M = F * max |c_j|) [10000]\n" +
                        "  -eps E        pivot and feasibility tolerance [1e-9]\n" +
                        "  -maxiter N    pivot limit factor (limit = N * (columns + rows)) [50]\n" +
                        "  -quiet        print only the final solution\n"
        );
    }

    public static void main(String[] args) {
        PrintWriter out = new PrintWriter(System.out, true);
        PrintWriter err = new PrintWriter(System.err, true);
        int code = run(args, out, err);
        if (code != 0) System.exit(code);
    }

    /** Runs the driver; returns the process exit code. */
    static int run(String[] args, PrintWriter out, PrintWriter err) {
        OptionsParser.Parsed parsed;
        try {
            parsed = OptionsParser.parse(args);
        } catch (IllegalArgumentException e) {
            usage(err);
            err.println("Argument error: " + e.getMessage());
            err.flush();
            return 2;
        }

        String filename = parsed.inputPath;
        long t0 = System.nanoTime();

        try {
            Problem problem = Problem.readFromFile(filename);

            Method method = parsed.method != null ? parsed.method : Method.recommend(problem);
            LpEngine engine = method.engine(parsed.settings);
            Result result = engine.solve(problem);
            logger.info(filename + ": " + method.displayName() + " -> " + result.status().label());

            // name line: base filename without extension
            String base = Paths.get(filename).getFileName().toString();
            int dot = base.lastIndexOf('.');
            if (dot > 0) base = base.substring(0, dot);
            out.println(base);
            out.print(Formats.formulation(problem));
            out.println();

            new ResultWriter(out, !parsed.quiet).write(result);

            long t1 = System.nanoTime();
            double secs = (t1 - t0) / 1_000_000_000.0;
            out.printf(Locale.ROOT, "*Time=%.3fs%n", secs);
            out.flush();
            return 0;

        } catch (ValidationException e) {
            err.println("Cannot solve: " + e.reason());
            err.flush();
            return 2;
        } catch (FileNotFoundException e) {
            err.println("File not found: " + filename);
            err.flush();
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }
}
