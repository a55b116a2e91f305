package com.linearprogramming;

public final class OptionsParser {

    public static final class Parsed {
        public final SolverSettings settings;
        public final Method method;        // null = pick from the problem's shape
        public final boolean quiet;
        public final String inputPath;
        private Parsed(SolverSettings s, Method m, boolean q, String p){ settings=s; method=m; quiet=q; inputPath=p; }
    }

    public static Parsed parse(String[] args){
        SolverSettings.Builder b = SolverSettings.builder();
        Method method = null;
        boolean quiet = false;
        String input = null;

        for (int i=0; i<args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-method": {
                    String m = value(args, ++i, a);
                    method = m.equalsIgnoreCase("auto") ? null : Method.parse(m);
                    break;
                }
                case "-simplex": method = Method.SIMPLEX; break;
                case "-bigm": method = Method.BIG_M; break;
                case "-graphical": method = Method.GRAPHICAL; break;
                case "-bland": b.pivotRule(SolverSettings.PivotRule.BLAND); break;
                case "-quiet": quiet = true; break;
                case "-M": b.bigMFactor(Double.parseDouble(value(args, ++i, a))); break;
                case "-eps": {
                    double eps = Double.parseDouble(value(args, ++i, a));
                    b.pivotTolerance(eps).feasibilityTolerance(eps);
                    break;
                }
                case "-maxiter": b.iterationFactor(Integer.parseInt(value(args, ++i, a))); break;
                default:
                    if (a.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + a);
                    if (input != null) throw new IllegalArgumentException("Multiple inputs: " + a);
                    input = a;
            }
        }
        if (input == null) throw new IllegalArgumentException("Missing input file");
        return new Parsed(b.build(), method, quiet, input);
    }

    private static String value(String[] args, int i, String option){
        if (i >= args.length) throw new IllegalArgumentException("Option " + option + " needs a value");
        return args[i];
    }
}
