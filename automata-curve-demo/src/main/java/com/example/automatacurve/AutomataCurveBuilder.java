package com.example.automatacurve;

import java.io.File;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry point: computes plot points for an editor graph or an
 * expression and writes them to a JSON file whose name is printed on stdout.
 * Also checks a graph ({@code verify}) and runs a single word through it
 * ({@code read}).
 */
public class AutomataCurveBuilder {

    static final int DEFAULT_LENGTH = 12;
    static final int DEFAULT_BASE = 2;

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /** @return the process exit status */
    static int run(String[] args, PrintStream out, PrintStream err) {
        String inputOrder = null;
        String outputOrder = null;
        String outDir = null;
        List<String> positional = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            if (args[i].startsWith("--")) {
                if (i + 1 >= args.length) {
                    err.println("❗ Option " + args[i] + " needs a value");
                    return 2;
                }
                String value = args[++i];
                if ("--inputs".equals(args[i - 1])) {
                    inputOrder = value;
                } else if ("--outputs".equals(args[i - 1])) {
                    outputOrder = value;
                } else if ("--out".equals(args[i - 1])) {
                    outDir = value;
                } else {
                    err.println("❗ Unknown option " + args[i - 1]);
                    return 2;
                }
            } else {
                positional.add(args[i]);
            }
        }

        if (positional.size() < 2) {
            err.println("❗ Please provide a mode and its source.");
            err.println("👉 Usage: java AutomataCurveBuilder automata <graph.json> [length] [prefix] [suffix] [last_state] [pattern]");
            err.println("👉        java AutomataCurveBuilder curves <graph.json>");
            err.println("👉        java AutomataCurveBuilder function \"<expression>\" [base] [length]");
            err.println("👉        java AutomataCurveBuilder verify <graph.json>");
            err.println("👉        java AutomataCurveBuilder read <graph.json> <word>");
            err.println("👉 Options: --inputs <symbols> --outputs <symbols> reorder the alphabets, --out <dir> picks the output directory");
            return 2;
        }

        String mode = positional.get(0);
        String source = positional.get(1);

        try {
            List<PointSet> sets;
            if ("function".equals(mode)) {
                int base = positional.size() > 2 ? Integer.parseInt(positional.get(2)) : DEFAULT_BASE;
                int length = positional.size() > 3 ? Integer.parseInt(positional.get(3)) : DEFAULT_LENGTH;
                CompiledExpression func = ExpressionCompiler.compile(source, base);
                sets = compute(CurveComputation.byFunction(func, base, length));
            } else if ("automata".equals(mode) || "curves".equals(mode)
                    || "verify".equals(mode) || "read".equals(mode)) {
                BuildResult result = GraphDocument.read(new File(source)).build();
                if (!result.isSuccess()) {
                    for (String error : result.getErrors()) {
                        err.println(error);
                    }
                    return 1;
                }
                TransducerModel model = result.getModel();
                applyOrder(model, inputOrder, outputOrder);

                if ("verify".equals(mode)) {
                    List<String> errors = model.detailedVerify();
                    for (String error : errors) {
                        err.println(error);
                    }
                    if (!errors.isEmpty()) {
                        return 1;
                    }
                    out.println("Automata is correct");
                    return 0;
                }
                if ("read".equals(mode)) {
                    if (positional.size() < 3) {
                        err.println("❗ Please provide the word to read.");
                        return 2;
                    }
                    String word = positional.get(2);
                    TransducerModel.Run run = model.run(word);
                    out.println(word + " -> " + run.getOutput() + " (" + run.getFinalState() + ")");
                    return 0;
                }
                if ("curves".equals(mode)) {
                    sets = compute(CurveComputation.curves(model));
                } else {
                    int length = positional.size() > 2 ? Integer.parseInt(positional.get(2)) : DEFAULT_LENGTH;
                    PairFilter filter = new PairFilter(arg(positional, 3), arg(positional, 4),
                            arg(positional, 5), arg(positional, 6));
                    sets = compute(CurveComputation.byAutomata(model, length, filter));
                }
            } else {
                err.println("❗ Unknown mode " + mode + ", expected automata, curves, function, verify or read");
                return 2;
            }

            String hash = sha256Hex(String.join(" ", args)).substring(0, 8);  // Use first 8 chars
            String outputFilename = "curve-" + hash + ".json";
            if (outDir != null) {
                outputFilename = new File(outDir, outputFilename).getPath();
            }
            PointSetSerializer.serializeToJson(sets, mode + " " + source, outputFilename);
            out.println(outputFilename); //Output filename so parent program can locate the output file
            return 0;

        } catch (ExpressionException e) {
            err.println("Invalid function (" + e.getKind() + "): " + e.getMessage());
            return 1;
        } catch (TransducerException e) {
            err.println("Invalid automaton: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            err.println("Error occurred: " + e.getMessage());
            e.printStackTrace(err);
            return 1;
        }
    }

    /** Reranks the alphabets from option strings such as {@code 10}; {@code null} keeps the current order. */
    static void applyOrder(TransducerModel model, String inputOrder, String outputOrder) {
        if (inputOrder != null) {
            model.resetInputOrder(symbols(inputOrder));
        }
        if (outputOrder != null) {
            model.resetOutputOrder(symbols(outputOrder));
        }
    }

    private static List<Character> symbols(String order) {
        List<Character> result = new ArrayList<>(order.length());
        for (char c : order.toCharArray()) {
            result.add(c);
        }
        return result;
    }

    private static List<PointSet> compute(CurveTask task) throws Exception {
        try (CurveRunner runner = new CurveRunner()) {
            return runner.start(task).get();
        }
    }

    private static String arg(List<String> args, int i) {
        return args.size() > i ? args.get(i) : "";
    }

    private static String sha256Hex(String input) throws Exception {
        java.security.MessageDigest digest = java.security.MessageDigest.getInstance("SHA-256");
        byte[] hash = digest.digest(input.getBytes(java.nio.charset.StandardCharsets.UTF_8));
        StringBuilder hex = new StringBuilder();
        for (byte b : hash) {
            hex.append(String.format("%02x", b));
        }
        return hex.toString();
    }
}
