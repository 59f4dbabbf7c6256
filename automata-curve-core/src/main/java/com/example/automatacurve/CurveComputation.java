package com.example.automatacurve;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Factories for the three plot computations. Each returns a {@link CurveTask}
 * that checks its token once per unit of work and, when cancelled, returns
 * the points gathered so far.
 */
public final class CurveComputation {

    private static final Logger logger = Logger.getLogger("com.example.automatacurve");
    private static final Level level = Level.FINE;

    private CurveComputation() {
    }

    /** Coordinate of an input word, Σ rank / (k+1)^i with k the input alphabet size. */
    public static double inputNumber(TransducerModel model, String word) {
        return NumericEncoder.wordToNumber(model.inputRanks(word), model.getInputAlphabet().size() + 1);
    }

    /** Coordinate of an output word, Σ rank / (m+1)^i with m the output alphabet size. */
    public static double outputNumber(TransducerModel model, String word) {
        return NumericEncoder.wordToNumber(model.outputRanks(word), model.getOutputAlphabet().size() + 1);
    }

    /**
     * Plots every (input, output) pair of lengths 1..{@code length}-1, so a
     * length of 1 or less gives an empty point set.
     *
     * @throws UnknownStateException if the filter names an undeclared terminal state
     */
    public static CurveTask byAutomata(TransducerModel model, int length, PairFilter filter) {
        if (filter.hasTerminalState() && !model.hasState(filter.getTerminalState())) {
            throw new UnknownStateException("Incorrect last state " + filter.getTerminalState());
        }
        WordEnumerator enumerator = new WordEnumerator(model);
        return token -> {
            PointSet.Range xlim = new PointSet.Range(1, model.getInputAlphabet().size() + 1);
            PointSet.Range ylim = new PointSet.Range(1, model.getOutputAlphabet().size() + 1);
            List<Double> x = new ArrayList<>();
            List<Double> y = new ArrayList<>();
            for (int i = 1; i < length; i++) {
                for (WordPair pair : enumerator.pairs(i, filter)) {
                    if (token.isCancelled()) {
                        logger.log(level, "automaton plot cancelled after " + x.size() + " points");
                        return single(new PointSet(x, y, xlim, ylim));
                    }
                    x.add(inputNumber(model, pair.getInput()));
                    y.add(outputNumber(model, pair.getOutput()));
                }
            }
            logger.log(level, "automaton plot finished with " + x.size() + " points");
            return single(new PointSet(x, y, xlim, ylim));
        };
    }

    /**
     * Plots {@code func} over every integer of magnitude class 0..length-1:
     * class i holds [base^i, base^(i+1)) and is encoded with i digits.
     */
    public static CurveTask byFunction(UnaryOperator<BigInteger> func, int base, int length) {
        return token -> {
            PointSet.Range xlim = new PointSet.Range(1, base + 1);
            PointSet.Range ylim = new PointSet.Range(1, base + 1);
            List<Double> x = new ArrayList<>();
            List<Double> y = new ArrayList<>();
            long low = 1;
            for (int i = 0; i < length; i++) {
                long high = Math.multiplyExact(low, base);
                for (long num = low; num < high; num++) {
                    if (token.isCancelled()) {
                        logger.log(level, "function plot cancelled after " + x.size() + " points");
                        return single(new PointSet(x, y, xlim, ylim));
                    }
                    BigInteger n = BigInteger.valueOf(num);
                    x.add(NumericEncoder.padicToGeom(n, i, base));
                    y.add(NumericEncoder.padicToGeom(func.apply(n), i, base));
                }
                low = high;
            }
            logger.log(level, "function plot finished with " + x.size() + " points");
            return single(new PointSet(x, y, xlim, ylim));
        };
    }

    /**
     * Self-similarity portrait: one decay curve per input symbol, built from
     * the output of reading that symbol |states| times.
     */
    public static CurveTask curves(TransducerModel model) {
        return token -> {
            List<Character> inputs = model.getInputAlphabet();
            List<Character> outputs = model.getOutputAlphabet();
            int k = model.getStates().size();
            int m = outputs.size();

            List<Double> t = new ArrayList<>(k);
            if (k > 0) {
                t.add(1.0);
            }
            for (int i = 1; i < k; i++) {
                t.add(t.get(i - 1) + Math.pow(2, -i));
            }

            List<PointSet> plots = new ArrayList<>();
            for (int s = 0; s < inputs.size(); s++) {
                if (token.isCancelled()) {
                    break;
                }
                String outWord = model.read(repeat(inputs.get(s), k));
                Map<Integer, List<Integer>> positions = new LinkedHashMap<>();
                for (char o : outputs) {
                    positions.put(model.outputRank(o), new ArrayList<>());
                }
                for (int j = 0; j < k; j++) {
                    int rank = model.outputRank(outWord.charAt(k - 1 - j));
                    positions.get(rank).add(k - 1 - j);
                }

                List<Double> y = new ArrayList<>(k);
                for (double ti : t) {
                    if (token.isCancelled()) {
                        logger.log(level, "curves cancelled after " + plots.size() + " curve(s)");
                        return plots;
                    }
                    double sum = 0;
                    for (Map.Entry<Integer, List<Integer>> e : positions.entrySet()) {
                        sum += e.getKey() * decay(ti, e.getValue(), m);
                    }
                    y.add(sum);
                }
                plots.add(new PointSet(new ArrayList<>(t), y, null, null, true, Palette.color(s)));
            }
            logger.log(level, "curves finished with " + plots.size() + " curve(s)");
            return plots;
        };
    }

    /** Σ (m+1)^-(log2(2/(2-t)) - 1 - p) over the positions p. */
    static double decay(double t, List<Integer> positions, int m) {
        double exponentBase = Math.log(2 / (2 - t)) / Math.log(2) - 1;
        double res = 0;
        for (int p : positions) {
            res += Math.pow(m + 1, -(exponentBase - p));
        }
        return res;
    }

    private static String repeat(char c, int times) {
        StringBuilder sb = new StringBuilder(times);
        for (int i = 0; i < times; i++) {
            sb.append(c);
        }
        return sb.toString();
    }

    private static List<PointSet> single(PointSet set) {
        List<PointSet> result = new ArrayList<>(1);
        result.add(set);
        return result;
    }
}
