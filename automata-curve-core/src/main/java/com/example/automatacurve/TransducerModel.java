package com.example.automatacurve;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * In-memory Mealy automaton.
 * <p>
 * Transition and output tables are dense {@code int[state][inputColumn]}
 * arrays; state names are mapped to compact ids at the boundary. A cell
 * holding {@link #UNDEFINED} has never been set.
 * <p>
 * The model performs no locking: it must not be mutated while an enumeration
 * or a curve computation is reading it.
 */
public class TransducerModel {

    static final int UNDEFINED = -1;

    private final List<String> stateNames = new ArrayList<>();
    private final Map<String, Integer> stateIds = new HashMap<>();
    private final Alphabet inputs = new Alphabet();
    private final Alphabet outputs = new Alphabet();

    private int[][] next = new int[0][];
    private int[][] emit = new int[0][];
    private int initial = UNDEFINED;

    /** Result of a single transition. */
    public static class Step {
        private final String nextState;
        private final char output;

        public Step(String nextState, char output) {
            this.nextState = nextState;
            this.output = output;
        }

        public String getNextState() { return nextState; }
        public char getOutput() { return output; }
    }

    /** Output word together with the state the run stopped in. */
    public static class Run {
        private final String output;
        private final String finalState;

        public Run(String output, String finalState) {
            this.output = output;
            this.finalState = finalState;
        }

        public String getOutput() { return output; }
        public String getFinalState() { return finalState; }
    }

    public void addState(String name) {
        if (stateIds.containsKey(name)) {
            return;
        }
        stateIds.put(name, stateNames.size());
        stateNames.add(name);
        next = Arrays.copyOf(next, stateNames.size());
        emit = Arrays.copyOf(emit, stateNames.size());
        next[next.length - 1] = undefinedRow(inputs.size());
        emit[emit.length - 1] = undefinedRow(inputs.size());
    }

    public void addInputSymbol(char symbol) {
        if (!inputs.add(symbol)) {
            return;
        }
        for (int s = 0; s < next.length; s++) {
            next[s] = grow(next[s]);
            emit[s] = grow(emit[s]);
        }
    }

    public void addOutputSymbol(char symbol) {
        outputs.add(symbol);
    }

    public void setInitialState(String name) {
        initial = requireState(name, UnknownStateException::new);
    }

    /** @return the initial state name, or {@code null} when none is set */
    public String getInitialState() {
        return initial == UNDEFINED ? null : stateNames.get(initial);
    }

    public void setTransition(char input, String source, String destination, char output) {
        int col = inputs.indexOf(input);
        if (col < 0) {
            throw new InvalidSymbolOrStateException("Input symbol '" + input + "' must be in input alphabet");
        }
        int src = requireState(source, InvalidSymbolOrStateException::new);
        int dst = requireState(destination, InvalidSymbolOrStateException::new);
        int out = outputs.indexOf(output);
        if (out < 0) {
            throw new InvalidSymbolOrStateException("Output symbol '" + output + "' must be in output alphabet");
        }
        next[src][col] = dst;
        emit[src][col] = out;
    }

    /** @throws UndefinedTransitionException if the pair was never set, undeclared members included */
    public Step transition(char symbol, String state) {
        int col = inputs.indexOf(symbol);
        if (col < 0) {
            throw new UndefinedTransitionException("No transition on undeclared symbol '" + symbol + "'");
        }
        int s = requireState(state, UndefinedTransitionException::new);
        if (next[s][col] == UNDEFINED || emit[s][col] == UNDEFINED) {
            throw new UndefinedTransitionException(
                    "No transition from state " + state + " on symbol '" + symbol + "'");
        }
        return new Step(stateNames.get(next[s][col]), outputs.symbolAt(emit[s][col]));
    }

    public String read(String word) {
        return run(word).getOutput();
    }

    /** Reads {@code word} from the initial state. Does not mutate the model. */
    public Run run(String word) {
        for (int i = 0; i < word.length(); i++) {
            if (!inputs.contains(word.charAt(i))) {
                throw new AlphabetMismatchException(
                        "The input word contains symbols not from the input alphabet: '" + word.charAt(i) + "'");
            }
        }
        if (initial == UNDEFINED) {
            throw new NoInitialStateException("Initial state must be set");
        }
        StringBuilder out = new StringBuilder(word.length());
        int s = initial;
        for (int i = 0; i < word.length(); i++) {
            int col = inputs.indexOf(word.charAt(i));
            if (next[s][col] == UNDEFINED || emit[s][col] == UNDEFINED) {
                throw new UndefinedTransitionException(
                        "No transition from state " + stateNames.get(s) + " on symbol '" + word.charAt(i) + "'");
            }
            out.append(outputs.symbolAt(emit[s][col]));
            s = next[s][col];
        }
        return new Run(out.toString(), stateNames.get(s));
    }

    /** Σ rank(word[i]) / k^i over the input alphabet, k its size. */
    public double toNumber(String word) {
        return NumericEncoder.wordToNumber(inputRanks(word), inputs.size());
    }

    public int[] inputRanks(String word) {
        return ranks(inputs, word);
    }

    public int[] outputRanks(String word) {
        return ranks(outputs, word);
    }

    public boolean verify() {
        return detailedVerify().isEmpty();
    }

    /**
     * Lists every problem that would make {@link #read(String)} fail on a
     * word drawn from the input alphabet.
     */
    public List<String> detailedVerify() {
        List<String> errors = new ArrayList<>();
        if (initial == UNDEFINED) {
            errors.add("There is no initial state");
        }
        for (int s = 0; s < stateNames.size(); s++) {
            String missing = undefinedSymbols(next[s]);
            if (!missing.isEmpty()) {
                errors.add("State " + stateNames.get(s) + " must have transition for " + missing + " input symbols");
            }
        }
        for (int s = 0; s < stateNames.size(); s++) {
            String missing = undefinedSymbols(emit[s]);
            if (!missing.isEmpty()) {
                errors.add("State " + stateNames.get(s) + " must have output for " + missing + " input symbols");
            }
        }
        return errors;
    }

    public void resetInputOrder(List<Character> ordered) {
        inputs.resetOrder(ordered);
    }

    public void resetOutputOrder(List<Character> ordered) {
        outputs.resetOrder(ordered);
    }

    public List<String> getStates() {
        return new ArrayList<>(stateNames);
    }

    public boolean hasState(String name) {
        return stateIds.containsKey(name);
    }

    /** Input symbols in rank order. */
    public List<Character> getInputAlphabet() {
        return inputs.ordered();
    }

    /** Output symbols in rank order. */
    public List<Character> getOutputAlphabet() {
        return outputs.ordered();
    }

    public int inputRank(char symbol) {
        return inputs.rankOf(symbol);
    }

    public int outputRank(char symbol) {
        return outputs.rankOf(symbol);
    }

    private String undefinedSymbols(int[] row) {
        StringBuilder sb = new StringBuilder();
        for (int col = 0; col < row.length; col++) {
            if (row[col] == UNDEFINED) {
                if (sb.length() > 0) {
                    sb.append(", ");
                }
                sb.append(inputs.symbolAt(col));
            }
        }
        return sb.toString();
    }

    private int requireState(String name, Function<String, ? extends TransducerException> error) {
        Integer id = name == null ? null : stateIds.get(name);
        if (id == null) {
            throw error.apply("State " + name + " must be in states");
        }
        return id;
    }

    private static int[] ranks(Alphabet alphabet, String word) {
        int[] r = new int[word.length()];
        for (int i = 0; i < word.length(); i++) {
            r[i] = alphabet.rankOf(word.charAt(i));
        }
        return r;
    }

    private static int[] undefinedRow(int size) {
        int[] row = new int[size];
        Arrays.fill(row, UNDEFINED);
        return row;
    }

    private static int[] grow(int[] row) {
        int[] grown = Arrays.copyOf(row, row.length + 1);
        grown[row.length] = UNDEFINED;
        return grown;
    }
}
