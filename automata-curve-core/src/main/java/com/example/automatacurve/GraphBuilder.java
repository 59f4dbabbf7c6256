package com.example.automatacurve;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds a {@link TransducerModel} from per-state edge lists and collects
 * every construction problem instead of stopping at the first one.
 */
public class GraphBuilder {

    private static final Logger logger = Logger.getLogger("com.example.automatacurve");
    private static final Level level = Level.FINE;

    /** A {@code (inputSymbol, target)} pair; the target is a state or an output symbol. */
    public static class Entry {
        private final String symbol;
        private final String target;

        public Entry(String symbol, String target) {
            this.symbol = symbol;
            this.target = target;
        }

        public String getSymbol() { return symbol; }
        public String getTarget() { return target; }

        @Override
        public String toString() { return "(" + symbol + ", " + target + ")"; }
    }

    private GraphBuilder() {
    }

    /**
     * @param initialState   may be empty for purely structural validation
     * @param transitions    state -> list of (input, destination state)
     * @param outputFunction state -> list of (input, output symbol)
     */
    public static BuildResult detailedBuild(String initialState,
                                            Map<String, List<Entry>> transitions,
                                            Map<String, List<Entry>> outputFunction) {
        List<String> errors = new ArrayList<>();

        Set<String> states = new LinkedHashSet<>(transitions.keySet());
        states.addAll(outputFunction.keySet());

        Set<Character> inputs = new TreeSet<>();
        for (List<Entry> entries : transitions.values()) {
            for (Entry e : entries) {
                Character c = single(e.getSymbol(), errors);
                if (c != null) {
                    inputs.add(c);
                }
            }
        }
        Set<Character> outputs = new TreeSet<>();
        for (List<Entry> entries : outputFunction.values()) {
            for (Entry e : entries) {
                single(e.getSymbol(), errors);
                Character c = single(e.getTarget(), errors);
                if (c != null) {
                    outputs.add(c);
                }
            }
        }

        Set<String> noOutputs = new TreeSet<>(transitions.keySet());
        noOutputs.removeAll(outputFunction.keySet());
        Set<String> noTransitions = new TreeSet<>(outputFunction.keySet());
        noTransitions.removeAll(transitions.keySet());
        if (!noTransitions.isEmpty()) {
            errors.add("Transition table is missing states: " + String.join(", ", noTransitions));
        }
        if (!noOutputs.isEmpty()) {
            errors.add("Output table is missing states: " + String.join(", ", noOutputs));
        }
        if (!errors.isEmpty()) {
            logger.log(level, "build aborted: " + errors);
            return new BuildResult(null, errors);
        }

        TransducerModel model = new TransducerModel();
        for (String s : states) {
            model.addState(s);
        }
        for (char c : inputs) {
            model.addInputSymbol(c);
        }
        for (char c : outputs) {
            model.addOutputSymbol(c);
        }

        Set<String> ambiguous = new LinkedHashSet<>();
        Map<String, Set<Character>> gaps = new LinkedHashMap<>();
        Map<String, Set<Character>> silent = new LinkedHashMap<>();
        for (String state : states) {
            Map<Character, Character> emitted = new LinkedHashMap<>();
            for (Entry e : outputFunction.get(state)) {
                char in = e.getSymbol().charAt(0);
                Character previous = emitted.putIfAbsent(in, e.getTarget().charAt(0));
                if (previous != null) {
                    ambiguous.add(state);
                }
            }

            Set<Character> covered = new TreeSet<>();
            for (Entry e : transitions.get(state)) {
                char in = e.getSymbol().charAt(0);
                if (!covered.add(in)) {
                    ambiguous.add(state);
                    continue;
                }
                if (!model.hasState(e.getTarget())) {
                    errors.add("State " + state + " has transition to unknown state " + e.getTarget());
                    continue;
                }
                Character out = emitted.get(in);
                if (out == null) {
                    silent.computeIfAbsent(state, k -> new TreeSet<>()).add(in);
                    continue;
                }
                model.setTransition(in, state, e.getTarget(), out);
            }

            if (covered.size() < inputs.size()) {
                Set<Character> missing = new TreeSet<>(inputs);
                missing.removeAll(covered);
                gaps.put(state, missing);
            }
        }

        for (String state : ambiguous) {
            errors.add("State " + state + " has ambiguous transition");
        }
        for (Map.Entry<String, Set<Character>> gap : gaps.entrySet()) {
            errors.add("State " + gap.getKey() + " is missing transition for " + join(gap.getValue()));
        }
        for (Map.Entry<String, Set<Character>> gap : silent.entrySet()) {
            errors.add("State " + gap.getKey() + " is missing output for " + join(gap.getValue()));
        }

        if (initialState != null && !initialState.isEmpty()) {
            if (model.hasState(initialState)) {
                model.setInitialState(initialState);
            } else {
                errors.add("Initial state " + initialState + " is not a state");
            }
        }

        if (!errors.isEmpty()) {
            logger.log(level, "build failed with " + errors.size() + " problem(s)");
            return new BuildResult(null, errors);
        }
        logger.log(level, "built transducer with " + states.size() + " states, inputs "
                + model.getInputAlphabet() + ", outputs " + model.getOutputAlphabet());
        return new BuildResult(model, errors);
    }

    private static Character single(String symbol, List<String> errors) {
        if (symbol == null || symbol.length() != 1) {
            errors.add("Symbol '" + symbol + "' must be a single character");
            return null;
        }
        return symbol.charAt(0);
    }

    private static String join(Set<Character> symbols) {
        StringBuilder sb = new StringBuilder();
        for (char c : symbols) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
