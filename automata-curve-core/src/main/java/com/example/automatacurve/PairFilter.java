package com.example.automatacurve;

import dk.brics.automaton.Automaton;
import dk.brics.automaton.RegExp;

/**
 * Constraints applied while enumerating word pairs: a fixed prefix and
 * suffix around every generated word, a state every run has to stop in, and
 * an optional regular expression the whole input word has to match.
 * <p>
 * Empty strings mean "no constraint".
 */
public class PairFilter {

    public static final PairFilter NONE = new PairFilter("", "", "", null);

    private final String prefix;
    private final String suffix;
    private final String terminalState;
    private final String pattern;
    private final Automaton acceptor;

    public PairFilter(String prefix, String suffix, String terminalState) {
        this(prefix, suffix, terminalState, null);
    }

    /**
     * @param pattern regular expression in dk.brics.automaton syntax, or {@code null}
     * @throws IllegalArgumentException if the pattern does not parse
     */
    public PairFilter(String prefix, String suffix, String terminalState, String pattern) {
        this.prefix = prefix == null ? "" : prefix;
        this.suffix = suffix == null ? "" : suffix;
        this.terminalState = terminalState == null ? "" : terminalState;
        this.pattern = pattern == null || pattern.isEmpty() ? null : pattern;
        if (this.pattern != null) {
            Automaton a = new RegExp(this.pattern).toAutomaton();
            a.determinize();
            this.acceptor = a;
        } else {
            this.acceptor = null;
        }
    }

    public String getPrefix() { return prefix; }
    public String getSuffix() { return suffix; }
    public String getTerminalState() { return terminalState; }
    public String getPattern() { return pattern; }

    public boolean hasTerminalState() {
        return !terminalState.isEmpty();
    }

    /** @return true when no pattern is set or the pattern accepts {@code word} */
    public boolean accepts(String word) {
        return acceptor == null || acceptor.run(word);
    }
}
