package com.example.automatacurve;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lazy enumeration of input words and their translations.
 * <p>
 * Every returned {@link Iterable} is restartable: each call to
 * {@code iterator()} enumerates from scratch, in rank order.
 */
public class WordEnumerator {

    private final TransducerModel model;

    public WordEnumerator(TransducerModel model) {
        this.model = model;
    }

    public Iterable<String> words(int length) {
        return words(length, "");
    }

    /** {@code prefix} followed by every word of {@code length} input symbols. */
    public Iterable<String> words(int length, String prefix) {
        if (length < 0) {
            throw new IllegalArgumentException("Length must not be negative: " + length);
        }
        List<Character> symbols = model.getInputAlphabet();
        String head = prefix == null ? "" : prefix;
        return () -> new OdometerIterator(symbols, length, head);
    }

    public Iterable<WordPair> pairs(int length) {
        return pairs(length, PairFilter.NONE);
    }

    public Iterable<WordPair> pairs(int length, String prefix, String suffix, String terminalState) {
        return pairs(length, new PairFilter(prefix, suffix, terminalState));
    }

    /**
     * Runs the transducer over every word of {@code filter.prefix + w + filter.suffix}.
     *
     * @throws UnknownStateException if the terminal state is set but not declared
     */
    public Iterable<WordPair> pairs(int length, PairFilter filter) {
        if (filter.hasTerminalState() && !model.hasState(filter.getTerminalState())) {
            throw new UnknownStateException("Unknown terminal state " + filter.getTerminalState());
        }
        Iterable<String> source = words(length, filter.getPrefix());
        return () -> new PairIterator(source.iterator(), filter);
    }

    private static class OdometerIterator implements Iterator<String> {
        private final List<Character> symbols;
        private final int[] digits;
        private final String prefix;
        private boolean done;

        OdometerIterator(List<Character> symbols, int length, String prefix) {
            this.symbols = symbols;
            this.digits = new int[length];
            this.prefix = prefix;
            this.done = length > 0 && symbols.isEmpty();
        }

        @Override
        public boolean hasNext() {
            return !done;
        }

        @Override
        public String next() {
            if (done) {
                throw new NoSuchElementException();
            }
            StringBuilder sb = new StringBuilder(prefix.length() + digits.length).append(prefix);
            for (int d : digits) {
                sb.append(symbols.get(d));
            }
            int i = digits.length - 1;
            while (i >= 0 && digits[i] == symbols.size() - 1) {
                digits[i--] = 0;
            }
            if (i < 0) {
                done = true;
            } else {
                digits[i]++;
            }
            return sb.toString();
        }
    }

    private class PairIterator implements Iterator<WordPair> {
        private final Iterator<String> words;
        private final PairFilter filter;
        private WordPair pending;

        PairIterator(Iterator<String> words, PairFilter filter) {
            this.words = words;
            this.filter = filter;
        }

        @Override
        public boolean hasNext() {
            while (pending == null && words.hasNext()) {
                String word = words.next() + filter.getSuffix();
                if (!filter.accepts(word)) {
                    continue;
                }
                TransducerModel.Run run = model.run(word);
                if (filter.hasTerminalState() && !filter.getTerminalState().equals(run.getFinalState())) {
                    continue;
                }
                pending = new WordPair(word, run.getOutput(), run.getFinalState());
            }
            return pending != null;
        }

        @Override
        public WordPair next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            WordPair p = pending;
            pending = null;
            return p;
        }
    }
}
