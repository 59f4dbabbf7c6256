package com.example.automatacurve;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ranked set of single-character symbols. Ranks are dense and 1-based.
 * <p>
 * Two orders are kept: insertion order, which fixes the column a symbol
 * occupies in the transition tables and never changes, and rank order, which
 * drives every numeric encoding and may be reset.
 */
public class Alphabet {

    private final List<Character> symbols = new ArrayList<>();
    private final Map<Character, Integer> index = new HashMap<>();
    private int[] ranks = new int[0];

    /** @return true if the symbol was not present before */
    public boolean add(char symbol) {
        if (index.containsKey(symbol)) {
            return false;
        }
        index.put(symbol, symbols.size());
        symbols.add(symbol);
        ranks = Arrays.copyOf(ranks, symbols.size());
        ranks[symbols.size() - 1] = symbols.size();
        return true;
    }

    public boolean contains(char symbol) {
        return index.containsKey(symbol);
    }

    public int size() {
        return symbols.size();
    }

    /** Column of the symbol in the tables, or -1 when absent. */
    public int indexOf(char symbol) {
        Integer i = index.get(symbol);
        return i == null ? -1 : i;
    }

    public char symbolAt(int column) {
        return symbols.get(column);
    }

    public int rankOf(char symbol) {
        int i = indexOf(symbol);
        if (i < 0) {
            throw new AlphabetMismatchException("Symbol '" + symbol + "' is not in the alphabet");
        }
        return ranks[i];
    }

    /** Symbols sorted by rank. */
    public List<Character> ordered() {
        Character[] out = new Character[symbols.size()];
        for (int i = 0; i < symbols.size(); i++) {
            out[ranks[i] - 1] = symbols.get(i);
        }
        return Arrays.asList(out);
    }

    /**
     * Re-ranks every symbol 1..k following {@code ordered}.
     *
     * @throws AlphabetSetMismatchException unless {@code ordered} is a permutation of this alphabet
     */
    public void resetOrder(List<Character> ordered) {
        Set<Character> given = new HashSet<>(ordered);
        if (ordered.size() != symbols.size() || given.size() != ordered.size()
                || !given.equals(index.keySet())) {
            throw new AlphabetSetMismatchException(
                    "Order " + ordered + " is not a permutation of " + symbols);
        }
        int[] fresh = new int[symbols.size()];
        for (int r = 0; r < ordered.size(); r++) {
            fresh[index.get(ordered.get(r))] = r + 1;
        }
        ranks = fresh;
    }

    @Override
    public String toString() {
        return ordered().toString();
    }
}
