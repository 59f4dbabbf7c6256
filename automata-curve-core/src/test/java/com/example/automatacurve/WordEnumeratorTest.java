package com.example.automatacurve;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WordEnumeratorTest {

    private final TransducerModel model = SampleTransducers.twoState();
    private final WordEnumerator enumerator = new WordEnumerator(model);

    @Test
    void wordsFollowRankOrder() {
        assertEquals(Arrays.asList("00", "01", "10", "11"), collect(enumerator.words(2)));
    }

    @Test
    void wordsAreRestartable() {
        Iterable<String> words = enumerator.words(3);
        List<String> first = collect(words);
        assertEquals(8, first.size());
        assertEquals(first, collect(words));
    }

    @Test
    void prefixIsPrepended() {
        assertEquals(Arrays.asList("10", "11"), collect(enumerator.words(1, "1")));
    }

    @Test
    void zeroLengthYieldsOnlyPrefix() {
        assertEquals(Collections.singletonList(""), collect(enumerator.words(0)));
        assertEquals(Collections.singletonList("01"), collect(enumerator.words(0, "01")));
    }

    @Test
    void negativeLengthIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> enumerator.words(-1));
    }

    @Test
    void resetOrderChangesEnumerationOrder() {
        model.resetInputOrder(Arrays.asList('1', '0'));
        assertEquals(Arrays.asList("11", "10", "01", "00"), collect(new WordEnumerator(model).words(2)));
    }

    @Test
    void pairsCarryTranslation() {
        List<String> pairs = new ArrayList<>();
        for (WordPair p : enumerator.pairs(2)) {
            pairs.add(p.getInput() + ">" + p.getOutput() + "@" + p.getFinalState());
        }
        assertEquals(Arrays.asList("00>00@A", "01>01@B", "10>11@A", "11>10@B"), pairs);
    }

    @Test
    void terminalStateFiltersRuns() {
        List<String> inputs = new ArrayList<>();
        for (WordPair p : enumerator.pairs(2, "", "", "B")) {
            inputs.add(p.getInput());
        }
        assertEquals(Arrays.asList("01", "11"), inputs);
    }

    @Test
    void prefixAndSuffixSurroundEveryWord() {
        List<String> pairs = new ArrayList<>();
        for (WordPair p : enumerator.pairs(1, "1", "0", "")) {
            pairs.add(p.getInput() + ">" + p.getOutput());
        }
        assertEquals(Arrays.asList("100>110", "110>101"), pairs);
    }

    @Test
    void unknownTerminalStateFailsUpFront() {
        assertThrows(UnknownStateException.class, () -> enumerator.pairs(2, "", "", "Z"));
    }

    @Test
    void patternRestrictsInputWords() {
        List<String> inputs = new ArrayList<>();
        for (WordPair p : enumerator.pairs(2, new PairFilter("", "", "", "(0|1)*0"))) {
            inputs.add(p.getInput());
        }
        assertEquals(Arrays.asList("00", "10"), inputs);
    }

    @Test
    void prefixOutsideAlphabetFailsOnRead() {
        Iterable<WordPair> pairs = enumerator.pairs(1, "2", "", "");
        assertThrows(AlphabetMismatchException.class, () -> pairs.iterator().hasNext());
    }

    private static <T> List<T> collect(Iterable<T> items) {
        List<T> out = new ArrayList<>();
        for (T item : items) {
            out.add(item);
        }
        return out;
    }
}
