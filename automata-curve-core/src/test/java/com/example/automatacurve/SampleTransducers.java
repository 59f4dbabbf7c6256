package com.example.automatacurve;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Transducers shared by the tests. */
final class SampleTransducers {

    private SampleTransducers() {
    }

    static GraphBuilder.Entry e(String symbol, String target) {
        return new GraphBuilder.Entry(symbol, target);
    }

    static List<GraphBuilder.Entry> row(GraphBuilder.Entry... entries) {
        return new ArrayList<>(Arrays.asList(entries));
    }

    /** A -0/0-> A, A -1/1-> B, B -0/1-> A, B -1/0-> B, initial A. */
    static TransducerModel twoState() {
        Map<String, List<GraphBuilder.Entry>> transitions = new LinkedHashMap<>();
        transitions.put("A", row(e("0", "A"), e("1", "B")));
        transitions.put("B", row(e("0", "A"), e("1", "B")));
        Map<String, List<GraphBuilder.Entry>> outputs = new LinkedHashMap<>();
        outputs.put("A", row(e("0", "0"), e("1", "1")));
        outputs.put("B", row(e("0", "1"), e("1", "0")));
        BuildResult result = GraphBuilder.detailedBuild("A", transitions, outputs);
        if (!result.isSuccess()) {
            throw new IllegalStateException(result.getErrors().toString());
        }
        return result.getModel();
    }
}
