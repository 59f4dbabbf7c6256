package com.example.automatacurve;

import java.util.*;

/**
 * Main demo class: builds a two-state transducer, simulates it and plots it
 */
public class AutomataCurveDemo {

    private static final String SAMPLE_WORD = "101";
    private static final int SAMPLE_LENGTH = 8;
    private static final String OUTPUT_FILENAME = "points.json";

    public static void main(String[] args) {
        try {
            System.out.println("Starting transducer curve demo...");

            // Step 1: Describe the graph as per-state edge lists
            System.out.println("\nStep 1: Building transducer from edge lists...");
            BuildResult result = GraphBuilder.detailedBuild("A", sampleTransitions(), sampleOutputs());
            if (!result.isSuccess()) {
                for (String error : result.getErrors()) {
                    System.err.println(error);
                }
                return;
            }
            TransducerModel model = result.getModel();
            System.out.println("Transducer built with " + model.getStates().size() + " states, inputs "
                    + model.getInputAlphabet() + ", outputs " + model.getOutputAlphabet());

            // Step 2: Simulate
            System.out.println("\nStep 2: Reading " + SAMPLE_WORD + "...");
            System.out.println(SAMPLE_WORD + " -> " + model.read(SAMPLE_WORD)
                    + " (x = " + model.toNumber(SAMPLE_WORD) + ")");

            // Step 3: Enumerate
            System.out.println("\nStep 3: Enumerating pairs of length 2...");
            for (WordPair pair : new WordEnumerator(model).pairs(2)) {
                System.out.println(pair);
            }

            // Step 4: Compute the automaton plot and the self-similarity curves
            System.out.println("\nStep 4: Computing points up to length " + SAMPLE_LENGTH + "...");
            List<PointSet> sets = new ArrayList<>();
            try (CurveRunner runner = new CurveRunner()) {
                sets.addAll(runner.start(CurveComputation.byAutomata(model, SAMPLE_LENGTH, PairFilter.NONE)).get());
                sets.addAll(runner.start(CurveComputation.curves(model)).get());
            }

            // Step 5: Serialize to JSON
            System.out.println("\nStep 5: Serializing to JSON...");
            PointSetSerializer.serializeToJson(sets, "the sample two-state transducer", OUTPUT_FILENAME);

            System.out.println("\nDemo completed successfully!");

        } catch (Exception e) {
            System.err.println("Error occurred: " + e.getMessage());
            e.printStackTrace();
        }
    }

    /**
     * A -0/0-> A, A -1/1-> B, B -0/1-> A, B -1/0-> B
     */
    static Map<String, List<GraphBuilder.Entry>> sampleTransitions() {
        Map<String, List<GraphBuilder.Entry>> transitions = new LinkedHashMap<>();
        transitions.put("A", Arrays.asList(new GraphBuilder.Entry("0", "A"), new GraphBuilder.Entry("1", "B")));
        transitions.put("B", Arrays.asList(new GraphBuilder.Entry("0", "A"), new GraphBuilder.Entry("1", "B")));
        return transitions;
    }

    static Map<String, List<GraphBuilder.Entry>> sampleOutputs() {
        Map<String, List<GraphBuilder.Entry>> outputs = new LinkedHashMap<>();
        outputs.put("A", Arrays.asList(new GraphBuilder.Entry("0", "0"), new GraphBuilder.Entry("1", "1")));
        outputs.put("B", Arrays.asList(new GraphBuilder.Entry("0", "1"), new GraphBuilder.Entry("1", "0")));
        return outputs;
    }
}
