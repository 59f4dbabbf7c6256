package com.example.automatacurve;

/** An input word and the output the transducer produced for it. */
public class WordPair {

    private final String input;
    private final String output;
    private final String finalState;

    public WordPair(String input, String output, String finalState) {
        this.input = input;
        this.output = output;
        this.finalState = finalState;
    }

    public String getInput() { return input; }
    public String getOutput() { return output; }
    public String getFinalState() { return finalState; }

    @Override
    public String toString() {
        return input + " -> " + output + " [" + finalState + "]";
    }
}
