package com.example.automatacurve;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.File;
import java.io.IOException;
import java.util.*;

/**
 * Graph saved by the automaton editor: positioned nodes, bent edges
 * labelled with {@code output -> [inputs]}, the initial state and the
 * visible scene rectangle.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphDocument {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NodeEntry {
        @JsonProperty("name")
        private String name;

        @JsonProperty("x")
        private double x;

        @JsonProperty("y")
        private double y;

        @JsonProperty("radius")
        private double radius = 20;

        public NodeEntry() {}

        public NodeEntry(String name, double x, double y, double radius) {
            this.name = name;
            this.x = x;
            this.y = y;
            this.radius = radius;
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public double getX() { return x; }
        public void setX(double x) { this.x = x; }

        public double getY() { return y; }
        public void setY(double y) { this.y = y; }

        public double getRadius() { return radius; }
        public void setRadius(double radius) { this.radius = radius; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EdgeEntry {
        @JsonProperty("source")
        private String source;

        @JsonProperty("destination")
        private String destination;

        /** output symbol -> input symbols producing it along this edge */
        @JsonProperty("transitions")
        private Map<String, List<String>> transitions = new LinkedHashMap<>();

        @JsonProperty("bend_ratio")
        private double bendRatio = 0.5;

        @JsonProperty("bend_offset")
        private double bendOffset = 5.0;

        public EdgeEntry() {}

        public EdgeEntry(String source, String destination, Map<String, List<String>> transitions) {
            this.source = source;
            this.destination = destination;
            this.transitions = transitions;
        }

        public String getSource() { return source; }
        public void setSource(String source) { this.source = source; }

        public String getDestination() { return destination; }
        public void setDestination(String destination) { this.destination = destination; }

        public Map<String, List<String>> getTransitions() { return transitions; }
        public void setTransitions(Map<String, List<String>> transitions) { this.transitions = transitions; }

        public double getBendRatio() { return bendRatio; }
        public void setBendRatio(double bendRatio) { this.bendRatio = bendRatio; }

        public double getBendOffset() { return bendOffset; }
        public void setBendOffset(double bendOffset) { this.bendOffset = bendOffset; }
    }

    public static class SceneRect {
        @JsonProperty("left")
        private double left;

        @JsonProperty("top")
        private double top;

        @JsonProperty("width")
        private double width;

        @JsonProperty("height")
        private double height;

        public SceneRect() {}

        public double getLeft() { return left; }
        public void setLeft(double left) { this.left = left; }

        public double getTop() { return top; }
        public void setTop(double top) { this.top = top; }

        public double getWidth() { return width; }
        public void setWidth(double width) { this.width = width; }

        public double getHeight() { return height; }
        public void setHeight(double height) { this.height = height; }
    }

    @JsonProperty("nodes")
    private List<NodeEntry> nodes = new ArrayList<>();

    @JsonProperty("edges")
    private List<EdgeEntry> edges = new ArrayList<>();

    @JsonProperty("initial_state")
    private String initialState = "";

    @JsonProperty("scene_rect")
    private SceneRect sceneRect;

    public GraphDocument() {}

    public List<NodeEntry> getNodes() { return nodes; }
    public void setNodes(List<NodeEntry> nodes) { this.nodes = nodes; }

    public List<EdgeEntry> getEdges() { return edges; }
    public void setEdges(List<EdgeEntry> edges) { this.edges = edges; }

    public String getInitialState() { return initialState; }
    public void setInitialState(String initialState) { this.initialState = initialState; }

    public SceneRect getSceneRect() { return sceneRect; }
    public void setSceneRect(SceneRect sceneRect) { this.sceneRect = sceneRect; }

    public static GraphDocument read(File file) throws IOException {
        return new ObjectMapper().readValue(file, GraphDocument.class);
    }

    public static GraphDocument read(String json) throws IOException {
        return new ObjectMapper().readValue(json, GraphDocument.class);
    }

    public void write(File file) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.writeValue(file, this);
    }

    /** state -> (input, destination) for every input listed on its outgoing edges. */
    public Map<String, List<GraphBuilder.Entry>> toTransitions() {
        Map<String, List<GraphBuilder.Entry>> table = emptyTable();
        for (EdgeEntry edge : edges) {
            List<GraphBuilder.Entry> row = table.computeIfAbsent(edge.getSource(), k -> new ArrayList<>());
            for (List<String> inputs : edge.getTransitions().values()) {
                for (String in : inputs) {
                    row.add(new GraphBuilder.Entry(in, edge.getDestination()));
                }
            }
        }
        return table;
    }

    /** state -> (input, output) for every input listed on its outgoing edges. */
    public Map<String, List<GraphBuilder.Entry>> toOutputFunction() {
        Map<String, List<GraphBuilder.Entry>> table = emptyTable();
        for (EdgeEntry edge : edges) {
            List<GraphBuilder.Entry> row = table.computeIfAbsent(edge.getSource(), k -> new ArrayList<>());
            for (Map.Entry<String, List<String>> t : edge.getTransitions().entrySet()) {
                for (String in : t.getValue()) {
                    row.add(new GraphBuilder.Entry(in, t.getKey()));
                }
            }
        }
        return table;
    }

    public BuildResult build() {
        return GraphBuilder.detailedBuild(initialState, toTransitions(), toOutputFunction());
    }

    private Map<String, List<GraphBuilder.Entry>> emptyTable() {
        Map<String, List<GraphBuilder.Entry>> table = new LinkedHashMap<>();
        for (NodeEntry node : nodes) {
            table.put(node.getName(), new ArrayList<>());
        }
        return table;
    }
}
