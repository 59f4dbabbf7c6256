package com.example.automatacurve;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AutomataCurveBuilderTest {

    private static final double EPS = 1e-9;

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private String graph;

    @BeforeEach
    void copyGraph() throws Exception {
        Path target = dir.resolve("graph.json");
        try (InputStream in = AutomataCurveBuilderTest.class.getResourceAsStream("/sample-graph.json")) {
            assertNotNull(in);
            Files.copy(in, target);
        }
        graph = target.toString();
    }

    @Test
    void verifyAcceptsCompleteGraph() {
        assertEquals(0, run("verify", graph));
        assertEquals("Automata is correct", stdout());
    }

    @Test
    void verifyReportsIncompleteGraph() throws Exception {
        GraphDocument doc = GraphDocument.read(new File(graph));
        doc.getNodes().add(new GraphDocument.NodeEntry("C", 50, 50, 20));
        File broken = dir.resolve("broken.json").toFile();
        doc.write(broken);

        assertEquals(1, run("verify", broken.getPath()));
        assertTrue(stderr().contains("State C"), stderr());
        assertEquals("", stdout());
    }

    @Test
    void readPrintsOutputAndFinalState() {
        assertEquals(0, run("read", graph, "101"));
        assertEquals("101 -> 111 (B)", stdout());
    }

    @Test
    void readRejectsForeignSymbols() {
        assertEquals(1, run("read", graph, "12"));
        assertTrue(stderr().startsWith("Invalid automaton"), stderr());
    }

    @Test
    void inputOrderChangesCurveSequence() throws Exception {
        JsonNode sets = plot("curves", graph, "--inputs", "10", "--out", dir.toString());

        assertEquals(2, sets.size());
        // first curve now belongs to '1': "11" -> "10"
        assertEquals(5.0, sets.get(0).get("y").get(0).asDouble(), EPS);
        assertEquals(4.0, sets.get(1).get("y").get(0).asDouble(), EPS);
    }

    @Test
    void outputOrderChangesCurveHeights() throws Exception {
        JsonNode sets = plot("curves", graph, "--outputs", "10", "--out", dir.toString());

        // "00" -> "00", and '0' now ranks second
        assertEquals(8.0, sets.get(0).get("y").get(0).asDouble(), EPS);
    }

    @Test
    void inputOrderAppliesToAutomataMode() throws Exception {
        JsonNode sets = plot("automata", graph, "2", "--inputs", "10", "--out", dir.toString());

        JsonNode x = sets.get(0).get("x");
        assertEquals(2, x.size());
        // "1" ranks first
        assertEquals(1.0 / 3, x.get(0).asDouble(), EPS);
        assertEquals(2.0 / 3, x.get(1).asDouble(), EPS);
    }

    @Test
    void orderWithDifferentSymbolsIsRejected() {
        assertEquals(1, run("curves", graph, "--inputs", "0x", "--out", dir.toString()));
        assertTrue(stderr().startsWith("Invalid automaton"), stderr());
        assertEquals("", stdout());
    }

    @Test
    void unknownOptionIsRejected() {
        assertEquals(2, run("curves", graph, "--colour", "red"));
        assertTrue(stderr().contains("--colour"));
    }

    private JsonNode plot(String... args) throws Exception {
        assertEquals(0, run(args), stderr());
        File file = new File(stdout());
        assertTrue(file.isFile(), stdout());
        return mapper.readTree(file).get("point_sets");
    }

    private int run(String... args) {
        return AutomataCurveBuilder.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8).trim();
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8).trim();
    }
}
