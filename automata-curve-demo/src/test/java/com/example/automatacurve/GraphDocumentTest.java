package com.example.automatacurve;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class GraphDocumentTest {

    @Test
    void readsEditorGraphAndBuildsTransducer() throws Exception {
        GraphDocument doc = load("sample-graph.json");

        assertEquals(2, doc.getNodes().size());
        assertEquals("A", doc.getInitialState());
        assertEquals(400.0, doc.getSceneRect().getWidth());
        assertEquals(-12.5, doc.getEdges().get(2).getBendOffset());

        BuildResult result = doc.build();
        assertTrue(result.isSuccess(), result.getErrors().toString());
        assertEquals("111", result.getModel().read("101"));
    }

    @Test
    void flattensEdgesIntoBuilderInput() throws Exception {
        GraphDocument doc = load("sample-graph.json");

        List<GraphBuilder.Entry> fromA = doc.toTransitions().get("A");
        assertEquals(2, fromA.size());
        assertEquals("0", fromA.get(0).getSymbol());
        assertEquals("A", fromA.get(0).getTarget());
        assertEquals("B", fromA.get(1).getTarget());

        List<GraphBuilder.Entry> outOfB = doc.toOutputFunction().get("B");
        assertEquals("0", outOfB.get(0).getSymbol());
        assertEquals("1", outOfB.get(0).getTarget());
    }

    @Test
    void nodeWithoutEdgesIsReportedAsIncomplete() throws Exception {
        GraphDocument doc = load("sample-graph.json");
        doc.getNodes().add(new GraphDocument.NodeEntry("C", 50, 50, 20));

        BuildResult result = doc.build();

        assertFalse(result.isSuccess());
        assertEquals(Arrays.asList("State C is missing transition for 0, 1"), result.getErrors());
    }

    @Test
    void edgeListingOneInputTwiceIsAmbiguous() throws Exception {
        GraphDocument doc = load("sample-graph.json");
        Map<String, List<String>> extra = new LinkedHashMap<>();
        extra.put("0", new ArrayList<>(Collections.singletonList("0")));
        doc.getEdges().add(new GraphDocument.EdgeEntry("A", "B", extra));

        BuildResult result = doc.build();

        assertNull(result.getModel());
        assertTrue(result.getErrors().contains("State A has ambiguous transition"), result.getErrors().toString());
    }

    @Test
    void writesDocumentBack(@TempDir Path dir) throws Exception {
        GraphDocument doc = load("sample-graph.json");
        File file = dir.resolve("copy.json").toFile();

        doc.write(file);
        GraphDocument copy = GraphDocument.read(file);

        assertEquals(doc.getEdges().size(), copy.getEdges().size());
        assertEquals("111", copy.build().getModel().read("101"));
    }

    private static GraphDocument load(String resource) throws Exception {
        try (InputStream in = GraphDocumentTest.class.getResourceAsStream("/" + resource)) {
            assertNotNull(in, resource);
            return GraphDocument.read(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }
}
