package com.example.automatacurve;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class PointSetSerializerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void scatterSetKeepsAxisBounds() throws Exception {
        PointSet set = new PointSet(Arrays.asList(0.5, 0.75), Arrays.asList(0.25, 1.0),
                new PointSet.Range(1, 3), new PointSet.Range(1, 4));

        JsonNode json = mapper.valueToTree(PointSetSerializer.toJson(Collections.singletonList(set), "test"));

        JsonNode entry = json.get("point_sets").get(0);
        assertEquals(0.75, entry.get("x").get(1).asDouble());
        assertEquals(4.0, entry.get("ylim").get(1).asDouble());
        assertFalse(entry.get("is_curve").asBoolean());
        assertEquals("red", entry.get("color").asText());
        assertEquals("Points computed for test", json.get("_comment").asText());
    }

    @Test
    void curveOmitsMissingBounds() throws Exception {
        List<PointSet> curves = CurveComputation.curves(sample()).compute(new CancellationToken());

        JsonNode json = mapper.valueToTree(PointSetSerializer.toJson(curves, "curves"));

        JsonNode first = json.get("point_sets").get(0);
        assertTrue(first.get("is_curve").asBoolean());
        assertFalse(first.has("xlim"));
        assertEquals(Palette.color(0), first.get("color").asText());
    }

    @Test
    void writesFile(@TempDir Path dir) throws Exception {
        String file = dir.resolve("points.json").toString();
        List<PointSet> sets = CurveComputation.byAutomata(sample(), 3, PairFilter.NONE).compute(new CancellationToken());

        PointSetSerializer.serializeToJson(sets, "sample", file);

        JsonNode json = mapper.readTree(new java.io.File(file));
        assertEquals(6, json.get("point_sets").get(0).get("x").size());
    }

    private static TransducerModel sample() {
        return GraphBuilder.detailedBuild("A",
                AutomataCurveDemo.sampleTransitions(), AutomataCurveDemo.sampleOutputs()).getModel();
    }
}
