package com.tsa.result;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tsa.collection.ConditionCollection;
import com.tsa.interval.AnalysisWindow;
import com.tsa.interval.InMemoryIntervalSource;
import com.tsa.interval.Interval;
import com.tsa.interval.IntervalPlanner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ReportWriter.
 */
class ReportWriterTest {

    private ReportWriter writer;
    private ConditionCollection collection;

    @BeforeEach
    void setUp() {
        writer = new ReportWriter();
        collection = new ConditionCollection("Ylojarvi",
                new AnalysisWindow(Instant.parse("2018-01-01T00:00:00Z"), Instant.parse("2018-01-01T10:00:00Z")));
        collection.addCondition("ylojarvi", "d1", "s1#kitka >= 0.3");
        collection.addCondition("ylojarvi", "d2", "d1 or d9");

        InMemoryIntervalSource source = new InMemoryIntervalSource().put("s1#kitka >= 0.3", List.of(
                new Interval(Instant.parse("2018-01-01T00:00:00Z"), Instant.parse("2018-01-01T04:00:00Z"), true)));
        collection.analyze(source, new IntervalPlanner());
    }

    @Test
    @DisplayName("Should report conditions with blocks and results")
    void shouldBuildTree() {
        JsonNode root = writer.toTree("test", List.of(collection));

        assertEquals("test", root.get("analysis").asText());
        JsonNode node = root.get("collections").get(0);
        assertEquals("Ylojarvi", node.get("title").asText());
        assertEquals("2018-01-01T00:00:00Z", node.get("timeFrom").asText());

        JsonNode d1 = node.get("conditions").get(0);
        assertEquals("ylojarvi_d1", d1.get("id").asText());
        assertEquals("VALID", d1.get("state").asText());
        assertEquals("s1#kitka >= 0.3", d1.get("blocks").get(0).get("predicate").asText());
        assertEquals("s1#kitka >= 0.3", d1.get("blocks").get(0).get("text").asText());
        assertEquals(14400, d1.get("result").get("totalSpanSeconds").asLong());
        assertEquals(1.0, d1.get("result").get("percentageValid").asDouble(), 1e-9);

        JsonNode d2 = node.get("conditions").get(1);
        assertEquals("INVALID", d2.get("state").asText());
        assertTrue(d2.get("secondary").asBoolean());
        assertNull(d2.get("result"));
    }

    @Test
    @DisplayName("Should include the error report")
    void shouldReportErrors() {
        JsonNode errors = writer.toTree("test", List.of(collection)).get("collections").get(0).get("errors");

        assertEquals(1, errors.size());
        assertEquals("ylojarvi_d2", errors.get(0).get("scope").asText());
        assertEquals("UnresolvedReference", errors.get(0).get("kind").asText());
        assertEquals("ERROR", errors.get(0).get("level").asText());
    }

    @Test
    @DisplayName("Should render the report as indented JSON")
    void shouldRenderJson() throws Exception {
        String json = writer.toJson("test", List.of(collection));

        assertTrue(json.contains("\"analysis\" : \"test\""));
        JsonNode read = new ObjectMapper().readTree(json);
        assertEquals("Ylojarvi", read.at("/collections/0/title").asText());
        assertEquals("d1_0", read.at("/collections/0/conditions/0/blocks/0/alias").asText());
    }

    @Test
    @DisplayName("Should write the report creating parent directories")
    void shouldWriteFile(@TempDir Path tempDir) throws Exception {
        Path target = tempDir.resolve("reports/out.json");

        writer.write(target, "test", List.of(collection));

        assertTrue(Files.exists(target));
        JsonNode read = new ObjectMapper().readTree(target.toFile());
        assertEquals("ylojarvi_d1", read.at("/collections/0/conditions/0/id").asText());
        assertEquals(14400, read.at("/collections/0/conditions/0/result/validSeconds").asLong());
    }
}
