package com.firmo.core.results;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.firmo.core.engine.OutcomeStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RunSummaryWriterTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private RunSummaryWriter writer;
    private RunSummary summary;

    @BeforeEach
    void setUp() {
        writer = new RunSummaryWriter();
        var aggregator = new ResultAggregator("RUN-9");
        aggregator.record(ResultAggregatorTest.outcome("adds", OutcomeStatus.PASS));
        aggregator.record(ResultAggregatorTest.outcome("divides", OutcomeStatus.FAIL));
        summary = aggregator.snapshot();
    }

    @Test
    @DisplayName("serializes counts, outcomes and failure detail")
    void json() throws Exception {
        JsonNode root = mapper.readTree(writer.toJson(summary));

        assertEquals("RUN-9", root.get("runId").asText());
        assertEquals(2, root.get("total").asInt());
        assertEquals(1, root.get("failed").asInt());
        assertEquals(2, root.get("outcomes").size());
        JsonNode failure = root.get("failures").get(0);
        assertEquals("divides", failure.get("caseName").asText());
        assertEquals("FAIL", failure.get("status").asText());
        assertEquals("divides went wrong", failure.get("failureDetail").get("message").asText());
    }

    @Test
    @DisplayName("each outcome carries its path string and classname")
    void resultPaths() throws Exception {
        JsonNode outcome = mapper.readTree(writer.toJson(summary)).get("outcomes").get(1);

        assertEquals("Suite / divides", outcome.get("path_string").asText());
        assertEquals("Suite", outcome.get("classname").asText());
    }

    @Test
    @DisplayName("timestamps are ISO-8601 strings")
    void isoDates() throws Exception {
        JsonNode root = mapper.readTree(writer.toJson(summary));

        assertTrue(root.get("startedAt").isTextual());
        assertTrue(root.get("startedAt").asText().matches("\\d{4}-\\d{2}-\\d{2}T.*Z"), root.get("startedAt").asText());
    }

    @Test
    @DisplayName("writes to a file, creating parent directories")
    void writesFile(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("reports/run.json");

        writer.write(summary, target);

        assertTrue(Files.exists(target));
        assertEquals("RUN-9", mapper.readTree(Files.readString(target)).get("runId").asText());
    }
}
