package com.specbridge.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.specbridge.fixtures.SimpleFailingSpec;
import com.specbridge.support.RecordingEventHandler;
import com.specbridge.support.SpecRuns;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

public class EventReportRecorderTest {

    private Path tempDir;

    @BeforeMethod
    public void setUp() throws IOException {
        tempDir = Files.createTempDirectory("specbridge-report");
    }

    @AfterMethod
    public void tearDown() throws IOException {
        try (Stream<Path> paths = Files.walk(tempDir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        }
    }

    @Test
    public void reportArg_writesEveryEventAsJson() throws IOException {
        Path report = tempDir.resolve("nested/events.json");

        SpecRuns.loadTask(SimpleFailingSpec.class.getName(), "-report", report.toString())
            .execute(new RecordingEventHandler(), new sbt.testing.Logger[0]);

        JsonNode root = new ObjectMapper().readTree(report.toFile());
        assertThat(root.isArray()).isTrue();
        assertThat(root).hasSize(3);
        for (JsonNode node : root) {
            assertThat(node.get("fullyQualifiedName").asText()).isEqualTo(SimpleFailingSpec.class.getName());
            assertThat(node.has("recordedAt")).isTrue();
        }
    }

    @Test
    public void handle_keepsRecordsInOrderWithFailureMessages() {
        EventReportRecorder recorder = new EventReportRecorder(tempDir.resolve("events.json"));

        SpecRuns.loadAndExecute(SimpleFailingSpec.class.getName(), recorder);
        recorder.flush();

        assertThat(recorder.getRecords())
            .extracting(EventRecord::selector, EventRecord::status, EventRecord::failureMessage)
            .containsExactly(
                tuple("failing test", "Failure", "1 did not satisfy equals(2)"),
                tuple("passing test", "Success", null),
                tuple("ignored test", "Ignored", null));
        assertThat(Files.exists(tempDir.resolve("events.json"))).isTrue();
        assertThat(Files.exists(tempDir.resolve("events.json.tmp"))).isFalse();
    }

    @Test
    public void handle_unwritableLocationDoesNotThrow() throws IOException {
        Path blocker = Files.createFile(tempDir.resolve("blocker"));
        EventReportRecorder recorder = new EventReportRecorder(blocker.resolve("events.json"));

        SpecRuns.loadAndExecute(SimpleFailingSpec.class.getName(), recorder);
        recorder.flush();

        assertThat(recorder.getRecords()).hasSize(3);
    }

    @Test
    public void handle_writesNothingUntilFlushed() throws IOException {
        Path report = tempDir.resolve("events.json");
        EventReportRecorder recorder = new EventReportRecorder(report);

        SpecRuns.loadAndExecute(SimpleFailingSpec.class.getName(), recorder);

        assertThat(Files.exists(report)).isFalse();

        recorder.flush();

        assertThat(new ObjectMapper().readTree(report.toFile())).hasSize(3);
    }
}
