package com.specbridge.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sbt.testing.Event;
import sbt.testing.EventHandler;
import sbt.testing.Selector;
import sbt.testing.TestSelector;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records every handled event to a JSON file for later review.
 *
 * {@link #handle} only collects; {@link #flush()} writes everything collected so far.
 * A task flushes once after handing over all of its events.
 *
 * ## Thread Safety
 * All methods are synchronized, so one recorder can be shared by tasks running
 * in parallel. The file is rewritten through a temporary sibling and a rename.
 *
 * ## File Format
 * JSON array of {@link EventRecord} objects, pretty-printed, in handling order.
 *
 * I/O problems are logged and never fail the run.
 */
public class EventReportRecorder implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(EventReportRecorder.class);

    private final Path reportPath;
    private final ObjectMapper mapper;
    private final List<EventRecord> records = new ArrayList<>();

    public EventReportRecorder(Path reportPath) {
        this.reportPath = reportPath;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

        try {
            Path parent = reportPath.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            log.warn("EventReportRecorder: Could not create parent directories for {}: {}", reportPath, e.getMessage());
        }
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    @Override
    public synchronized void handle(Event event) {
        records.add(toRecord(event));
    }

    /** Writes every record collected so far to the report file. */
    public synchronized void flush() {
        save();
    }

    /** Everything recorded so far, in handling order. */
    public synchronized List<EventRecord> getRecords() {
        return Collections.unmodifiableList(new ArrayList<>(records));
    }

    public Path getReportPath() { return reportPath; }

    // ── Private Helpers ───────────────────────────────────────────────────────

    private static EventRecord toRecord(Event event) {
        String failureMessage = event.throwable().isDefined()
            ? event.throwable().get().getMessage()
            : null;
        return new EventRecord(
            event.fullyQualifiedName(),
            selectorText(event.selector()),
            event.status().name(),
            failureMessage,
            event.duration(),
            Instant.now());
    }

    private static String selectorText(Selector selector) {
        return selector instanceof TestSelector ts ? ts.testName() : String.valueOf(selector);
    }

    private void save() {
        try {
            Path tmp = reportPath.resolveSibling(reportPath.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), records);
            try {
                Files.move(tmp, reportPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, reportPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.error("EventReportRecorder: Failed to save {} record(s) to {}: {}",
                records.size(), reportPath, e.getMessage());
        }
    }
}
