package com.specbridge.framework;

import com.specbridge.executor.ExecutedSpec;
import com.specbridge.executor.SpecExecutor;
import com.specbridge.model.Spec;
import com.specbridge.report.EventReportRecorder;
import com.specbridge.report.LogRenderer;
import org.slf4j.LoggerFactory;
import sbt.testing.EventHandler;
import sbt.testing.Logger;
import sbt.testing.Task;
import sbt.testing.TaskDef;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * One resolved suite, ready to run.
 *
 * {@link #execute} runs the suite once, then reports the same result tree two ways:
 *   1. one {@link SpecEvent} per leaf test to the event handler
 *   2. the rendered log lines, in order, to every logger, each getting the full sequence
 *
 * Calling {@code execute} again runs every body again; nothing is memoized.
 * Not meant to be shared between threads.
 */
public class SpecTask implements Task {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(SpecTask.class);
    private static final Task[] NO_TASKS = new Task[0];

    private final TaskDef             taskDef;
    private final RunnableSpec        spec;
    private final SpecFilter          filter;
    private final SpecExecutor        executor;
    private final EventProjector      projector;
    private final LogRenderer         renderer;
    private final EventReportRecorder recorder;     // null when no event report is configured
    private final Consumer<Boolean>   onCompleted;  // receives true when any test failed

    SpecTask(TaskDef taskDef,
             RunnableSpec spec,
             SpecFilter filter,
             SpecExecutor executor,
             EventProjector projector,
             LogRenderer renderer,
             EventReportRecorder recorder,
             Consumer<Boolean> onCompleted) {
        this.taskDef     = taskDef;
        this.spec        = spec;
        this.filter      = filter;
        this.executor    = executor;
        this.projector   = projector;
        this.renderer    = renderer;
        this.recorder    = recorder;
        this.onCompleted = onCompleted;
    }

    // ── Task ──────────────────────────────────────────────────────────────────

    @Override
    public String[] tags() {
        return new String[0];
    }

    @Override
    public Task[] execute(EventHandler eventHandler, Logger[] loggers) {
        String fqn = taskDef.fullyQualifiedName();
        Optional<Spec> selected = filter.apply(spec.spec());
        if (selected.isEmpty()) {
            log.info("SpecTask: {} -- no tests selected", fqn);
            onCompleted.accept(false);
            return NO_TASKS;
        }

        ExecutedSpec executed = executor.execute(selected.get());

        List<SpecEvent> events = projector.project(fqn, executed);
        for (SpecEvent event : events) {
            eventHandler.handle(event);
            if (recorder != null) recorder.handle(event);
        }
        if (recorder != null) recorder.flush();

        List<String> lines = renderer.render(executed);
        for (Logger logger : loggers) {
            for (String line : lines) {
                logger.info(line);
            }
        }

        log.debug("SpecTask: {} -- {} event(s), {} line(s) to {} logger(s)",
            fqn, events.size(), lines.size(), loggers.length);
        onCompleted.accept(executed.hasFailures());
        return NO_TASKS;
    }

    @Override
    public TaskDef taskDef() {
        return taskDef;
    }

    /** Nested tasks offered for finer-grained discovery; a suite always runs as one task. */
    public Task[] subtasks() {
        return NO_TASKS;
    }
}
