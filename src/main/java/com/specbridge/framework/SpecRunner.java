package com.specbridge.framework;

import com.specbridge.core.SpecBridgeConfig;
import com.specbridge.executor.SpecExecutor;
import com.specbridge.report.EventReportRecorder;
import com.specbridge.report.LogRenderer;
import com.specbridge.report.SummaryReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sbt.testing.Runner;
import sbt.testing.Task;
import sbt.testing.TaskDef;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Builds {@link SpecTask}s for one run and summarises them in {@link #done()}.
 *
 * Tasks built here may execute concurrently; the only state they share with the
 * runner is the completion queue, which is thread-safe.
 */
public class SpecRunner implements Runner {

    private static final Logger log = LoggerFactory.getLogger(SpecRunner.class);

    private final String[]         args;
    private final String[]         remoteArgs;
    private final SpecResolver     resolver;
    private final SpecBridgeConfig config;

    private final SpecExecutor        executor  = new SpecExecutor();
    private final EventProjector      projector = new EventProjector();
    private final LogRenderer         renderer;
    private final SummaryReporter     reporter;
    private final EventReportRecorder recorder;   // null when disabled

    // One entry per executed task: true when any of its tests failed
    private final Queue<Boolean> completed = new ConcurrentLinkedQueue<>();

    public SpecRunner(String[] args, String[] remoteArgs, SpecResolver resolver, SpecBridgeConfig config) {
        this.args       = args.clone();
        this.remoteArgs = remoteArgs.clone();
        this.resolver   = resolver;
        this.config     = config;
        this.renderer   = new LogRenderer(config.isAnsiColors());
        this.reporter   = new SummaryReporter(config.isAnsiColors());
        this.recorder   = config.isEventReportEnabled()
            ? new EventReportRecorder(config.getEventReportPath())
            : null;
        log.info("SpecRunner: ready -- searchTerms={}, tags={}, eventReport={}",
            config.getSearchTerms(), config.getTags(),
            config.isEventReportEnabled() ? config.getEventReportPath() : "disabled");
    }

    // ── Runner ────────────────────────────────────────────────────────────────

    /**
     * @throws SpecResolutionException for the first definition that does not resolve
     */
    @Override
    public Task[] tasks(TaskDef[] taskDefs) {
        List<Task> tasks = new ArrayList<>(taskDefs.length);
        for (TaskDef taskDef : taskDefs) {
            tasks.add(newTask(taskDef));
        }
        return tasks.toArray(new Task[0]);
    }

    @Override
    public String done() {
        String line = reporter.render(summary());
        log.info("SpecRunner: {}", line);
        return line;
    }

    @Override
    public String[] remoteArgs() {
        return remoteArgs.clone();
    }

    @Override
    public String[] args() {
        return args.clone();
    }

    // ── Accessors ─────────────────────────────────────────────────────────────

    /** Counts for every task that has finished so far. */
    public SummaryReporter.Summary summary() {
        return reporter.summarize(new ArrayList<>(completed));
    }

    public SummaryReporter getReporter() {
        return reporter;
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private SpecTask newTask(TaskDef taskDef) {
        RunnableSpec spec;
        try {
            spec = resolver.resolve(taskDef.fullyQualifiedName(), taskDef.fingerprint());
        } catch (SpecResolutionException e) {
            log.error("SpecRunner: {}", e.getMessage());
            throw e;
        }
        SpecFilter filter = new SpecFilter(taskDef.selectors(), config.getSearchTerms(), config.getTags());
        return new SpecTask(taskDef, spec, filter, executor, projector, renderer, recorder, completed::add);
    }
}
