package com.specbridge.core;

import com.specbridge.framework.SpecFramework;
import com.specbridge.framework.SpecRunner;
import com.specbridge.report.AggregateTestFailureError;
import com.specbridge.report.Slf4jTestLogger;
import com.specbridge.report.SummaryReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sbt.testing.EventHandler;
import sbt.testing.Task;
import sbt.testing.TaskDef;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs suites without a build tool.
 *
 * <pre>
 *   java com.specbridge.core.SpecLauncher com.example.specs -t parser -no-color
 * </pre>
 *
 * Arguments that do not start with {@code -} name packages to scan; the rest are
 * runner args (see {@link SpecBridgeConfig#withArgs}). Exits with status 1 when any
 * suite failed.
 */
public class SpecLauncher {

    private static final Logger log = LoggerFactory.getLogger(SpecLauncher.class);

    public static void main(String[] args) {
        try {
            new SpecLauncher().run(args);
        } catch (AggregateTestFailureError e) {
            log.error("SpecLauncher: {}", e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Discovers, runs and summarises.
     *
     * @return the summary when every suite passed
     * @throws AggregateTestFailureError when any suite failed
     */
    public SummaryReporter.Summary run(String[] args) {
        List<String> packages = new ArrayList<>();
        List<String> runnerArgs = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("-")) {
                runnerArgs.add(arg);
                if (takesValue(arg) && i + 1 < args.length) runnerArgs.add(args[++i]);
            } else {
                packages.add(arg);
            }
        }

        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        TaskDef[] taskDefs = new SpecDiscovery(classLoader).taskDefs(packages.toArray(new String[0]));

        SpecFramework framework = new SpecFramework();
        String[] runnerArgArray = runnerArgs.toArray(new String[0]);
        SpecRunner runner = framework.runner(runnerArgArray, new String[0], classLoader);

        EventHandler discard = event -> { };
        sbt.testing.Logger[] loggers = { new Slf4jTestLogger("specbridge") };
        for (Task task : runner.tasks(taskDefs)) {
            task.execute(discard, loggers);
        }

        runner.done();
        SummaryReporter.Summary summary = runner.summary();
        runner.getReporter().assertNoFailures(summary);
        return summary;
    }

    private static boolean takesValue(String arg) {
        return arg.equals("-t") || arg.equals("-tags") || arg.equals("-report");
    }
}
