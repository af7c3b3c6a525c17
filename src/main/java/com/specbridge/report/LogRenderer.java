package com.specbridge.report;

import com.specbridge.assertion.FailureDetail;
import com.specbridge.executor.ExecutedSpec;
import com.specbridge.executor.ExecutedSuite;
import com.specbridge.executor.ExecutedTest;
import com.specbridge.executor.TestOutcome;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Renders a result tree as log lines, depth-first in declaration order.
 *
 * <pre>
 *   - some suite                      (red: the suite holds a failure)
 *     - failing test                  (red)
 *       1 did not satisfy equals(2)   (actual blue, assertion cyan)
 *     + passing test                  (green "+")
 * </pre>
 *
 * Each level indents by two spaces. Suites without failures render like passing
 * tests. Ignored tests produce no line at all. Thrown failures render their
 * message in red on the detail line.
 */
public class LogRenderer {

    private static final String INDENT = "  ";

    private final boolean colors;

    public LogRenderer(boolean colors) {
        this.colors = colors;
    }

    public LogRenderer() {
        this(true);
    }

    public List<String> render(ExecutedSpec root) {
        List<String> lines = new ArrayList<>();
        render(root, 0, lines);
        return colors ? Collections.unmodifiableList(lines) : lines.stream().map(Ansi::strip).toList();
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private void render(ExecutedSpec node, int depth, List<String> lines) {
        if (node instanceof ExecutedSuite suite) {
            lines.add(indent(depth) + header(suite.label(), suite.hasFailures()));
            for (ExecutedSpec child : suite.children()) {
                render(child, depth + 1, lines);
            }
        } else if (node instanceof ExecutedTest test) {
            renderTest(test, depth, lines);
        }
    }

    private void renderTest(ExecutedTest test, int depth, List<String> lines) {
        TestOutcome outcome = test.outcome();
        if (outcome.isIgnored()) {
            return;
        }
        lines.add(indent(depth) + header(test.label(), outcome.isFailed()));
        for (FailureDetail failure : outcome.getFailures()) {
            lines.add(indent(depth + 1) + detail(failure));
        }
    }

    private static String header(String label, boolean failed) {
        return failed ? Ansi.red("- " + label) : Ansi.green("+") + " " + label;
    }

    private static String detail(FailureDetail failure) {
        if (failure.isValueMismatch()) {
            return Ansi.blue(failure.getActual()) + " did not satisfy " + Ansi.cyan(failure.getExpected());
        }
        return Ansi.red(failure.describe());
    }

    private static String indent(int depth) {
        return INDENT.repeat(depth);
    }
}
