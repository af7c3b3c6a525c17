package com.specbridge.framework;

import com.specbridge.model.Spec;
import com.specbridge.model.SuiteSpec;
import com.specbridge.model.TestSpec;
import sbt.testing.Selector;
import sbt.testing.SuiteSelector;
import sbt.testing.TestSelector;
import sbt.testing.TestWildcardSelector;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Narrows a spec to the tests a run asked for.
 *
 * A leaf test is kept when it passes all three checks:
 *   1. task selectors -- none, or a {@link SuiteSelector}, keeps everything; otherwise the
 *      label must equal a {@link TestSelector} name or contain a {@link TestWildcardSelector}
 *   2. search terms   -- when any are configured, the label must contain one of them
 *   3. tags           -- when any are configured, the test must carry one of them
 *
 * When at least one check narrows the run, suites left without tests are pruned.
 * A filter that narrows nothing returns the spec untouched, empty groups included.
 */
public class SpecFilter {

    private final List<Selector> selectors;
    private final List<String>   searchTerms;
    private final Set<String>    tags;

    public SpecFilter(Selector[] selectors, List<String> searchTerms, Set<String> tags) {
        this.selectors   = selectors == null ? List.of() : List.of(selectors);
        this.searchTerms = List.copyOf(searchTerms);
        this.tags        = Set.copyOf(tags);
    }

    /** Keeps everything. */
    public static SpecFilter none() {
        return new SpecFilter(new Selector[0], List.of(), Set.of());
    }

    /**
     * @return the narrowed spec, or empty when filtering left no test
     */
    public Optional<Spec> apply(Spec spec) {
        return narrows() ? prune(spec) : Optional.of(spec);
    }

    /** False when every test would be kept regardless of its label or tags. */
    boolean narrows() {
        boolean wholeSuite = selectors.isEmpty() || selectors.stream().anyMatch(s -> s instanceof SuiteSelector);
        return !wholeSuite || !searchTerms.isEmpty() || !tags.isEmpty();
    }

    private Optional<Spec> prune(Spec spec) {
        if (spec instanceof TestSpec test) {
            return keeps(test) ? Optional.of(test) : Optional.empty();
        }
        SuiteSpec suite = (SuiteSpec) spec;
        List<Spec> kept = new ArrayList<>();
        for (Spec child : suite.children()) {
            prune(child).ifPresent(kept::add);
        }
        return kept.isEmpty() ? Optional.empty() : Optional.of(new SuiteSpec(suite.label(), kept));
    }

    boolean keeps(TestSpec test) {
        return matchesSelectors(test.label())
            && (searchTerms.isEmpty() || searchTerms.stream().anyMatch(test.label()::contains))
            && (tags.isEmpty() || test.tags().stream().anyMatch(tags::contains));
    }

    private boolean matchesSelectors(String label) {
        if (selectors.isEmpty()) return true;
        for (Selector selector : selectors) {
            if (selector instanceof SuiteSelector) return true;
            if (selector instanceof TestSelector ts && ts.testName().equals(label)) return true;
            if (selector instanceof TestWildcardSelector tw && label.contains(tw.testWildcard())) return true;
        }
        return false;
    }
}
