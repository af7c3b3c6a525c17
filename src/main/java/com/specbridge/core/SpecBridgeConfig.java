package com.specbridge.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration for a SpecBridge run.
 *
 * Load from environment variables, then overlay the runner args the build tool passes:
 *
 *   SPECBRIDGE_SEARCH_TERMS       / -t &lt;term&gt;      - Run only tests whose label contains a term (comma-separated)
 *   SPECBRIDGE_TAGS               / -tags &lt;tag&gt;    - Run only tests carrying a tag (comma-separated)
 *   SPECBRIDGE_ANSI_COLORS        / -no-color       - Colour rendered log lines (default: true)
 *   SPECBRIDGE_EVENT_REPORT_PATH  / -report &lt;path&gt; - Also write every event to this JSON file (default: disabled)
 *
 * Args add to the search terms and tags from the environment; {@code -report} and
 * {@code -no-color} override it.
 */
public class SpecBridgeConfig {

    private static final Logger log = LoggerFactory.getLogger(SpecBridgeConfig.class);

    public static final String ENV_SEARCH_TERMS      = "SPECBRIDGE_SEARCH_TERMS";
    public static final String ENV_TAGS              = "SPECBRIDGE_TAGS";
    public static final String ENV_ANSI_COLORS       = "SPECBRIDGE_ANSI_COLORS";
    public static final String ENV_EVENT_REPORT_PATH = "SPECBRIDGE_EVENT_REPORT_PATH";

    private final List<String> searchTerms;
    private final Set<String>  tags;
    private final boolean      ansiColors;
    private final Path         eventReportPath;   // null = disabled

    private SpecBridgeConfig(Builder b) {
        this.searchTerms     = List.copyOf(b.searchTerms);
        this.tags            = Set.copyOf(b.tags);
        this.ansiColors      = b.ansiColors;
        this.eventReportPath = b.eventReportPath;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static SpecBridgeConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static SpecBridgeConfig fromEnvironment(Map<String, String> env) {
        return builder()
            .searchTerms(listOrEmpty(env.get(ENV_SEARCH_TERMS)))
            .tags(listOrEmpty(env.get(ENV_TAGS)))
            .ansiColors(boolOrDefault(env.get(ENV_ANSI_COLORS), true))
            .eventReportPath(pathOrNull(env.get(ENV_EVENT_REPORT_PATH)))
            .build();
    }

    /**
     * Returns a copy with runner args applied. Unknown args are skipped; a flag
     * missing its value is ignored.
     */
    public SpecBridgeConfig withArgs(String[] args) {
        Builder b = toBuilder();
        int i = 0;
        while (i < args.length) {
            String arg = args[i];
            boolean hasValue = i + 1 < args.length;
            switch (arg) {
                case "-t" -> {
                    if (hasValue) b.searchTerms.add(args[++i]);
                }
                case "-tags" -> {
                    if (hasValue) b.tags.add(args[++i]);
                }
                case "-report" -> {
                    if (hasValue) b.eventReportPath(pathOrNull(args[++i]));
                }
                case "-no-color" -> b.ansiColors(false);
                default -> log.debug("SpecBridgeConfig: ignoring unknown arg '{}'", arg);
            }
            i++;
        }
        return b.build();
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public List<String> getSearchTerms()       { return searchTerms; }
    public Set<String>  getTags()              { return tags; }
    public boolean      isAnsiColors()         { return ansiColors; }
    public Path         getEventReportPath()   { return eventReportPath; }
    public boolean      isEventReportEnabled() { return eventReportPath != null; }

    @Override
    public String toString() {
        return String.format("SpecBridgeConfig{searchTerms=%s, tags=%s, ansiColors=%s, eventReportPath=%s}",
            searchTerms, tags, ansiColors, eventReportPath);
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        return builder()
            .searchTerms(searchTerms)
            .tags(tags)
            .ansiColors(ansiColors)
            .eventReportPath(eventReportPath);
    }

    public static class Builder {
        private final List<String> searchTerms = new ArrayList<>();
        private final Set<String>  tags = new LinkedHashSet<>();
        private boolean ansiColors = true;
        private Path eventReportPath = null;

        public Builder searchTerms(List<String> terms)  { this.searchTerms.addAll(terms); return this; }
        public Builder tags(Iterable<String> t)         { t.forEach(this.tags::add); return this; }
        public Builder ansiColors(boolean b)            { this.ansiColors = b; return this; }
        public Builder eventReportPath(Path path)       { this.eventReportPath = path; return this; }
        public Builder eventReportPath(String path) {
            this.eventReportPath = pathOrNull(path);
            return this;
        }

        public SpecBridgeConfig build() {
            return new SpecBridgeConfig(this);
        }
    }

    // ── Env helpers ───────────────────────────────────────────────────────────

    private static List<String> listOrEmpty(String val) {
        if (val == null || val.isBlank()) return List.of();
        return Arrays.stream(val.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    private static boolean boolOrDefault(String val, boolean defaultValue) {
        if (val == null || val.isBlank()) return defaultValue;
        return "true".equalsIgnoreCase(val.trim()) || "1".equals(val.trim());
    }

    private static Path pathOrNull(String val) {
        return (val != null && !val.isBlank()) ? Paths.get(val.trim()) : null;
    }
}
