package com.specbridge.core;

import org.testng.annotations.Test;

import java.nio.file.Paths;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class SpecBridgeConfigTest {

    @Test
    public void fromEnvironment_defaults() {
        SpecBridgeConfig config = SpecBridgeConfig.fromEnvironment(Map.of());

        assertThat(config.getSearchTerms()).isEmpty();
        assertThat(config.getTags()).isEmpty();
        assertThat(config.isAnsiColors()).isTrue();
        assertThat(config.isEventReportEnabled()).isFalse();
    }

    @Test
    public void fromEnvironment_readsVariables() {
        SpecBridgeConfig config = SpecBridgeConfig.fromEnvironment(Map.of(
            SpecBridgeConfig.ENV_SEARCH_TERMS, "parser, lexer ,",
            SpecBridgeConfig.ENV_TAGS, "slow",
            SpecBridgeConfig.ENV_ANSI_COLORS, "false",
            SpecBridgeConfig.ENV_EVENT_REPORT_PATH, "target/events.json"));

        assertThat(config.getSearchTerms()).containsExactly("parser", "lexer");
        assertThat(config.getTags()).containsExactly("slow");
        assertThat(config.isAnsiColors()).isFalse();
        assertThat(config.getEventReportPath()).isEqualTo(Paths.get("target/events.json"));
    }

    @Test
    public void withArgs_addsTermsAndOverridesFlags() {
        SpecBridgeConfig config = SpecBridgeConfig.fromEnvironment(Map.of(SpecBridgeConfig.ENV_SEARCH_TERMS, "parser"))
            .withArgs(new String[] { "-t", "lexer", "-tags", "fast", "-no-color", "-report", "out.json" });

        assertThat(config.getSearchTerms()).containsExactly("parser", "lexer");
        assertThat(config.getTags()).containsExactly("fast");
        assertThat(config.isAnsiColors()).isFalse();
        assertThat(config.getEventReportPath()).isEqualTo(Paths.get("out.json"));
    }

    @Test
    public void withArgs_ignoresUnknownArgsAndDanglingFlags() {
        SpecBridgeConfig config = SpecBridgeConfig.builder().build()
            .withArgs(new String[] { "-verbose", "-t" });

        assertThat(config.getSearchTerms()).isEmpty();
        assertThat(config.isAnsiColors()).isTrue();
    }

    @Test
    public void malformedBooleanFallsBackToFalse() {
        SpecBridgeConfig config = SpecBridgeConfig.fromEnvironment(Map.of(SpecBridgeConfig.ENV_ANSI_COLORS, "maybe"));

        assertThat(config.isAnsiColors()).isFalse();
    }
}
