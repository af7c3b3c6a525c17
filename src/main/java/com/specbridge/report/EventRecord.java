package com.specbridge.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One entry of the JSON event report.
 *
 * @param selector       the reported test's label, or the selector's text for non-test selectors
 * @param failureMessage present only for failures
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventRecord(
    String fullyQualifiedName,
    String selector,
    String status,
    String failureMessage,
    long durationMillis,
    Instant recordedAt
) {
}
