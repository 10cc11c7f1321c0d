package com.tally.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Instant;

/**
 * One counted event. {@code timestamp} defaults to now and {@code delta} to 1. Timestamps in months
 * that were already rolled up are accepted; the next monthly rollup promotes them into their own
 * month.
 */
public record IncrementRequest(
        @NotNull Long subjectId,
        @NotNull Long scopeId,
        @NotBlank String type,
        Instant timestamp,
        @Positive Long delta) {

    public long effectiveDelta() {
        return delta != null ? delta : 1L;
    }
}
