package com.tracechain.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

/**
 * POST /api/v1/bridges request body. Omitted numbers take the bridge defaults; {@code twoWay} also creates the
 * reverse bridge; {@code start} starts the new bridge(s) right away.
 */
public record CreateBridgeRequest(
        @NotBlank(message = "INVALID_LEDGER")
        String source,

        @NotBlank(message = "INVALID_LEDGER")
        String target,

        List<String> eventTypes,

        @Positive
        Long pollIntervalSeconds,

        @PositiveOrZero
        Integer confirmationBlocks,

        @PositiveOrZero
        Long lookbackBlocks,

        Boolean twoWay,

        Boolean start
) {
}
