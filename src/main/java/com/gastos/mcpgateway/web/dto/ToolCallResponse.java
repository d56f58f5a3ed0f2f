package com.gastos.mcpgateway.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public record ToolCallResponse(
        boolean success,
        String tool,
        JsonNode result,
        @JsonProperty("execution_time_ms") long executionTimeMs,
        @JsonProperty("user_id") String userId,
        String timestamp,
        String environment
) {
}
