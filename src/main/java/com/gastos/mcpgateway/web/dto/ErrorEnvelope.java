package com.gastos.mcpgateway.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Error body returned for every failed call.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorEnvelope(
        boolean success,
        String error,
        String message,
        String tool,
        Object details,
        @JsonProperty("retry_after") Long retryAfter,
        @JsonProperty("available_tools") List<String> availableTools,
        @JsonProperty("available_endpoints") List<String> availableEndpoints,
        String timestamp,
        String environment
) {
}
