package com.gastos.mcpgateway.error;

import java.util.List;

/**
 * Terminal pipeline failure carrying its taxonomy kind.
 * The message is for logs only; callers see the catalog entry of the kind.
 */
public class GatewayException extends RuntimeException {

    private final ErrorKind kind;
    private final Long retryAfterSeconds;
    private final List<String> availableTools;
    private final List<String> availableEndpoints;

    public GatewayException(ErrorKind kind, String message) {
        this(kind, message, null, null, null, null);
    }

    public GatewayException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, cause, null, null, null);
    }

    protected GatewayException(ErrorKind kind, String message, Throwable cause,
                               Long retryAfterSeconds, List<String> availableTools,
                               List<String> availableEndpoints) {
        super(message, cause);
        this.kind = kind;
        this.retryAfterSeconds = retryAfterSeconds;
        this.availableTools = availableTools != null ? List.copyOf(availableTools) : null;
        this.availableEndpoints = availableEndpoints != null ? List.copyOf(availableEndpoints) : null;
    }

    public static GatewayException rateLimited(long retryAfterSeconds) {
        return new GatewayException(ErrorKind.RATE_LIMITED, "Rate limit exceeded", null, retryAfterSeconds, null, null);
    }

    public static GatewayException toolNotFound(String toolName, List<String> availableTools) {
        return new GatewayException(ErrorKind.NOT_FOUND, "Tool '" + toolName + "' not found", null, null, availableTools,
                null);
    }

    public static GatewayException routeNotFound(String endpoint, List<String> availableEndpoints) {
        return new GatewayException(ErrorKind.ROUTE_NOT_FOUND, "Endpoint " + endpoint + " not found", null, null,
                null, availableEndpoints);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Seconds until the caller may retry, only for RATE_LIMITED.
     */
    public Long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    /**
     * Registered tool names, only for an unknown tool.
     */
    public List<String> getAvailableTools() {
        return availableTools;
    }

    /**
     * Public routes, only for an unmatched route.
     */
    public List<String> getAvailableEndpoints() {
        return availableEndpoints;
    }

    /**
     * Caller-safe detail payload; only parameter validation has one.
     */
    public Object getDetails() {
        return null;
    }
}
