package com.gastos.mcpgateway.error;

import com.gastos.mcpgateway.config.GwProperties;
import org.springframework.http.HttpStatus;

/**
 * Closed set of failure kinds the gateway reports to callers.
 */
public enum ErrorKind {
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED, "authentication_required"),
    FORBIDDEN(HttpStatus.FORBIDDEN, "insufficient_permissions"),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "rate_limit_exceeded"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "tool_not_found"),
    ROUTE_NOT_FOUND(HttpStatus.NOT_FOUND, "not_found"),
    INVALID_PARAMETERS(HttpStatus.BAD_REQUEST, "invalid_parameters"),
    UPSTREAM_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "service_unavailable"),
    SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "server_error");

    private final HttpStatus status;
    private final String code;

    ErrorKind(HttpStatus status, String code) {
        this.status = status;
        this.code = code;
    }

    public HttpStatus status() {
        return status;
    }

    public String code() {
        return code;
    }

    /**
     * Catalog message shown to callers for this kind.
     */
    public String message(GwProperties.Messages messages) {
        return switch (this) {
            case UNAUTHENTICATED -> messages.getAuthenticationFailed();
            case FORBIDDEN -> messages.getInsufficientPermissions();
            case RATE_LIMITED -> messages.getRateLimitExceeded();
            case NOT_FOUND, ROUTE_NOT_FOUND -> messages.getNotFound();
            case INVALID_PARAMETERS -> messages.getInvalidParameters();
            case UPSTREAM_UNAVAILABLE -> messages.getServiceUnavailable();
            case SERVER_ERROR -> messages.getServerError();
        };
    }

    /**
     * Kind for a non-2xx status returned by the backend.
     */
    public static ErrorKind fromUpstreamStatus(int status) {
        return switch (status) {
            case 400, 422 -> INVALID_PARAMETERS;
            case 401 -> UNAUTHENTICATED;
            case 403 -> FORBIDDEN;
            case 404 -> NOT_FOUND;
            case 429 -> RATE_LIMITED;
            default -> status >= 500 ? UPSTREAM_UNAVAILABLE : SERVER_ERROR;
        };
    }
}
