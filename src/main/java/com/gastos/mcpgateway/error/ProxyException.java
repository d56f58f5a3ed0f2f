package com.gastos.mcpgateway.error;

/**
 * Failed backend call made on behalf of a tool.
 * The upstream body is kept for logs and never shown to callers.
 */
public class ProxyException extends RuntimeException {

    public enum ProxyError {
        NETWORK_ERROR,
        UPSTREAM_STATUS
    }

    private final ProxyError error;
    private final int statusCode;
    private final String body;

    private ProxyException(ProxyError error, int statusCode, String body, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
        this.statusCode = statusCode;
        this.body = body;
    }

    public static ProxyException networkError(String endpoint, Throwable cause) {
        String reason = cause != null && cause.getMessage() != null ? cause.getMessage() : String.valueOf(cause);
        return new ProxyException(ProxyError.NETWORK_ERROR, 0, null,
                "Backend unreachable for " + endpoint + ": " + reason, cause);
    }

    public static ProxyException upstreamStatus(String endpoint, int statusCode, String body) {
        return new ProxyException(ProxyError.UPSTREAM_STATUS, statusCode, body,
                "Backend returned " + statusCode + " for " + endpoint, null);
    }

    public ProxyError getError() {
        return error;
    }

    /**
     * HTTP status of the backend response, 0 for network errors.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    /**
     * Kind this failure maps to when it reaches the dispatcher.
     */
    public ErrorKind toErrorKind() {
        if (error == ProxyError.NETWORK_ERROR) {
            return ErrorKind.UPSTREAM_UNAVAILABLE;
        }
        return ErrorKind.fromUpstreamStatus(statusCode);
    }

    /**
     * A backend 401 means the credential behind the cached record is no longer honoured.
     */
    public boolean indicatesRevokedCredential() {
        return error == ProxyError.UPSTREAM_STATUS && statusCode == 401;
    }
}
