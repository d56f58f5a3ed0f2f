package com.gastos.mcpgateway.error;

/**
 * Outcome of a failed credential validation.
 */
public class CredentialValidationException extends RuntimeException {

    public enum AuthError {
        // identity service definitively rejected the credential
        INVALID_CREDENTIAL,
        // transport failure, timeout, 5xx or malformed response
        VALIDATOR_UNAVAILABLE
    }

    private final AuthError error;

    public CredentialValidationException(AuthError error, String message) {
        super(message);
        this.error = error;
    }

    public CredentialValidationException(AuthError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public static CredentialValidationException invalid(String reason) {
        return new CredentialValidationException(AuthError.INVALID_CREDENTIAL, "Credential rejected: " + reason);
    }

    public static CredentialValidationException unavailable(String message, Throwable cause) {
        return new CredentialValidationException(AuthError.VALIDATOR_UNAVAILABLE, message, cause);
    }

    public AuthError getError() {
        return error;
    }

    public boolean isInvalidCredential() {
        return error == AuthError.INVALID_CREDENTIAL;
    }
}
