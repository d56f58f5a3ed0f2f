package com.gastos.mcpgateway.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable result of a successful credential validation.
 * Collections are copied on construction, so cached instances cannot be mutated by readers.
 */
public record AuthRecord(
        String userId,
        Map<String, Object> userAttributes,
        String keyId,
        Set<String> scopes,
        String rateLimitTier,   // optional, as reported by the identity service
        Instant validatedAt
) {

    public static final String ADMIN_SCOPE = "mcp:admin";

    public AuthRecord {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(validatedAt, "validatedAt");
        userAttributes = userAttributes != null ? Map.copyOf(userAttributes) : Map.of();
        scopes = scopes != null ? Set.copyOf(scopes) : Set.of();
    }

    /**
     * True when the scope was granted directly or through mcp:admin.
     */
    public boolean hasScope(String scope) {
        return scopes.contains(scope) || scopes.contains(ADMIN_SCOPE);
    }
}
