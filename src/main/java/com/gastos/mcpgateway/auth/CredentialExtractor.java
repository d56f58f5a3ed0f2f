package com.gastos.mcpgateway.auth;

import com.gastos.mcpgateway.model.Credential;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Pulls the caller's credential out of the request headers.
 *
 * Strategies are tried in order and the first match wins:
 * {@code Authorization: Bearer <key>}, a raw {@code gcp_} key in Authorization,
 * then {@code X-API-Key}.
 */
@Component
public class CredentialExtractor {
    private static final Logger log = LoggerFactory.getLogger(CredentialExtractor.class);

    public static final String API_KEY_HEADER = "X-API-Key";
    static final String BEARER_PREFIX = "Bearer ";
    static final String RAW_KEY_PREFIX = "gcp_";

    private final List<Function<HttpHeaders, String>> strategies = List.of(
            CredentialExtractor::bearerToken,
            CredentialExtractor::rawPrefixedKey,
            headers -> headers.getFirst(API_KEY_HEADER)
    );

    public Optional<Credential> extract(HttpHeaders headers) {
        for (Function<HttpHeaders, String> strategy : strategies) {
            String value = strategy.apply(headers);
            if (value != null && !value.isBlank()) {
                return Optional.of(new Credential(value.trim()));
            }
        }
        log.debug("No credential found in request headers");
        return Optional.empty();
    }

    private static String bearerToken(HttpHeaders headers) {
        String authorization = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            return null;
        }
        return authorization.substring(BEARER_PREFIX.length());
    }

    private static String rawPrefixedKey(HttpHeaders headers) {
        String authorization = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization == null) {
            return null;
        }
        String trimmed = authorization.trim();
        return trimmed.startsWith(RAW_KEY_PREFIX) ? trimmed : null;
    }
}
