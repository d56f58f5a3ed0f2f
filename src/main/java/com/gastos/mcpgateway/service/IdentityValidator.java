package com.gastos.mcpgateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gastos.mcpgateway.config.GwProperties;
import com.gastos.mcpgateway.error.CredentialValidationException;
import com.gastos.mcpgateway.model.AuthRecord;
import com.gastos.mcpgateway.model.Credential;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Validates credentials against the remote identity endpoint.
 *
 * Chain: CredentialCache → in-flight validation for the same credential → remote call → cache.
 * Concurrent misses for one credential share a single pending future, so the identity service
 * sees one call per credential no matter how many requests arrive while it is in flight.
 * Negative and indeterminate outcomes are never cached.
 */
@Service
public class IdentityValidator {
    private static final Logger log = LoggerFactory.getLogger(IdentityValidator.class);

    private final CredentialCache cache;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String validationPath;
    private final Duration timeout;
    private final Duration revalidateAfter;

    private final Map<Credential, CompletableFuture<AuthRecord>> inFlight = new ConcurrentHashMap<>();

    public IdentityValidator(CredentialCache cache,
                             WebClient.Builder builder,
                             ObjectMapper objectMapper,
                             GwProperties properties,
                             Clock clock) {
        this.cache = cache;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.validationPath = properties.getIdentity().getValidationPath();
        this.timeout = properties.getIdentity().timeout();
        this.revalidateAfter = properties.getCache().revalidateAfter();
        this.webClient = builder.clone()
                .baseUrl(properties.getBackendBaseUrl())
                .defaultHeader("User-Agent", properties.getBackend().getUserAgent())
                .build();
        log.info("IdentityValidator initialized: endpoint={}{}, timeout={}, revalidateAfter={}",
                properties.getBackendBaseUrl(), validationPath, timeout,
                revalidateAfter.isZero() ? "disabled" : revalidateAfter);
    }

    /**
     * Resolve the credential to an AuthRecord.
     * Errors with {@link CredentialValidationException} when the credential is rejected
     * or the identity service cannot give a definitive answer.
     */
    public Mono<AuthRecord> validate(Credential credential) {
        return Mono.defer(() -> {
            Optional<AuthRecord> cached = cache.get(credential);
            if (cached.isPresent()) {
                revalidateIfStale(credential, cached.get());
                return Mono.just(cached.get());
            }
            // suppressCancel: one caller going away must not fail the others waiting on it
            return Mono.fromFuture(singleFlight(credential, true), true);
        });
    }

    /**
     * Number of validations currently waiting on the identity service.
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    private CompletableFuture<AuthRecord> singleFlight(Credential credential, boolean useCache) {
        CompletableFuture<AuthRecord> pending = new CompletableFuture<>();
        CompletableFuture<AuthRecord> existing = inFlight.putIfAbsent(credential, pending);
        if (existing != null) {
            log.debug("Joining in-flight validation for credential {}", credential);
            return existing;
        }

        // A flight that finished between our cache miss and putIfAbsent has already cached its result
        Optional<AuthRecord> cached = useCache ? cache.get(credential) : Optional.empty();
        if (cached.isPresent()) {
            inFlight.remove(credential, pending);
            pending.complete(cached.get());
            return pending;
        }

        // The entry leaves the map before waiters are released, so a completed flight is never joined
        fetchRemote(credential)
                .doOnNext(record -> cache.put(credential, record))
                .subscribe(
                        record -> {
                            inFlight.remove(credential, pending);
                            pending.complete(record);
                        },
                        error -> {
                            inFlight.remove(credential, pending);
                            pending.completeExceptionally(error);
                        },
                        () -> {
                            inFlight.remove(credential, pending);
                            pending.completeExceptionally(CredentialValidationException.unavailable(
                                    "Identity service returned no result", null));
                        });
        return pending;
    }

    /**
     * Background re-check of an old but unexpired record; only a definitive rejection evicts it.
     */
    private void revalidateIfStale(Credential credential, AuthRecord record) {
        if (revalidateAfter.isZero() || inFlight.containsKey(credential)) {
            return;
        }
        if (Duration.between(record.validatedAt(), clock.instant()).compareTo(revalidateAfter) < 0) {
            return;
        }
        log.debug("Revalidating cached credential {} in background", credential);
        singleFlight(credential, false).whenComplete((fresh, error) -> {
            if (error instanceof CredentialValidationException cve && cve.isInvalidCredential()) {
                log.info("Cached credential {} was revoked upstream (user={})", credential, record.userId());
                cache.invalidate(credential);
            }
        });
    }

    private Mono<AuthRecord> fetchRemote(Credential credential) {
        log.debug("Validating credential {} with identity service", credential);
        return webClient.post()
                .uri(validationPath)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("api_key", credential.value()))
                .exchangeToMono(response -> {
                    HttpStatusCode status = response.statusCode();
                    if (status.value() == 401 || status.value() == 403) {
                        return response.releaseBody().then(Mono.<AuthRecord>error(
                                CredentialValidationException.invalid("identity service returned " + status.value())));
                    }
                    if (!status.is2xxSuccessful()) {
                        return response.releaseBody().then(Mono.<AuthRecord>error(CredentialValidationException.unavailable(
                                "Identity service returned " + status.value(), null)));
                    }
                    return response.bodyToMono(JsonNode.class)
                            .switchIfEmpty(Mono.<JsonNode>error(CredentialValidationException.unavailable(
                                    "Identity service returned an empty body", null)))
                            .map(this::toAuthRecord);
                })
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof CredentialValidationException), e -> {
                    String reason = e instanceof TimeoutException ? "timed out after " + timeout : e.getMessage();
                    return CredentialValidationException.unavailable("Identity service unavailable: " + reason, e);
                })
                .doOnNext(record -> log.info("Credential validated: userId={} keyId={} scopes={}",
                        record.userId(), record.keyId(), record.scopes()))
                .doOnError(CredentialValidationException.class, e -> {
                    if (e.isInvalidCredential()) {
                        log.warn("Credential {} rejected: {}", credential, e.getMessage());
                    } else {
                        log.error("Credential {} validation error: {}", credential, e.getMessage());
                    }
                });
    }

    private AuthRecord toAuthRecord(JsonNode body) {
        JsonNode valid = body.get("valid");
        if (valid == null || !valid.isBoolean()) {
            throw CredentialValidationException.unavailable("Malformed identity response: missing 'valid'", null);
        }
        if (!valid.booleanValue()) {
            throw CredentialValidationException.invalid(body.path("reason").asText("unknown"));
        }

        JsonNode user = body.path("user");
        String userId = user.path("id").asText(null);
        if (userId == null || userId.isBlank()) {
            throw CredentialValidationException.unavailable("Malformed identity response: missing user.id", null);
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        user.fields().forEachRemaining(field -> {
            if (!field.getValue().isNull()) {
                attributes.put(field.getKey(), objectMapper.convertValue(field.getValue(), Object.class));
            }
        });

        Set<String> scopes = new LinkedHashSet<>();
        body.path("scopes").forEach(scope -> scopes.add(scope.asText()));

        return new AuthRecord(
                userId,
                attributes,
                body.path("key_id").asText(null),
                scopes,
                body.path("rate_limit_tier").asText(null),
                clock.instant()
        );
    }
}
