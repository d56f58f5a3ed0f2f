package com.gastos.mcpgateway.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gastos.mcpgateway.auth.CredentialExtractor;
import com.gastos.mcpgateway.config.GwProperties;
import com.gastos.mcpgateway.error.CredentialValidationException;
import com.gastos.mcpgateway.error.ErrorKind;
import com.gastos.mcpgateway.error.GatewayException;
import com.gastos.mcpgateway.error.InvalidParametersException;
import com.gastos.mcpgateway.error.ProxyException;
import com.gastos.mcpgateway.model.AuthRecord;
import com.gastos.mcpgateway.model.Credential;
import com.gastos.mcpgateway.model.RequestContext;
import com.gastos.mcpgateway.model.ToolDescriptor;
import com.gastos.mcpgateway.service.AuditService;
import com.gastos.mcpgateway.service.AuditService.AuditEvent;
import com.gastos.mcpgateway.service.CredentialCache;
import com.gastos.mcpgateway.service.IdentityValidator;
import com.gastos.mcpgateway.service.RateLimiter;
import com.gastos.mcpgateway.service.RateLimiter.RateLimitDecision;
import com.gastos.mcpgateway.tool.ToolHandler;
import com.gastos.mcpgateway.tool.ToolRegistry;
import com.gastos.mcpgateway.web.dto.ErrorEnvelope;
import com.gastos.mcpgateway.web.dto.ToolCallResponse;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.codec.DecodingException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

/**
 * Request pipeline for every gateway route.
 *
 * Authenticated calls run extract → rate limit → validate identity → resolve tool → scope check
 * → validate parameters → invoke, stopping at the first failure. Every failure is a
 * {@link GatewayException} by the time it reaches {@link #toErrorResponse}, which is the only
 * place an HTTP status is chosen.
 */
@Component
public class ToolDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final CredentialExtractor credentialExtractor;
    private final RateLimiter rateLimiter;
    private final IdentityValidator identityValidator;
    private final CredentialCache credentialCache;
    private final ToolRegistry toolRegistry;
    private final AuditService auditService;
    private final GwProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ToolDispatcher(CredentialExtractor credentialExtractor,
                          RateLimiter rateLimiter,
                          IdentityValidator identityValidator,
                          CredentialCache credentialCache,
                          ToolRegistry toolRegistry,
                          AuditService auditService,
                          GwProperties properties,
                          ObjectMapper objectMapper,
                          Clock clock) {
        this.credentialExtractor = credentialExtractor;
        this.rateLimiter = rateLimiter;
        this.identityValidator = identityValidator;
        this.credentialCache = credentialCache;
        this.toolRegistry = toolRegistry;
        this.auditService = auditService;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Full pipeline for POST /mcp/tools/{name}.
     *
     * @param body raw request body, read only after authentication; empty when the caller sent none
     */
    public Mono<ResponseEntity<Object>> dispatchTool(String toolName,
                                                     Mono<String> body,
                                                     ServerHttpRequest request) {
        Instant startedAt = clock.instant();
        String clientIp = ClientIp.resolve(request);
        String endpoint = endpointOf(request);
        AtomicReference<RequestContext> current = new AtomicReference<>();

        return authenticate(request, clientIp)
                .flatMap(authenticated -> {
                    RequestContext context = new RequestContext(authenticated.record(), clientIp, startedAt);
                    current.set(context);

                    ToolHandler handler = toolRegistry.resolve(toolName)
                            .orElseThrow(() -> GatewayException.toolNotFound(toolName, toolRegistry.names()));
                    checkScope(handler.descriptor(), authenticated.record());

                    return readArguments(body)
                            .map(handler::validateParams)
                            .flatMap(params -> handler.invoke(params, context))
                            .onErrorMap(ProxyException.class, e -> {
                                if (e.indicatesRevokedCredential()) {
                                    credentialCache.invalidate(authenticated.credential());
                                }
                                return new GatewayException(e.toErrorKind(), e.getMessage(), e);
                            });
                })
                .map(result -> {
                    RequestContext context = current.get();
                    long elapsed = context.elapsedMillis(clock);
                    auditService.record(AuditEvent.success(endpoint, toolName, context.getUserId(),
                            context.getKeyId(), elapsed, context.getClientIp()));
                    Object envelope = new ToolCallResponse(true, toolName, result, elapsed, context.getUserId(),
                            clock.instant().toString(), properties.getEnvironment());
                    return ResponseEntity.ok(envelope);
                })
                .onErrorResume(e -> Mono.just(fail(e, endpoint, toolName, current.get(), startedAt, clientIp)));
    }

    /**
     * Authenticated route without a tool: steps extract, rate limit and validate, then the handler.
     */
    public Mono<ResponseEntity<Object>> authenticated(ServerHttpRequest request,
                                                      Function<RequestContext, Object> handler) {
        Instant startedAt = clock.instant();
        String clientIp = ClientIp.resolve(request);
        String endpoint = endpointOf(request);
        AtomicReference<RequestContext> current = new AtomicReference<>();

        return authenticate(request, clientIp)
                .map(authenticated -> {
                    RequestContext context = new RequestContext(authenticated.record(), clientIp, startedAt);
                    current.set(context);
                    Object body = handler.apply(context);
                    auditService.record(AuditEvent.success(endpoint, null, context.getUserId(),
                            context.getKeyId(), context.elapsedMillis(clock), context.getClientIp()));
                    return ResponseEntity.ok(body);
                })
                .onErrorResume(e -> Mono.just(fail(e, endpoint, null, current.get(), startedAt, clientIp)));
    }

    /**
     * Public route: rate limited, no credential. Only rejections are audited.
     */
    public Mono<ResponseEntity<Object>> publicEndpoint(ServerHttpRequest request,
                                                       Supplier<Mono<ResponseEntity<Object>>> handler) {
        Instant startedAt = clock.instant();
        String clientIp = ClientIp.resolve(request);
        return Mono.defer(() -> {
                    enforceRateLimit(clientIp);
                    return handler.get();
                })
                .onErrorResume(e -> Mono.just(fail(e, endpointOf(request), null, null, startedAt, clientIp)));
    }

    /**
     * Error response for a failure raised before any route handler ran: an unmatched route,
     * an unsupported method or an unexpected framework error. Audited like any other failure.
     */
    public ResponseEntity<Object> handleUnrouted(Throwable error, ServerHttpRequest request) {
        Instant startedAt = clock.instant();
        String endpoint = endpointOf(request);
        return fail(unroutedError(error, endpoint), endpoint, null, null, startedAt, ClientIp.resolve(request));
    }

    private ResponseEntity<Object> toErrorResponse(GatewayException e, String tool) {
        ErrorKind kind = e.getKind();
        ErrorEnvelope envelope = new ErrorEnvelope(
                false,
                kind.code(),
                kind.message(properties.getMessages()),
                tool,
                e.getDetails(),
                e.getRetryAfterSeconds(),
                e.getAvailableTools(),
                e.getAvailableEndpoints(),
                clock.instant().toString(),
                properties.getEnvironment()
        );
        ResponseEntity.BodyBuilder response = ResponseEntity.status(kind.status());
        if (e.getRetryAfterSeconds() != null) {
            response.header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()));
        }
        return response.body(envelope);
    }

    private Mono<Authenticated> authenticate(ServerHttpRequest request, String clientIp) {
        return Mono.defer(() -> {
            Credential credential = credentialExtractor.extract(request.getHeaders())
                    .orElseThrow(() -> new GatewayException(ErrorKind.UNAUTHENTICATED, "No credential presented"));
            enforceRateLimit(clientIp);
            return identityValidator.validate(credential)
                    .onErrorMap(CredentialValidationException.class, e -> e.isInvalidCredential()
                            ? new GatewayException(ErrorKind.UNAUTHENTICATED, e.getMessage(), e)
                            : new GatewayException(ErrorKind.UPSTREAM_UNAVAILABLE, e.getMessage(), e))
                    .map(record -> new Authenticated(credential, record));
        });
    }

    private void enforceRateLimit(String clientIp) {
        RateLimitDecision decision = rateLimiter.consume(clientIp);
        if (!decision.allowed()) {
            throw GatewayException.rateLimited(decision.retryAfterSeconds());
        }
    }

    private static void checkScope(ToolDescriptor descriptor, AuthRecord record) {
        String scope = descriptor.requiredScope();
        if (scope != null && !record.hasScope(scope)) {
            throw new GatewayException(ErrorKind.FORBIDDEN,
                    "User " + record.userId() + " lacks scope " + scope + " for tool " + descriptor.name());
        }
    }

    private Mono<Map<String, Object>> readArguments(Mono<String> body) {
        return body
                .onErrorMap(e -> e instanceof ServerWebInputException || e instanceof DecodingException,
                        e -> bodyNotAnObject())
                .filter(text -> !text.isBlank())
                .map(this::parseArguments)
                .defaultIfEmpty(Map.of());
    }

    /**
     * Arguments from a JSON body of any declared content type, under "arguments" or the alias "args".
     */
    private Map<String, Object> parseArguments(String text) {
        JsonNode json;
        try {
            json = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw bodyNotAnObject();
        }
        if (json == null || !json.isObject()) {
            throw bodyNotAnObject();
        }
        JsonNode arguments = json.has("arguments") ? json.get("arguments") : json.get("args");
        if (arguments == null || arguments.isNull()) {
            return Map.of();
        }
        if (!arguments.isObject()) {
            throw new InvalidParametersException(Map.of("arguments", "must be an object"));
        }
        return objectMapper.convertValue(arguments, ARGUMENTS_TYPE);
    }

    private static InvalidParametersException bodyNotAnObject() {
        return new InvalidParametersException(Map.of("body", "must be a JSON object"));
    }

    private ResponseEntity<Object> fail(Throwable error, String endpoint, String tool, RequestContext context,
                                        Instant startedAt, String clientIp) {
        GatewayException gatewayError = asGatewayException(error);
        ErrorKind kind = gatewayError.getKind();
        AuthRecord record = context != null ? context.getAuthRecord() : null;
        long elapsed = context != null ? context.elapsedMillis(clock) : elapsedMillis(startedAt);

        if (kind == ErrorKind.SERVER_ERROR) {
            log.error("Unhandled error on {} tool={} userId={}: {}",
                    endpoint, tool, record != null ? record.userId() : null, error.getMessage(), error);
        } else {
            log.warn("Request failed on {} tool={} userId={} kind={} latency={}ms: {}",
                    endpoint, tool, record != null ? record.userId() : null, kind, elapsed,
                    gatewayError.getMessage());
        }

        auditService.record(AuditEvent.failure(endpoint, tool,
                record != null ? record.userId() : null,
                record != null ? record.keyId() : null,
                kind, elapsed, clientIp));

        // The tool name is only echoed once it is known to be registered
        boolean knownTool = tool != null && toolRegistry.resolve(tool).isPresent();
        return toErrorResponse(gatewayError, knownTool ? tool : null);
    }

    private static Throwable unroutedError(Throwable error, String endpoint) {
        if (error instanceof ResponseStatusException statusError) {
            int status = statusError.getStatusCode().value();
            if (status == HttpStatus.NOT_FOUND.value() || status == HttpStatus.METHOD_NOT_ALLOWED.value()) {
                return GatewayException.routeNotFound(endpoint, McpController.ROUTES);
            }
            if (statusError.getStatusCode().is4xxClientError()) {
                return new GatewayException(ErrorKind.INVALID_PARAMETERS, statusError.getMessage(), statusError);
            }
        }
        return error;
    }

    private static GatewayException asGatewayException(Throwable error) {
        if (error instanceof GatewayException gatewayException) {
            return gatewayException;
        }
        return new GatewayException(ErrorKind.SERVER_ERROR, "Unexpected error: " + error.getMessage(), error);
    }

    private long elapsedMillis(Instant startedAt) {
        return Math.max(0, clock.millis() - startedAt.toEpochMilli());
    }

    private static String endpointOf(ServerHttpRequest request) {
        return request.getMethod() + " " + request.getPath().value();
    }

    private record Authenticated(Credential credential, AuthRecord record) {
    }
}
