package com.gastos.mcpgateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gastos.mcpgateway.config.GwProperties;
import com.gastos.mcpgateway.error.ProxyException;
import com.gastos.mcpgateway.model.AuthRecord;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Outbound client for the agent API, used by tools.
 *
 * Every call carries the internal service authorization plus the resolved user and key ids
 * in context headers; the backend scopes its authorization on those. The raw caller credential
 * is never forwarded. One attempt per call, no retries.
 */
@Service
public class BackendProxyClient {
    private static final Logger log = LoggerFactory.getLogger(BackendProxyClient.class);

    public static final String USER_ID_HEADER = "X-MCP-User-ID";
    public static final String KEY_ID_HEADER = "X-MCP-Key-ID";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String baseUrl;
    private final String apiPrefix;
    private final Duration timeout;
    private final String serviceTokenTemplate;
    private final String healthPath;
    private final Duration probeTimeout;

    public BackendProxyClient(WebClient.Builder builder,
                              ObjectMapper objectMapper,
                              GwProperties properties,
                              Clock clock) {
        GwProperties.BackendConfig backend = properties.getBackend();
        String configured = properties.getBackendBaseUrl();
        this.baseUrl = configured.endsWith("/") ? configured.substring(0, configured.length() - 1) : configured;
        this.apiPrefix = backend.getApiPrefix() != null ? backend.getApiPrefix() : "";
        this.timeout = backend.timeout();
        this.serviceTokenTemplate = backend.getServiceToken();
        this.healthPath = backend.getHealthPath();
        this.probeTimeout = backend.probeTimeout();
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.webClient = builder.clone()
                .baseUrl(baseUrl)
                .defaultHeader("User-Agent", backend.getUserAgent())
                .build();
        log.info("BackendProxyClient initialized with baseUrl={}{}, timeout={}", baseUrl, apiPrefix, timeout);
    }

    /**
     * Call the agent API on behalf of a user.
     *
     * @param endpoint   encoded path below the API prefix, query string included (e.g. /sheets/42/state)
     * @param method     HTTP method; a body is only sent for POST and PUT
     * @param body       request body or null
     * @param authRecord resolved identity of the caller
     * @param keyId      key identifier propagated to the backend
     * @return the JSON response (an empty object for an empty body), or a {@link ProxyException}
     */
    public Mono<JsonNode> call(String endpoint, HttpMethod method, Object body, AuthRecord authRecord, String keyId) {
        String path = apiPrefix + endpoint;
        return Mono.defer(() -> {
            long startMillis = clock.millis();

            // endpoint arrives already encoded; a URI bypasses template expansion
            WebClient.RequestBodySpec request = webClient.method(method)
                    .uri(URI.create(baseUrl + path))
                    .headers(headers -> {
                        headers.setBearerAuth(serviceToken(authRecord));
                        headers.setContentType(MediaType.APPLICATION_JSON);
                        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
                        headers.set(USER_ID_HEADER, authRecord.userId());
                        if (keyId != null) {
                            headers.set(KEY_ID_HEADER, keyId);
                        }
                    });
            WebClient.RequestHeadersSpec<?> ready = body != null && sendsBody(method)
                    ? request.bodyValue(body)
                    : request;

            return ready.retrieve()
                    .bodyToMono(JsonNode.class)
                    .defaultIfEmpty(objectMapper.createObjectNode())
                    .timeout(timeout)
                    .onErrorMap(WebClientResponseException.class, e ->
                            ProxyException.upstreamStatus(path, e.getStatusCode().value(), e.getResponseBodyAsString()))
                    .onErrorMap(e -> !(e instanceof ProxyException), e ->
                            ProxyException.networkError(path, e instanceof TimeoutException
                                    ? new TimeoutException("no response within " + timeout)
                                    : e))
                    .doOnSuccess(result -> log.debug("Backend call {} {} ok user={} keyId={} latency={}ms",
                            method, path, authRecord.userId(), keyId, clock.millis() - startMillis))
                    .doOnError(ProxyException.class, e -> log.warn(
                            "Backend call {} {} failed user={} keyId={} status={} latency={}ms: {}",
                            method, path, authRecord.userId(), keyId, e.getStatusCode(),
                            clock.millis() - startMillis, e.getMessage()));
        });
    }

    /**
     * Reachability check of the backend health endpoint. Never errors.
     */
    public Mono<ProbeResult> probe() {
        return webClient.get()
                .uri(healthPath)
                .retrieve()
                .toBodilessEntity()
                .timeout(probeTimeout)
                .map(entity -> ProbeResult.reachable(entity.getStatusCode().value()))
                .onErrorResume(e -> {
                    String reason = e instanceof TimeoutException ? "timed out after " + probeTimeout : e.getMessage();
                    log.warn("Backend probe failed: {}", reason);
                    return Mono.just(ProbeResult.unreachable(reason));
                });
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    private String serviceToken(AuthRecord authRecord) {
        return serviceTokenTemplate.replace("{userId}", authRecord.userId());
    }

    private static boolean sendsBody(HttpMethod method) {
        return HttpMethod.POST.equals(method) || HttpMethod.PUT.equals(method);
    }

    /**
     * Outcome of {@link #probe()}.
     */
    public record ProbeResult(boolean reachable, int status, String error) {

        static ProbeResult reachable(int status) {
            return new ProbeResult(true, status, null);
        }

        static ProbeResult unreachable(String error) {
            return new ProbeResult(false, 0, error);
        }
    }
}
