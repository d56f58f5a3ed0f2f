package com.gastos.mcpgateway.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gastos.mcpgateway.error.ProxyException;
import com.gastos.mcpgateway.model.RequestContext;
import com.gastos.mcpgateway.model.ToolDescriptor;
import com.gastos.mcpgateway.service.BackendProxyClient;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import reactor.core.publisher.Mono;

/**
 * Base for tools backed by the agent API.
 * Holds the descriptor, validates parameters against it and logs every execution.
 */
public abstract class AbstractBackendTool implements ToolHandler {
    private final Logger log = LoggerFactory.getLogger(getClass());

    public static final String READ_SCOPE = "mcp:read";

    protected final BackendProxyClient backend;
    protected final ObjectMapper objectMapper;
    private final Clock clock;
    private final ToolDescriptor descriptor;

    protected AbstractBackendTool(ToolDescriptor descriptor,
                                  BackendProxyClient backend,
                                  ObjectMapper objectMapper,
                                  Clock clock) {
        this.descriptor = descriptor;
        this.backend = backend;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public ToolDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Map<String, Object> validateParams(Map<String, Object> raw) {
        return ParameterValidator.validate(descriptor.parameters(), raw);
    }

    @Override
    public final Mono<JsonNode> invoke(Map<String, Object> params, RequestContext context) {
        return Mono.defer(() -> {
            long start = clock.millis();
            return execute(params, context)
                    .doOnSuccess(result -> log.info("Tool executed: tool={} userId={} keyId={} success=true latency={}ms",
                            descriptor.name(), context.getUserId(), context.getKeyId(), clock.millis() - start))
                    .doOnError(e -> log.warn("Tool executed: tool={} userId={} keyId={} success=false latency={}ms error={}",
                            descriptor.name(), context.getUserId(), context.getKeyId(), clock.millis() - start,
                            e.getMessage()));
        });
    }

    protected abstract Mono<JsonNode> execute(Map<String, Object> params, RequestContext context);

    protected Mono<JsonNode> get(String endpoint, RequestContext context) {
        return backend.call(endpoint, HttpMethod.GET, null, context.getAuthRecord(), context.getKeyId());
    }

    /**
     * A backend call whose failure must not fail the tool: on error the fallback is used
     * and the enrichment name is added to {@code degraded}.
     */
    protected Mono<JsonNode> optional(String enrichment, Mono<JsonNode> call, JsonNode fallback,
                                      List<String> degraded) {
        return call.onErrorResume(ProxyException.class, e -> {
            log.warn("Enrichment {} unavailable for tool {}: {}", enrichment, descriptor.name(), e.getMessage());
            synchronized (degraded) {
                degraded.add(enrichment);
            }
            return Mono.just(fallback);
        });
    }
}
