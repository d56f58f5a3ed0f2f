package com.gastos.mcpgateway.web;

import com.gastos.mcpgateway.config.GwProperties;
import com.gastos.mcpgateway.model.AuthRecord;
import com.gastos.mcpgateway.model.ToolDescriptor;
import com.gastos.mcpgateway.service.BackendProxyClient;
import com.gastos.mcpgateway.service.CredentialCache;
import com.gastos.mcpgateway.tool.ToolRegistry;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * HTTP surface of the gateway: discovery, health and tool execution.
 * Every route goes through {@link ToolDispatcher}.
 */
@RestController
public class McpController {
    private static final Logger log = LoggerFactory.getLogger(McpController.class);

    private static final Map<String, String> ENDPOINTS = endpoints();

    /**
     * Routes listed to callers that hit an unmatched one.
     */
    static final List<String> ROUTES = List.copyOf(ENDPOINTS.values());

    private final ToolDispatcher dispatcher;
    private final ToolRegistry toolRegistry;
    private final BackendProxyClient backend;
    private final CredentialCache credentialCache;
    private final GwProperties properties;
    private final Clock clock;

    public McpController(ToolDispatcher dispatcher,
                         ToolRegistry toolRegistry,
                         BackendProxyClient backend,
                         CredentialCache credentialCache,
                         GwProperties properties,
                         Clock clock) {
        this.dispatcher = dispatcher;
        this.toolRegistry = toolRegistry;
        this.backend = backend;
        this.credentialCache = credentialCache;
        this.properties = properties;
        this.clock = clock;
    }

    @GetMapping(path = "/", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> info(ServerHttpRequest request) {
        return dispatcher.publicEndpoint(request, () -> {
            GwProperties.McpConfig mcp = properties.getMcp();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("service", mcp.getName());
            body.put("version", mcp.getVersion());
            body.put("description", mcp.getDescription());
            body.put("environment", properties.getEnvironment());
            body.put("endpoints", List.of(
                    "GET /health - Health check",
                    "GET /mcp/schema - API discovery",
                    "GET /mcp/tools - List tools (auth required)",
                    "POST /mcp/tools/{name} - Execute tool (auth required)",
                    "POST /mcp/initialize - MCP handshake (auth required)"));
            body.put("backend", properties.getBackendBaseUrl());
            return Mono.just(ResponseEntity.<Object>ok(body));
        });
    }

    /**
     * 200 when the backend probe succeeds, 503 (degraded) otherwise.
     */
    @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> health(ServerHttpRequest request) {
        return dispatcher.publicEndpoint(request, () -> backend.probe().map(probe -> {
            Map<String, Object> backendStatus = new LinkedHashMap<>();
            backendStatus.put("agent_api_url", properties.getBackendBaseUrl());
            backendStatus.put("connectivity", probe.reachable() ? "ok" : "failed");
            backendStatus.put("reachable", probe.reachable());
            if (probe.error() != null) {
                backendStatus.put("error", probe.error());
            }

            Map<String, Object> cache = new LinkedHashMap<>();
            cache.put("size", credentialCache.size());
            cache.put("ttl_ms", credentialCache.getTtl().toMillis());

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", probe.reachable() ? "healthy" : "degraded");
            body.put("service", properties.getMcp().getName());
            body.put("version", properties.getMcp().getVersion());
            body.put("timestamp", clock.instant().toString());
            body.put("environment", properties.getEnvironment());
            body.put("tools", toolRegistry.names());
            body.put("backend", backendStatus);
            body.put("cache", cache);

            if (!probe.reachable()) {
                log.warn("Health check degraded: backend unreachable");
            }
            HttpStatus status = probe.reachable() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
            return ResponseEntity.status(status).<Object>body(body);
        }));
    }

    @GetMapping(path = "/mcp/schema", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> schema(ServerHttpRequest request) {
        return dispatcher.publicEndpoint(request, () -> {
            GwProperties.McpConfig mcp = properties.getMcp();

            Map<String, Object> server = new LinkedHashMap<>();
            server.put("name", mcp.getName());
            server.put("version", mcp.getVersion());
            server.put("description", mcp.getDescription());
            server.put("environment", properties.getEnvironment());
            server.put("agent_api_url", properties.getBackendBaseUrl());

            Map<String, Object> authentication = new LinkedHashMap<>();
            authentication.put("type", "api_key");
            authentication.put("description", "Requiere API key en header Authorization como Bearer token");
            authentication.put("header", "Authorization: Bearer gcp_your_api_key");
            authentication.put("alternatives", List.of("Authorization: gcp_your_api_key", "X-API-Key: gcp_your_api_key"));

            Map<String, Object> rateLimiting = new LinkedHashMap<>();
            rateLimiting.put("window_ms", properties.getRateLimit().getWindowMs());
            rateLimiting.put("max_requests", properties.getRateLimit().getMaxRequests());

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("server", server);
            body.put("capabilities", Map.of("tools", true, "resources", false, "prompts", false));
            body.put("tools", toolSchemas());
            body.put("authentication", authentication);
            body.put("endpoints", ENDPOINTS);
            body.put("rate_limiting", rateLimiting);
            return Mono.just(ResponseEntity.<Object>ok(body));
        });
    }

    @GetMapping(path = "/mcp/tools", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> listTools(ServerHttpRequest request) {
        return dispatcher.authenticated(request, context -> {
            List<Map<String, Object>> tools = toolSchemas();
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("tools", tools);
            body.put("total_count", tools.size());
            body.put("user_id", context.getUserId());
            body.put("environment", properties.getEnvironment());
            body.put("agent_api_url", properties.getBackendBaseUrl());
            return body;
        });
    }

    @PostMapping(path = "/mcp/tools/{name}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> callTool(@PathVariable("name") String name,
                                                 @RequestBody(required = false) Mono<String> body,
                                                 ServerHttpRequest request) {
        return dispatcher.dispatchTool(name, body != null ? body : Mono.empty(), request);
    }

    @PostMapping(path = "/mcp/initialize", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> initialize(ServerHttpRequest request) {
        return dispatcher.authenticated(request, context -> {
            GwProperties.McpConfig mcp = properties.getMcp();
            AuthRecord record = context.getAuthRecord();

            Map<String, Object> serverInfo = new LinkedHashMap<>();
            serverInfo.put("name", mcp.getName());
            serverInfo.put("version", mcp.getVersion());
            serverInfo.put("environment", properties.getEnvironment());
            serverInfo.put("agent_api_url", properties.getBackendBaseUrl());

            Map<String, Object> user = new LinkedHashMap<>();
            user.put("id", record.userId());
            user.put("scopes", new TreeSet<>(record.scopes()));

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("protocolVersion", mcp.getProtocolVersion());
            body.put("serverInfo", serverInfo);
            body.put("capabilities", Map.of("tools", Map.of()));
            body.put("user", user);
            return body;
        });
    }

    private List<Map<String, Object>> toolSchemas() {
        return toolRegistry.list().stream().map(ToolDescriptor::schema).toList();
    }

    private static Map<String, String> endpoints() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("health", "GET /health");
        endpoints.put("schema", "GET /mcp/schema");
        endpoints.put("list_tools", "GET /mcp/tools");
        endpoints.put("call_tool", "POST /mcp/tools/{tool_name}");
        endpoints.put("initialize", "POST /mcp/initialize");
        return endpoints;
    }
}
