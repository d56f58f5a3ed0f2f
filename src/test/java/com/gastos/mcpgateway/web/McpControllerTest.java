package com.gastos.mcpgateway.web;

import static com.gastos.mcpgateway.support.TestFixtures.API_PREFIX;
import static com.gastos.mcpgateway.support.TestFixtures.VALIDATE_PATH;
import static com.gastos.mcpgateway.support.TestFixtures.validResponse;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gastos.mcpgateway.auth.CredentialExtractor;
import com.gastos.mcpgateway.config.GwProperties;
import com.gastos.mcpgateway.model.Credential;
import com.gastos.mcpgateway.service.AuditService;
import com.gastos.mcpgateway.service.AuditService.AuditEvent;
import com.gastos.mcpgateway.service.BackendProxyClient;
import com.gastos.mcpgateway.service.CredentialCache;
import com.gastos.mcpgateway.service.IdentityValidator;
import com.gastos.mcpgateway.service.RateLimiter;
import com.gastos.mcpgateway.support.MutableClock;
import com.gastos.mcpgateway.support.StubExchangeFunction;
import com.gastos.mcpgateway.support.TestFixtures;
import com.gastos.mcpgateway.tool.GetSheetSummaryTool;
import com.gastos.mcpgateway.tool.ListMySheetsTool;
import com.gastos.mcpgateway.tool.ToolRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.MockServerConfigurer;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.server.adapter.WebHttpHandlerBuilder;

@DisplayName("MCP routes")
class McpControllerTest {

    private static final String KEY = "gcp_live_0123456789";
    private static final String SHEETS = API_PREFIX + "/sheets";

    private MutableClock clock;
    private GwProperties properties;
    private StubExchangeFunction upstream;
    private CredentialCache cache;
    private AuditService audit;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        properties = TestFixtures.properties();
        properties.getBackend().setTimeoutMs(300);
        properties.getBackend().setProbeTimeoutMs(300);
        upstream = new StubExchangeFunction()
                .json(VALIDATE_PATH, HttpStatus.OK, validResponse("u1", "mcp:read"))
                .json(SHEETS, HttpStatus.OK, "{\"sheets\":[{\"id\":\"s1\",\"type\":\"shared\",\"status\":\"active\"}]}")
                .json("/health", HttpStatus.OK, "{\"status\":\"ok\"}");
        build();
    }

    private void build() {
        ObjectMapper mapper = new ObjectMapper();
        cache = new CredentialCache(properties, clock);
        audit = spy(new AuditService());
        BackendProxyClient backend = new BackendProxyClient(upstream.builder(), mapper, properties, clock);
        ToolRegistry registry = new ToolRegistry()
                .register(new ListMySheetsTool(backend, mapper, properties, clock))
                .register(new GetSheetSummaryTool(backend, mapper, clock));
        ToolDispatcher dispatcher = new ToolDispatcher(
                new CredentialExtractor(),
                new RateLimiter(properties, clock),
                new IdentityValidator(cache, upstream.builder(), mapper, properties, clock),
                cache,
                registry,
                audit,
                properties,
                mapper,
                clock);
        GatewayErrorHandler errorHandler = new GatewayErrorHandler(dispatcher, mapper);
        client = WebTestClient.bindToController(new McpController(dispatcher, registry, backend, cache, properties, clock))
                .apply(new MockServerConfigurer() {
                    @Override
                    public void beforeServerCreated(WebHttpHandlerBuilder builder) {
                        builder.exceptionHandlers(handlers -> handlers.add(0, errorHandler));
                    }
                })
                .build();
    }

    private WebTestClient.ResponseSpec callTool(String tool, String body) {
        return client.post().uri("/mcp/tools/" + tool)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange();
    }

    private AuditEvent lastAudit() {
        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(audit, atLeastOnce()).record(captor.capture());
        List<AuditEvent> events = captor.getAllValues();
        return events.get(events.size() - 1);
    }

    @Nested
    @DisplayName("POST /mcp/tools/{name}")
    class CallTool {

        @Test
        @DisplayName("a valid key and tool returns the success envelope with the user id")
        void success() {
            callTool("list_my_sheets", "{\"arguments\":{\"limit\":5}}")
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(true)
                    .jsonPath("$.tool").isEqualTo("list_my_sheets")
                    .jsonPath("$.user_id").isEqualTo("u1")
                    .jsonPath("$.environment").isEqualTo("test")
                    .jsonPath("$.execution_time_ms").exists()
                    .jsonPath("$.result.summary.total_sheets").isEqualTo(1);

            assertThat(upstream.lastRequest(SHEETS).headers().getFirst(BackendProxyClient.USER_ID_HEADER))
                    .isEqualTo("u1");
            AuditEvent event = lastAudit();
            assertThat(event.success()).isTrue();
            assertThat(event.tool()).isEqualTo("list_my_sheets");
            assertThat(event.userId()).isEqualTo("u1");
            assertThat(event.keyId()).isEqualTo("key-u1");
        }

        @Test
        @DisplayName("accepts 'args' as an alias and a missing body as no arguments")
        void argumentForms() {
            callTool("list_my_sheets", "{\"args\":{\"filter\":\"shared\"}}").expectStatus().isOk();
            assertThat(upstream.lastRequest(SHEETS).url().getQuery()).isEqualTo("filter=shared&limit=20");

            client.post().uri("/mcp/tools/list_my_sheets")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + KEY)
                    .contentType(MediaType.APPLICATION_JSON)
                    .exchange()
                    .expectStatus().isOk();
        }

        @Test
        @DisplayName("no credential is 401 and the tool is never reached")
        void missingCredential() {
            client.post().uri("/mcp/tools/list_my_sheets")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{}")
                    .exchange()
                    .expectStatus().isUnauthorized()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(false)
                    .jsonPath("$.error").isEqualTo("authentication_required")
                    .jsonPath("$.message").isEqualTo(properties.getMessages().getAuthenticationFailed());

            assertThat(upstream.hits(SHEETS)).isZero();
            assertThat(upstream.hits(VALIDATE_PATH)).isZero();
            assertThat(lastAudit().outcome()).isEqualTo("authentication_required");
        }

        @Test
        @DisplayName("a rejected key is 401 and is not cached")
        void invalidCredential() {
            upstream.json(VALIDATE_PATH, HttpStatus.OK, "{\"valid\":false,\"reason\":\"revoked\"}");

            callTool("list_my_sheets", "{}").expectStatus().isUnauthorized();
            callTool("list_my_sheets", "{}").expectStatus().isUnauthorized();

            assertThat(upstream.hits(VALIDATE_PATH)).isEqualTo(2);
            assertThat(upstream.hits(SHEETS)).isZero();
        }

        @Test
        @DisplayName("an unreachable identity service is 503, not 401")
        void validatorUnavailable() {
            upstream.json(VALIDATE_PATH, HttpStatus.INTERNAL_SERVER_ERROR, "{}");

            callTool("list_my_sheets", "{}")
                    .expectStatus().isEqualTo(HttpStatus.SERVICE_UNAVAILABLE)
                    .expectBody().jsonPath("$.error").isEqualTo("service_unavailable");
        }

        @Test
        @DisplayName("a backend timeout is 503 and the audit record carries tool and latency")
        void backendTimeout() {
            upstream.never(SHEETS);

            callTool("list_my_sheets", "{}")
                    .expectStatus().isEqualTo(HttpStatus.SERVICE_UNAVAILABLE)
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("service_unavailable")
                    .jsonPath("$.tool").isEqualTo("list_my_sheets");

            AuditEvent event = lastAudit();
            assertThat(event.success()).isFalse();
            assertThat(event.tool()).isEqualTo("list_my_sheets");
            assertThat(event.outcome()).isEqualTo("service_unavailable");
            assertThat(event.latencyMs()).isGreaterThanOrEqualTo(0);
            assertThat(event.userId()).isEqualTo("u1");
        }

        @Test
        @DisplayName("an unknown tool is 404 listing the available tools")
        void unknownTool() {
            callTool("delete_everything", "{}")
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("tool_not_found")
                    .jsonPath("$.available_tools[0]").isEqualTo("list_my_sheets")
                    .jsonPath("$.available_tools[1]").isEqualTo("get_sheet_summary")
                    .jsonPath("$.tool").doesNotExist();
        }

        @Test
        @DisplayName("a key without the tool's scope is 403")
        void missingScope() {
            upstream.json(VALIDATE_PATH, HttpStatus.OK, validResponse("u2", "mcp:write"));

            callTool("list_my_sheets", "{}")
                    .expectStatus().isForbidden()
                    .expectBody().jsonPath("$.error").isEqualTo("insufficient_permissions");
            assertThat(upstream.hits(SHEETS)).isZero();
        }

        @Test
        @DisplayName("invalid parameters are 400 naming the fields")
        void invalidParameters() {
            callTool("list_my_sheets", "{\"arguments\":{\"limit\":0,\"filter\":\"nope\"}}")
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("invalid_parameters")
                    .jsonPath("$.details.limit").exists()
                    .jsonPath("$.details.filter").exists();
        }

        @Test
        @DisplayName("non-object arguments are 400")
        void argumentsNotObject() {
            callTool("list_my_sheets", "{\"arguments\":[1,2]}")
                    .expectStatus().isBadRequest()
                    .expectBody().jsonPath("$.details.arguments").isEqualTo("must be an object");
        }

        @Test
        @DisplayName("a backend 401 is 401 and evicts the cached credential")
        void backendRevoked() {
            upstream.json(SHEETS, HttpStatus.UNAUTHORIZED, "{\"detail\":\"internal stack trace\"}");

            callTool("list_my_sheets", "{}")
                    .expectStatus().isUnauthorized()
                    .expectBody(String.class)
                    .value(body -> assertThat(body).doesNotContain("internal stack trace"));

            assertThat(cache.get(new Credential(KEY))).isEmpty();
        }

        @Test
        @DisplayName("the request past the window limit is 429 with Retry-After")
        void rateLimited() {
            properties.getRateLimit().setMaxRequests(3);
            build();

            for (int i = 0; i < 3; i++) {
                callTool("list_my_sheets", "{}").expectStatus().isOk();
            }
            callTool("list_my_sheets", "{}")
                    .expectStatus().isEqualTo(HttpStatus.TOO_MANY_REQUESTS)
                    .expectHeader().valueEquals(HttpHeaders.RETRY_AFTER, "60")
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("rate_limit_exceeded")
                    .jsonPath("$.retry_after").isEqualTo(60);
        }
    }

    @Nested
    @DisplayName("authenticated discovery")
    class Discovery {

        @Test
        @DisplayName("GET /mcp/tools lists descriptors in registration order")
        void listTools() {
            client.get().uri("/mcp/tools")
                    .header(CredentialExtractor.API_KEY_HEADER, KEY)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.total_count").isEqualTo(2)
                    .jsonPath("$.tools[0].name").isEqualTo("list_my_sheets")
                    .jsonPath("$.tools[0].inputSchema.properties.filter.enum").isArray()
                    .jsonPath("$.user_id").isEqualTo("u1");
        }

        @Test
        @DisplayName("POST /mcp/initialize returns protocol and user info")
        void initialize() {
            client.post().uri("/mcp/initialize")
                    .header(HttpHeaders.AUTHORIZATION, KEY)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.protocolVersion").isEqualTo("1.0.0")
                    .jsonPath("$.serverInfo.name").isEqualTo("gastoscompartidos-mcp-server")
                    .jsonPath("$.user.id").isEqualTo("u1")
                    .jsonPath("$.user.scopes[0]").isEqualTo("mcp:read");
        }

        @Test
        @DisplayName("GET /mcp/tools without a key is 401")
        void listToolsUnauthenticated() {
            client.get().uri("/mcp/tools")
                    .exchange()
                    .expectStatus().isUnauthorized();
        }
    }

    @Nested
    @DisplayName("public routes")
    class PublicRoutes {

        @Test
        @DisplayName("GET /health is 200 with cache stats when the backend answers")
        void healthy() {
            client.get().uri("/health")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("healthy")
                    .jsonPath("$.backend.connectivity").isEqualTo("ok")
                    .jsonPath("$.cache.ttl_ms").isEqualTo(300000)
                    .jsonPath("$.tools[0]").isEqualTo("list_my_sheets");
        }

        @Test
        @DisplayName("GET /health is 503 degraded when the backend is unreachable")
        void degraded() {
            upstream.never("/health");

            client.get().uri("/health")
                    .exchange()
                    .expectStatus().isEqualTo(HttpStatus.SERVICE_UNAVAILABLE)
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("degraded")
                    .jsonPath("$.backend.reachable").isEqualTo(false);
        }

        @Test
        @DisplayName("GET /mcp/schema needs no credential")
        void schema() {
            client.get().uri("/mcp/schema")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.capabilities.tools").isEqualTo(true)
                    .jsonPath("$.tools[1].name").isEqualTo("get_sheet_summary")
                    .jsonPath("$.rate_limiting.max_requests").isEqualTo(100);
            assertThat(upstream.hits(VALIDATE_PATH)).isZero();
        }

        @Test
        @DisplayName("public routes share the rate limit")
        void publicRateLimited() {
            properties.getRateLimit().setMaxRequests(1);
            build();

            client.get().uri("/").exchange().expectStatus().isOk();
            client.get().uri("/").exchange()
                    .expectStatus().isEqualTo(HttpStatus.TOO_MANY_REQUESTS)
                    .expectHeader().exists(HttpHeaders.RETRY_AFTER);
        }
    }

    @Nested
    @DisplayName("request bodies")
    class RequestBodies {

        @Test
        @DisplayName("a text/plain body without a credential is 401 and audited")
        void textPlainUnauthenticated() {
            client.post().uri("/mcp/tools/list_my_sheets")
                    .contentType(MediaType.TEXT_PLAIN)
                    .bodyValue("{\"arguments\":{}}")
                    .exchange()
                    .expectStatus().isUnauthorized()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(false)
                    .jsonPath("$.error").isEqualTo("authentication_required");

            AuditEvent event = lastAudit();
            assertThat(event.success()).isFalse();
            assertThat(event.outcome()).isEqualTo("authentication_required");
            assertThat(event.tool()).isEqualTo("list_my_sheets");
        }

        @Test
        @DisplayName("a text/plain JSON body with a credential runs the tool with its arguments")
        void textPlainAuthenticated() {
            client.post().uri("/mcp/tools/list_my_sheets")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + KEY)
                    .contentType(MediaType.TEXT_PLAIN)
                    .bodyValue("{\"arguments\":{\"limit\":5}}")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody().jsonPath("$.success").isEqualTo(true);

            assertThat(upstream.lastRequest(SHEETS).url().getQuery()).isEqualTo("filter=all&limit=5");
            assertThat(lastAudit().success()).isTrue();
        }

        @Test
        @DisplayName("a body that is not JSON is 400 once the caller is authenticated")
        void notJson() {
            client.post().uri("/mcp/tools/list_my_sheets")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + KEY)
                    .contentType(MediaType.TEXT_PLAIN)
                    .bodyValue("limit=5")
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("invalid_parameters")
                    .jsonPath("$.details.body").isEqualTo("must be a JSON object");

            assertThat(upstream.hits(VALIDATE_PATH)).isEqualTo(1);
            assertThat(upstream.hits(SHEETS)).isZero();
            AuditEvent event = lastAudit();
            assertThat(event.outcome()).isEqualTo("invalid_parameters");
            assertThat(event.userId()).isEqualTo("u1");
        }

        @Test
        @DisplayName("a JSON array body is 400")
        void arrayBody() {
            callTool("list_my_sheets", "[1,2]")
                    .expectStatus().isBadRequest()
                    .expectBody().jsonPath("$.details.body").isEqualTo("must be a JSON object");
        }
    }

    @Nested
    @DisplayName("unmatched routes")
    class UnmatchedRoutes {

        @Test
        @DisplayName("an unknown path is 404 not_found listing the routes, and is audited")
        void unknownPath() {
            client.get().uri("/mcp/unknown")
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(false)
                    .jsonPath("$.error").isEqualTo("not_found")
                    .jsonPath("$.message").isEqualTo(properties.getMessages().getNotFound())
                    .jsonPath("$.available_endpoints[0]").isEqualTo("GET /health")
                    .jsonPath("$.available_endpoints[3]").isEqualTo("POST /mcp/tools/{tool_name}")
                    .jsonPath("$.environment").isEqualTo("test");

            AuditEvent event = lastAudit();
            assertThat(event.success()).isFalse();
            assertThat(event.outcome()).isEqualTo("not_found");
            assertThat(event.endpoint()).isEqualTo("GET /mcp/unknown");
        }

        @Test
        @DisplayName("a known path with the wrong method is 404 not_found")
        void wrongMethod() {
            client.post().uri("/health")
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody().jsonPath("$.error").isEqualTo("not_found");

            assertThat(lastAudit().outcome()).isEqualTo("not_found");
            assertThat(upstream.hits("/health")).isZero();
        }
    }
}
