package com.gastos.mcpgateway.tool;

import static com.gastos.mcpgateway.support.TestFixtures.API_PREFIX;
import static com.gastos.mcpgateway.support.TestFixtures.authRecord;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gastos.mcpgateway.config.GwProperties;
import com.gastos.mcpgateway.model.RequestContext;
import com.gastos.mcpgateway.model.ToolParameter;
import com.gastos.mcpgateway.service.BackendProxyClient;
import com.gastos.mcpgateway.support.MutableClock;
import com.gastos.mcpgateway.support.StubExchangeFunction;
import com.gastos.mcpgateway.support.TestFixtures;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

@DisplayName("list_my_sheets")
class ListMySheetsToolTest {

    private StubExchangeFunction backend;
    private ListMySheetsTool tool;
    private RequestContext context;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        GwProperties properties = TestFixtures.properties();
        properties.getTools().setMaxLimit(50);
        backend = new StubExchangeFunction();
        ObjectMapper mapper = new ObjectMapper();
        tool = new ListMySheetsTool(new BackendProxyClient(backend.builder(), mapper, properties, clock),
                mapper, properties, clock);
        context = new RequestContext(authRecord("u1", "mcp:read"), "10.0.0.1", clock.instant());
    }

    @Test
    @DisplayName("declares filter and limit bounded by the configured maximum")
    void descriptor() {
        assertThat(tool.descriptor().name()).isEqualTo("list_my_sheets");
        assertThat(tool.descriptor().requiredScope()).isEqualTo("mcp:read");
        ToolParameter limit = tool.descriptor().parameters().get(1);
        assertThat(limit.maximum()).isEqualTo(50.0);
        assertThat(limit.defaultValue()).isEqualTo(20);
    }

    @Test
    @DisplayName("queries the backend with filter and limit and summarises by type and status")
    void summarises() {
        backend.json(API_PREFIX + "/sheets", HttpStatus.OK, """
                {"sheets":[
                  {"id":"s1","type":"shared","status":"active"},
                  {"id":"s2","type":"shared","status":"archived"},
                  {"id":"s3","type":"personal"}
                ]}
                """);

        Map<String, Object> params = tool.validateParams(Map.of("filter", "owned", "limit", 5));

        StepVerifier.create(tool.invoke(params, context))
                .assertNext(result -> {
                    assertThat(result.path("success").asBoolean()).isTrue();
                    assertThat(result.path("sheets")).hasSize(3);
                    assertThat(result.at("/summary/total_sheets").asInt()).isEqualTo(3);
                    assertThat(result.at("/summary/by_type/shared").asInt()).isEqualTo(2);
                    assertThat(result.at("/summary/by_status/active").asInt()).isEqualTo(2);
                })
                .verifyComplete();

        assertThat(backend.lastRequest(API_PREFIX + "/sheets").url().getQuery()).isEqualTo("filter=owned&limit=5");
    }

    @Test
    @DisplayName("accepts a bare array response")
    void bareArray() {
        backend.json(API_PREFIX + "/sheets", HttpStatus.OK, "[{\"id\":\"s1\",\"type\":\"shared\"}]");

        StepVerifier.create(tool.invoke(tool.validateParams(Map.of()), context))
                .assertNext(result -> assertThat(result.at("/summary/total_sheets").asInt()).isEqualTo(1))
                .verifyComplete();
    }
}
