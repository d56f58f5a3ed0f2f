package com.gastos.mcpgateway.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gastos.mcpgateway.model.ToolParameter.ParamType;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ToolDescriptor")
class ToolDescriptorTest {

    @Test
    @DisplayName("renders a JSON-schema input object with required fields")
    @SuppressWarnings("unchecked")
    void inputSchema() {
        ToolDescriptor descriptor = new ToolDescriptor("demo", "Demo tool", List.of(
                ToolParameter.of("id", ParamType.STRING, "identifier").asRequired(),
                ToolParameter.of("limit", ParamType.INTEGER, "max rows").between(1, 50).withDefault(10)
        ), "mcp:read");

        Map<String, Object> schema = descriptor.inputSchema();

        assertThat(schema).containsEntry("type", "object").containsEntry("required", List.of("id"));
        Map<String, Object> properties = (Map<String, Object>) schema.get("properties");
        assertThat(properties).containsOnlyKeys("id", "limit");
        assertThat((Map<String, Object>) properties.get("limit"))
                .containsEntry("type", "integer")
                .containsEntry("minimum", 1.0)
                .containsEntry("maximum", 50.0)
                .containsEntry("default", 10);
        assertThat(descriptor.schema()).containsKeys("name", "description", "inputSchema");
    }

    @Test
    @DisplayName("rejects a blank name")
    void blankName() {
        assertThatThrownBy(() -> new ToolDescriptor(" ", "x", List.of(), null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("mcp:admin satisfies any scope")
    void adminScope() {
        AuthRecord admin = new AuthRecord("u1", Map.of(), "k", Set.of(AuthRecord.ADMIN_SCOPE), null, Instant.EPOCH);

        assertThat(admin.hasScope("mcp:read")).isTrue();
    }
}
