package com.gastos.mcpgateway.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gastos.mcpgateway.config.GwProperties;
import com.gastos.mcpgateway.model.RequestContext;
import com.gastos.mcpgateway.model.ToolDescriptor;
import com.gastos.mcpgateway.model.ToolParameter;
import com.gastos.mcpgateway.model.ToolParameter.ParamType;
import com.gastos.mcpgateway.service.BackendProxyClient;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

/**
 * Lists the expense sheets visible to the caller, with counts by type and status.
 */
@Component
public class ListMySheetsTool extends AbstractBackendTool {

    public static final String NAME = "list_my_sheets";

    public ListMySheetsTool(BackendProxyClient backend, ObjectMapper objectMapper, GwProperties properties,
                            Clock clock) {
        super(descriptor(properties.getTools()), backend, objectMapper, clock);
    }

    static ToolDescriptor descriptor(GwProperties.ToolsConfig tools) {
        return new ToolDescriptor(
                NAME,
                "Obtener todas las hojas de gastos del usuario. Incluye hojas propias, compartidas y donde participa.",
                List.of(
                        ToolParameter.of("filter", ParamType.STRING,
                                        "Filtrar hojas por tipo: all, owned, shared, archived, favorites")
                                .oneOf("all", "owned", "shared", "archived", "favorites")
                                .withDefault("all"),
                        ToolParameter.of("limit", ParamType.INTEGER,
                                        "Número máximo de hojas a retornar (máximo " + tools.getMaxLimit() + ")")
                                .between(1, tools.getMaxLimit())
                                .withDefault(tools.getDefaultLimit())
                ),
                READ_SCOPE
        );
    }

    @Override
    protected Mono<JsonNode> execute(Map<String, Object> params, RequestContext context) {
        String endpoint = UriComponentsBuilder.fromPath("/sheets")
                .queryParam("filter", params.get("filter"))
                .queryParam("limit", ((Number) params.get("limit")).intValue())
                .build()
                .toUriString();

        return get(endpoint, context).map(this::toResult);
    }

    private JsonNode toResult(JsonNode response) {
        // the backend answers either a bare array or {"sheets": [...]}
        JsonNode sheets = response.isArray() ? response : response.path("sheets");
        ArrayNode list = sheets.isArray() ? (ArrayNode) sheets.deepCopy() : objectMapper.createArrayNode();

        ObjectNode byType = objectMapper.createObjectNode();
        ObjectNode byStatus = objectMapper.createObjectNode();
        for (JsonNode sheet : list) {
            increment(byType, sheet.path("type").asText("unknown"));
            increment(byStatus, sheet.path("status").asText("active"));
        }

        ObjectNode result = objectMapper.createObjectNode();
        result.put("success", true);
        result.put("message", "Se encontraron " + list.size() + " hojas de gastos");
        result.set("sheets", list);
        ObjectNode summary = result.putObject("summary");
        summary.put("total_sheets", list.size());
        summary.set("by_type", byType);
        summary.set("by_status", byStatus);
        return result;
    }

    private static void increment(ObjectNode counts, String key) {
        counts.put(key, counts.path(key).asInt(0) + 1);
    }
}
