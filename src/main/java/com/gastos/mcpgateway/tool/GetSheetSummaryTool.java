package com.gastos.mcpgateway.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gastos.mcpgateway.model.RequestContext;
import com.gastos.mcpgateway.model.ToolDescriptor;
import com.gastos.mcpgateway.model.ToolParameter;
import com.gastos.mcpgateway.model.ToolParameter.ParamType;
import com.gastos.mcpgateway.service.BackendProxyClient;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

/**
 * Detailed summary of one sheet.
 *
 * The sheet state is required; balance, participants and recent events are enrichments
 * fetched in parallel. A failed enrichment falls back to an empty structure and is named
 * in the result's {@code degraded} list.
 */
@Component
public class GetSheetSummaryTool extends AbstractBackendTool {

    public static final String NAME = "get_sheet_summary";

    static final String BALANCE = "balance";
    static final String PARTICIPANTS = "participants";
    static final String RECENT_EVENTS = "recent_events";

    static final ToolDescriptor DESCRIPTOR = new ToolDescriptor(
            NAME,
            "Obtener resumen detallado de una hoja de gastos específica: balance, participantes "
                    + "y últimos movimientos.",
            List.of(
                    ToolParameter.of("sheet_id", ParamType.STRING, "ID único de la hoja de gastos a consultar")
                            .asRequired(),
                    ToolParameter.of("include_suggestions", ParamType.BOOLEAN,
                                    "Incluir sugerencias de próximas acciones")
                            .withDefault(true)
            ),
            READ_SCOPE
    );

    public GetSheetSummaryTool(BackendProxyClient backend, ObjectMapper objectMapper, Clock clock) {
        super(DESCRIPTOR, backend, objectMapper, clock);
    }

    @Override
    protected Mono<JsonNode> execute(Map<String, Object> params, RequestContext context) {
        String sheetId = (String) params.get("sheet_id");
        boolean includeSuggestions = Boolean.TRUE.equals(params.get("include_suggestions"));
        List<String> degraded = new ArrayList<>();

        Mono<JsonNode> state = get(sheetPath(sheetId, "state")
                .queryParam("include_suggestions", includeSuggestions)
                .toUriString(), context);

        return state.flatMap(stateNode -> Mono.zip(
                        optional(BALANCE, get(sheetPath(sheetId, "balance").toUriString(), context),
                                emptyBalance(), degraded),
                        optional(PARTICIPANTS, get(sheetPath(sheetId, "participants").toUriString(), context),
                                emptyParticipants(), degraded),
                        optional(RECENT_EVENTS, get(sheetPath(sheetId, "events")
                                        .queryParam("limit", 5).toUriString(), context),
                                emptyEvents(), degraded))
                .map(parts -> toResult(sheetId, stateNode, parts.getT1(), parts.getT2(), parts.getT3(),
                        includeSuggestions, degraded)));
    }

    private static UriComponentsBuilder sheetPath(String sheetId, String resource) {
        return UriComponentsBuilder.fromPath("/sheets").pathSegment(sheetId, resource);
    }

    private JsonNode toResult(String sheetId, JsonNode state, JsonNode balance, JsonNode participants,
                              JsonNode events, boolean includeSuggestions, List<String> degraded) {
        ObjectNode result = objectMapper.createObjectNode();
        result.put("success", true);
        result.put("message", "Resumen de hoja obtenido exitosamente");

        ObjectNode sheet = result.putObject("sheet");
        sheet.put("id", sheetId);
        copyIfPresent(state, sheet, "type");
        copyIfPresent(state, sheet, "status");
        copyIfPresent(state, sheet, "period_info");
        sheet.put("pending_items_count", state.path("pending_items_count").asInt(0));
        sheet.set("balance", balance);
        sheet.set("participants", participants);
        sheet.set("recent_activity", events);
        if (includeSuggestions) {
            JsonNode nextSteps = state.path("next_steps");
            sheet.set("next_steps", nextSteps.isArray() ? nextSteps : objectMapper.createArrayNode());
        }

        List<String> failed;
        synchronized (degraded) {
            failed = List.copyOf(degraded);
        }
        result.set("degraded", objectMapper.valueToTree(failed));
        return result;
    }

    private static void copyIfPresent(JsonNode from, ObjectNode to, String field) {
        JsonNode value = from.get(field);
        if (value != null && !value.isNull()) {
            to.set(field, value);
        }
    }

    private JsonNode emptyBalance() {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("is_balanced", false);
        node.putArray("participants");
        node.putArray("settlements_needed");
        return node;
    }

    private JsonNode emptyParticipants() {
        ObjectNode node = objectMapper.createObjectNode();
        node.putArray("participants");
        node.putObject("summary").put("total_count", 0);
        return node;
    }

    private JsonNode emptyEvents() {
        ObjectNode node = objectMapper.createObjectNode();
        node.putArray("events");
        return node;
    }
}
