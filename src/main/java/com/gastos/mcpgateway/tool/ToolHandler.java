package com.gastos.mcpgateway.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.gastos.mcpgateway.model.RequestContext;
import com.gastos.mcpgateway.model.ToolDescriptor;
import java.util.Map;
import reactor.core.publisher.Mono;

/**
 * A named operation callers can invoke through the gateway.
 */
public interface ToolHandler {

    ToolDescriptor descriptor();

    /**
     * Apply defaults, coerce types and check bounds.
     *
     * @param raw caller-supplied arguments, never null
     * @return the parameters to pass to {@link #invoke}
     * @throws com.gastos.mcpgateway.error.InvalidParametersException naming every offending field
     */
    Map<String, Object> validateParams(Map<String, Object> raw);

    /**
     * Run the tool for an authenticated caller.
     * Backend failures surface as {@link com.gastos.mcpgateway.error.ProxyException}.
     */
    Mono<JsonNode> invoke(Map<String, Object> params, RequestContext context);
}
