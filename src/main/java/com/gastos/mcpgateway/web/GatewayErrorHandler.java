package com.gastos.mcpgateway.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebExceptionHandler;
import reactor.core.publisher.Mono;

/**
 * Writes the gateway error envelope for failures no route handler answered, such as unmatched
 * routes and unsupported methods. Runs ahead of the Boot error handler (order -1).
 */
@Component
@Order(-2)
public class GatewayErrorHandler implements WebExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GatewayErrorHandler.class);

    private final ToolDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    public GatewayErrorHandler(ToolDispatcher dispatcher, ObjectMapper objectMapper) {
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> handle(ServerWebExchange exchange, Throwable ex) {
        ServerHttpResponse response = exchange.getResponse();
        if (response.isCommitted()) {
            return Mono.error(ex);
        }

        ResponseEntity<Object> entity = dispatcher.handleUnrouted(ex, exchange.getRequest());
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(entity.getBody());
        } catch (JsonProcessingException e) {
            log.error("Failed to write error envelope for {}", exchange.getRequest().getPath(), e);
            return Mono.error(ex);
        }

        response.setStatusCode(entity.getStatusCode());
        response.getHeaders().addAll(entity.getHeaders());
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        return response.writeWith(Mono.just(response.bufferFactory().wrap(bytes)));
    }
}
