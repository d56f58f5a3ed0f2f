package com.gastos.mcpgateway.web;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * One access-log line per request. Headers are never logged, so credentials stay out of the log.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestLogFilter implements WebFilter {
    private static final Logger log = LoggerFactory.getLogger(RequestLogFilter.class);

    private final Clock clock;

    public RequestLogFilter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        long start = clock.millis();
        ServerHttpRequest request = exchange.getRequest();
        return chain.filter(exchange)
                .doFinally(signal -> {
                    HttpStatusCode status = exchange.getResponse().getStatusCode();
                    log.info("method={} path={} status={} latency={}ms ip={} userAgent=\"{}\"",
                            request.getMethod(),
                            request.getPath().value(),
                            status != null ? status.value() : "n/a",
                            clock.millis() - start,
                            ClientIp.resolve(request),
                            request.getHeaders().getFirst(HttpHeaders.USER_AGENT));
                });
    }
}
