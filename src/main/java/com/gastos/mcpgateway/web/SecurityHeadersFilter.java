package com.gastos.mcpgateway.web;

import com.gastos.mcpgateway.config.GwProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Adds hardening response headers to every response, unless disabled with
 * gw.security.headers-enabled=false.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class SecurityHeadersFilter implements WebFilter {
    private static final Logger log = LoggerFactory.getLogger(SecurityHeadersFilter.class);

    private final boolean enabled;

    public SecurityHeadersFilter(GwProperties properties) {
        this.enabled = properties.getSecurity().isHeadersEnabled();
        if (!enabled) {
            log.warn("Security response headers are disabled");
        }
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (enabled) {
            HttpHeaders headers = exchange.getResponse().getHeaders();
            headers.set("X-Content-Type-Options", "nosniff");
            headers.set("X-Frame-Options", "SAMEORIGIN");
            headers.set("X-DNS-Prefetch-Control", "off");
            headers.set("X-Download-Options", "noopen");
            headers.set("X-Permitted-Cross-Domain-Policies", "none");
            headers.set("Referrer-Policy", "no-referrer");
            headers.set("Strict-Transport-Security", "max-age=15552000; includeSubDomains");
            headers.set("Content-Security-Policy", "default-src 'self'; frame-ancestors 'self'; object-src 'none'");
            headers.set("Cross-Origin-Opener-Policy", "same-origin");
            headers.set("Cross-Origin-Resource-Policy", "same-origin");
        }
        return chain.filter(exchange);
    }
}
