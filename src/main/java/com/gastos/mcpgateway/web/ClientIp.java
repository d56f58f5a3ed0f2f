package com.gastos.mcpgateway.web;

import java.net.InetSocketAddress;
import org.springframework.http.server.reactive.ServerHttpRequest;

/**
 * Client address used as the rate-limit key and in audit records.
 *
 * Proxy headers are not read here: with server.forward-headers-strategy=framework the
 * remote address has already been rewritten from X-Forwarded-For by a trusted proxy.
 */
public final class ClientIp {

    public static final String UNKNOWN = "unknown";

    private ClientIp() {
    }

    public static String resolve(ServerHttpRequest request) {
        InetSocketAddress remoteAddress = request.getRemoteAddress();
        if (remoteAddress == null) {
            return UNKNOWN;
        }
        if (remoteAddress.getAddress() != null) {
            return remoteAddress.getAddress().getHostAddress();
        }
        String host = remoteAddress.getHostString();
        return host != null && !host.isBlank() ? host : UNKNOWN;
    }
}
