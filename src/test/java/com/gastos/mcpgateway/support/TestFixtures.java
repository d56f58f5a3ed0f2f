package com.gastos.mcpgateway.support;

import com.gastos.mcpgateway.config.GwProperties;
import com.gastos.mcpgateway.model.AuthRecord;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

public final class TestFixtures {

    public static final String BACKEND_URL = "http://backend.test";
    public static final String VALIDATE_PATH = "/api/mcp/validate-key";
    public static final String API_PREFIX = "/api/agent/v1";

    private TestFixtures() {
    }

    public static GwProperties properties() {
        GwProperties properties = new GwProperties();
        properties.setBackendBaseUrl(BACKEND_URL);
        properties.setEnvironment("test");
        return properties;
    }

    public static AuthRecord authRecord(String userId, String... scopes) {
        return new AuthRecord(userId, Map.of("id", userId, "name", "Ana"), "key-" + userId,
                Set.of(scopes), "standard", Instant.parse("2026-01-01T00:00:00Z"));
    }

    public static String validResponse(String userId, String... scopes) {
        StringBuilder scopeList = new StringBuilder();
        for (String scope : scopes) {
            if (scopeList.length() > 0) {
                scopeList.append(',');
            }
            scopeList.append('"').append(scope).append('"');
        }
        return "{\"valid\":true,\"user\":{\"id\":\"" + userId + "\",\"name\":\"Ana\",\"email\":null},"
                + "\"key_id\":\"key-" + userId + "\",\"scopes\":[" + scopeList + "],"
                + "\"rate_limit_tier\":\"standard\"}";
    }
}
