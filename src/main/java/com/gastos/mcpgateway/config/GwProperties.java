package com.gastos.mcpgateway.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "gw")
@Validated
public class GwProperties {

    // Agent API base URL, also hosts the key validation endpoint. Startup fails without it.
    @NotBlank
    private String backendBaseUrl;

    private String environment = "development";

    // "*" or a comma-separated list of origins
    private String corsOrigins = "*";

    @Valid
    private RateLimitConfig rateLimit = new RateLimitConfig();
    @Valid
    private CacheConfig cache = new CacheConfig();
    private IdentityConfig identity = new IdentityConfig();
    private BackendConfig backend = new BackendConfig();
    private ToolsConfig tools = new ToolsConfig();
    private SecurityConfig security = new SecurityConfig();
    private McpConfig mcp = new McpConfig();
    private Messages messages = new Messages();

    public String getBackendBaseUrl() {
        return backendBaseUrl;
    }

    public void setBackendBaseUrl(String backendBaseUrl) {
        this.backendBaseUrl = backendBaseUrl;
    }

    public String getEnvironment() {
        return environment;
    }

    public void setEnvironment(String environment) {
        this.environment = environment;
    }

    public String getCorsOrigins() {
        return corsOrigins;
    }

    public void setCorsOrigins(String corsOrigins) {
        this.corsOrigins = corsOrigins;
    }

    /**
     * Parsed CORS origins; a single "*" entry means any origin.
     */
    public List<String> corsOriginList() {
        if (corsOrigins == null || corsOrigins.isBlank()) {
            return List.of("*");
        }
        return Arrays.stream(corsOrigins.split(","))
                .map(String::trim)
                .filter(origin -> !origin.isEmpty())
                .toList();
    }

    public RateLimitConfig getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimitConfig rateLimit) {
        this.rateLimit = rateLimit;
    }

    public CacheConfig getCache() {
        return cache;
    }

    public void setCache(CacheConfig cache) {
        this.cache = cache;
    }

    public IdentityConfig getIdentity() {
        return identity;
    }

    public void setIdentity(IdentityConfig identity) {
        this.identity = identity;
    }

    public BackendConfig getBackend() {
        return backend;
    }

    public void setBackend(BackendConfig backend) {
        this.backend = backend;
    }

    public ToolsConfig getTools() {
        return tools;
    }

    public void setTools(ToolsConfig tools) {
        this.tools = tools;
    }

    public SecurityConfig getSecurity() {
        return security;
    }

    public void setSecurity(SecurityConfig security) {
        this.security = security;
    }

    public McpConfig getMcp() {
        return mcp;
    }

    public void setMcp(McpConfig mcp) {
        this.mcp = mcp;
    }

    public Messages getMessages() {
        return messages;
    }

    public void setMessages(Messages messages) {
        this.messages = messages;
    }

    // ==================== Nested Config Classes ====================

    /**
     * Fixed-window rate limiting per client IP.
     */
    public static class RateLimitConfig {
        @Min(1)
        private long windowMs = 60_000;

        @Min(1)
        private int maxRequests = 100;

        public long getWindowMs() {
            return windowMs;
        }

        public void setWindowMs(long windowMs) {
            this.windowMs = windowMs;
        }

        public int getMaxRequests() {
            return maxRequests;
        }

        public void setMaxRequests(int maxRequests) {
            this.maxRequests = maxRequests;
        }

        public Duration window() {
            return Duration.ofMillis(windowMs);
        }
    }

    /**
     * Credential validation cache.
     */
    public static class CacheConfig {
        @Min(1)
        private long apiKeyTtlMs = 5 * 60 * 1000;  // 5 minutes

        // 0 means 10 x ttl
        @Min(0)
        private long sweepIntervalMs = 0;

        // 0 disables background revalidation of cached records
        @Min(0)
        private long revalidateAfterMs = 0;

        public long getApiKeyTtlMs() {
            return apiKeyTtlMs;
        }

        public void setApiKeyTtlMs(long apiKeyTtlMs) {
            this.apiKeyTtlMs = apiKeyTtlMs;
        }

        public long getSweepIntervalMs() {
            return sweepIntervalMs;
        }

        public void setSweepIntervalMs(long sweepIntervalMs) {
            this.sweepIntervalMs = sweepIntervalMs;
        }

        public long getRevalidateAfterMs() {
            return revalidateAfterMs;
        }

        public void setRevalidateAfterMs(long revalidateAfterMs) {
            this.revalidateAfterMs = revalidateAfterMs;
        }

        public Duration ttl() {
            return Duration.ofMillis(apiKeyTtlMs);
        }

        public Duration sweepInterval() {
            return sweepIntervalMs > 0 ? Duration.ofMillis(sweepIntervalMs) : ttl().multipliedBy(10);
        }

        public Duration revalidateAfter() {
            return Duration.ofMillis(revalidateAfterMs);
        }
    }

    /**
     * Remote key validation endpoint, hosted on the backend base URL.
     */
    public static class IdentityConfig {
        private String validationPath = "/api/mcp/validate-key";
        private long timeoutMs = 10_000;

        public String getValidationPath() {
            return validationPath;
        }

        public void setValidationPath(String validationPath) {
            this.validationPath = validationPath;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public Duration timeout() {
            return Duration.ofMillis(timeoutMs);
        }
    }

    /**
     * Outbound agent API calls made by tools.
     */
    public static class BackendConfig {
        private String apiPrefix = "/api/agent/v1";
        private long timeoutMs = 10_000;
        private String healthPath = "/health";
        private long probeTimeoutMs = 5_000;

        // {userId} is replaced with the resolved user id
        private String serviceToken = "mcp_service_token_{userId}";

        private String userAgent = "GastosCompartidos-MCP-Server/1.0";

        public String getApiPrefix() {
            return apiPrefix;
        }

        public void setApiPrefix(String apiPrefix) {
            this.apiPrefix = apiPrefix;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public String getHealthPath() {
            return healthPath;
        }

        public void setHealthPath(String healthPath) {
            this.healthPath = healthPath;
        }

        public long getProbeTimeoutMs() {
            return probeTimeoutMs;
        }

        public void setProbeTimeoutMs(long probeTimeoutMs) {
            this.probeTimeoutMs = probeTimeoutMs;
        }

        public String getServiceToken() {
            return serviceToken;
        }

        public void setServiceToken(String serviceToken) {
            this.serviceToken = serviceToken;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }

        public Duration timeout() {
            return Duration.ofMillis(timeoutMs);
        }

        public Duration probeTimeout() {
            return Duration.ofMillis(probeTimeoutMs);
        }
    }

    public static class ToolsConfig {
        private int defaultLimit = 20;
        private int maxLimit = 100;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }
    }

    public static class SecurityConfig {
        private boolean headersEnabled = true;

        public boolean isHeadersEnabled() {
            return headersEnabled;
        }

        public void setHeadersEnabled(boolean headersEnabled) {
            this.headersEnabled = headersEnabled;
        }
    }

    /**
     * Server metadata reported by discovery and initialize.
     */
    public static class McpConfig {
        private String name = "gastoscompartidos-mcp-server";
        private String version = "1.0.0";
        private String description = "MCP Server for Gastos Compartidos - Manage your shared expenses via LLM agents";
        private String protocolVersion = "1.0.0";

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getProtocolVersion() {
            return protocolVersion;
        }

        public void setProtocolVersion(String protocolVersion) {
            this.protocolVersion = protocolVersion;
        }
    }

    /**
     * User-facing message catalog, one entry per error kind.
     */
    public static class Messages {
        private String authenticationFailed = "Autenticación fallida. Verificá tu API key.";
        private String insufficientPermissions = "No tenés permisos para realizar esta acción.";
        private String notFound = "Recurso no encontrado o sin acceso.";
        private String invalidParameters = "Parámetros inválidos en la petición.";
        private String serverError = "Error interno del servidor. Intentá nuevamente.";
        private String rateLimitExceeded = "Límite de peticiones excedido. Esperá un momento.";
        private String serviceUnavailable = "Servicio temporalmente no disponible. Intentá más tarde.";

        public String getAuthenticationFailed() {
            return authenticationFailed;
        }

        public void setAuthenticationFailed(String authenticationFailed) {
            this.authenticationFailed = authenticationFailed;
        }

        public String getInsufficientPermissions() {
            return insufficientPermissions;
        }

        public void setInsufficientPermissions(String insufficientPermissions) {
            this.insufficientPermissions = insufficientPermissions;
        }

        public String getNotFound() {
            return notFound;
        }

        public void setNotFound(String notFound) {
            this.notFound = notFound;
        }

        public String getInvalidParameters() {
            return invalidParameters;
        }

        public void setInvalidParameters(String invalidParameters) {
            this.invalidParameters = invalidParameters;
        }

        public String getServerError() {
            return serverError;
        }

        public void setServerError(String serverError) {
            this.serverError = serverError;
        }

        public String getRateLimitExceeded() {
            return rateLimitExceeded;
        }

        public void setRateLimitExceeded(String rateLimitExceeded) {
            this.rateLimitExceeded = rateLimitExceeded;
        }

        public String getServiceUnavailable() {
            return serviceUnavailable;
        }

        public void setServiceUnavailable(String serviceUnavailable) {
            this.serviceUnavailable = serviceUnavailable;
        }
    }
}
