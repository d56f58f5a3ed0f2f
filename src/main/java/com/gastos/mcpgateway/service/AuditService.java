package com.gastos.mcpgateway.service;

import com.gastos.mcpgateway.error.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Audit trail of gateway calls.
 * One record per terminal outcome, written to the dedicated "audit" logger.
 */
@Service
public class AuditService {
    private static final Logger auditLog = LoggerFactory.getLogger("audit");

    public static final String OUTCOME_SUCCESS = "success";

    /**
     * Record one terminal outcome.
     */
    public void record(AuditEvent event) {
        if (event.success()) {
            auditLog.info("endpoint={} tool={} userId={} keyId={} success=true outcome={} latencyMs={} clientIp={}",
                    event.endpoint(), event.tool(), event.userId(), event.keyId(),
                    event.outcome(), event.latencyMs(), event.clientIp());
        } else {
            auditLog.warn("endpoint={} tool={} userId={} keyId={} success=false outcome={} latencyMs={} clientIp={}",
                    event.endpoint(), event.tool(), event.userId(), event.keyId(),
                    event.outcome(), event.latencyMs(), event.clientIp());
        }
    }

    /**
     * @param tool    tool name, null for non-tool endpoints
     * @param userId  null when the caller was never authenticated
     * @param outcome {@link #OUTCOME_SUCCESS} or an {@link ErrorKind} wire code
     */
    public record AuditEvent(
            String endpoint,
            String tool,
            String userId,
            String keyId,
            boolean success,
            String outcome,
            long latencyMs,
            String clientIp
    ) {

        public static AuditEvent success(String endpoint, String tool, String userId, String keyId,
                                         long latencyMs, String clientIp) {
            return new AuditEvent(endpoint, tool, userId, keyId, true, OUTCOME_SUCCESS, latencyMs, clientIp);
        }

        public static AuditEvent failure(String endpoint, String tool, String userId, String keyId,
                                         ErrorKind kind, long latencyMs, String clientIp) {
            return new AuditEvent(endpoint, tool, userId, keyId, false, kind.code(), latencyMs, clientIp);
        }
    }
}
