package com.gastos.mcpgateway.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-request context binding the resolved identity and the start time.
 * Created by the dispatcher after validation and discarded with the response.
 */
public class RequestContext {

    private final AuthRecord authRecord;
    private final String clientIp;
    private final Instant startedAt;

    public RequestContext(AuthRecord authRecord, String clientIp, Instant startedAt) {
        this.authRecord = authRecord;
        this.clientIp = clientIp;
        this.startedAt = startedAt;
    }

    public AuthRecord getAuthRecord() {
        return authRecord;
    }

    public String getUserId() {
        return authRecord.userId();
    }

    public String getKeyId() {
        return authRecord.keyId();
    }

    public String getClientIp() {
        return clientIp;
    }

    /**
     * Milliseconds since the request entered the pipeline.
     */
    public long elapsedMillis(Clock clock) {
        return Math.max(0, Duration.between(startedAt, clock.instant()).toMillis());
    }

    @Override
    public String toString() {
        return "RequestContext{" +
                "userId='" + authRecord.userId() + '\'' +
                ", keyId='" + authRecord.keyId() + '\'' +
                ", clientIp='" + clientIp + '\'' +
                '}';
    }
}
