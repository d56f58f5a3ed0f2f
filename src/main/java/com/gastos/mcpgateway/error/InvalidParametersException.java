package com.gastos.mcpgateway.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameter validation failure. The field errors only reflect the caller's own input,
 * so they are safe to echo back.
 */
public class InvalidParametersException extends GatewayException {

    private final Map<String, String> fieldErrors;

    public InvalidParametersException(Map<String, String> fieldErrors) {
        super(ErrorKind.INVALID_PARAMETERS, "Invalid parameters: " + String.join(", ", fieldErrors.keySet()));
        this.fieldErrors = new LinkedHashMap<>(fieldErrors);
    }

    /**
     * Offending field name to reason, in the order they were found.
     */
    public Map<String, String> getFieldErrors() {
        return Collections.unmodifiableMap(fieldErrors);
    }

    @Override
    public Object getDetails() {
        return new LinkedHashMap<>(fieldErrors);
    }
}
