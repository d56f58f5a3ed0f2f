package com.gastos.mcpgateway.model;

import java.util.Objects;

/**
 * Opaque bearer credential presented by a caller.
 * toString() only ever reveals a short prefix, so instances are safe to pass to loggers.
 */
public record Credential(String value) {

    private static final int PREFIX_LENGTH = 8;

    public Credential {
        Objects.requireNonNull(value, "value");
    }

    /**
     * Diagnostic prefix (first 8 chars + "***").
     */
    public String prefix() {
        if (value.length() < PREFIX_LENGTH) {
            return "invalid_key";
        }
        return value.substring(0, PREFIX_LENGTH) + "***";
    }

    @Override
    public String toString() {
        return prefix();
    }
}
