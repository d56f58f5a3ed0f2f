package com.gastos.mcpgateway.tool;

import com.gastos.mcpgateway.error.InvalidParametersException;
import com.gastos.mcpgateway.model.ToolParameter;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks raw arguments against declared {@link ToolParameter}s.
 * Undeclared arguments are dropped. All field errors are collected before failing.
 */
public final class ParameterValidator {

    private ParameterValidator() {
    }

    public static Map<String, Object> validate(List<ToolParameter> declared, Map<String, Object> raw) {
        Map<String, Object> params = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();

        for (ToolParameter parameter : declared) {
            Object value = raw != null ? raw.get(parameter.name()) : null;
            if (isAbsent(value)) {
                if (parameter.required()) {
                    errors.put(parameter.name(), "is required");
                } else if (parameter.defaultValue() != null) {
                    params.put(parameter.name(), parameter.defaultValue());
                }
                continue;
            }
            try {
                params.put(parameter.name(), coerce(parameter, value));
            } catch (IllegalArgumentException e) {
                errors.put(parameter.name(), e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new InvalidParametersException(errors);
        }
        return params;
    }

    private static boolean isAbsent(Object value) {
        return value == null || (value instanceof String s && s.isBlank());
    }

    private static Object coerce(ToolParameter parameter, Object value) {
        return switch (parameter.type()) {
            case STRING -> checkAllowed(parameter, toText(value));
            case NUMBER -> checkBounds(parameter, toNumber(value).doubleValue());
            case INTEGER -> checkBounds(parameter, toInteger(value));
            case BOOLEAN -> toBoolean(value);
            case OBJECT -> {
                if (!(value instanceof Map<?, ?>)) {
                    throw new IllegalArgumentException("must be an object");
                }
                yield value;
            }
        };
    }

    private static String toText(Object value) {
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        throw new IllegalArgumentException("must be a string");
    }

    private static Number toNumber(Object value) {
        if (value instanceof Number n) {
            return n;
        }
        if (value instanceof String s) {
            try {
                return new BigDecimal(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("must be a number");
            }
        }
        throw new IllegalArgumentException("must be a number");
    }

    private static long toInteger(Object value) {
        Number number = toNumber(value);
        double asDouble = number.doubleValue();
        if (asDouble != Math.rint(asDouble) || Double.isInfinite(asDouble)) {
            throw new IllegalArgumentException("must be an integer");
        }
        return number.longValue();
    }

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            if ("true".equalsIgnoreCase(s.trim())) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(s.trim())) {
                return Boolean.FALSE;
            }
        }
        throw new IllegalArgumentException("must be a boolean");
    }

    private static String checkAllowed(ToolParameter parameter, String value) {
        if (!parameter.allowedValues().isEmpty() && !parameter.allowedValues().contains(value)) {
            throw new IllegalArgumentException("must be one of " + parameter.allowedValues());
        }
        return value;
    }

    private static <T extends Number> T checkBounds(ToolParameter parameter, T value) {
        double v = value.doubleValue();
        if (parameter.minimum() != null && v < parameter.minimum()) {
            throw new IllegalArgumentException("must be >= " + formatBound(parameter.minimum()));
        }
        if (parameter.maximum() != null && v > parameter.maximum()) {
            throw new IllegalArgumentException("must be <= " + formatBound(parameter.maximum()));
        }
        return value;
    }

    private static String formatBound(double bound) {
        return bound == Math.rint(bound) ? String.valueOf((long) bound) : String.valueOf(bound);
    }
}
