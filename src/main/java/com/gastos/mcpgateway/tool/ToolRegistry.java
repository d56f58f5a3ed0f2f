package com.gastos.mcpgateway.tool;

import com.gastos.mcpgateway.model.ToolDescriptor;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Name to handler mapping, filled at startup and read on every call.
 * Registration replaces the map wholesale, so readers never see a partial update.
 */
public class ToolRegistry {
    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private volatile Map<String, Registration> tools = Map.of();

    public ToolRegistry register(ToolHandler handler) {
        return register(handler.descriptor(), handler);
    }

    public synchronized ToolRegistry register(ToolDescriptor descriptor, ToolHandler handler) {
        if (tools.containsKey(descriptor.name())) {
            throw new IllegalStateException("Tool already registered: " + descriptor.name());
        }
        if (!descriptor.name().equals(handler.descriptor().name())) {
            throw new IllegalArgumentException("Descriptor " + descriptor.name()
                    + " does not match handler " + handler.descriptor().name());
        }
        Map<String, Registration> next = new LinkedHashMap<>(tools);
        next.put(descriptor.name(), new Registration(descriptor, handler));
        tools = Collections.unmodifiableMap(next);
        log.info("Registered tool {} (scope={})", descriptor.name(), descriptor.requiredScope());
        return this;
    }

    public Optional<ToolHandler> resolve(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name)).map(Registration::handler);
    }

    /**
     * Descriptors as registered, in registration order.
     */
    public List<ToolDescriptor> list() {
        return tools.values().stream().map(Registration::descriptor).toList();
    }

    public List<String> names() {
        return List.copyOf(tools.keySet());
    }

    public int size() {
        return tools.size();
    }

    private record Registration(ToolDescriptor descriptor, ToolHandler handler) {
    }
}
