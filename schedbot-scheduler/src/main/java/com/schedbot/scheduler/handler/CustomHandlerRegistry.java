package com.schedbot.scheduler.handler;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Custom handlers by name, populated at startup.
 */
@Slf4j
public class CustomHandlerRegistry {

    private final Map<String, CustomJobHandler> handlers = new ConcurrentHashMap<>();

    public void register(String name, CustomJobHandler handler) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("handler name is required");
        }
        CustomJobHandler previous = handlers.put(name, handler);
        if (previous != null) {
            log.warn("Custom handler {} replaced", name);
        } else {
            log.debug("Registered custom handler {}", name);
        }
    }

    public Optional<CustomJobHandler> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(handlers.get(name));
    }

    public boolean contains(String name) {
        return name != null && handlers.containsKey(name);
    }

    public Set<String> names() {
        return new TreeSet<>(handlers.keySet());
    }
}
