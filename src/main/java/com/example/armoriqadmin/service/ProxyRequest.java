package com.example.armoriqadmin.service;

import java.util.Map;
import java.util.Objects;

/**
 * A single call to forward upstream: the route, the values for its path template and an optional
 * JSON-serializable body.
 */
public record ProxyRequest(
        ProxyRoute route,
        Map<String, String> pathVariables,
        Object body
) {
    public ProxyRequest {
        Objects.requireNonNull(route, "route");
        pathVariables = pathVariables == null ? Map.of() : Map.copyOf(pathVariables);
    }

    public static ProxyRequest of(ProxyRoute route) {
        return new ProxyRequest(route, Map.of(), null);
    }

    public static ProxyRequest forAgent(ProxyRoute route, String agentId) {
        Objects.requireNonNull(agentId, "agentId");
        if (agentId.isBlank()) {
            throw AdminRequestException.blank("agentId");
        }
        return new ProxyRequest(route, Map.of("agentId", agentId), null);
    }

    public ProxyRequest withBody(Object payload) {
        return new ProxyRequest(route, pathVariables, payload);
    }
}
