package com.example.armoriqadmin.service;

import java.net.URI;
import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Upstream calls the admin API knows how to make. Each route fixes the HTTP method, the path on
 * the proxy and the status codes that count as success for that call.
 */
public enum ProxyRoute {
    STATUS(HttpMethod.GET, "/health", HttpStatus.OK),
    AUDIT_LOGS(HttpMethod.GET, "/api/audit-logs", HttpStatus.OK),
    ENDPOINTS(HttpMethod.GET, "/api/endpoints", HttpStatus.OK),
    LIST_POLICIES(HttpMethod.GET, "/api/policies", HttpStatus.OK),
    GET_POLICY(HttpMethod.GET, "/api/policies/{agentId}", HttpStatus.OK),
    CREATE_POLICY(HttpMethod.POST, "/api/policies", HttpStatus.CREATED),
    UPDATE_POLICY(HttpMethod.PUT, "/api/policies/{agentId}", HttpStatus.OK),
    DELETE_POLICY(HttpMethod.DELETE, "/api/policies/{agentId}", HttpStatus.NO_CONTENT),
    MCP_DEFINITION(HttpMethod.GET, "/api/mcp", HttpStatus.OK),
    MCP_RESOURCES(HttpMethod.GET, "/api/mcp/resources", HttpStatus.OK),
    MCP_PROMPTS(HttpMethod.GET, "/api/mcp/prompts", HttpStatus.OK),
    MCP_TOOLS(HttpMethod.GET, "/api/mcp/tools", HttpStatus.OK);

    private final HttpMethod method;
    private final String pathTemplate;
    private final Set<Integer> expectedStatuses;

    ProxyRoute(HttpMethod method, String pathTemplate, HttpStatus... expected) {
        this.method = method;
        this.pathTemplate = pathTemplate;
        this.expectedStatuses = Arrays.stream(expected)
                .map(HttpStatus::value)
                .collect(Collectors.toUnmodifiableSet());
    }

    public HttpMethod method() {
        return method;
    }

    public String pathTemplate() {
        return pathTemplate;
    }

    public Set<Integer> expectedStatuses() {
        return expectedStatuses;
    }

    public boolean expects(int statusCode) {
        return expectedStatuses.contains(statusCode);
    }

    /**
     * Builds the absolute upstream URI. Path variables are encoded as single path segments, so
     * an agent id containing {@code /} or {@code ?} cannot escape its segment.
     */
    public URI resolve(String baseUrl, Map<String, String> pathVariables) {
        return UriComponentsBuilder.fromUriString(baseUrl)
                .path(pathTemplate)
                .encode()
                .buildAndExpand(pathVariables)
                .toUri();
    }
}
