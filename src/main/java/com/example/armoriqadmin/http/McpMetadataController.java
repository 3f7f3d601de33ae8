package com.example.armoriqadmin.http;

import com.example.armoriqadmin.service.ProxyGateway;
import com.example.armoriqadmin.service.ProxyRequest;
import com.example.armoriqadmin.service.ProxyRoute;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Exposes the MCP definition the proxy loaded at startup.
 */
@RestController
public class McpMetadataController {

    private final ProxyGateway gateway;

    public McpMetadataController(ProxyGateway gateway) {
        this.gateway = gateway;
    }

    @GetMapping("/mcp")
    public ResponseEntity<JsonNode> definition() {
        return ProxyResponses.ok(gateway.forward(ProxyRequest.of(ProxyRoute.MCP_DEFINITION)));
    }

    @GetMapping("/mcp/resources")
    public ResponseEntity<JsonNode> resources() {
        return ProxyResponses.ok(gateway.forward(ProxyRequest.of(ProxyRoute.MCP_RESOURCES)));
    }

    @GetMapping("/mcp/prompts")
    public ResponseEntity<JsonNode> prompts() {
        return ProxyResponses.ok(gateway.forward(ProxyRequest.of(ProxyRoute.MCP_PROMPTS)));
    }

    @GetMapping("/mcp/tools")
    public ResponseEntity<JsonNode> tools() {
        return ProxyResponses.ok(gateway.forward(ProxyRequest.of(ProxyRoute.MCP_TOOLS)));
    }
}
