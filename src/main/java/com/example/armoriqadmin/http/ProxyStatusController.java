package com.example.armoriqadmin.http;

import com.example.armoriqadmin.service.ProxyGateway;
import com.example.armoriqadmin.service.ProxyRequest;
import com.example.armoriqadmin.service.ProxyRoute;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only views of the proxy's runtime state: health and inventory, recent audit entries and
 * registered MCP endpoints.
 */
@RestController
public class ProxyStatusController {

    private final ProxyGateway gateway;

    public ProxyStatusController(ProxyGateway gateway) {
        this.gateway = gateway;
    }

    @GetMapping("/status")
    public ResponseEntity<JsonNode> status() {
        return ProxyResponses.ok(gateway.forward(ProxyRequest.of(ProxyRoute.STATUS)));
    }

    @GetMapping("/logs")
    public ResponseEntity<JsonNode> auditLogs() {
        return ProxyResponses.ok(gateway.forward(ProxyRequest.of(ProxyRoute.AUDIT_LOGS)));
    }

    @GetMapping("/endpoints")
    public ResponseEntity<JsonNode> endpoints() {
        return ProxyResponses.ok(gateway.forward(ProxyRequest.of(ProxyRoute.ENDPOINTS)));
    }
}
