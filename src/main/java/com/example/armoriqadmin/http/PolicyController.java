package com.example.armoriqadmin.http;

import com.example.armoriqadmin.requests.PolicyCreateHttpRequest;
import com.example.armoriqadmin.requests.PolicyUpdateHttpRequest;
import com.example.armoriqadmin.service.ProxyGateway;
import com.example.armoriqadmin.service.ProxyRequest;
import com.example.armoriqadmin.service.ProxyRoute;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for agent policies. Every operation maps onto the proxy's own policy API;
 * the proxy owns storage and policy semantics, so bodies pass through untouched.
 */
@RestController
public class PolicyController {

    private final ProxyGateway gateway;

    public PolicyController(ProxyGateway gateway) {
        this.gateway = gateway;
    }

    @GetMapping("/policies")
    public ResponseEntity<JsonNode> listPolicies() {
        return ProxyResponses.ok(gateway.forward(ProxyRequest.of(ProxyRoute.LIST_POLICIES)));
    }

    @GetMapping("/policies/{agentId}")
    public ResponseEntity<JsonNode> getPolicy(@PathVariable String agentId) {
        return ProxyResponses.ok(gateway.forward(ProxyRequest.forAgent(ProxyRoute.GET_POLICY, agentId)));
    }

    @PostMapping("/policies")
    public ResponseEntity<JsonNode> createPolicy(@Valid @RequestBody PolicyCreateHttpRequest request) {
        return ProxyResponses.withStatus(HttpStatus.CREATED,
                gateway.forward(ProxyRequest.of(ProxyRoute.CREATE_POLICY).withBody(request)));
    }

    @PutMapping("/policies/{agentId}")
    public ResponseEntity<JsonNode> updatePolicy(
            @PathVariable String agentId,
            @Valid @RequestBody PolicyUpdateHttpRequest request
    ) {
        return ProxyResponses.ok(gateway.forward(
                ProxyRequest.forAgent(ProxyRoute.UPDATE_POLICY, agentId).withBody(request)));
    }

    @DeleteMapping("/policies/{agentId}")
    public ResponseEntity<Void> deletePolicy(@PathVariable String agentId) {
        gateway.forward(ProxyRequest.forAgent(ProxyRoute.DELETE_POLICY, agentId));
        return ResponseEntity.noContent().build();
    }
}
