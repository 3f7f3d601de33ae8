package com.example.armoriqadmin.requests;

import com.example.armoriqadmin.models.Permissions;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * HTTP-layer payload for POST /policies. Forwarded to the proxy field-for-field; omitted
 * permissions become all-unset.
 */
public record PolicyCreateHttpRequest(
        @JsonProperty("agentId") @NotBlank String agentId,
        @JsonProperty("endpointId") @NotBlank String endpointId,
        @JsonProperty("permissions") Permissions permissions
) {
    public PolicyCreateHttpRequest {
        if (permissions == null) {
            permissions = Permissions.unset();
        }
    }
}
