package com.example.armoriqadmin.requests;

import com.example.armoriqadmin.models.Permissions;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * HTTP-layer payload for PUT /policies/{agentId}. The agent comes from the path, so only the
 * permission changes are carried.
 */
public record PolicyUpdateHttpRequest(
        @JsonProperty("permissions") Permissions permissions
) {
    public PolicyUpdateHttpRequest {
        if (permissions == null) {
            permissions = Permissions.unset();
        }
    }
}
