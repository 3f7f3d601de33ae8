package com.example.armoriqadmin.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Requested change to an agent's capabilities on an endpoint. Every flag is always written,
 * unset ones as {@code null}.
 */
@JsonPropertyOrder({"read", "create", "update", "delete"})
public record Permissions(
        @JsonProperty("read") PermissionState read,
        @JsonProperty("create") PermissionState create,
        @JsonProperty("update") PermissionState update,
        @JsonProperty("delete") PermissionState delete
) {
    private static final Permissions UNSET = new Permissions(null, null, null, null);

    public Permissions {
        read = orUnset(read);
        create = orUnset(create);
        update = orUnset(update);
        delete = orUnset(delete);
    }

    public static Permissions unset() {
        return UNSET;
    }

    private static PermissionState orUnset(PermissionState state) {
        return state == null ? PermissionState.UNSET : state;
    }
}
