package com.example.armoriqadmin.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Requested value for a single capability flag. {@link #UNSET} travels as JSON {@code null} and
 * tells the proxy to leave the flag as it is.
 */
public enum PermissionState {
    UNSET(null),
    GRANTED(Boolean.TRUE),
    DENIED(Boolean.FALSE);

    private final Boolean wireValue;

    PermissionState(Boolean wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public Boolean wireValue() {
        return wireValue;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PermissionState fromWire(Boolean value) {
        if (value == null) {
            return UNSET;
        }
        return value ? GRANTED : DENIED;
    }
}
