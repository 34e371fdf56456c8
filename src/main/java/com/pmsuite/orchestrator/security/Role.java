package com.pmsuite.orchestrator.security;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Organization roles, declared from least to most privileged so that
 * enum order is the role hierarchy.
 */
public enum Role {

    MEMBER,
    MANAGER,
    ADMIN;

    public boolean satisfies(Role required) {
        return compareTo(required) >= 0;
    }

    @JsonValue
    public String claimValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return the role for a claim value, or null when the value is not a known role
     */
    public static Role fromClaim(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.name().equals(normalized)) {
                return role;
            }
        }
        return null;
    }

    @JsonCreator
    static Role fromJson(String value) {
        Role role = fromClaim(value);
        if (role == null && value != null) {
            throw new IllegalArgumentException("Unknown role: " + value);
        }
        return role;
    }
}
