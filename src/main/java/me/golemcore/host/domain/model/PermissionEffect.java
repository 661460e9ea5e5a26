package me.golemcore.host.domain.model;

import java.util.Locale;

public enum PermissionEffect {

    ALLOW, DENY;

    public static PermissionEffect fromString(String value) {
        if (value == null || value.isBlank()) {
            return ALLOW;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid permission effect: " + value, e);
        }
    }
}
