package com.pmsuite.orchestrator.tenant;

import java.util.Locale;

public record UserAccount(String id, String email, String name, String passwordHash, boolean active) {

    public UserAccount {
        email = normalizeEmail(email);
    }

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
