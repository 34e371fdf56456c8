package com.pmsuite.orchestrator.collaboration;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SuggestionStatus {

    SUGGESTED,
    ACCEPTED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
