package com.pmsuite.orchestrator.collaboration;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Researcher as reported by the Labs backend. Expertise tags are kept
 * trimmed and lower-cased so tag comparison is case-insensitive.
 */
public record Researcher(String id, String labId, String name, Set<String> expertise) {

    public Researcher {
        Objects.requireNonNull(id, "id");
        expertise = expertise == null ? Set.of() : expertise.stream()
                .filter(Objects::nonNull)
                .map(tag -> tag.trim().toLowerCase(Locale.ROOT))
                .filter(tag -> !tag.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }
}
