package com.pmsuite.orchestrator.collaboration;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.Objects;

/**
 * Unordered pair of distinct labs, stored with the smaller id first so
 * (A, B) and (B, A) are the same pair.
 *
 * The storage key URL-encodes both ids, so the separator only ever appears
 * between them.
 */
public record LabPair(String labAId, String labBId) implements Comparable<LabPair> {

    private static final String SEPARATOR = "|";
    private static final Comparator<LabPair> ORDER =
            Comparator.comparing(LabPair::labAId).thenComparing(LabPair::labBId);

    public LabPair {
        Objects.requireNonNull(labAId, "labAId");
        Objects.requireNonNull(labBId, "labBId");
        if (labAId.equals(labBId)) {
            throw new IllegalArgumentException("A lab cannot be paired with itself: " + labAId);
        }
        if (labAId.compareTo(labBId) > 0) {
            String swap = labAId;
            labAId = labBId;
            labBId = swap;
        }
    }

    public static LabPair of(String first, String second) {
        return new LabPair(first, second);
    }

    public String key() {
        return encode(labAId) + SEPARATOR + encode(labBId);
    }

    public static LabPair fromKey(String key) {
        int split = key.indexOf(SEPARATOR);
        if (split <= 0 || split == key.length() - 1 || key.indexOf(SEPARATOR, split + 1) >= 0) {
            throw new IllegalArgumentException("Malformed lab pair key: " + key);
        }
        return new LabPair(decode(key.substring(0, split)), decode(key.substring(split + 1)));
    }

    private static String encode(String labId) {
        return URLEncoder.encode(labId, StandardCharsets.UTF_8);
    }

    private static String decode(String encoded) {
        return URLDecoder.decode(encoded, StandardCharsets.UTF_8);
    }

    @Override
    public int compareTo(LabPair other) {
        return ORDER.compare(this, other);
    }
}
