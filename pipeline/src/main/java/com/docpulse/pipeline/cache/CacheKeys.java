package com.docpulse.pipeline.cache;

import com.docpulse.pipeline.model.ExtractionTarget;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Deterministic cache keys: SHA-256 hex over a canonical rendering of the
 * key components. Maps and sets are rendered in sorted order, so two inputs
 * that differ only in iteration order share a key.
 */
public final class CacheKeys {

    private static final String SEPARATOR = "\u001f";

    private CacheKeys() {
    }

    public static String of(Object... components) {
        StringBuilder canonical = new StringBuilder();
        for (int i = 0; i < components.length; i++) {
            if (i > 0) {
                canonical.append(SEPARATOR);
            }
            canonical.append(canonical(components[i]));
        }
        return sha256(canonical.toString());
    }

    /**
     * Key for a discovery query and its parameters.
     */
    public static String query(String query, Map<String, ?> parameters) {
        return of("query", query, parameters);
    }

    /**
     * Key for an item's converted text.
     */
    public static String artifact(String itemId) {
        return of("artifact", itemId);
    }

    /**
     * Key for an item's summary under a set of targets; target order is irrelevant.
     */
    public static String result(String itemId, List<ExtractionTarget> targets) {
        Set<String> fingerprints = targets.stream()
                .map(ExtractionTarget::fingerprint)
                .collect(Collectors.toSet());
        return of("result", itemId, fingerprints);
    }

    private static String canonical(Object component) {
        if (component == null) {
            return "null";
        }
        if (component instanceof Map) {
            return ((Map<?, ?>) component).entrySet().stream()
                    .map(e -> canonical(e.getKey()) + "=" + canonical(e.getValue()))
                    .sorted()
                    .collect(Collectors.joining(",", "{", "}"));
        }
        if (component instanceof Set) {
            return ((Set<?>) component).stream()
                    .map(CacheKeys::canonical)
                    .sorted()
                    .collect(Collectors.joining(",", "[", "]"));
        }
        if (component instanceof Collection) {
            return ((Collection<?>) component).stream()
                    .map(CacheKeys::canonical)
                    .collect(Collectors.joining(",", "(", ")"));
        }
        return component.toString();
    }

    static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
