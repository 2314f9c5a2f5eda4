package com.example.platformsync.model;

import java.util.Map;

/**
 * Decoded payload with its required identity fields pulled out.
 * {@code payload} keeps every other field as-is (insertion order preserved).
 */
public record ParsedEvent(
        String sourceKey,
        String workOrder,
        String documentNumber,
        String idlpn,
        Map<String, Object> payload) {
}
