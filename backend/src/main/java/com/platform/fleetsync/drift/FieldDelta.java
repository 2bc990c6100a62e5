package com.platform.fleetsync.drift;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One field-level difference between desired and live configuration.
 *
 * @param path     dotted path, array indices as segments ("relay.relays.0.name")
 * @param expected desired value, null for EXTRA
 * @param actual   live value, null for MISSING
 * @param category network, security, system or device
 * @param severity critical, warning or info
 */
public record FieldDelta(String path, DriftKind kind, JsonNode expected, JsonNode actual,
        String category, String severity) {
}
