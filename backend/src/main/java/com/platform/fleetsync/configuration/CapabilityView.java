package com.platform.fleetsync.configuration;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * One capability group of a device: resolved value, the device's own
 * override for it, and where each resolved leaf came from.
 */
public record CapabilityView(String group, JsonNode desired, JsonNode override, Map<String, String> sources) {
}
