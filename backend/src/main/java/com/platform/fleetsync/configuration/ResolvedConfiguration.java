package com.platform.fleetsync.configuration;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * Desired configuration plus, per leaf path, the layer that last set it
 * ({@code system}, {@code template:<id>} or {@code override}).
 */
public record ResolvedConfiguration(ObjectNode config, Map<String, String> sources) {
}
