package com.platform.fleetsync.configuration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.fleetsync.error.ValidationException;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Merges system defaults, templates in order, and the device override into
 * the desired configuration.
 * 
 * Objects merge field by field, arrays element by element, so layers that
 * touch different groups or fields never clobber each other. Null values and
 * empty arrays leave the lower layer in place. No I/O.
 */
@Component
public class HierarchyResolver {
    
    public static final String SOURCE_SYSTEM = "system";
    public static final String SOURCE_OVERRIDE = "override";
    public static final String SOURCE_TEMPLATE_PREFIX = "template:";
    
    private final SystemDefaults systemDefaults;
    
    public HierarchyResolver(SystemDefaults systemDefaults) {
        this.systemDefaults = systemDefaults;
    }
    
    public ResolvedConfiguration resolve(List<ConfigTemplate> templates, ObjectNode override) {
        return resolve(systemDefaults.get(), templates, override);
    }
    
    /**
     * @throws ValidationException when a layer names an unknown group
     */
    public static ResolvedConfiguration resolve(ObjectNode defaults, List<ConfigTemplate> templates,
                                                ObjectNode override) {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        Map<String, String> sources = new TreeMap<>();
        
        mergeLayer(result, defaults, SOURCE_SYSTEM, sources);
        for (ConfigTemplate template : templates) {
            mergeLayer(result, template.getConfig(), SOURCE_TEMPLATE_PREFIX + template.getId(), sources);
        }
        mergeLayer(result, override, SOURCE_OVERRIDE, sources);
        
        return new ResolvedConfiguration(result, Collections.unmodifiableMap(sources));
    }
    
    /**
     * Overlay {@code patch} onto a copy of {@code base} with the same rules.
     */
    public static ObjectNode overlay(ObjectNode base, ObjectNode patch) {
        ObjectNode result = base == null ? JsonNodeFactory.instance.objectNode() : base.deepCopy();
        if (patch != null) {
            mergeObject(result, patch, "", "patch", new TreeMap<>());
        }
        return result;
    }
    
    private static void mergeLayer(ObjectNode target, ObjectNode layer, String source, Map<String, String> sources) {
        if (layer == null) {
            return;
        }
        Iterator<String> names = layer.fieldNames();
        while (names.hasNext()) {
            String group = names.next();
            if (!CapabilityGroup.isKnown(group)) {
                throw ValidationException.configuration(group,
                    "Layer " + source + " sets unknown configuration group '" + group + "'");
            }
        }
        mergeObject(target, layer, "", source, sources);
    }
    
    private static void mergeObject(ObjectNode target, ObjectNode source, String prefix, String layer,
                                    Map<String, String> sources) {
        Iterator<Map.Entry<String, JsonNode>> it = source.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String path = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            JsonNode value = entry.getValue();
            
            if (value == null || value.isNull() || value.isMissingNode()) {
                continue;
            }
            if (value.isObject()) {
                if (value.isEmpty()) {
                    continue;
                }
                JsonNode existing = target.get(entry.getKey());
                ObjectNode child;
                if (existing instanceof ObjectNode existingObject) {
                    child = existingObject;
                } else {
                    clearSources(sources, path);
                    child = target.putObject(entry.getKey());
                }
                mergeObject(child, (ObjectNode) value, path, layer, sources);
            } else if (value.isArray()) {
                if (value.isEmpty()) {
                    continue;
                }
                JsonNode existing = target.get(entry.getKey());
                ArrayNode array;
                if (existing instanceof ArrayNode existingArray) {
                    array = existingArray;
                } else {
                    clearSources(sources, path);
                    array = target.putArray(entry.getKey());
                }
                mergeArray(array, (ArrayNode) value, path, layer, sources);
            } else {
                clearSources(sources, path);
                target.set(entry.getKey(), value.deepCopy());
                sources.put(path, layer);
            }
        }
    }
    
    private static void mergeArray(ArrayNode target, ArrayNode source, String prefix, String layer,
                                   Map<String, String> sources) {
        while (target.size() < source.size()) {
            target.addNull();
        }
        for (int i = 0; i < source.size(); i++) {
            String path = prefix + "." + i;
            JsonNode value = source.get(i);
            if (value == null || value.isNull()) {
                continue;
            }
            if (value.isObject()) {
                JsonNode existing = target.get(i);
                ObjectNode element;
                if (existing instanceof ObjectNode existingObject) {
                    element = existingObject;
                } else {
                    clearSources(sources, path);
                    element = JsonNodeFactory.instance.objectNode();
                    target.set(i, element);
                }
                mergeObject(element, (ObjectNode) value, path, layer, sources);
            } else {
                clearSources(sources, path);
                target.set(i, value.deepCopy());
                sources.put(path, layer);
            }
        }
    }
    
    /**
     * Drop attributions at or below {@code path} when a layer replaces that subtree.
     */
    private static void clearSources(Map<String, String> sources, String path) {
        sources.remove(path);
        sources.keySet().removeIf(key -> key.startsWith(path + "."));
    }
}
