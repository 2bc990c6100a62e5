package com.platform.fleetsync.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tree helpers shared by the generation mappers.
 */
public final class CanonicalJson {
    
    public static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    
    private CanonicalJson() {
    }
    
    public static ObjectNode object() {
        return NODES.objectNode();
    }
    
    /**
     * Copy {@code source.sourceField} to {@code target.targetField} when present and not null.
     */
    public static void copy(JsonNode source, String sourceField, ObjectNode target, String targetField) {
        if (source == null) {
            return;
        }
        JsonNode value = source.get(sourceField);
        if (value != null && !value.isNull() && !value.isMissingNode()) {
            target.set(targetField, value.deepCopy());
        }
    }
    
    public static void copy(JsonNode source, String field, ObjectNode target) {
        copy(source, field, target, field);
    }
    
    /**
     * Copy an inverted boolean, e.g. a device "disable" flag into a canonical "enabled" flag.
     */
    public static void copyInverted(JsonNode source, String sourceField, ObjectNode target, String targetField) {
        if (source == null) {
            return;
        }
        JsonNode value = source.get(sourceField);
        if (value != null && value.isBoolean()) {
            target.put(targetField, !value.booleanValue());
        }
    }
    
    /**
     * Attach {@code group} under {@code name} unless it is empty.
     */
    public static void putGroup(ObjectNode root, String name, ObjectNode group) {
        if (group != null && group.size() > 0) {
            root.set(name, group);
        }
    }
    
    public static ObjectNode objectOrNull(JsonNode parent, String field) {
        if (parent == null) {
            return null;
        }
        JsonNode node = parent.get(field);
        return node instanceof ObjectNode objectNode ? objectNode : null;
    }
    
    /**
     * Split "host:port" into its parts. The port is null when absent or not numeric.
     */
    public static HostPort splitHostPort(String server) {
        if (server == null || server.isBlank()) {
            return new HostPort(server, null);
        }
        int colon = server.lastIndexOf(':');
        if (colon <= 0 || colon == server.length() - 1) {
            return new HostPort(server, null);
        }
        try {
            return new HostPort(server.substring(0, colon), Integer.parseInt(server.substring(colon + 1)));
        } catch (NumberFormatException e) {
            return new HostPort(server, null);
        }
    }
    
    public record HostPort(String host, Integer port) {
        public String join() {
            return port == null ? host : host + ":" + port;
        }
    }
    
    /**
     * Per-channel relay settings with the top-level relay fields applied to channel 0
     * where the channel does not set them itself.
     */
    public static List<ObjectNode> relayChannels(ObjectNode relay) {
        List<ObjectNode> channels = new ArrayList<>();
        if (relay == null) {
            return channels;
        }
        JsonNode relays = relay.get("relays");
        if (relays instanceof ArrayNode array) {
            for (int i = 0; i < array.size(); i++) {
                JsonNode element = array.get(i);
                ObjectNode channel = element instanceof ObjectNode o ? o.deepCopy() : object();
                if (!channel.has("id")) {
                    channel.put("id", i);
                }
                channels.add(channel);
            }
        }
        ObjectNode first;
        if (channels.isEmpty()) {
            first = object();
            first.put("id", 0);
        } else {
            first = channels.get(0);
        }
        for (String field : List.of("default_state", "auto_on", "auto_off", "btn_type")) {
            if (!first.hasNonNull(field) && relay.hasNonNull(field)) {
                first.set(field, relay.get(field).deepCopy());
            }
        }
        if (channels.isEmpty() && first.size() > 1) {
            channels.add(first);
        }
        return channels;
    }
    
    /**
     * Mirror channel 0 of {@code relay.relays} into the top-level relay fields.
     */
    public static void mirrorFirstChannel(ObjectNode relay, List<String> fields) {
        JsonNode relays = relay.get("relays");
        if (!(relays instanceof ArrayNode array) || array.isEmpty()) {
            return;
        }
        JsonNode first = array.get(0);
        for (String field : fields) {
            JsonNode value = first.get(field);
            if (value != null && !value.isNull()) {
                relay.set(field, value.deepCopy());
            }
        }
    }
    
    /**
     * Flatten an object into query parameters, skipping nulls.
     */
    public static void putParam(Map<String, String> params, String name, JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return;
        }
        params.put(name, value.isTextual() ? value.textValue() : value.toString());
    }
}
