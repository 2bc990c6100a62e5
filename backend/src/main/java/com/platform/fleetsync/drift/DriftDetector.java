package com.platform.fleetsync.drift;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Field-by-field comparison of a desired configuration against a live one,
 * both in the canonical schema.
 * 
 * <ul>
 *   <li>A desired value that is absent or null is inherited and not compared.</li>
 *   <li>Identity fields and write-only secrets are never compared.</li>
 *   <li>Numbers compare by value; coordinates within {@value #COORDINATE_TOLERANCE}.</li>
 *   <li>Live fields inside an object the desired configuration defines, and
 *       live array elements past the desired length, are reported as
 *       {@link DriftKind#EXTRA}.</li>
 * </ul>
 */
@Component
public class DriftDetector {
    
    public static final double COORDINATE_TOLERANCE = 0.0001;
    
    public static final String SEVERITY_CRITICAL = "critical";
    public static final String SEVERITY_WARNING = "warning";
    public static final String SEVERITY_INFO = "info";
    
    private static final Set<String> SKIPPED_PATHS = Set.of(
        "system.mac", "system.firmware", "system.fw_id",
        "wifi.password", "mqtt.password", "auth.password");
    
    private static final Set<String> TOLERANT_PATHS = Set.of("location.lat", "location.lng");
    
    private static final Map<String, String> CATEGORIES = Map.of(
        "wifi", "network",
        "mqtt", "network",
        "cloud", "network",
        "coiot", "network",
        "auth", "security",
        "system", "system",
        "location", "system");
    
    public List<FieldDelta> compare(ObjectNode desired, ObjectNode live) {
        List<FieldDelta> deltas = new ArrayList<>();
        if (desired != null) {
            compareObject("", desired, live, deltas);
        }
        return deltas;
    }
    
    /**
     * True iff no delta is {@link DriftKind#MISSING} or {@link DriftKind#CHANGED}.
     */
    public static boolean isInSync(List<FieldDelta> deltas) {
        return deltas.stream().noneMatch(delta -> delta.kind().isDrift());
    }
    
    private void compareObject(String prefix, JsonNode desired, JsonNode live, List<FieldDelta> deltas) {
        Iterator<Map.Entry<String, JsonNode>> it = desired.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String path = join(prefix, entry.getKey());
            JsonNode liveValue = live != null && live.isObject() ? live.get(entry.getKey()) : null;
            compareValue(path, entry.getValue(), liveValue, deltas);
        }
        
        // top-level groups the desired configuration leaves unset are inherited, not extra
        if (prefix.isEmpty() || live == null || !live.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> liveFields = live.fields();
        while (liveFields.hasNext()) {
            Map.Entry<String, JsonNode> entry = liveFields.next();
            String path = join(prefix, entry.getKey());
            if (!desired.has(entry.getKey()) && !isAbsent(entry.getValue()) && !SKIPPED_PATHS.contains(path)) {
                deltas.add(delta(path, DriftKind.EXTRA, null, entry.getValue()));
            }
        }
    }
    
    private void compareValue(String path, JsonNode desired, JsonNode live, List<FieldDelta> deltas) {
        if (isAbsent(desired) || SKIPPED_PATHS.contains(path)) {
            return;
        }
        
        if (desired.isObject()) {
            if (isAbsent(live)) {
                compareObject(path, desired, null, deltas);
            } else if (!live.isObject()) {
                deltas.add(delta(path, DriftKind.CHANGED, desired, live));
            } else {
                compareObject(path, desired, live, deltas);
            }
            return;
        }
        
        if (desired.isArray()) {
            if (!isAbsent(live) && !live.isArray()) {
                deltas.add(delta(path, DriftKind.CHANGED, desired, live));
                return;
            }
            compareArray(path, desired, isAbsent(live) ? null : live, deltas);
            return;
        }
        
        if (isAbsent(live)) {
            deltas.add(delta(path, DriftKind.MISSING, desired, null));
        } else if (!valuesEqual(path, desired, live)) {
            deltas.add(delta(path, DriftKind.CHANGED, desired, live));
        }
    }
    
    private void compareArray(String path, JsonNode desired, JsonNode live, List<FieldDelta> deltas) {
        for (int i = 0; i < desired.size(); i++) {
            JsonNode liveElement = live != null && i < live.size() ? live.get(i) : null;
            compareValue(path + "." + i, desired.get(i), liveElement, deltas);
        }
        if (live != null) {
            for (int i = desired.size(); i < live.size(); i++) {
                if (!isAbsent(live.get(i))) {
                    deltas.add(delta(path + "." + i, DriftKind.EXTRA, null, live.get(i)));
                }
            }
        }
    }
    
    static boolean valuesEqual(String path, JsonNode desired, JsonNode live) {
        if (desired.isNumber() && live.isNumber()) {
            if (TOLERANT_PATHS.contains(path)) {
                return Math.abs(desired.doubleValue() - live.doubleValue()) <= COORDINATE_TOLERANCE;
            }
            return desired.decimalValue().compareTo(live.decimalValue()) == 0;
        }
        return desired.equals(live);
    }
    
    private static FieldDelta delta(String path, DriftKind kind, JsonNode expected, JsonNode actual) {
        return new FieldDelta(path, kind,
            expected != null ? expected.deepCopy() : null,
            actual != null ? actual.deepCopy() : null,
            categoryOf(path), severityOf(path, kind));
    }
    
    public static String categoryOf(String path) {
        int dot = path.indexOf('.');
        String group = dot < 0 ? path : path.substring(0, dot);
        return CATEGORIES.getOrDefault(group, "device");
    }
    
    public static String severityOf(String path, DriftKind kind) {
        if (kind == DriftKind.EXTRA) {
            return SEVERITY_INFO;
        }
        if (path.equals("system.device.name") || path.equals("led") || path.startsWith("led.")) {
            return SEVERITY_WARNING;
        }
        return SEVERITY_CRITICAL;
    }
    
    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }
    
    private static String join(String prefix, String key) {
        return prefix.isEmpty() ? key : prefix + "." + key;
    }
}
