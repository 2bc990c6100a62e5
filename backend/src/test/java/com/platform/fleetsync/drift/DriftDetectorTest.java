package com.platform.fleetsync.drift;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class DriftDetectorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final DriftDetector detector = new DriftDetector();

    @Test
    void compare_identicalDocuments_isInSync() throws Exception {
        ObjectNode config = json("{\"mqtt\":{\"server\":\"broker.local\",\"port\":1883},"
            + "\"relay\":{\"relays\":[{\"id\":0,\"default_state\":\"off\"}]}}");

        List<FieldDelta> deltas = detector.compare(config, config.deepCopy());

        assertThat(deltas).isEmpty();
        assertThat(DriftDetector.isInSync(deltas)).isTrue();
    }

    @Test
    void compare_oneChangedField_reportsExactlyThatPath() throws Exception {
        ObjectNode desired = json("{\"mqtt\":{\"server\":\"broker.local\",\"port\":1883}}");
        ObjectNode live = json("{\"mqtt\":{\"server\":\"other.local\",\"port\":1883}}");

        List<FieldDelta> deltas = detector.compare(desired, live);

        assertThat(deltas).hasSize(1);
        FieldDelta delta = deltas.get(0);
        assertThat(delta.path()).isEqualTo("mqtt.server");
        assertThat(delta.kind()).isEqualTo(DriftKind.CHANGED);
        assertThat(delta.expected().asText()).isEqualTo("broker.local");
        assertThat(delta.actual().asText()).isEqualTo("other.local");
        assertThat(delta.category()).isEqualTo("network");
        assertThat(delta.severity()).isEqualTo(DriftDetector.SEVERITY_CRITICAL);
    }

    @Test
    void compare_missingLiveValue_reportsMissing() throws Exception {
        List<FieldDelta> deltas = detector.compare(
            json("{\"auth\":{\"enable\":true}}"), json("{}"));

        assertThat(deltas).singleElement().satisfies(delta -> {
            assertThat(delta.path()).isEqualTo("auth.enable");
            assertThat(delta.kind()).isEqualTo(DriftKind.MISSING);
            assertThat(delta.actual()).isNull();
            assertThat(delta.category()).isEqualTo("security");
        });
    }

    @Test
    void compare_ignoresReadOnlyAndWriteOnlyFields() throws Exception {
        ObjectNode desired = json("{\"system\":{\"mac\":\"AA\",\"firmware\":\"1.0\"},"
            + "\"wifi\":{\"ssid\":\"iot\",\"password\":\"secret\"}}");
        ObjectNode live = json("{\"system\":{\"mac\":\"BB\",\"firmware\":\"2.0\"},\"wifi\":{\"ssid\":\"iot\"}}");

        assertThat(detector.compare(desired, live)).isEmpty();
    }

    @Test
    void compare_coordinatesWithinTolerance_areEqual() throws Exception {
        ObjectNode desired = json("{\"location\":{\"lat\":42.69770,\"lng\":23.32190}}");
        ObjectNode close = json("{\"location\":{\"lat\":42.69775,\"lng\":23.32185}}");
        ObjectNode far = json("{\"location\":{\"lat\":42.6990,\"lng\":23.32190}}");

        assertThat(detector.compare(desired, close)).isEmpty();
        assertThat(detector.compare(desired, far)).extracting(FieldDelta::path).containsExactly("location.lat");
    }

    @Test
    void compare_numbersOfDifferentRepresentation_areEqual() throws Exception {
        assertThat(detector.compare(json("{\"relay\":{\"auto_off\":30}}"), json("{\"relay\":{\"auto_off\":30.0}}")))
            .isEmpty();
    }

    @Test
    void compare_unmentionedLiveFields_areExtraOnly() throws Exception {
        ObjectNode desired = json("{\"mqtt\":{\"server\":\"broker.local\"}}");
        ObjectNode live = json("{\"mqtt\":{\"server\":\"broker.local\",\"user\":\"dev\"},\"cloud\":{\"enable\":true}}");

        List<FieldDelta> deltas = detector.compare(desired, live);

        assertThat(deltas).singleElement().satisfies(delta -> {
            assertThat(delta.path()).isEqualTo("mqtt.user");
            assertThat(delta.kind()).isEqualTo(DriftKind.EXTRA);
            assertThat(delta.severity()).isEqualTo(DriftDetector.SEVERITY_INFO);
        });
        assertThat(DriftDetector.isInSync(deltas)).isTrue();
    }

    @Test
    void compare_arrayElements_comparedByIndex() throws Exception {
        ObjectNode desired = json("{\"relay\":{\"relays\":[{\"id\":0,\"name\":\"pump\"}]}}");
        ObjectNode live = json("{\"relay\":{\"relays\":[{\"id\":0,\"name\":\"fan\"},{\"id\":1,\"name\":\"x\"}]}}");

        List<FieldDelta> deltas = detector.compare(desired, live);

        assertThat(deltas).extracting(FieldDelta::path, FieldDelta::kind)
            .containsExactlyInAnyOrder(
                tuple("relay.relays.0.name", DriftKind.CHANGED),
                tuple("relay.relays.1", DriftKind.EXTRA));
    }

    @Test
    void compare_typeMismatch_isChanged() throws Exception {
        List<FieldDelta> deltas = detector.compare(json("{\"led\":{\"power_indication\":true}}"),
            json("{\"led\":{\"power_indication\":\"yes\"}}"));

        assertThat(deltas).singleElement().satisfies(delta -> {
            assertThat(delta.kind()).isEqualTo(DriftKind.CHANGED);
            assertThat(delta.severity()).isEqualTo(DriftDetector.SEVERITY_WARNING);
            assertThat(delta.category()).isEqualTo("device");
        });
    }

    @Test
    void severityOf_deviceName_isWarning() {
        assertThat(DriftDetector.severityOf("system.device.name", DriftKind.CHANGED))
            .isEqualTo(DriftDetector.SEVERITY_WARNING);
        assertThat(DriftDetector.categoryOf("system.device.name")).isEqualTo("system");
    }

    private ObjectNode json(String text) throws Exception {
        return (ObjectNode) mapper.readTree(text);
    }
}
