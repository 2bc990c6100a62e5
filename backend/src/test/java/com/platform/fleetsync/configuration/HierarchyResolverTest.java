package com.platform.fleetsync.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.fleetsync.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HierarchyResolverTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void resolve_templatesOnDifferentFields_bothSurvive() throws Exception {
        ConfigTemplate a = template(1L, "{\"relay\":{\"default_state\":\"on\"}}");
        ConfigTemplate b = template(2L, "{\"relay\":{\"auto_off\":30}}");

        ResolvedConfiguration resolved = HierarchyResolver.resolve(json("{}"), List.of(a, b), null);

        assertThat(resolved.config().path("relay").path("default_state").asText()).isEqualTo("on");
        assertThat(resolved.config().path("relay").path("auto_off").asInt()).isEqualTo(30);
        assertThat(resolved.sources())
            .containsEntry("relay.default_state", "template:1")
            .containsEntry("relay.auto_off", "template:2");
    }

    @Test
    void resolve_overrideWinsOverTemplates() throws Exception {
        ConfigTemplate a = template(1L, "{\"relay\":{\"default_state\":\"on\"}}");
        ConfigTemplate b = template(2L, "{\"relay\":{\"auto_off\":30}}");

        ResolvedConfiguration resolved = HierarchyResolver.resolve(json("{}"), List.of(a, b),
            json("{\"relay\":{\"default_state\":\"off\"}}"));

        assertThat(resolved.config().path("relay").path("default_state").asText()).isEqualTo("off");
        assertThat(resolved.config().path("relay").path("auto_off").asInt()).isEqualTo(30);
        assertThat(resolved.sources()).containsEntry("relay.default_state", "override");
    }

    @Test
    void resolve_laterTemplateWinsOnSameField() throws Exception {
        ConfigTemplate first = template(1L, "{\"mqtt\":{\"server\":\"a.local\",\"port\":1883}}");
        ConfigTemplate second = template(2L, "{\"mqtt\":{\"server\":\"b.local\"}}");

        ResolvedConfiguration resolved = HierarchyResolver.resolve(
            json("{\"mqtt\":{\"enable\":false}}"), List.of(first, second), null);

        assertThat(resolved.config().path("mqtt").path("server").asText()).isEqualTo("b.local");
        assertThat(resolved.config().path("mqtt").path("port").asInt()).isEqualTo(1883);
        assertThat(resolved.sources())
            .containsEntry("mqtt.enable", "system")
            .containsEntry("mqtt.server", "template:2")
            .containsEntry("mqtt.port", "template:1");
    }

    @Test
    void resolve_nullAndEmptyValues_keepLowerLayer() throws Exception {
        ConfigTemplate base = template(1L, "{\"relay\":{\"relays\":[{\"id\":0,\"name\":\"pump\"}],\"auto_on\":5}}");

        ResolvedConfiguration resolved = HierarchyResolver.resolve(json("{}"), List.of(base),
            json("{\"relay\":{\"relays\":[],\"auto_on\":null}}"));

        assertThat(resolved.config().path("relay").path("relays").get(0).path("name").asText()).isEqualTo("pump");
        assertThat(resolved.config().path("relay").path("auto_on").asInt()).isEqualTo(5);
    }

    @Test
    void resolve_arraysMergeByIndex() throws Exception {
        ConfigTemplate base = template(1L,
            "{\"relay\":{\"relays\":[{\"id\":0,\"name\":\"pump\"},{\"id\":1,\"name\":\"fan\"}]}}");

        ResolvedConfiguration resolved = HierarchyResolver.resolve(json("{}"), List.of(base),
            json("{\"relay\":{\"relays\":[{\"default_state\":\"off\"}]}}"));

        ObjectNode channel0 = (ObjectNode) resolved.config().path("relay").path("relays").get(0);
        assertThat(channel0.path("name").asText()).isEqualTo("pump");
        assertThat(channel0.path("default_state").asText()).isEqualTo("off");
        assertThat(resolved.config().path("relay").path("relays")).hasSize(2);
        assertThat(resolved.sources()).containsEntry("relay.relays.0.default_state", "override");
    }

    @Test
    void resolve_isDeterministic() throws Exception {
        List<ConfigTemplate> templates = List.of(
            template(1L, "{\"led\":{\"power_indication\":true}}"),
            template(2L, "{\"system\":{\"device\":{\"name\":\"kitchen\"}}}"));

        ResolvedConfiguration first = HierarchyResolver.resolve(json("{}"), templates, null);
        ResolvedConfiguration second = HierarchyResolver.resolve(json("{}"), templates, null);

        assertThat(first).isEqualTo(second);
    }

    @Test
    void resolve_unknownGroup_isRejected() throws Exception {
        ConfigTemplate bad = template(3L, "{\"bluetooth\":{\"enable\":true}}");

        assertThatThrownBy(() -> HierarchyResolver.resolve(json("{}"), List.of(bad), null))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("bluetooth");
    }

    @Test
    void overlay_doesNotModifyBase() throws Exception {
        ObjectNode base = json("{\"mqtt\":{\"server\":\"a.local\"}}");

        ObjectNode merged = HierarchyResolver.overlay(base, json("{\"mqtt\":{\"port\":1884}}"));

        assertThat(base.path("mqtt").has("port")).isFalse();
        assertThat(merged.path("mqtt").path("port").asInt()).isEqualTo(1884);
        assertThat(merged.path("mqtt").path("server").asText()).isEqualTo("a.local");
    }

    private ConfigTemplate template(Long id, String config) throws Exception {
        return ConfigTemplate.builder().id(id).name("t" + id).config(json(config)).build();
    }

    private ObjectNode json(String text) throws Exception {
        return (ObjectNode) mapper.readTree(text);
    }
}
