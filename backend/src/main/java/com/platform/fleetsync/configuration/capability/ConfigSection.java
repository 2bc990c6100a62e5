package com.platform.fleetsync.configuration.capability;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of every typed configuration section. Fields the type does not know
 * are kept and written back unchanged.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class ConfigSection {
    
    private final Map<String, Object> unknown = new LinkedHashMap<>();
    
    @JsonAnyGetter
    public Map<String, Object> getUnknown() {
        return unknown;
    }
    
    @JsonAnySetter
    public void putUnknown(String key, Object value) {
        unknown.put(key, value);
    }
}
