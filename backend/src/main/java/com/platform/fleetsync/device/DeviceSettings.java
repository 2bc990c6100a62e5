package com.platform.fleetsync.device;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.platform.fleetsync.protocol.DeviceCredential;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Device settings blob.
 * 
 * {@code model}, {@code gen} and {@code auth_enabled} are owned by discovery;
 * the credential pair is written only by credential recovery and explicit
 * credential updates. Unknown keys survive a read/write cycle.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeviceSettings {
    
    private String model;
    
    private Integer gen;
    
    @JsonProperty("auth_enabled")
    private Boolean authEnabled;
    
    @JsonProperty("auth_user")
    private String authUser;
    
    @JsonProperty("auth_pass")
    private String authPass;
    
    @Builder.Default
    private Map<String, Object> unknown = new LinkedHashMap<>();
    
    @JsonAnyGetter
    public Map<String, Object> getUnknown() {
        return unknown;
    }
    
    @JsonAnySetter
    public void putUnknown(String key, Object value) {
        if (unknown == null) {
            unknown = new LinkedHashMap<>();
        }
        unknown.put(key, value);
    }
    
    /**
     * The credential that last worked against this device, if any.
     */
    @JsonIgnore
    public DeviceCredential savedCredential() {
        return DeviceCredential.ofNullable(authUser, authPass);
    }
    
    @JsonIgnore
    public boolean hasSavedCredential() {
        return savedCredential() != null;
    }
    
    public DeviceSettings withCredential(DeviceCredential credential) {
        return toBuilder()
            .authUser(credential.username())
            .authPass(credential.password())
            .unknown(copyUnknown())
            .build();
    }
    
    public DeviceSettings withoutCredential() {
        return toBuilder()
            .authUser(null)
            .authPass(null)
            .unknown(copyUnknown())
            .build();
    }
    
    /**
     * Merge discovery-owned fields; null observations keep the stored value.
     */
    public DeviceSettings withDiscovery(String observedModel, Integer observedGen, Boolean observedAuth) {
        return toBuilder()
            .model(observedModel != null ? observedModel : model)
            .gen(observedGen != null ? observedGen : gen)
            .authEnabled(observedAuth != null ? observedAuth : authEnabled)
            .unknown(copyUnknown())
            .build();
    }
    
    private Map<String, Object> copyUnknown() {
        return unknown == null ? new LinkedHashMap<>() : new LinkedHashMap<>(unknown);
    }
    
    @Override
    public String toString() {
        return "DeviceSettings[model=" + model + ", gen=" + gen + ", authEnabled=" + authEnabled
            + ", hasCredential=" + hasSavedCredential() + "]";
    }
}
