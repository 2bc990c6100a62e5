package com.platform.fleetsync.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Uniform capability surface over both device generations.
 * 
 * Every call is bound to a {@link CallContext}. Failures are raised as
 * {@link com.platform.fleetsync.error.DeviceAuthException},
 * {@link com.platform.fleetsync.error.DeviceNetworkException} or
 * {@link com.platform.fleetsync.error.DeviceProtocolException}.
 */
public interface DeviceClient {
    
    DeviceInfo getInfo(CallContext ctx);
    
    DeviceStatus getStatus(CallContext ctx);
    
    /**
     * Full device configuration in the device's own dialect.
     */
    JsonNode getConfiguration(CallContext ctx);
    
    /**
     * Change a component's state, e.g. ("switch", 0, "on") or ("light", 1, "40").
     */
    void setComponentState(CallContext ctx, String component, int channel, String value);
    
    void reboot(CallContext ctx);
    
    /**
     * Authenticated round trip. Succeeds only if the current credential is accepted.
     */
    void testConnection(CallContext ctx);
    
    /**
     * Push a canonical configuration document to the device.
     */
    void applyConfiguration(CallContext ctx, ObjectNode canonicalConfig);
    
    Generation generation();
    
    String ip();
}
