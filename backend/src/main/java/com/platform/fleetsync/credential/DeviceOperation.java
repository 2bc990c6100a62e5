package com.platform.fleetsync.credential;

import com.platform.fleetsync.protocol.CallContext;
import com.platform.fleetsync.protocol.DeviceClient;

/**
 * A unit of work against a live device client.
 */
@FunctionalInterface
public interface DeviceOperation<T> {
    
    T apply(DeviceClient client, CallContext ctx);
}
