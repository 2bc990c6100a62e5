package com.platform.fleetsync.protocol;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Application-wide parent of every device call. Cancelled on shutdown so
 * in-flight calls stop cooperatively.
 */
@Slf4j
@Component
public class RootCallContext {
    
    private final CallContext root = CallContext.root();
    
    public CallContext get() {
        return root;
    }
    
    @PreDestroy
    public void shutdown() {
        log.info("Cancelling in-flight device calls");
        root.cancel();
    }
}
