package com.platform.fleetsync.api;

public final class ApiHeaders {
    
    /**
     * Who made the change; recorded in configuration history and audit lines.
     */
    public static final String ACTOR = "X-Actor";
    
    public static final String DEFAULT_ACTOR = "api";
    
    private ApiHeaders() {
    }
}
