package com.platform.fleetsync.drift;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DriftKind {
    
    /** Desired has a value, live does not. */
    MISSING,
    
    /** Both present, values differ. */
    CHANGED,
    
    /** Live has a value the desired configuration does not mention. Informational. */
    EXTRA;
    
    /**
     * MISSING and CHANGED take a device out of sync; EXTRA does not.
     */
    public boolean isDrift() {
        return this != EXTRA;
    }
    
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
    
    @JsonCreator
    public static DriftKind fromWireName(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
