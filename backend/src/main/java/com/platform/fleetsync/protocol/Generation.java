package com.platform.fleetsync.protocol;

/**
 * Protocol dialect spoken by a device.
 */
public enum Generation {
    
    /** Legacy REST dialect with HTTP Basic auth. */
    GEN1(1),
    
    /** JSON-RPC dialect with HTTP Digest auth (Gen2 and later). */
    GEN2(2);
    
    private final int number;
    
    Generation(int number) {
        this.number = number;
    }
    
    public int number() {
        return number;
    }
    
    /**
     * Gen3 and later speak the Gen2 dialect.
     */
    public static Generation fromNumber(int number) {
        if (number <= 0) {
            throw new IllegalArgumentException("Unknown device generation: " + number);
        }
        return number == 1 ? GEN1 : GEN2;
    }
}
