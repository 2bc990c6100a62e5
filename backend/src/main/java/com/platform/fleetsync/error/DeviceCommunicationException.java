package com.platform.fleetsync.error;

/**
 * Base exception for failed calls to a device.
 * Callers branch on the subclass (auth, network, protocol), never on transport detail.
 */
public abstract class DeviceCommunicationException extends FleetSyncException {
    
    private final String deviceIp;
    private final int generation;
    private final String operation;
    private final int statusCode;
    
    protected DeviceCommunicationException(ErrorCode errorCode, String deviceIp, int generation,
            String operation, int statusCode, String message, Throwable cause) {
        super(errorCode, String.format("%s on %s failed: %s", operation, deviceIp, message), cause);
        this.deviceIp = deviceIp;
        this.generation = generation;
        this.operation = operation;
        this.statusCode = statusCode;
    }
    
    public String getDeviceIp() {
        return deviceIp;
    }
    
    public int getGeneration() {
        return generation;
    }
    
    public String getOperation() {
        return operation;
    }
    
    /**
     * HTTP status returned by the device, or 0 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
