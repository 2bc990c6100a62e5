package com.platform.fleetsync.error;

/**
 * The device refused the call because of missing or wrong credentials.
 * Recoverable: triggers credential fallback once.
 */
public class DeviceAuthException extends DeviceCommunicationException {
    
    public DeviceAuthException(ErrorCode errorCode, String deviceIp, int generation,
            String operation, int statusCode, String message) {
        super(errorCode, deviceIp, generation, operation, statusCode, message, null);
    }
    
    public static DeviceAuthException required(String deviceIp, int generation, String operation) {
        return new DeviceAuthException(ErrorCode.DEVICE_AUTH_REQUIRED, deviceIp, generation, operation,
            401, "authentication required");
    }
    
    public static DeviceAuthException rejected(String deviceIp, int generation, String operation) {
        return new DeviceAuthException(ErrorCode.DEVICE_AUTH_FAILED, deviceIp, generation, operation,
            401, "credentials rejected");
    }
}
