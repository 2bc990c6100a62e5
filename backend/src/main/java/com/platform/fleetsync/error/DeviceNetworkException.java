package com.platform.fleetsync.error;

/**
 * Timeout, refused connection, unreachable host or cancelled call.
 * Fails the single operation, never the fleet.
 */
public class DeviceNetworkException extends DeviceCommunicationException {
    
    public DeviceNetworkException(ErrorCode errorCode, String deviceIp, int generation,
            String operation, String message, Throwable cause) {
        super(errorCode, deviceIp, generation, operation, 0, message, cause);
    }
    
    public static DeviceNetworkException unreachable(String deviceIp, int generation, String operation,
            Throwable cause) {
        return new DeviceNetworkException(ErrorCode.DEVICE_UNREACHABLE, deviceIp, generation, operation,
            cause != null && cause.getMessage() != null ? cause.getMessage() : "connection failed", cause);
    }
    
    public static DeviceNetworkException timeout(String deviceIp, int generation, String operation) {
        return new DeviceNetworkException(ErrorCode.DEVICE_TIMEOUT, deviceIp, generation, operation,
            "deadline exceeded", null);
    }
    
    public static DeviceNetworkException cancelled(String deviceIp, int generation, String operation) {
        return new DeviceNetworkException(ErrorCode.OPERATION_CANCELLED, deviceIp, generation, operation,
            "call cancelled", null);
    }
}
