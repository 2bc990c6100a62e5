package com.platform.fleetsync.error;

/**
 * Malformed or unexpected device response. Fatal for that call.
 */
public class DeviceProtocolException extends DeviceCommunicationException {
    
    public DeviceProtocolException(String deviceIp, int generation, String operation,
            int statusCode, String message, Throwable cause) {
        super(ErrorCode.DEVICE_PROTOCOL_ERROR, deviceIp, generation, operation, statusCode, message, cause);
    }
    
    private DeviceProtocolException(String deviceIp, int generation, String operation,
            int rpcErrorCode, String message) {
        super(ErrorCode.DEVICE_RPC_ERROR, deviceIp, generation, operation, 200,
            String.format("RPC error %d: %s", rpcErrorCode, message), null);
    }
    
    public static DeviceProtocolException malformed(String deviceIp, int generation, String operation,
            String message, Throwable cause) {
        return new DeviceProtocolException(deviceIp, generation, operation, 200, message, cause);
    }
    
    public static DeviceProtocolException unexpectedStatus(String deviceIp, int generation, String operation,
            int statusCode, String body) {
        return new DeviceProtocolException(deviceIp, generation, operation, statusCode,
            "unexpected HTTP status " + statusCode + (body == null || body.isBlank() ? "" : ": " + body), null);
    }
    
    public static DeviceProtocolException rpcError(String deviceIp, String operation, int code, String message) {
        return new DeviceProtocolException(deviceIp, 2, operation, code, message);
    }
}
