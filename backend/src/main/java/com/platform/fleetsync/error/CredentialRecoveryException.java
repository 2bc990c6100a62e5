package com.platform.fleetsync.error;

/**
 * Terminal Failed state of credential recovery: neither the saved nor the
 * fallback credential was accepted (or no fallback was available).
 */
public class CredentialRecoveryException extends FleetSyncException {
    
    private final Long deviceId;
    private final int attempts;
    
    public CredentialRecoveryException(Long deviceId, int attempts, String message, Throwable cause) {
        super(ErrorCode.CREDENTIAL_RECOVERY_FAILED,
            String.format("No working credential for device %d after %d attempt(s): %s", deviceId, attempts, message),
            cause);
        this.deviceId = deviceId;
        this.attempts = attempts;
    }
    
    public Long getDeviceId() {
        return deviceId;
    }
    
    public int getAttempts() {
        return attempts;
    }
}
