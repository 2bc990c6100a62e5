package com.platform.fleetsync.protocol;

/**
 * Username/password pair used against a device.
 */
public record DeviceCredential(String username, String password) {
    
    public DeviceCredential {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("username must not be blank");
        }
        if (password == null) {
            throw new IllegalArgumentException("password must not be null");
        }
    }
    
    /**
     * Returns a credential, or null when either part is missing.
     */
    public static DeviceCredential ofNullable(String username, String password) {
        if (username == null || username.isBlank() || password == null || password.isEmpty()) {
            return null;
        }
        return new DeviceCredential(username, password);
    }
    
    @Override
    public String toString() {
        return "DeviceCredential[username=" + username + ", password=****]";
    }
}
