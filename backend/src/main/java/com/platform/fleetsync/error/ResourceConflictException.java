package com.platform.fleetsync.error;

/**
 * The resource is in a state that forbids the operation, e.g. deleting a template still assigned to devices.
 */
public class ResourceConflictException extends FleetSyncException {
    
    public ResourceConflictException(String message) {
        super(ErrorCode.RESOURCE_CONFLICT, message);
    }
}
