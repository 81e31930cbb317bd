package com.hostpanel.orchestrator.discovery;

/**
 * Discovery retrieved the inventory but could not store the new snapshot.
 * The previous snapshot is left in place.
 */
public class DiscoveryException extends RuntimeException {

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
