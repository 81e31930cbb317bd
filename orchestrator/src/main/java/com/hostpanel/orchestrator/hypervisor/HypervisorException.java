package com.hostpanel.orchestrator.hypervisor;

/**
 * Thrown when a hypervisor control plane returns an error or is unreachable.
 */
public class HypervisorException extends RuntimeException {

    public HypervisorException(String message) {
        super(message);
    }

    public HypervisorException(String message, Throwable cause) {
        super(message, cause);
    }
}
