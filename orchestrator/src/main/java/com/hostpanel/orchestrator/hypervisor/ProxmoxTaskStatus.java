package com.hostpanel.orchestrator.hypervisor;

/**
 * Snapshot of an asynchronous Proxmox task (UPID).
 *
 * @param status     "running" or "stopped"
 * @param exitStatus "OK" on success, an error text otherwise; null while running
 */
public record ProxmoxTaskStatus(String upid, String status, String exitStatus) {

    public boolean isRunning() {
        return !"stopped".equals(status);
    }

    public boolean isSuccessful() {
        return "stopped".equals(status) && "OK".equals(exitStatus);
    }
}
