package com.hostpanel.orchestrator.migration;

/**
 * How VMs reach the target cluster.
 */
public enum ImportStrategy {
    /** Download, convert and upload each disk through this machine, then create the VM. */
    FULL_PIPELINE,
    /** Let the cluster pull disks from the ESXi host itself (Proxmox VE 8.2+). */
    NATIVE_IMPORT
}
