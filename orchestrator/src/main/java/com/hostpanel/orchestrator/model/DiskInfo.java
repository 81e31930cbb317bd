package com.hostpanel.orchestrator.model;

/**
 * One virtual disk of a discovered VM.
 *
 * @param sourcePath datastore path on the source host, e.g. "[datastore1] web01/web01.vmdk"
 * @param type       backing type reported by the source (e.g. "VirtualDiskFlatVer2BackingInfo")
 */
public record DiskInfo(String name, double sizeGB, String sourcePath, String type) {}
