package com.hostpanel.orchestrator.model;

/**
 * One virtual NIC of a discovered VM.
 *
 * ipAddress is only known when guest tooling reported it; null otherwise.
 */
public record NetworkAdapter(String name, String macAddress, String ipAddress, String network) {

    public NetworkAdapter withIpAddress(String ip) {
        return new NetworkAdapter(name, macAddress, ip, network);
    }
}
