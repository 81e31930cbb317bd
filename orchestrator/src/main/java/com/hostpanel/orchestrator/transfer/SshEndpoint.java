package com.hostpanel.orchestrator.transfer;

/**
 * Where and as whom to open an SFTP session. The password is already decrypted.
 */
public record SshEndpoint(String host, int port, String username, String password) {

    @Override
    public String toString() {
        return username + "@" + host + ":" + port;
    }
}
