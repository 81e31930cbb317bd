package com.hostpanel.orchestrator.hypervisor;

/**
 * Decrypts host and cluster passwords stored at rest.
 */
public interface CredentialCipher {

    String decrypt(String ciphertext);
}
