package com.hostpanel.orchestrator.hypervisor;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;

/**
 * AES-256-GCM decryption of stored credentials.
 *
 * Ciphertext format: base64(iv[12] || ciphertext+tag). The key is a base64
 * encoded 32-byte value shared with the panel that writes the credentials.
 */
@Component
public class AesGcmCredentialCipher implements CredentialCipher {

    private static final int IV_LENGTH = 12;
    private static final int TAG_BITS  = 128;

    private final SecretKeySpec key;

    public AesGcmCredentialCipher(@Value("${hostpanel.credentials.key}") String base64Key) {
        byte[] raw = Base64.getDecoder().decode(base64Key);
        if (raw.length != 32) {
            throw new IllegalArgumentException("hostpanel.credentials.key must decode to 32 bytes, got " + raw.length);
        }
        this.key = new SecretKeySpec(raw, "AES");
    }

    @Override
    public String decrypt(String ciphertext) {
        try {
            byte[] all = Base64.getDecoder().decode(ciphertext);
            if (all.length <= IV_LENGTH) {
                throw new IllegalArgumentException("Ciphertext too short");
            }
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, all, 0, IV_LENGTH));
            byte[] plain = cipher.doFinal(all, IV_LENGTH, all.length - IV_LENGTH);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Credential decryption failed", e);
        }
    }
}
