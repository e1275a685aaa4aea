package org.lite.vault.credential;

import lombok.extern.slf4j.Slf4j;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * AES-256-GCM credential vault.
 *
 * Ciphertext layout: {@code v1:} followed by base64 of {@code IV (12 bytes) || encrypted data || GCM tag}.
 * The AES key is derived from the injected master key and a key context, so one master
 * key can serve several independent vaults.
 */
@Slf4j
public class AesGcmCredentialVault implements CredentialVault {

    static final String VERSION_PREFIX = "v1:";

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12; // 96 bits for GCM
    private static final int GCM_TAG_LENGTH = 16; // 128 bits

    private final SecretKey key;

    public AesGcmCredentialVault(String masterKeyBase64, String keyContext) {
        Objects.requireNonNull(keyContext, "keyContext");
        this.key = MasterKeys.deriveAesKey(MasterKeys.decode(masterKeyBase64), keyContext);
        log.info("Credential vault initialized for key context: {}", keyContext);
    }

    @Override
    public String encrypt(String plaintext) {
        Objects.requireNonNull(plaintext, "plaintext");
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key);

            byte[] encryptedBytes = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            byte[] iv = cipher.getIV();

            // IV + encrypted data (GCM appends the tag)
            byte[] combined = new byte[iv.length + encryptedBytes.length];
            System.arraycopy(iv, 0, combined, 0, iv.length);
            System.arraycopy(encryptedBytes, 0, combined, iv.length, encryptedBytes.length);

            return VERSION_PREFIX + Base64.getEncoder().encodeToString(combined);
        } catch (GeneralSecurityException e) {
            throw new CredentialVaultException("Credential encryption failed", e);
        }
    }

    @Override
    public String decrypt(String ciphertext) {
        Objects.requireNonNull(ciphertext, "ciphertext");
        if (!ciphertext.startsWith(VERSION_PREFIX)) {
            throw new CredentialVaultException("Unsupported credential ciphertext version");
        }

        byte[] combined;
        try {
            combined = Base64.getDecoder().decode(ciphertext.substring(VERSION_PREFIX.length()));
        } catch (IllegalArgumentException e) {
            throw new CredentialVaultException("Credential ciphertext is not valid base64", e);
        }
        if (combined.length < GCM_IV_LENGTH + GCM_TAG_LENGTH) {
            throw new CredentialVaultException("Credential ciphertext is truncated");
        }

        byte[] iv = Arrays.copyOfRange(combined, 0, GCM_IV_LENGTH);
        byte[] encrypted = Arrays.copyOfRange(combined, GCM_IV_LENGTH, combined.length);
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            return new String(cipher.doFinal(encrypted), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            // Tag mismatch lands here: wrong key or tampered data
            throw new CredentialVaultException("Credential decryption failed", e);
        }
    }
}
