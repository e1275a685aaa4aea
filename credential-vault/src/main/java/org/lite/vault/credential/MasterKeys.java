package org.lite.vault.credential;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * Helpers for vault master key material: generation, decoding and
 * context-specific key derivation.
 */
public final class MasterKeys {

    public static final int KEY_LENGTH = 32; // 256 bits

    private static final SecureRandom RANDOM = new SecureRandom();

    private MasterKeys() {
    }

    /**
     * Generate a fresh random master key, base64 encoded.
     */
    public static String generate() {
        byte[] key = new byte[KEY_LENGTH];
        RANDOM.nextBytes(key);
        return Base64.getEncoder().encodeToString(key);
    }

    /**
     * Decode a base64 master key and check it carries at least 256 bits.
     */
    public static byte[] decode(String masterKeyBase64) {
        if (masterKeyBase64 == null || masterKeyBase64.isBlank()) {
            throw new CredentialVaultException("Vault master key is not configured");
        }
        byte[] masterKey;
        try {
            masterKey = Base64.getDecoder().decode(masterKeyBase64.trim());
        } catch (IllegalArgumentException e) {
            throw new CredentialVaultException("Vault master key is not valid base64", e);
        }
        if (masterKey.length < KEY_LENGTH) {
            throw new CredentialVaultException(
                    "Vault master key must be at least " + KEY_LENGTH + " bytes, got " + masterKey.length);
        }
        return masterKey;
    }

    /**
     * Derive a context-specific AES key from the master key using HMAC-SHA256
     * (HKDF-like, one expansion block).
     */
    public static SecretKeySpec deriveAesKey(byte[] masterKey, String context) {
        try {
            Mac hmac = Mac.getInstance("HmacSHA256");
            hmac.init(new SecretKeySpec(masterKey, "HmacSHA256"));
            byte[] derived = hmac.doFinal(context.getBytes(StandardCharsets.UTF_8));
            byte[] key = Arrays.copyOf(derived, KEY_LENGTH);
            return new SecretKeySpec(key, "AES");
        } catch (GeneralSecurityException e) {
            throw new CredentialVaultException("Failed to derive vault key for context: " + context, e);
        }
    }
}
