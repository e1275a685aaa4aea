package org.lite.vault.credential;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class AesGcmCredentialVaultTest {

    private static final String CONTEXT = "integration-credentials";

    private String masterKey;
    private AesGcmCredentialVault vault;

    @BeforeEach
    void setUp() {
        masterKey = MasterKeys.generate();
        vault = new AesGcmCredentialVault(masterKey, CONTEXT);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "admin", "p@ss:w0rd with spaces", "{\"X-Trace\":\"abc\"}", "ключ-密钥-🔑"})
    void testRoundTrip(String plaintext) {
        String ciphertext = vault.encrypt(plaintext);

        assertEquals(plaintext, vault.decrypt(ciphertext));
    }

    @Test
    void testCiphertextNeverContainsPlaintext() {
        String ciphertext = vault.encrypt("secret123");

        assertTrue(ciphertext.startsWith(AesGcmCredentialVault.VERSION_PREFIX));
        assertFalse(ciphertext.contains("secret123"));
    }

    @Test
    void testSamePlaintextEncryptsDifferentlyEachTime() {
        assertNotEquals(vault.encrypt("token"), vault.encrypt("token"));
    }

    @Test
    void testTamperedCiphertextFailsAuthentication() {
        String ciphertext = vault.encrypt("secret123");
        byte[] raw = Base64.getDecoder().decode(ciphertext.substring(3));
        raw[raw.length - 1] ^= 0x01;
        String tampered = "v1:" + Base64.getEncoder().encodeToString(raw);

        assertThrows(CredentialVaultException.class, () -> vault.decrypt(tampered));
    }

    @Test
    void testOtherMasterKeyCannotDecrypt() {
        String ciphertext = vault.encrypt("secret123");
        AesGcmCredentialVault other = new AesGcmCredentialVault(MasterKeys.generate(), CONTEXT);

        assertThrows(CredentialVaultException.class, () -> other.decrypt(ciphertext));
    }

    @Test
    void testOtherKeyContextCannotDecrypt() {
        String ciphertext = vault.encrypt("secret123");
        AesGcmCredentialVault other = new AesGcmCredentialVault(masterKey, "another-context");

        assertThrows(CredentialVaultException.class, () -> other.decrypt(ciphertext));
    }

    @Test
    void testMalformedCiphertextIsRejected() {
        assertThrows(CredentialVaultException.class, () -> vault.decrypt("plain-text"));
        assertThrows(CredentialVaultException.class, () -> vault.decrypt("v1:%%%not-base64%%%"));
        assertThrows(CredentialVaultException.class, () -> vault.decrypt("v1:AAAA"));
    }

    @Test
    void testShortOrMissingMasterKeyIsRejected() {
        String shortKey = Base64.getEncoder().encodeToString(new byte[16]);

        assertThrows(CredentialVaultException.class, () -> new AesGcmCredentialVault(shortKey, CONTEXT));
        assertThrows(CredentialVaultException.class, () -> new AesGcmCredentialVault("", CONTEXT));
        assertThrows(CredentialVaultException.class, () -> new AesGcmCredentialVault(null, CONTEXT));
    }

    @Test
    void testGeneratedMasterKeyIs256Bits() {
        assertEquals(MasterKeys.KEY_LENGTH, Base64.getDecoder().decode(MasterKeys.generate()).length);
    }
}
