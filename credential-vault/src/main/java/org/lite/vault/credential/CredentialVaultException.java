package org.lite.vault.credential;

/**
 * Raised when a credential cannot be encrypted or decrypted.
 * Messages never contain plaintext or ciphertext material.
 */
public class CredentialVaultException extends RuntimeException {

    public CredentialVaultException(String message) {
        super(message);
    }

    public CredentialVaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
