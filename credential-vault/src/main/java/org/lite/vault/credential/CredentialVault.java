package org.lite.vault.credential;

/**
 * Encrypts and decrypts the small secret strings used to authenticate against
 * external systems (usernames, passwords, tokens, custom header blobs).
 *
 * Implementations must round-trip exactly: {@code decrypt(encrypt(x)).equals(x)}
 * for every non-null string, including the empty string. A ciphertext that
 * cannot be authenticated is reported with {@link CredentialVaultException},
 * never with a partial or empty plaintext.
 */
public interface CredentialVault {

    /**
     * Encrypt a plaintext secret.
     *
     * @param plaintext secret value, never null
     * @return self-describing ciphertext safe to persist
     */
    String encrypt(String plaintext);

    /**
     * Decrypt a ciphertext previously produced by {@link #encrypt(String)}.
     *
     * @param ciphertext stored ciphertext, never null
     * @return the original plaintext
     * @throws CredentialVaultException if the ciphertext is malformed, was produced
     *                                  with another key, or has been tampered with
     */
    String decrypt(String ciphertext);
}
