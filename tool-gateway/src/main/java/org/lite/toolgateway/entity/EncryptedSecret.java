package org.lite.toolgateway.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreType;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.springframework.data.annotation.PersistenceCreator;

import java.util.Objects;

/**
 * Ciphertext of one credential slot. Presence of the value object is the
 * presence flag; plaintext never lives here.
 */
@Getter
@EqualsAndHashCode
@JsonIgnoreType
public final class EncryptedSecret {

    private final String ciphertext;

    @PersistenceCreator
    public EncryptedSecret(String ciphertext) {
        this.ciphertext = Objects.requireNonNull(ciphertext, "ciphertext");
    }

    public static EncryptedSecret of(String ciphertext) {
        return new EncryptedSecret(ciphertext);
    }

    @Override
    public String toString() {
        return "EncryptedSecret[****]";
    }
}
