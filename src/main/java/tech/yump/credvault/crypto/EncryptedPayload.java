package tech.yump.credvault.crypto;

import java.util.Arrays;
import java.util.Objects;

/**
 * AES-GCM output split into its three stored parts.
 */
public record EncryptedPayload(byte[] ciphertext, byte[] nonce, byte[] tag) {

    public EncryptedPayload {
        Objects.requireNonNull(ciphertext, "ciphertext");
        Objects.requireNonNull(nonce, "nonce");
        Objects.requireNonNull(tag, "tag");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EncryptedPayload that)) return false;
        return Arrays.equals(ciphertext, that.ciphertext)
                && Arrays.equals(nonce, that.nonce)
                && Arrays.equals(tag, that.tag);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(ciphertext);
        result = 31 * result + Arrays.hashCode(nonce);
        result = 31 * result + Arrays.hashCode(tag);
        return result;
    }

    @Override
    public String toString() {
        // Lengths only
        return "EncryptedPayload[ciphertext=" + ciphertext.length + " bytes, nonce=" + nonce.length
                + " bytes, tag=" + tag.length + " bytes]";
    }
}
