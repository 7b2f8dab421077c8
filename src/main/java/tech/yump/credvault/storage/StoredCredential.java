package tech.yump.credvault.storage;

import lombok.Builder;
import tech.yump.credvault.crypto.EncryptedPayload;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One persisted credential row. The secret itself only exists here in encrypted form.
 */
@Builder
public record StoredCredential(
        Long id,
        String tenantId,
        String storageKey,
        String providerId,
        String scope,
        byte[] encryptedValue,
        byte[] nonce,
        byte[] authTag,
        Map<String, String> metadata,
        Instant createdAt,
        Instant updatedAt
) {

    public StoredCredential {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public EncryptedPayload payload() {
        return new EncryptedPayload(encryptedValue, nonce, authTag);
    }

    @Override
    public String toString() {
        // Never print the encrypted bytes
        return "StoredCredential[" +
                "id=" + id +
                ", tenantId='" + tenantId + '\'' +
                ", storageKey='" + storageKey + '\'' +
                ", providerId='" + providerId + '\'' +
                ", scope='" + scope + '\'' +
                ", metadata=" + metadata +
                ", createdAt=" + createdAt +
                ", updatedAt=" + updatedAt +
                ']';
    }
}
