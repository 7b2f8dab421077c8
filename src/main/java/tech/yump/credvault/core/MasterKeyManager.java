package tech.yump.credvault.core;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.credvault.config.VaultProperties;
import tech.yump.credvault.crypto.CryptoEngine;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the process-wide master key used to seal every stored credential.
 * <p>
 * The key is derived once at startup and never replaced while the process runs. Changing
 * it requires a restart and re-encryption of existing rows; records sealed under another
 * key fail authentication on read.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MasterKeyManager {

    static final int MIN_SECRET_LENGTH = 32;
    private static final String AES = "AES";

    private final VaultProperties vaultProperties;
    private final CryptoEngine cryptoEngine;

    private final AtomicReference<SecretKey> masterKey = new AtomicReference<>(null);
    private volatile boolean ephemeral;

    @PostConstruct
    void initialize() {
        log.info("Initializing MasterKeyManager...");
        VaultProperties.EncryptionProperties encryption = vaultProperties.encryption();

        if (!encryption.hasKey()) {
            if (vaultProperties.productionMode()) {
                log.error("No encryption key configured (vault.encryption.key / CREDENTIAL_ENCRYPTION_KEY) in production mode.");
                throw new IllegalStateException("CREDENTIAL_ENCRYPTION_KEY must be set when running in production mode.");
            }
            initializeEphemeralKey();
            return;
        }

        String secret = encryption.key();
        if (secret.length() < MIN_SECRET_LENGTH) {
            log.error("Configured encryption key is too short: {} characters, at least {} required.", secret.length(), MIN_SECRET_LENGTH);
            throw new IllegalStateException("Encryption key must be at least " + MIN_SECRET_LENGTH + " characters long.");
        }

        byte[] salt;
        if (encryption.hasSalt()) {
            salt = encryption.salt().getBytes(StandardCharsets.UTF_8);
        } else {
            log.warn("No encryption salt configured (CREDENTIAL_ENCRYPTION_SALT). Deriving a deterministic salt from the key; "
                    + "deployments sharing this key will share the derived master key.");
            salt = cryptoEngine.defaultSalt(secret);
        }

        char[] secretChars = secret.toCharArray();
        try {
            masterKey.set(cryptoEngine.deriveKey(secretChars, salt, encryption.iterations()));
        } finally {
            Arrays.fill(secretChars, '\0');
            Arrays.fill(salt, (byte) 0);
        }
        ephemeral = false;
        log.info("Master key derived from configured secret ({} PBKDF2 iterations).", encryption.iterations());
    }

    private void initializeEphemeralKey() {
        byte[] keyBytes = new byte[CryptoEngine.KEY_LENGTH_BYTE];
        new SecureRandom().nextBytes(keyBytes);
        masterKey.set(new SecretKeySpec(keyBytes, AES));
        Arrays.fill(keyBytes, (byte) 0);
        ephemeral = true;

        log.error("!!! No encryption key configured (CREDENTIAL_ENCRYPTION_KEY). Using a RANDOM master key for this process. !!!");
        log.warn("Credentials stored now will be UNREADABLE after a restart. Set CREDENTIAL_ENCRYPTION_KEY (32+ characters) to persist them.");
    }

    /**
     * @return the master key.
     * @throws IllegalStateException if called before initialization.
     */
    public SecretKey getMasterKey() {
        SecretKey key = masterKey.get();
        if (key == null) {
            throw new IllegalStateException("Master key has not been initialized.");
        }
        return key;
    }

    /**
     * @return true when the key was generated at random because none was configured.
     */
    public boolean isEphemeral() {
        return ephemeral;
    }
}
