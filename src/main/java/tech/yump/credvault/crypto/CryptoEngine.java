package tech.yump.credvault.crypto;

import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.PBEParametersGenerator;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.springframework.stereotype.Component;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.Security;
import java.util.Arrays;

/**
 * Key derivation and authenticated encryption for stored credentials.
 * <p>
 * Keys are derived with PBKDF2-HMAC-SHA256. Values are sealed with AES-256-GCM using a
 * fresh random 96-bit nonce per call and a 128-bit authentication tag, which is kept
 * separately from the ciphertext.
 */
@Slf4j
@Component
public class CryptoEngine {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    public static final int KEY_LENGTH_BYTE = 32;
    public static final int NONCE_LENGTH_BYTE = 12;
    public static final int TAG_LENGTH_BYTE = 16;
    public static final int MIN_ITERATIONS = 100_000;

    static final String DEFAULT_SALT_LABEL = "credential-vault-salt";

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final String AES = "AES";
    private static final int TAG_LENGTH_BIT = TAG_LENGTH_BYTE * 8;

    private final SecureRandom secureRandom = new SecureRandom();

    /**
     * Derives a 256-bit AES key from a secret with PBKDF2-HMAC-SHA256.
     *
     * @param secret     the operator supplied secret. Not retained.
     * @param salt       the salt, see {@link #defaultSalt(String)} when none is configured.
     * @param iterations iteration count, at least {@value #MIN_ITERATIONS}.
     * @return the derived key.
     * @throws IllegalArgumentException on empty secret or salt, or too few iterations.
     */
    public SecretKey deriveKey(char[] secret, byte[] salt, int iterations) {
        if (secret == null || secret.length == 0) {
            throw new IllegalArgumentException("Secret cannot be null or empty.");
        }
        if (salt == null || salt.length == 0) {
            throw new IllegalArgumentException("Salt cannot be null or empty.");
        }
        if (iterations < MIN_ITERATIONS) {
            throw new IllegalArgumentException("PBKDF2 iterations must be at least " + MIN_ITERATIONS + ", got " + iterations);
        }

        byte[] passwordBytes = PBEParametersGenerator.PKCS5PasswordToUTF8Bytes(secret);
        try {
            PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
            generator.init(passwordBytes, salt, iterations);
            KeyParameter keyParameter = (KeyParameter) generator.generateDerivedParameters(KEY_LENGTH_BYTE * 8);
            byte[] keyBytes = keyParameter.getKey();
            SecretKey key = new SecretKeySpec(keyBytes, AES);
            Arrays.fill(keyBytes, (byte) 0);
            log.debug("Derived {}-bit key using {} PBKDF2 iterations.", KEY_LENGTH_BYTE * 8, iterations);
            return key;
        } finally {
            Arrays.fill(passwordBytes, (byte) 0);
        }
    }

    /**
     * Deterministic fallback salt: {@code SHA-256(secret || "credential-vault-salt")}.
     * Two deployments sharing a secret share a derived key when they both rely on it.
     */
    public byte[] defaultSalt(String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("Secret cannot be null or empty.");
        }
        byte[] input = (secret + DEFAULT_SALT_LABEL).getBytes(StandardCharsets.UTF_8);
        SHA256Digest digest = new SHA256Digest();
        digest.update(input, 0, input.length);
        byte[] salt = new byte[digest.getDigestSize()];
        digest.doFinal(salt, 0);
        Arrays.fill(input, (byte) 0);
        return salt;
    }

    /**
     * Encrypts the plaintext under the given key with a freshly generated nonce.
     *
     * @throws EncryptionFailedException if the cipher cannot be initialised or run.
     */
    public EncryptedPayload encrypt(byte[] plaintext, SecretKey key) {
        if (plaintext == null) {
            throw new EncryptionFailedException("Plaintext cannot be null.");
        }
        requireKey(key);
        log.debug("Attempting to encrypt {} bytes of data.", plaintext.length);

        byte[] nonce = new byte[NONCE_LENGTH_BYTE];
        secureRandom.nextBytes(nonce);

        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BIT, nonce));
            byte[] sealed = cipher.doFinal(plaintext);

            // JCE appends the tag to the ciphertext
            int ciphertextLength = sealed.length - TAG_LENGTH_BYTE;
            byte[] ciphertext = Arrays.copyOfRange(sealed, 0, ciphertextLength);
            byte[] tag = Arrays.copyOfRange(sealed, ciphertextLength, sealed.length);
            log.trace("Encryption successful, ciphertext length: {} bytes.", ciphertext.length);
            return new EncryptedPayload(ciphertext, nonce, tag);
        } catch (GeneralSecurityException e) {
            log.error("Encryption failed: {}", e.getMessage(), e);
            throw new EncryptionFailedException("Failed to encrypt data.", e);
        }
    }

    /**
     * Verifies and decrypts a payload produced by {@link #encrypt(byte[], SecretKey)}.
     *
     * @throws AuthenticationFailedException if the tag does not verify or the payload is malformed.
     *                                       Never returns partial plaintext.
     */
    public byte[] decrypt(EncryptedPayload payload, SecretKey key) {
        if (payload == null) {
            throw new AuthenticationFailedException("Encrypted payload cannot be null.");
        }
        requireKey(key);
        if (payload.nonce().length != NONCE_LENGTH_BYTE || payload.tag().length != TAG_LENGTH_BYTE) {
            log.error("Malformed encrypted payload: nonce {} bytes, tag {} bytes.", payload.nonce().length, payload.tag().length);
            throw new AuthenticationFailedException("Malformed encrypted payload.");
        }
        log.debug("Attempting to decrypt {} bytes of ciphertext.", payload.ciphertext().length);

        byte[] sealed = new byte[payload.ciphertext().length + TAG_LENGTH_BYTE];
        System.arraycopy(payload.ciphertext(), 0, sealed, 0, payload.ciphertext().length);
        System.arraycopy(payload.tag(), 0, sealed, payload.ciphertext().length, TAG_LENGTH_BYTE);

        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BIT, payload.nonce()));
            byte[] plaintext = cipher.doFinal(sealed);
            log.trace("Decryption successful, plaintext length: {} bytes.", plaintext.length);
            return plaintext;
        } catch (AEADBadTagException e) {
            log.error("Decryption failed due to invalid authentication tag (tampered data or wrong key).");
            throw new AuthenticationFailedException("Decryption failed: invalid authentication tag.", e);
        } catch (GeneralSecurityException e) {
            log.error("Decryption failed due to cryptographic error: {}", e.getMessage(), e);
            throw new EncryptionFailedException("Failed to decrypt data.", e);
        }
    }

    private static void requireKey(SecretKey key) {
        if (key == null || key.getEncoded() == null || key.getEncoded().length != KEY_LENGTH_BYTE) {
            throw new EncryptionFailedException("A 256-bit key is required.");
        }
    }
}
