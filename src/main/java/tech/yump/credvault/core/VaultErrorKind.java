package tech.yump.credvault.core;

/**
 * Classification of vault failures as seen by callers of the tool boundary.
 */
public enum VaultErrorKind {

    /** Input rejected: bad tenant id, bad scope, credential format. */
    VALIDATION(false, false),

    /** Provider id not present in the registry. */
    UNKNOWN_PROVIDER(false, false),

    /** AEAD tag mismatch. Tampered record or wrong master key. */
    AUTHENTICATION_FAILED(true, false),

    /** Database unreachable, pool exhausted or query timed out. */
    STORAGE_UNAVAILABLE(false, true),

    /** Cryptographic primitive failed while encrypting. */
    ENCRYPTION_FAILED(true, false),

    /** Anything not covered above. */
    INTERNAL(true, false);

    private final boolean incident;
    private final boolean retryable;

    VaultErrorKind(boolean incident, boolean retryable) {
        this.incident = incident;
        this.retryable = retryable;
    }

    public boolean isIncident() {
        return incident;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
