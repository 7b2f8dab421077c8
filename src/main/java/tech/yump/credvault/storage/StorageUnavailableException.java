package tech.yump.credvault.storage;

import tech.yump.credvault.core.CredentialVaultException;
import tech.yump.credvault.core.VaultErrorKind;

/**
 * Persistence failure: connection refused, pool exhausted or query timeout.
 * Safe to retry since writes are upserts.
 */
public class StorageUnavailableException extends CredentialVaultException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(VaultErrorKind.STORAGE_UNAVAILABLE, message, cause);
    }
}
