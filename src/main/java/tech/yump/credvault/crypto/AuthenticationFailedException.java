package tech.yump.credvault.crypto;

import tech.yump.credvault.core.CredentialVaultException;
import tech.yump.credvault.core.VaultErrorKind;

/**
 * Thrown when a stored payload fails AEAD verification. The payload is either
 * corrupt, tampered with, or was written under a different master key.
 */
public class AuthenticationFailedException extends CredentialVaultException {

    public AuthenticationFailedException(String message) {
        super(VaultErrorKind.AUTHENTICATION_FAILED, message);
    }

    public AuthenticationFailedException(String message, Throwable cause) {
        super(VaultErrorKind.AUTHENTICATION_FAILED, message, cause);
    }
}
