package tech.yump.credvault.crypto;

import tech.yump.credvault.core.CredentialVaultException;
import tech.yump.credvault.core.VaultErrorKind;

public class EncryptionFailedException extends CredentialVaultException {

    public EncryptionFailedException(String message) {
        super(VaultErrorKind.ENCRYPTION_FAILED, message);
    }

    public EncryptionFailedException(String message, Throwable cause) {
        super(VaultErrorKind.ENCRYPTION_FAILED, message, cause);
    }
}
