package tech.yump.credvault.core;

/**
 * Base class for every failure raised by the credential vault.
 */
public abstract class CredentialVaultException extends RuntimeException {

    private final VaultErrorKind kind;

    protected CredentialVaultException(VaultErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected CredentialVaultException(VaultErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public VaultErrorKind getKind() {
        return kind;
    }
}
