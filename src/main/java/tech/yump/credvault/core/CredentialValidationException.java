package tech.yump.credvault.core;

/**
 * Rejected input: malformed credential, tenant id, scope or project name.
 * The reason is safe to show to callers; it never contains the credential itself.
 */
public class CredentialValidationException extends CredentialVaultException {

    private final String reason;

    public CredentialValidationException(String reason) {
        super(VaultErrorKind.VALIDATION, reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
