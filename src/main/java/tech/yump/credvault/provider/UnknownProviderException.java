package tech.yump.credvault.provider;

import tech.yump.credvault.core.CredentialVaultException;
import tech.yump.credvault.core.VaultErrorKind;

import java.util.List;

public class UnknownProviderException extends CredentialVaultException {

    private final String providerId;
    private final List<String> availableProviders;

    public UnknownProviderException(String providerId, List<String> availableProviders) {
        super(VaultErrorKind.UNKNOWN_PROVIDER,
                "Unknown provider: " + providerId + ". Available providers: " + String.join(", ", availableProviders));
        this.providerId = providerId;
        this.availableProviders = List.copyOf(availableProviders);
    }

    public String getProviderId() {
        return providerId;
    }

    public List<String> getAvailableProviders() {
        return availableProviders;
    }
}
