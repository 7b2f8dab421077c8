package tech.yump.credvault.store;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Per-tenant overview of stored credentials. Contains masked values only.
 */
public record CredentialStatusReport(
        String tenantId,
        int totalCredentials,
        Map<String, ProviderStatus> byProvider,
        List<String> providers
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ProviderStatus(
            int count,
            String maskedValue, // of the most recently updated credential
            List<String> scopes
    ) {
    }
}
