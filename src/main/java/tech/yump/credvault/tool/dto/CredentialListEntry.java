package tech.yump.credvault.tool.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import tech.yump.credvault.storage.CredentialSummary;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CredentialListEntry(
        String providerId,
        String scope,
        String maskedValue,
        Instant createdAt,
        Instant updatedAt
) {

    public static CredentialListEntry from(CredentialSummary summary, String maskedValue) {
        return new CredentialListEntry(summary.providerId(), summary.scope(), maskedValue,
                summary.createdAt(), summary.updatedAt());
    }
}
