package tech.yump.credvault.git;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GitCredentialSummary(
        String repoUrl,
        String username,
        String storageKey,
        Instant createdAt,
        Instant updatedAt
) {
}
