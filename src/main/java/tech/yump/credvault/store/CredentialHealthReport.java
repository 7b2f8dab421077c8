package tech.yump.credvault.store;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

public record CredentialHealthReport(
        String tenantId,
        int totalCredentials,
        boolean healthy,
        List<Warning> warnings,
        List<Recommendation> recommendations
) {

    public enum Priority {
        LOW, MEDIUM, HIGH
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Warning(String providerId, String scope, long ageDays, String message) {
    }

    public record Recommendation(Priority priority, String providerId, String action, String message) {
    }
}
