package tech.yump.credvault.project;

import java.time.Instant;
import java.util.Map;

/**
 * All credentials of one project, grouped by provider then environment.
 */
public record ProjectCredentials(
        String project,
        Map<String, Map<String, Entry>> byProvider,
        int totalCredentials
) {

    public record Entry(String scope, Instant createdAt, Instant updatedAt) {
    }
}
