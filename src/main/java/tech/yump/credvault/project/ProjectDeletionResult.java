package tech.yump.credvault.project;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Result of a project deletion. When not {@code executed} it is a dry run: {@code outcomes}
 * lists what would be removed and nothing was deleted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProjectDeletionResult(
        String project,
        boolean executed,
        String warning,
        int deletedCount,
        List<Outcome> outcomes
) {

    public record Outcome(String providerId, String environment, boolean deleted) {
    }
}
