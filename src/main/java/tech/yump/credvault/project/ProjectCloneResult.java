package tech.yump.credvault.project;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Per-credential outcome of a best-effort project clone.
 */
public record ProjectCloneResult(
        String sourceProject,
        String targetProject,
        List<Outcome> outcomes,
        int clonedCount,
        int failedCount
) {

    public enum Status {
        CLONED, FAILED
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Outcome(String providerId, String environment, Status status, String reason) {
    }

    static ProjectCloneResult of(String sourceProject, String targetProject, List<Outcome> outcomes) {
        int cloned = (int) outcomes.stream().filter(o -> o.status() == Status.CLONED).count();
        return new ProjectCloneResult(sourceProject, targetProject, List.copyOf(outcomes), cloned, outcomes.size() - cloned);
    }
}
