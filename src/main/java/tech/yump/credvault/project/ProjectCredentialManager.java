package tech.yump.credvault.project;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.credvault.audit.AuditHelper;
import tech.yump.credvault.core.CredentialValidationException;
import tech.yump.credvault.core.CredentialVaultException;
import tech.yump.credvault.scope.CredentialScope;
import tech.yump.credvault.storage.CredentialSummary;
import tech.yump.credvault.store.CredentialStore;
import tech.yump.credvault.store.MetadataKeys;
import tech.yump.credvault.store.StoredCredentialSummary;
import tech.yump.credvault.store.TenantIdSanitizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Project and environment view over {@link CredentialStore}.
 * <p>
 * Project credentials are ordinary credentials whose scope is a
 * {@link CredentialScope.Project}; the stored scope string is the only source of truth
 * for grouping.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProjectCredentialManager {

    static final String PROJECT_CREDENTIAL_TYPE = "project_credential";
    static final String AUDIT_TYPE = "project_operation";

    private final CredentialStore credentialStore;
    private final AuditHelper auditHelper;

    public StoredCredentialSummary setProjectCredential(String tenantId, String project, String providerId,
                                                        String credential, String environment) {
        CredentialScope.Project scope = new CredentialScope.Project(project, environment);
        return credentialStore.storeCredential(providerId, credential, tenantId, scope, projectMetadata(scope, null));
    }

    public Optional<String> getProjectCredential(String tenantId, String project, String providerId, String environment) {
        return credentialStore.getCredential(providerId, tenantId, new CredentialScope.Project(project, environment));
    }

    public ProjectCredentials getProjectCredentials(String tenantId, String project) {
        String projectName = new CredentialScope.Project(project, null).name();
        Map<String, Map<String, ProjectCredentials.Entry>> byProvider = new TreeMap<>();
        int total = 0;
        for (ProjectEntry entry : projectEntries(tenantId)) {
            if (!entry.scope().name().equals(projectName)) {
                continue;
            }
            byProvider.computeIfAbsent(entry.summary().providerId(), id -> new TreeMap<>())
                    .put(entry.scope().environment(), new ProjectCredentials.Entry(
                            entry.summary().scope(), entry.summary().createdAt(), entry.summary().updatedAt()));
            total++;
        }
        return new ProjectCredentials(projectName, byProvider, total);
    }

    /**
     * @return the tenant's projects sorted by name, derived from stored scopes.
     */
    public List<ProjectSummary> listProjects(String tenantId) {
        Map<String, Set<String>> environments = new TreeMap<>();
        Map<String, Set<String>> providers = new TreeMap<>();
        Map<String, Integer> counts = new TreeMap<>();

        for (ProjectEntry entry : projectEntries(tenantId)) {
            String name = entry.scope().name();
            environments.computeIfAbsent(name, n -> new TreeSet<>()).add(entry.scope().environment());
            providers.computeIfAbsent(name, n -> new TreeSet<>()).add(entry.summary().providerId());
            counts.merge(name, 1, Integer::sum);
        }

        List<ProjectSummary> projects = new ArrayList<>();
        counts.forEach((name, count) -> projects.add(new ProjectSummary(
                name, List.copyOf(environments.get(name)), List.copyOf(providers.get(name)), count)));
        return projects;
    }

    /**
     * Copies every credential of {@code sourceProject} (optionally only the given providers)
     * into {@code targetProject}, keeping environments. Failures are recorded per credential
     * and do not stop the clone.
     *
     * @param providerIds providers to copy, null or empty for all.
     */
    public ProjectCloneResult cloneProjectCredentials(String tenantId, String sourceProject, String targetProject,
                                                      Collection<String> providerIds) {
        String tenant = TenantIdSanitizer.sanitize(tenantId);
        String source = new CredentialScope.Project(sourceProject, null).name();
        String target = new CredentialScope.Project(targetProject, null).name();
        if (source.equals(target)) {
            throw new CredentialValidationException("Source and target projects must differ");
        }

        List<ProjectEntry> toClone = projectEntries(tenant).stream()
                .filter(entry -> entry.scope().name().equals(source))
                .filter(entry -> providerIds == null || providerIds.isEmpty() || providerIds.contains(entry.summary().providerId()))
                .sorted(Comparator.comparing((ProjectEntry e) -> e.summary().providerId()).thenComparing(e -> e.scope().environment()))
                .toList();
        if (toClone.isEmpty()) {
            log.info("No credentials to clone from project '{}' for tenant '{}'", source, tenant);
        }

        List<ProjectCloneResult.Outcome> outcomes = new ArrayList<>();
        for (ProjectEntry entry : toClone) {
            String providerId = entry.summary().providerId();
            String environment = entry.scope().environment();
            try {
                Optional<String> value = credentialStore.getCredential(providerId, tenant, entry.scope());
                if (value.isEmpty()) {
                    outcomes.add(new ProjectCloneResult.Outcome(providerId, environment,
                            ProjectCloneResult.Status.FAILED, "Credential was removed during clone"));
                    continue;
                }
                CredentialScope.Project targetScope = new CredentialScope.Project(target, environment);
                credentialStore.storeCredential(providerId, value.get(), tenant, targetScope, projectMetadata(targetScope, source));
                outcomes.add(new ProjectCloneResult.Outcome(providerId, environment, ProjectCloneResult.Status.CLONED, null));
            } catch (CredentialVaultException e) {
                log.warn("Failed to clone {} credential ({}) from project '{}' to '{}': {}",
                        providerId, environment, source, target, e.getMessage());
                outcomes.add(new ProjectCloneResult.Outcome(providerId, environment,
                        ProjectCloneResult.Status.FAILED, e.getMessage()));
            }
        }

        ProjectCloneResult result = ProjectCloneResult.of(source, target, outcomes);
        log.info("Cloned project '{}' to '{}' for tenant '{}': {} cloned, {} failed",
                source, target, tenant, result.clonedCount(), result.failedCount());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("source_project", source);
        data.put("target_project", target);
        data.put("cloned", result.clonedCount());
        data.put("failed", result.failedCount());
        auditHelper.logInternalEvent(AUDIT_TYPE, "project.clone",
                result.failedCount() == 0 ? AuditHelper.OUTCOME_SUCCESS : AuditHelper.OUTCOME_FAILURE, tenant, data);
        return result;
    }

    /**
     * Deletes every credential of the project. Without {@code confirm} nothing is removed and
     * the result lists what would be deleted.
     */
    public ProjectDeletionResult deleteProject(String tenantId, String project, boolean confirm) {
        String tenant = TenantIdSanitizer.sanitize(tenantId);
        String projectName = new CredentialScope.Project(project, null).name();
        List<ProjectEntry> entries = projectEntries(tenant).stream()
                .filter(entry -> entry.scope().name().equals(projectName))
                .toList();

        if (!confirm) {
            List<ProjectDeletionResult.Outcome> planned = entries.stream()
                    .map(e -> new ProjectDeletionResult.Outcome(e.summary().providerId(), e.scope().environment(), false))
                    .toList();
            return new ProjectDeletionResult(projectName, false,
                    "This will delete all credentials for project: " + projectName
                            + " (" + entries.size() + " credentials). Please confirm by setting confirm=true",
                    0, planned);
        }

        List<ProjectDeletionResult.Outcome> outcomes = new ArrayList<>();
        int deleted = 0;
        for (ProjectEntry entry : entries) {
            boolean removed = credentialStore.deleteCredential(entry.summary().providerId(), tenant, entry.scope());
            outcomes.add(new ProjectDeletionResult.Outcome(entry.summary().providerId(), entry.scope().environment(), removed));
            if (removed) {
                deleted++;
            }
        }

        log.info("Deleted project '{}' for tenant '{}': {} credentials removed", projectName, tenant, deleted);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("project", projectName);
        data.put("deleted", deleted);
        auditHelper.logInternalEvent(AUDIT_TYPE, "project.delete", AuditHelper.OUTCOME_SUCCESS, tenant, data);
        return new ProjectDeletionResult(projectName, true, null, deleted, List.copyOf(outcomes));
    }

    private List<ProjectEntry> projectEntries(String tenantId) {
        List<ProjectEntry> entries = new ArrayList<>();
        for (CredentialSummary summary : credentialStore.listCredentials(tenantId)) {
            if (CredentialScope.parse(summary.scope()) instanceof CredentialScope.Project scope) {
                entries.add(new ProjectEntry(summary, scope));
            }
        }
        return entries;
    }

    private static Map<String, String> projectMetadata(CredentialScope.Project scope, String clonedFrom) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(MetadataKeys.PROJECT, scope.name());
        metadata.put(MetadataKeys.ENVIRONMENT, scope.environment());
        metadata.put(MetadataKeys.TYPE, PROJECT_CREDENTIAL_TYPE);
        if (clonedFrom != null) {
            metadata.put(MetadataKeys.CLONED_FROM, clonedFrom);
        }
        return metadata;
    }

    private record ProjectEntry(CredentialSummary summary, CredentialScope.Project scope) {
    }
}
