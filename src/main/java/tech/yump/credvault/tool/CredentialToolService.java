package tech.yump.credvault.tool;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import tech.yump.credvault.git.GitCredentialManager;
import tech.yump.credvault.git.GitCredentialSummary;
import tech.yump.credvault.git.GitRepositoryUrl;
import tech.yump.credvault.project.ProjectCloneResult;
import tech.yump.credvault.project.ProjectCredentialManager;
import tech.yump.credvault.project.ProjectCredentials;
import tech.yump.credvault.project.ProjectDeletionResult;
import tech.yump.credvault.project.ProjectSummary;
import tech.yump.credvault.provider.CredentialMasking;
import tech.yump.credvault.provider.GitProvider;
import tech.yump.credvault.provider.ProviderRegistry;
import tech.yump.credvault.provider.ValidationResult;
import tech.yump.credvault.scope.CredentialScope;
import tech.yump.credvault.store.CredentialHealthInspector;
import tech.yump.credvault.store.CredentialHealthReport;
import tech.yump.credvault.store.CredentialStatusReport;
import tech.yump.credvault.store.CredentialStore;
import tech.yump.credvault.store.MetadataKeys;
import tech.yump.credvault.store.StoredCredentialSummary;
import tech.yump.credvault.store.TenantIdSanitizer;
import tech.yump.credvault.tool.dto.CredentialListEntry;
import tech.yump.credvault.tool.dto.DeleteCredentialResponse;
import tech.yump.credvault.tool.dto.GetCredentialResponse;
import tech.yump.credvault.tool.dto.GetGitCredentialsResponse;
import tech.yump.credvault.tool.dto.SetCredentialResponse;
import tech.yump.credvault.tool.dto.ValidateCredentialResponse;
import tech.yump.credvault.usage.CredentialUsageReport;
import tech.yump.credvault.usage.CredentialUsageTracker;
import tech.yump.credvault.usage.MostUsedCredentials;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Credential operations as exposed to the tool-call router. Every method returns a
 * {@link ToolResult} and never throws for vault errors. A missing {@code userId} means the
 * {@value TenantIdSanitizer#DEFAULT_TENANT} tenant.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialToolService {

    private final CredentialStore credentialStore;
    private final ProjectCredentialManager projectCredentialManager;
    private final GitCredentialManager gitCredentialManager;
    private final CredentialUsageTracker usageTracker;
    private final CredentialHealthInspector credentialHealthInspector;
    private final ProviderRegistry providerRegistry;
    private final ToolExceptionTranslator exceptionTranslator;

    public ToolResult<SetCredentialResponse> setCredential(String provider, String credential, String userId, String scope) {
        String tenant = tenantOrDefault(userId);
        return execute("set_credential", tenant, () -> {
            StoredCredentialSummary stored = credentialStore.storeCredential(
                    provider, credential, tenant, CredentialScope.parse(scope), null);
            return new SetCredentialResponse(true, stored.providerId(), stored.scope(), stored.storageKey(),
                    stored.createdAt(), stored.updatedAt());
        });
    }

    public ToolResult<GetCredentialResponse> getCredential(String provider, String userId, String scope) {
        String tenant = tenantOrDefault(userId);
        return execute("get_credential", tenant, () -> {
            CredentialScope parsed = CredentialScope.parse(scope);
            Optional<String> credential = credentialStore.getCredential(provider, tenant, parsed);
            return credential
                    .map(value -> new GetCredentialResponse(true, provider, parsed.storedValue(), value,
                            CredentialMasking.mask(value)))
                    .orElseGet(() -> GetCredentialResponse.notFound(provider, parsed.storedValue()));
        });
    }

    /**
     * Without {@code confirm} nothing is deleted and the response carries a warning.
     */
    public ToolResult<DeleteCredentialResponse> deleteCredential(String provider, String userId, String scope, boolean confirm) {
        String tenant = tenantOrDefault(userId);
        return execute("delete_credential", tenant, () -> {
            CredentialScope parsed = CredentialScope.parse(scope);
            providerRegistry.get(provider);
            if (!confirm) {
                return new DeleteCredentialResponse(false, false, provider, parsed.storedValue(),
                        "This will permanently remove your " + provider + " credential. Please confirm by setting confirm=true");
            }
            boolean deleted = credentialStore.deleteCredential(provider, tenant, parsed);
            return new DeleteCredentialResponse(deleted, true, provider, parsed.storedValue(), null);
        });
    }

    public ToolResult<List<CredentialListEntry>> listCredentials(String userId) {
        String tenant = tenantOrDefault(userId);
        return execute("list_credentials", tenant, () -> credentialStore.listCredentials(tenant).stream()
                .map(summary -> CredentialListEntry.from(summary, summary.metadata().get(MetadataKeys.MASKED_VALUE)))
                .toList());
    }

    public ToolResult<CredentialStatusReport> credentialStatus(String userId) {
        String tenant = tenantOrDefault(userId);
        return execute("credential_status", tenant, () -> credentialStore.credentialStatus(tenant));
    }

    public ToolResult<ValidateCredentialResponse> validateCredential(String provider, String credential) {
        return execute("validate_credential", null, () -> {
            if (!providerRegistry.contains(provider)) {
                return new ValidateCredentialResponse(false, provider, "Unknown provider", providerRegistry.providerIds());
            }
            ValidationResult result = credentialStore.validateCredential(provider, credential);
            return new ValidateCredentialResponse(result.valid(), provider, result.reason(), null);
        });
    }

    public ToolResult<CredentialHealthReport> credentialHealth(String userId) {
        String tenant = tenantOrDefault(userId);
        return execute("credential_health", tenant, () -> credentialHealthInspector.inspect(tenant));
    }

    public ToolResult<SetCredentialResponse> setProjectCredential(String project, String provider, String credential,
                                                                  String environment, String userId) {
        String tenant = tenantOrDefault(userId);
        return execute("set_project_credential", tenant, () -> {
            StoredCredentialSummary stored = projectCredentialManager.setProjectCredential(
                    tenant, project, provider, credential, environment);
            return new SetCredentialResponse(true, stored.providerId(), stored.scope(), stored.storageKey(),
                    stored.createdAt(), stored.updatedAt());
        });
    }

    public ToolResult<GetCredentialResponse> getProjectCredential(String project, String provider, String environment,
                                                                  String userId) {
        String tenant = tenantOrDefault(userId);
        return execute("get_project_credential", tenant, () -> {
            String scope = new CredentialScope.Project(project, environment).storedValue();
            return projectCredentialManager.getProjectCredential(tenant, project, provider, environment)
                    .map(value -> new GetCredentialResponse(true, provider, scope, value, CredentialMasking.mask(value)))
                    .orElseGet(() -> GetCredentialResponse.notFound(provider, scope));
        });
    }

    public ToolResult<ProjectCredentials> getProjectCredentials(String project, String userId) {
        String tenant = tenantOrDefault(userId);
        return execute("get_project_credentials", tenant, () -> projectCredentialManager.getProjectCredentials(tenant, project));
    }

    public ToolResult<List<ProjectSummary>> listProjects(String userId) {
        String tenant = tenantOrDefault(userId);
        return execute("list_projects", tenant, () -> projectCredentialManager.listProjects(tenant));
    }

    public ToolResult<ProjectCloneResult> cloneProject(String sourceProject, String targetProject,
                                                       Collection<String> providers, String userId) {
        String tenant = tenantOrDefault(userId);
        return execute("clone_project", tenant,
                () -> projectCredentialManager.cloneProjectCredentials(tenant, sourceProject, targetProject, providers));
    }

    public ToolResult<ProjectDeletionResult> deleteProject(String project, boolean confirm, String userId) {
        String tenant = tenantOrDefault(userId);
        return execute("delete_project", tenant, () -> projectCredentialManager.deleteProject(tenant, project, confirm));
    }

    public ToolResult<GitCredentialSummary> setGitCredentials(String repoUrl, String username, String password, String userId) {
        String tenant = tenantOrDefault(userId);
        return execute("set_git_credentials", tenant,
                () -> gitCredentialManager.storeGitCredentials(tenant, repoUrl, username, password));
    }

    public ToolResult<GetGitCredentialsResponse> getGitCredentials(String repoUrl, String userId) {
        String tenant = tenantOrDefault(userId);
        return execute("get_git_credentials", tenant, () -> {
            String canonical = GitRepositoryUrl.parse(repoUrl).value();
            return gitCredentialManager.getGitCredentials(tenant, repoUrl)
                    .map(found -> new GetGitCredentialsResponse(true, found.repoUrl(), found.username(), found.password(),
                            CredentialMasking.mask(found.password())))
                    .orElseGet(() -> GetGitCredentialsResponse.notFound(canonical));
        });
    }

    /**
     * Without {@code confirm} nothing is deleted and the response carries a warning.
     */
    public ToolResult<DeleteCredentialResponse> deleteGitCredentials(String repoUrl, String userId, boolean confirm) {
        String tenant = tenantOrDefault(userId);
        return execute("delete_git_credentials", tenant, () -> {
            GitRepositoryUrl url = GitRepositoryUrl.parse(repoUrl);
            if (!confirm) {
                return new DeleteCredentialResponse(false, false, GitProvider.ID, url.scope().storedValue(),
                        "This will permanently remove your git credentials for " + url + ". Please confirm by setting confirm=true");
            }
            boolean deleted = gitCredentialManager.deleteGitCredentials(tenant, repoUrl);
            return new DeleteCredentialResponse(deleted, true, GitProvider.ID, url.scope().storedValue(), null);
        });
    }

    public ToolResult<List<GitCredentialSummary>> listGitCredentials(String userId) {
        String tenant = tenantOrDefault(userId);
        return execute("list_git_credentials", tenant, () -> gitCredentialManager.listGitCredentials(tenant));
    }

    /**
     * @param days look-back window in days, null for the configured period.
     */
    public ToolResult<CredentialUsageReport> credentialUsage(String userId, Integer days) {
        String tenant = tenantOrDefault(userId);
        return execute("credential_usage", tenant, () -> usageTracker.usageStats(tenant, days));
    }

    public ToolResult<MostUsedCredentials> mostUsedCredentials(String userId, Integer limit) {
        String tenant = tenantOrDefault(userId);
        return execute("most_used_credentials", tenant, () -> usageTracker.mostUsed(tenant, limit));
    }

    private <T> ToolResult<T> execute(String operation, String principal, Supplier<T> action) {
        try {
            return ToolResult.ok(action.get());
        } catch (RuntimeException e) {
            return ToolResult.failure(exceptionTranslator.translate(operation, principal, e));
        }
    }

    private static String tenantOrDefault(String userId) {
        return StringUtils.hasText(userId) ? userId : TenantIdSanitizer.DEFAULT_TENANT;
    }
}
