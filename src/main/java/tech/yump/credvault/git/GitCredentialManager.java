package tech.yump.credvault.git;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.credvault.core.CredentialValidationException;
import tech.yump.credvault.provider.GitProvider;
import tech.yump.credvault.storage.CredentialSummary;
import tech.yump.credvault.store.CredentialStore;
import tech.yump.credvault.store.MetadataKeys;
import tech.yump.credvault.store.StoredCredentialSummary;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-repository git logins. Each repository's login is a {@value GitProvider#ID} credential
 * stored under the scope {@code repo:{canonical url}}, so two spellings of the same URL
 * share one credential.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GitCredentialManager {

    static final String GIT_CREDENTIAL_TYPE = "git_credentials";

    private final CredentialStore credentialStore;

    /**
     * @throws CredentialValidationException if the URL, username or password is rejected.
     */
    public GitCredentialSummary storeGitCredentials(String tenantId, String repoUrl, String username, String password) {
        if (isBlank(repoUrl) || isBlank(username) || isBlank(password)) {
            throw new CredentialValidationException("Repository URL, username, and password are required");
        }
        if (username.indexOf(GitProvider.SEPARATOR) >= 0) {
            throw new CredentialValidationException("Git username must not contain ':'");
        }
        GitRepositoryUrl url = GitRepositoryUrl.parse(repoUrl);

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(MetadataKeys.TYPE, GIT_CREDENTIAL_TYPE);
        metadata.put(MetadataKeys.REPO_URL, url.value());
        StoredCredentialSummary stored = credentialStore.storeCredential(GitProvider.ID,
                username + GitProvider.SEPARATOR + password, tenantId, url.scope(), metadata);

        log.info("Git credentials stored for tenant '{}', repository '{}', username '{}'", stored.tenantId(), url, username);
        return new GitCredentialSummary(url.value(), username, stored.storageKey(), stored.createdAt(), stored.updatedAt());
    }

    /**
     * @return the login stored for exactly this repository, after URL normalization.
     */
    public Optional<GitCredentials> getGitCredentials(String tenantId, String repoUrl) {
        GitRepositoryUrl url = GitRepositoryUrl.parse(repoUrl);
        return credentialStore.getCredential(GitProvider.ID, tenantId, url.scope())
                .map(value -> {
                    int separator = value.indexOf(GitProvider.SEPARATOR);
                    return new GitCredentials(url.value(), value.substring(0, separator), value.substring(separator + 1));
                });
    }

    public boolean deleteGitCredentials(String tenantId, String repoUrl) {
        GitRepositoryUrl url = GitRepositoryUrl.parse(repoUrl);
        return credentialStore.deleteCredential(GitProvider.ID, tenantId, url.scope());
    }

    /**
     * @return the repositories with a stored login, most recently updated first. Never decrypts.
     */
    public List<GitCredentialSummary> listGitCredentials(String tenantId) {
        return credentialStore.listCredentials(tenantId).stream()
                .filter(summary -> GitProvider.ID.equals(summary.providerId()))
                .map(this::toSummary)
                .filter(Objects::nonNull)
                .toList();
    }

    private GitCredentialSummary toSummary(CredentialSummary summary) {
        String repoUrl = GitRepositoryUrl.fromScope(summary.scope());
        if (repoUrl == null) {
            return null;
        }
        return new GitCredentialSummary(repoUrl, summary.metadata().get(MetadataKeys.USERNAME), summary.storageKey(),
                summary.createdAt(), summary.updatedAt());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
