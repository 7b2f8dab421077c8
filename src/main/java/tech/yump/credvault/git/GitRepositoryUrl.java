package tech.yump.credvault.git;

import tech.yump.credvault.core.CredentialValidationException;
import tech.yump.credvault.scope.CredentialScope;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A validated repository URL in canonical form.
 * <p>
 * Accepts {@code http}, {@code https}, {@code ssh} and {@code git} URLs and the scp-like
 * {@code user@host:path} form. The scheme and host are lower-cased, and a trailing '/' or
 * {@code .git} is dropped, so {@code https://GitHub.com/acme/app.git} and
 * {@code https://github.com/acme/app} name the same repository. HTTP URLs must not embed
 * userinfo: the URL ends up in storage keys, logs and audit data.
 */
public record GitRepositoryUrl(String value) {

    public static final String SCOPE_PREFIX = "repo:";
    public static final int MAX_LENGTH = CredentialScope.Named.MAX_LENGTH - SCOPE_PREFIX.length();

    private static final Pattern SCP_LIKE = Pattern.compile("^([A-Za-z0-9._-]+)@([A-Za-z0-9.-]+):(?!//)([^\\s]+)$");

    public static GitRepositoryUrl parse(String repoUrl) {
        if (repoUrl == null || repoUrl.isBlank()) {
            throw new CredentialValidationException("Repository URL is required");
        }
        String trimmed = repoUrl.trim();
        if (trimmed.length() > MAX_LENGTH) {
            throw new CredentialValidationException("Repository URL too long (max " + MAX_LENGTH + " characters)");
        }
        if (trimmed.chars().anyMatch(c -> Character.isWhitespace(c) || Character.isISOControl(c))) {
            throw new CredentialValidationException("Invalid repository URL format");
        }

        Matcher scp = SCP_LIKE.matcher(trimmed);
        if (scp.matches()) {
            String path = stripSuffixes(scp.group(3));
            requirePath(path.startsWith("/") ? path.substring(1) : path);
            return new GitRepositoryUrl(scp.group(1) + "@" + scp.group(2).toLowerCase(Locale.ROOT) + ":" + path);
        }
        return new GitRepositoryUrl(normalizeUri(trimmed));
    }

    /**
     * @return the scope under which this repository's credentials are stored.
     */
    public CredentialScope scope() {
        return CredentialScope.named(SCOPE_PREFIX + value);
    }

    /**
     * @return the repository URL for a stored scope string, or null if the scope is not a repository scope.
     */
    public static String fromScope(String storedScope) {
        if (storedScope == null || !storedScope.startsWith(SCOPE_PREFIX)) {
            return null;
        }
        return storedScope.substring(SCOPE_PREFIX.length());
    }

    @Override
    public String toString() {
        return value;
    }

    private static String normalizeUri(String value) {
        URI uri;
        try {
            uri = new URI(value);
        } catch (URISyntaxException e) {
            throw new CredentialValidationException("Invalid repository URL format");
        }
        String scheme = uri.getScheme() == null ? null : uri.getScheme().toLowerCase(Locale.ROOT);
        if (scheme == null || !(scheme.equals("https") || scheme.equals("http") || scheme.equals("ssh") || scheme.equals("git"))) {
            throw new CredentialValidationException("Repository URL must use https, http, ssh or git");
        }
        if (uri.getHost() == null) {
            throw new CredentialValidationException("Repository URL must name a host");
        }
        if (uri.getRawUserInfo() != null && (scheme.startsWith("http") || uri.getRawUserInfo().indexOf(':') >= 0)) {
            throw new CredentialValidationException("Repository URL must not embed credentials");
        }
        if (uri.getRawQuery() != null || uri.getRawFragment() != null) {
            throw new CredentialValidationException("Repository URL must not carry a query or fragment");
        }

        String path = stripSuffixes(uri.getRawPath() == null ? "" : uri.getRawPath());
        requirePath(path.startsWith("/") ? path.substring(1) : path);

        StringBuilder canonical = new StringBuilder(scheme).append("://");
        if (uri.getRawUserInfo() != null) {
            canonical.append(uri.getRawUserInfo()).append('@');
        }
        canonical.append(uri.getHost().toLowerCase(Locale.ROOT));
        if (uri.getPort() != -1) {
            canonical.append(':').append(uri.getPort());
        }
        return canonical.append(path).toString();
    }

    private static String stripSuffixes(String path) {
        String result = path;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        if (result.endsWith(".git")) {
            result = result.substring(0, result.length() - ".git".length());
        }
        return result;
    }

    private static void requirePath(String path) {
        if (path.isEmpty()) {
            throw new CredentialValidationException("Repository URL must include the repository path");
        }
    }
}
