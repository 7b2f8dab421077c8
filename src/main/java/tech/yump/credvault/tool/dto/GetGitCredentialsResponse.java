package tech.yump.credvault.tool.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * {@code password} holds the plaintext secret when found. It must not be logged.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GetGitCredentialsResponse(
        boolean found,
        String repoUrl,
        String username,
        String password,
        String maskedPassword
) {

    public static GetGitCredentialsResponse notFound(String repoUrl) {
        return new GetGitCredentialsResponse(false, repoUrl, null, null, null);
    }

    @Override
    public String toString() {
        return "GetGitCredentialsResponse[found=" + found + ", repoUrl=" + repoUrl + ", username=" + username
                + ", maskedPassword=" + maskedPassword + ']';
    }
}
