package tech.yump.credvault.git;

/**
 * A git login read back from the vault.
 */
public record GitCredentials(String repoUrl, String username, String password) {

    @Override
    public String toString() {
        return "GitCredentials[repoUrl=" + repoUrl + ", username=" + username + ", password=******]";
    }
}
