package tech.yump.credvault.provider;

public enum CredentialType {
    OAUTH_TOKEN,
    API_KEY,
    SSH_KEY,
    BASIC_AUTH,
    BEARER_TOKEN,
    SESSION_COOKIE
}
