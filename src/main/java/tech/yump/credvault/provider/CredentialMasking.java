package tech.yump.credvault.provider;

/**
 * Display-safe rendering of secrets for logs and metadata.
 */
public final class CredentialMasking {

    public static final int DEFAULT_VISIBLE_CHARS = 4;
    static final String FULLY_MASKED = "***";

    private CredentialMasking() {
    }

    /**
     * Keeps {@code visibleChars} characters at each end, e.g. {@code ghp_...lmno}.
     * Values too short to hide anything are rendered as {@code ***}.
     */
    public static String mask(String credential, int visibleChars) {
        if (credential == null || visibleChars < 0 || credential.length() <= visibleChars * 2) {
            return FULLY_MASKED;
        }
        return credential.substring(0, visibleChars) + "..." + credential.substring(credential.length() - visibleChars);
    }

    public static String mask(String credential) {
        return mask(credential, DEFAULT_VISIBLE_CHARS);
    }
}
