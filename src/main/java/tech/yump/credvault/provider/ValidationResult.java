package tech.yump.credvault.provider;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a structural credential check. {@code reason} is set only when invalid.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationResult(boolean valid, String reason) {

    private static final ValidationResult VALID = new ValidationResult(true, null);

    public static ValidationResult ok() {
        return VALID;
    }

    public static ValidationResult invalid(String reason) {
        return new ValidationResult(false, reason);
    }
}
