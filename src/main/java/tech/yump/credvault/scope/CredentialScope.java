package tech.yump.credvault.scope;

import tech.yump.credvault.core.CredentialValidationException;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Where a credential applies within a tenant.
 * <p>
 * Stored as a flat string: absent for {@link None}, the raw value for {@link Named}, and
 * {@code project:{name}} or {@code project:{name}:{environment}} for {@link Project}. The
 * environment segment is omitted when it is {@value #DEFAULT_ENVIRONMENT}. Every string in
 * the {@code project:} namespace parses back to a {@link Project}.
 */
public sealed interface CredentialScope permits CredentialScope.None, CredentialScope.Named, CredentialScope.Project {

    String PROJECT_PREFIX = "project:";
    String DEFAULT_ENVIRONMENT = "default";

    /**
     * @return the stored form, empty for the tenant-wide scope.
     */
    Optional<String> serialize();

    /**
     * @return the stored form or null, for DTOs and audit data.
     */
    default String storedValue() {
        return serialize().orElse(null);
    }

    static CredentialScope none() {
        return None.INSTANCE;
    }

    static CredentialScope named(String value) {
        return new Named(value);
    }

    static CredentialScope project(String name, String environment) {
        return new Project(name, environment);
    }

    /**
     * Parses a stored or caller supplied scope string. Null or empty means {@link None}.
     *
     * @throws CredentialValidationException if the value is malformed.
     */
    static CredentialScope parse(String value) {
        if (value == null || value.isEmpty()) {
            return none();
        }
        if (value.startsWith(PROJECT_PREFIX)) {
            return Project.parseStored(value);
        }
        return new Named(value);
    }

    /**
     * Tenant-wide credential, no scope suffix in the storage key.
     */
    record None() implements CredentialScope {

        private static final None INSTANCE = new None();

        @Override
        public Optional<String> serialize() {
            return Optional.empty();
        }
    }

    /**
     * Free-form scope chosen by the caller.
     */
    record Named(String value) implements CredentialScope {

        public static final int MAX_LENGTH = 512;

        public Named {
            if (value == null || value.isBlank()) {
                throw new CredentialValidationException("Scope must be a non-empty string");
            }
            if (value.length() > MAX_LENGTH) {
                throw new CredentialValidationException("Scope too long (max " + MAX_LENGTH + " characters)");
            }
            if (value.chars().anyMatch(Character::isISOControl)) {
                throw new CredentialValidationException("Scope must not contain control characters");
            }
            if (value.startsWith(PROJECT_PREFIX)) {
                throw new CredentialValidationException("Scopes starting with '" + PROJECT_PREFIX + "' are reserved for project credentials");
            }
        }

        @Override
        public Optional<String> serialize() {
            return Optional.of(value);
        }
    }

    /**
     * Project credential, optionally split per environment.
     */
    record Project(String name, String environment) implements CredentialScope {

        public static final int MAX_NAME_LENGTH = 128;
        private static final String NAME_CHARS = "[A-Za-z0-9_.-]+";
        private static final Pattern NAME = Pattern.compile(NAME_CHARS);
        private static final Pattern STORED = Pattern.compile(
                Pattern.quote(PROJECT_PREFIX) + "(" + NAME_CHARS + ")(?::(" + NAME_CHARS + "))?");

        public Project {
            checkName("Project name", name);
            if (environment == null || environment.isBlank()) {
                environment = DEFAULT_ENVIRONMENT;
            }
            checkName("Environment", environment);
        }

        public boolean isDefaultEnvironment() {
            return DEFAULT_ENVIRONMENT.equals(environment);
        }

        @Override
        public Optional<String> serialize() {
            return Optional.of(isDefaultEnvironment()
                    ? PROJECT_PREFIX + name
                    : PROJECT_PREFIX + name + ":" + environment);
        }

        static Project parseStored(String value) {
            Matcher matcher = STORED.matcher(value);
            if (!matcher.matches()) {
                throw new CredentialValidationException("Malformed project scope '" + value
                        + "'. Expected project:{name} or project:{name}:{environment}");
            }
            return new Project(matcher.group(1), matcher.group(2));
        }

        private static void checkName(String label, String value) {
            if (value == null || value.isBlank()) {
                throw new CredentialValidationException(label + " is required");
            }
            if (value.length() > MAX_NAME_LENGTH) {
                throw new CredentialValidationException(label + " too long (max " + MAX_NAME_LENGTH + " characters)");
            }
            if (!NAME.matcher(value).matches()) {
                throw new CredentialValidationException(label + " '" + value
                        + "' may only contain letters, digits, '_', '.' and '-'");
            }
        }
    }
}
