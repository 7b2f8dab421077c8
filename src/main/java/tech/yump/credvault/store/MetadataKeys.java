package tech.yump.credvault.store;

/**
 * Metadata keys written by the vault itself, alongside provider and caller supplied ones.
 */
public final class MetadataKeys {

    public static final String SOURCE = "source";
    public static final String SCHEMA_VERSION = "schemaVersion";
    public static final String CREATED_AT = "createdAt";
    public static final String UPDATED_AT = "updatedAt";
    public static final String MASKED_VALUE = "maskedValue";

    public static final String PROJECT = "project";
    public static final String ENVIRONMENT = "environment";
    public static final String TYPE = "type";
    public static final String CLONED_FROM = "clonedFrom";

    public static final String REPO_URL = "repoUrl";
    public static final String USERNAME = "username";

    private MetadataKeys() {
    }
}
