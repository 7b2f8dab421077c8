package tech.yump.credvault.support;

import org.springframework.web.client.RestClient;
import tech.yump.credvault.audit.AuditHelper;
import tech.yump.credvault.config.VaultProperties;
import tech.yump.credvault.core.MasterKeyManager;
import tech.yump.credvault.crypto.CryptoEngine;
import tech.yump.credvault.git.GitCredentialManager;
import tech.yump.credvault.project.ProjectCredentialManager;
import tech.yump.credvault.provider.AnthropicProvider;
import tech.yump.credvault.provider.BitbucketProvider;
import tech.yump.credvault.provider.GitHubProvider;
import tech.yump.credvault.provider.GitLabProvider;
import tech.yump.credvault.provider.GitProvider;
import tech.yump.credvault.provider.OpenAIProvider;
import tech.yump.credvault.provider.ProviderAccountLookup;
import tech.yump.credvault.provider.ProviderRegistry;
import tech.yump.credvault.store.CredentialCache;
import tech.yump.credvault.store.CredentialHealthInspector;
import tech.yump.credvault.store.CredentialStore;
import tech.yump.credvault.tool.CredentialToolService;
import tech.yump.credvault.tool.ToolExceptionTranslator;
import tech.yump.credvault.usage.CredentialUsageTracker;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.function.Function;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * The full vault wired by hand over an in-memory repository, for tests that exercise
 * several components together without Spring or a database.
 */
public class VaultTestStack {

    public final MutableClock clock = new MutableClock(Instant.parse("2024-01-15T10:00:00Z"));
    public final VaultProperties properties;
    public final SecretKey masterKey;
    public final MasterKeyManager masterKeyManager;
    public final CryptoEngine cryptoEngine = new CryptoEngine();
    public final ProviderRegistry providerRegistry;
    public final InMemoryCredentialRepository repository;
    public final CredentialCache cache;
    public final RecordingAuditBackend auditBackend = new RecordingAuditBackend();
    public final AuditHelper auditHelper = new AuditHelper(auditBackend, clock);
    public final InMemoryCredentialUsageRepository usageRepository = new InMemoryCredentialUsageRepository();
    public final CredentialUsageTracker usageTracker;
    public final CredentialStore store;
    public final ProjectCredentialManager projectManager;
    public final GitCredentialManager gitManager;
    public final CredentialHealthInspector healthInspector;
    public final CredentialToolService toolService;

    public VaultTestStack() {
        this(TestVaultProperties.defaults());
    }

    public VaultTestStack(VaultProperties properties) {
        this(properties, InMemoryCredentialRepository::new);
    }

    /**
     * @param repositoryFactory builds the repository over the stack's clock, e.g. a subclass
     *                          that pauses inside a write.
     */
    public VaultTestStack(VaultProperties properties, Function<Clock, ? extends InMemoryCredentialRepository> repositoryFactory) {
        this.properties = properties;
        this.repository = repositoryFactory.apply(clock);

        byte[] keyBytes = new byte[CryptoEngine.KEY_LENGTH_BYTE];
        new SecureRandom().nextBytes(keyBytes);
        this.masterKey = new SecretKeySpec(keyBytes, "AES");
        this.masterKeyManager = mock(MasterKeyManager.class);
        when(masterKeyManager.getMasterKey()).thenReturn(masterKey);

        // Lookup is disabled in the default properties, so no request is ever sent
        ProviderAccountLookup accountLookup = new ProviderAccountLookup(RestClient.create(), properties);
        this.providerRegistry = new ProviderRegistry(List.of(
                new GitHubProvider(accountLookup),
                new GitLabProvider(accountLookup),
                new OpenAIProvider(),
                new AnthropicProvider(),
                new BitbucketProvider(),
                new GitProvider()));

        this.cache = new CredentialCache(properties);
        this.usageTracker = new CredentialUsageTracker(usageRepository, properties, clock);
        this.store = new CredentialStore(providerRegistry, cryptoEngine, masterKeyManager, repository, cache, auditHelper,
                usageTracker, clock);
        this.projectManager = new ProjectCredentialManager(store, auditHelper);
        this.healthInspector = new CredentialHealthInspector(store, properties, clock);
        this.gitManager = new GitCredentialManager(store);
        this.toolService = new CredentialToolService(store, projectManager, gitManager, usageTracker, healthInspector, providerRegistry,
                new ToolExceptionTranslator(auditHelper));
    }
}
