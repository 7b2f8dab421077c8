package tech.yump.credvault.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.yump.credvault.support.TestTokens;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class BuiltInProvidersTest {

    @Mock
    private ProviderAccountLookup accountLookup;

    @Test
    @DisplayName("GitLab: accepts glpat-, glft- and glt_ tokens of 20+ characters")
    void gitlab_Validation() {
        GitLabProvider provider = new GitLabProvider(accountLookup);

        assertThat(provider.validate(TestTokens.GITLAB).valid()).isTrue();
        assertThat(provider.validate("glft-a1B2c3D4e5F6g7H8i9J0").valid()).isTrue();
        assertThat(provider.validate("glt_a1B2c3D4e5F6g7H8i9J0").valid()).isTrue();
        assertThat(provider.validate("glpat-abc").reason()).contains("too short (minimum 20");
        assertThat(provider.validate("ghp_a1B2c3D4e5F6g7H8i9J0").reason()).contains("Expected prefix");
        assertThat(provider.requiredScopes()).containsExactlyInAnyOrder("api", "read_repository", "write_repository");
    }

    @Test
    @DisplayName("OpenAI: API keys start with sk-")
    void openai_Validation() {
        OpenAIProvider provider = new OpenAIProvider();

        assertThat(provider.validate(TestTokens.OPENAI).valid()).isTrue();
        assertThat(provider.validate("pk-a1B2c3D4e5F6g7H8i9J0k1L2").valid()).isFalse();
        assertThat(provider.supportedTypes()).containsExactly(CredentialType.API_KEY);
        assertThat(provider.authHeaders(TestTokens.OPENAI))
                .containsEntry("Authorization", "Bearer " + TestTokens.OPENAI)
                .containsEntry("Content-Type", "application/json");
    }

    @Test
    @DisplayName("Anthropic: sk-ant- keys, authenticated with x-api-key")
    void anthropic_ValidationAndHeaders() {
        AnthropicProvider provider = new AnthropicProvider();

        assertThat(provider.validate(TestTokens.ANTHROPIC).valid()).isTrue();
        assertThat(provider.validate(TestTokens.OPENAI).valid()).isFalse();

        Map<String, String> headers = provider.authHeaders(TestTokens.ANTHROPIC);
        assertThat(headers)
                .containsEntry("x-api-key", TestTokens.ANTHROPIC)
                .containsEntry("anthropic-version", "2023-06-01")
                .doesNotContainKey("Authorization");
    }

    @Test
    @DisplayName("Bitbucket: no prefix, length bounds only")
    void bitbucket_Validation() {
        BitbucketProvider provider = new BitbucketProvider();

        assertThat(provider.validate(TestTokens.BITBUCKET).valid()).isTrue();
        assertThat(provider.validate("a".repeat(19)).reason()).contains("too short");
        assertThat(provider.validate("a".repeat(256)).reason()).contains("exceeds maximum length (255 characters)");
        assertThat(provider.requiredScopes()).containsExactlyInAnyOrder("repository:write", "pullrequest:write");
        assertThat(provider.authHeaders(TestTokens.BITBUCKET)).containsEntry("Accept", "application/json");
    }

    @Test
    @DisplayName("Default metadata identifies the provider")
    void defaultMetadata_ContainsProvider() {
        assertThat(new OpenAIProvider().metadata(TestTokens.OPENAI))
                .containsEntry("provider", "openai")
                .containsEntry("version", "1");
    }

    @Test
    @DisplayName("Git: username:password logins, basic auth, password masked")
    void git_ValidationHeadersAndMask() {
        GitProvider provider = new GitProvider();
        String login = "bob:" + TestTokens.GITHUB;

        assertThat(provider.validate(login).valid()).isTrue();
        assertThat(provider.validate("bob").reason()).contains("username:password");
        assertThat(provider.validate(":secret").reason()).contains("username:password");
        assertThat(provider.validate("bob:").reason()).contains("password must not be empty");
        assertThat(provider.validate("bo b:secret").reason()).contains("whitespace");
        assertThat(provider.metadata(login)).containsEntry("username", "bob");
        assertThat(provider.mask(login)).isEqualTo("bob:ghp_...q7R8").doesNotContain(TestTokens.GITHUB);
        assertThat(provider.authHeaders("bob:secret"))
                .containsEntry("Authorization", "Basic Ym9iOnNlY3JldA==");
    }
}
