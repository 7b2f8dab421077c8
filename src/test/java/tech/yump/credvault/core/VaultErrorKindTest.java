package tech.yump.credvault.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VaultErrorKindTest {

    @Test
    @DisplayName("Only storage failures are retryable")
    void retryable_OnlyStorageUnavailable() {
        for (VaultErrorKind kind : VaultErrorKind.values()) {
            assertThat(kind.isRetryable()).as(kind.name()).isEqualTo(kind == VaultErrorKind.STORAGE_UNAVAILABLE);
        }
    }

    @Test
    @DisplayName("Caller mistakes are not incidents")
    void incident_NotForCallerMistakes() {
        assertThat(VaultErrorKind.VALIDATION.isIncident()).isFalse();
        assertThat(VaultErrorKind.UNKNOWN_PROVIDER.isIncident()).isFalse();
        assertThat(VaultErrorKind.AUTHENTICATION_FAILED.isIncident()).isTrue();
        assertThat(VaultErrorKind.ENCRYPTION_FAILED.isIncident()).isTrue();
    }
}
