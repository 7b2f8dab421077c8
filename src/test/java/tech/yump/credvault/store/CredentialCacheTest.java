package tech.yump.credvault.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.yump.credvault.support.TestVaultProperties;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class CredentialCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private CredentialCache cache;

    @BeforeEach
    void setUp() {
        cache = new CredentialCache(TestVaultProperties.cache(Duration.ofMinutes(5), 100), nanos::get);
    }

    private void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }

    private void write(String storageKey, String credential) {
        cache.putAfterWrite(storageKey, credential, cache.writeStamp());
    }

    @Test
    @DisplayName("Entries are served until the TTL elapses")
    void get_BeforeAndAfterTtl() {
        write("alice:github", "token");

        advance(Duration.ofMinutes(4));
        assertThat(cache.get("alice:github")).contains("token");

        advance(Duration.ofMinutes(2));
        assertThat(cache.get("alice:github")).isEmpty();
    }

    @Test
    @DisplayName("Reads do not extend the TTL")
    void get_DoesNotRefreshTtl() {
        write("alice:github", "token");
        advance(Duration.ofMinutes(3));
        cache.get("alice:github");
        advance(Duration.ofMinutes(3));

        assertThat(cache.get("alice:github")).isEmpty();
    }

    @Test
    @DisplayName("Size bound is enforced")
    void put_OverCapacity_Evicts() {
        cache = new CredentialCache(TestVaultProperties.cache(Duration.ofMinutes(5), 2), nanos::get);

        write("a", "1");
        write("b", "2");
        write("c", "3");

        assertThat(cache.size()).isLessThanOrEqualTo(2);
    }

    @Test
    @DisplayName("A fill from storage is accepted when no write intervened")
    void putIfUnchanged_NoWrite_Cached() {
        long stamp = cache.writeStamp();

        assertThat(cache.putIfUnchanged("alice:github", "token", stamp)).isTrue();
        assertThat(cache.get("alice:github")).contains("token");
    }

    @Test
    @DisplayName("A fill from storage is refused after a concurrent invalidate")
    void putIfUnchanged_AfterInvalidate_Refused() {
        long stamp = cache.writeStamp();
        cache.invalidate("alice:github");

        assertThat(cache.putIfUnchanged("alice:github", "stale", stamp)).isFalse();
        assertThat(cache.get("alice:github")).isEmpty();
    }

    @Test
    @DisplayName("A fill from storage never replaces a newer written value")
    void putIfUnchanged_AfterPut_KeepsNewer() {
        long stamp = cache.writeStamp();
        write("alice:github", "new");

        assertThat(cache.putIfUnchanged("alice:github", "old", stamp)).isFalse();
        assertThat(cache.get("alice:github")).contains("new");
    }

    @Test
    @DisplayName("A write publishes its value when nothing intervened")
    void putAfterWrite_NoConcurrentWrite_Cached() {
        long stamp = cache.writeStamp();

        assertThat(cache.putAfterWrite("alice:github", "token", stamp)).isTrue();
        assertThat(cache.get("alice:github")).contains("token");
    }

    @Test
    @DisplayName("A write that overlapped a delete leaves the key uncached")
    void putAfterWrite_AfterInvalidate_DropsKey() {
        long stamp = cache.writeStamp();
        cache.invalidate("alice:github");

        assertThat(cache.putAfterWrite("alice:github", "deleted", stamp)).isFalse();
        assertThat(cache.get("alice:github")).isEmpty();
    }

    @Test
    @DisplayName("Of two overlapping writes, the one finishing last drops the key")
    void putAfterWrite_OverlappingWrites_LastDropsKey() {
        long first = cache.writeStamp();
        long second = cache.writeStamp();

        assertThat(cache.putAfterWrite("alice:github", "v2", second)).isTrue();
        assertThat(cache.putAfterWrite("alice:github", "v1", first)).isFalse();

        assertThat(cache.get("alice:github")).isEmpty();
    }

    @Test
    @DisplayName("clear drops everything and reports the count")
    void clear_ReturnsCount() {
        write("a", "1");
        write("b", "2");
        long stamp = cache.writeStamp();

        assertThat(cache.clear()).isEqualTo(2);
        assertThat(cache.size()).isZero();
        assertThat(cache.putIfUnchanged("a", "1", stamp)).isFalse();
    }

    @Test
    @DisplayName("sweep removes expired entries")
    void sweep_RemovesExpired() {
        write("a", "1");
        advance(Duration.ofMinutes(6));

        cache.sweep();

        assertThat(cache.size()).isZero();
    }
}
