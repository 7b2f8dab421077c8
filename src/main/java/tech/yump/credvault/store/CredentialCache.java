package tech.yump.credvault.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tech.yump.credvault.config.VaultProperties;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local plaintext cache keyed by storage key.
 * <p>
 * Entries expire a fixed TTL after they were written; reads do not extend it. The cache is
 * bounded by entry count, but eviction is Caffeine's W-TinyLFU policy rather than oldest
 * first: when full, the admission filter may keep frequently read entries and drop the
 * newest one instead.
 * <p>
 * Every cache mutation bumps a global write stamp. Writers take the stamp before the durable
 * write and finish with {@link #putAfterWrite}, which caches the value only when no other
 * write touched the cache in between and otherwise drops the key, so racing writers and
 * deletes leave the key uncached rather than stale. Deletes call {@link #invalidate} after
 * the row is gone. Readers that loaded from storage fill the cache with
 * {@link #putIfUnchanged}, which refuses the fill under the same condition.
 */
@Slf4j
@Component
public class CredentialCache {

    private final Cache<String, String> cache;
    private final AtomicLong writeStamp = new AtomicLong();

    @Autowired
    public CredentialCache(VaultProperties vaultProperties) {
        this(vaultProperties.cache(), Ticker.systemTicker());
    }

    CredentialCache(VaultProperties.CacheProperties properties, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(properties.ttl())
                .maximumSize(properties.maxSize())
                .ticker(ticker)
                .executor(Runnable::run) // maintenance on the calling thread
                .build();
        log.info("Credential cache configured: ttl={}, maxSize={}", properties.ttl(), properties.maxSize());
    }

    public Optional<String> get(String storageKey) {
        return Optional.ofNullable(cache.getIfPresent(storageKey));
    }

    /**
     * @return a token to pass to {@link #putAfterWrite} or {@link #putIfUnchanged}.
     */
    public long writeStamp() {
        return writeStamp.get();
    }

    /**
     * Publishes a value just written to storage. If any other write happened after
     * {@code stamp} was taken, the key is dropped instead, since the database may now hold
     * the other writer's value or no row at all.
     *
     * @return true if the value was cached.
     */
    public boolean putAfterWrite(String storageKey, String credential, long stamp) {
        boolean[] cached = {false};
        cache.asMap().compute(storageKey, (key, previous) -> {
            boolean unchanged = writeStamp.compareAndSet(stamp, stamp + 1);
            if (!unchanged) {
                writeStamp.incrementAndGet();
                return null;
            }
            cached[0] = true;
            return credential;
        });
        if (!cached[0]) {
            log.debug("Dropped cache entry for '{}': concurrent write detected", storageKey);
        }
        return cached[0];
    }

    /**
     * Caches a value read from storage unless a write happened after {@code stamp} was taken.
     *
     * @return true if the value was cached.
     */
    public boolean putIfUnchanged(String storageKey, String credential, long stamp) {
        boolean[] cached = {false};
        cache.asMap().compute(storageKey, (key, previous) -> {
            if (writeStamp.get() != stamp) {
                return previous;
            }
            cached[0] = true;
            return credential;
        });
        if (!cached[0]) {
            log.debug("Skipped cache fill for '{}': concurrent write detected", storageKey);
        }
        return cached[0];
    }

    public void invalidate(String storageKey) {
        cache.asMap().compute(storageKey, (key, previous) -> {
            writeStamp.incrementAndGet();
            return null;
        });
    }

    /**
     * @return the number of entries dropped.
     */
    public long clear() {
        writeStamp.incrementAndGet();
        long size = cache.estimatedSize();
        cache.invalidateAll();
        return size;
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    /**
     * Drops expired entries. Run periodically by the scheduler.
     */
    public void sweep() {
        long before = cache.estimatedSize();
        cache.cleanUp();
        long removed = before - cache.estimatedSize();
        if (removed > 0) {
            log.debug("Cache sweep removed {} expired entries", removed);
        }
    }
}
