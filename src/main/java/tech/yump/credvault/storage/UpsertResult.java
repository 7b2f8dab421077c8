package tech.yump.credvault.storage;

import java.time.Instant;

/**
 * Row timestamps after an upsert. {@code createdAt} is the original insert time on update.
 */
public record UpsertResult(Instant createdAt, Instant updatedAt) {
}
