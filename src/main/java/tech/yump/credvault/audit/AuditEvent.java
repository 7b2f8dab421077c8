package tech.yump.credvault.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Represents a single audit log entry.
 * Logged as one JSON document; never carries credential values, masked or not.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
        Instant timestamp,      // When the event occurred
        String type,            // Event family, e.g. "credential_operation", "tool"
        String action,          // e.g. "credential.store", "project.clone"
        String outcome,         // "success" or "failure"
        String principal,       // Tenant id the operation ran for, or "system"
        String errorMessage,    // Set on failures only
        Map<String, Object> data // Operation specific context (provider, scope, storage key...)
) {
}
