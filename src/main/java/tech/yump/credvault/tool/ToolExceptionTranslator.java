package tech.yump.credvault.tool;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.yump.credvault.audit.AuditHelper;
import tech.yump.credvault.core.CredentialVaultException;
import tech.yump.credvault.core.VaultErrorKind;
import tech.yump.credvault.provider.UnknownProviderException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns exceptions escaping a tool operation into {@link ToolError}s.
 * Caller mistakes are logged at WARN, incidents at ERROR; every failure is audited.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolExceptionTranslator {

    static final String AUDIT_TYPE = "tool";
    static final String INTERNAL_ERROR_MESSAGE = "An unexpected internal error occurred.";

    private final AuditHelper auditHelper;

    public ToolError translate(String operation, String principal, RuntimeException ex) {
        ToolError error;
        if (ex instanceof CredentialVaultException vaultException) {
            error = handleVaultException(operation, vaultException);
        } else {
            log.error("Unexpected error in tool operation '{}': {}", operation, ex.getMessage(), ex);
            error = ToolError.of(VaultErrorKind.INTERNAL, INTERNAL_ERROR_MESSAGE, null);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error_kind", error.kind().name());
        auditHelper.logFailureEvent(AUDIT_TYPE, operation, principal, error.message(), data);
        return error;
    }

    private ToolError handleVaultException(String operation, CredentialVaultException ex) {
        VaultErrorKind kind = ex.getKind();
        if (kind.isIncident()) {
            log.error("Tool operation '{}' failed ({}): {}", operation, kind, ex.getMessage(), ex);
        } else {
            log.warn("Tool operation '{}' rejected ({}): {}", operation, kind, ex.getMessage());
        }

        Map<String, Object> details = null;
        if (ex instanceof UnknownProviderException unknown) {
            details = Map.of("availableProviders", unknown.getAvailableProviders());
        }
        return ToolError.of(kind, ex.getMessage(), details);
    }
}
