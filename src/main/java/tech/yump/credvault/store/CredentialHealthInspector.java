package tech.yump.credvault.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.yump.credvault.config.VaultProperties;
import tech.yump.credvault.storage.CredentialSummary;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Flags credentials due for rotation and recommends providers the tenant has not set up.
 * Works from listing data only; never decrypts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialHealthInspector {

    private final CredentialStore credentialStore;
    private final VaultProperties vaultProperties;
    private final Clock clock;

    public CredentialHealthReport inspect(String tenantId) {
        String tenant = TenantIdSanitizer.sanitize(tenantId);
        List<CredentialSummary> credentials = credentialStore.listCredentials(tenant);
        VaultProperties.HealthProperties health = vaultProperties.health();
        Duration rotationAge = health.rotationAge();
        Instant now = clock.instant();

        List<CredentialHealthReport.Warning> warnings = new ArrayList<>();
        List<CredentialHealthReport.Recommendation> recommendations = new ArrayList<>();

        for (CredentialSummary credential : credentials) {
            // Age of the current value: an upsert counts as a rotation
            Instant lastWritten = credential.updatedAt() != null ? credential.updatedAt() : credential.createdAt();
            if (lastWritten == null) {
                continue;
            }
            Duration age = Duration.between(lastWritten, now);
            if (age.compareTo(rotationAge) > 0) {
                long ageDays = age.toDays();
                warnings.add(new CredentialHealthReport.Warning(credential.providerId(), credential.scope(), ageDays,
                        "Credential is " + ageDays + " days old"));
                recommendations.add(new CredentialHealthReport.Recommendation(
                        CredentialHealthReport.Priority.MEDIUM, credential.providerId(), "rotate",
                        "Rotate " + credential.providerId() + " credential (older than " + rotationAge.toDays() + " days)"));
            }
        }

        Set<String> configured = credentials.stream().map(CredentialSummary::providerId).collect(Collectors.toSet());
        for (String recommended : health.recommendedProviders()) {
            if (!configured.contains(recommended)) {
                recommendations.add(new CredentialHealthReport.Recommendation(
                        CredentialHealthReport.Priority.LOW, recommended, "add",
                        "Add " + recommended + " credential for full functionality"));
            }
        }

        log.debug("Health check for tenant '{}': {} credentials, {} warnings", tenant, credentials.size(), warnings.size());
        return new CredentialHealthReport(
                tenant,
                credentials.size(),
                warnings.isEmpty(),
                List.copyOf(warnings),
                List.copyOf(recommendations));
    }
}
