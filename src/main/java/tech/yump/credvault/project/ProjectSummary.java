package tech.yump.credvault.project;

import java.util.List;

public record ProjectSummary(
        String name,
        List<String> environments,
        List<String> providers,
        int credentialCount
) {
}
