package tech.yump.credvault.tool.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidateCredentialResponse(
        boolean valid,
        String providerId,
        String reason,
        List<String> availableProviders // set when the provider is unknown
) {
}
