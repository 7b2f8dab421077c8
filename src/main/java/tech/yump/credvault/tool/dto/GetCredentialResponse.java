package tech.yump.credvault.tool.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * {@code credential} holds the plaintext secret when found. It must not be logged.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GetCredentialResponse(
        boolean found,
        String providerId,
        String scope,
        String credential,
        String maskedCredential
) {

    public static GetCredentialResponse notFound(String providerId, String scope) {
        return new GetCredentialResponse(false, providerId, scope, null, null);
    }

    @Override
    public String toString() {
        return "GetCredentialResponse[found=" + found + ", providerId=" + providerId + ", scope=" + scope
                + ", maskedCredential=" + maskedCredential + ']';
    }
}
