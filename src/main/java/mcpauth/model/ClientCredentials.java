package mcpauth.model;

import org.springframework.lang.Nullable;

/**
 * Supplied by the caller per operation and never retained.
 *
 * @param clientId     absent for anonymous requests
 * @param clientSecret absent for public clients
 */
public record ClientCredentials(
    @Nullable
    String clientId,
    @Nullable
    String clientSecret
) {

    private static final ClientCredentials NONE = new ClientCredentials(null, null);

    public static ClientCredentials none() {
        return NONE;
    }

    public static ClientCredentials publicClient(String clientId) {
        return new ClientCredentials(clientId, null);
    }

    public static ClientCredentials confidential(String clientId, String clientSecret) {
        return new ClientCredentials(clientId, clientSecret);
    }

    /**
     * Both parts present, so HTTP Basic can be used.
     */
    public boolean isConfidential() {
        return clientId != null && clientSecret != null;
    }

    @Override
    public String toString() {
        return "ClientCredentials[clientId=" + clientId + ", clientSecret=" + (clientSecret != null ? "***" : null) + "]";
    }
}
