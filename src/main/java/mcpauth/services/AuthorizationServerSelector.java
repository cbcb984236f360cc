package mcpauth.services;

import java.util.List;
import org.springframework.lang.Nullable;

/**
 * Picks one of the authorization servers listed in protected resource metadata. Selection is deterministic:
 * the preferred server when it is listed, otherwise the first one.
 */
public final class AuthorizationServerSelector {

    private AuthorizationServerSelector() {}

    /**
     * @throws OAuthDiscoveryException when no servers are listed
     */
    public static String selectAuthorizationServer(List<String> servers, @Nullable String preferredServer) {
        if (servers == null || servers.isEmpty()) {
            throw new OAuthDiscoveryException("No authorization servers listed in protected resource metadata");
        }
        if (servers.size() == 1) {
            return servers.get(0);
        }
        if (preferredServer != null && servers.contains(preferredServer)) {
            return preferredServer;
        }
        return servers.get(0);
    }
}
