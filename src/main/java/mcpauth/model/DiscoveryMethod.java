package mcpauth.model;

/**
 * How the protected resource's authorization server was located.
 */
public enum DiscoveryMethod {
    /**
     * {@code resource_metadata} parameter of the 401 challenge
     */
    WWW_AUTHENTICATE,
    /**
     * well-known protected resource metadata
     * <a href="https://datatracker.ietf.org/doc/html/rfc9728#section-3">RFC 9728 3</a>
     */
    RFC9728_PRM,
    /**
     * no resource metadata, so the resource's own origin was treated as the authorization server
     */
    DIRECT_OAUTH
}
