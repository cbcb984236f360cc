package mcpauth.config;

/**
 * Behavior when every authorization server metadata candidate fails. The MCP authorization text has changed
 * between revisions, so the choice is made explicit.
 */
public enum FallbackPolicy {
    /**
     * Synthesize {@code /authorize}, {@code /token} and {@code /register} on the issuer's origin, dropping any
     * path. Matches the 2025-03-26 revision.
     */
    ORIGIN_ENDPOINTS,

    /**
     * Don't synthesize anything and report the exhaustion as a discovery failure.
     */
    DISABLED
}
