package mcpauth.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * @param protocolVersion    sent as the {@value mcpauth.services.McpHttpClient#PROTOCOL_VERSION_HEADER} header
 *                           on every outbound request
 * @param probeTimeout       allowed response time for the unauthenticated probe of a resource. Kept short since most
 *                           probed servers will not require auth at all
 * @param discoveryTimeout   allowed response time for each well-known metadata candidate
 * @param tokenTimeout       allowed response time for revocation and introspection endpoints
 * @param allowLocalhost     permit plain {@code http://} endpoints on loopback hosts
 * @param fallbackPolicy     what to do when no authorization server metadata candidate answers
 * @param clientMetadataPath path, relative to the client's API base URL, of its client ID metadata document
 */
@ConfigurationProperties("mcp.auth")
@Validated
public record McpAuthProperties(
    @DefaultValue("2025-11-25") @NotBlank
    String protocolVersion,

    @DefaultValue("5s") @NotNull
    Duration probeTimeout,

    @DefaultValue("10s") @NotNull
    Duration discoveryTimeout,

    @DefaultValue("30s") @NotNull
    Duration tokenTimeout,

    @DefaultValue("true")
    boolean allowLocalhost,

    @DefaultValue("ORIGIN_ENDPOINTS") @NotNull
    FallbackPolicy fallbackPolicy,

    @DefaultValue("/api/v1/oauth/client-metadata.json") @NotBlank
    String clientMetadataPath
) {

    /**
     * @return the defaults, for use outside of a Spring context
     */
    public static McpAuthProperties defaults() {
        return new McpAuthProperties("2025-11-25",
            Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofSeconds(30),
            true, FallbackPolicy.ORIGIN_ENDPOINTS, "/api/v1/oauth/client-metadata.json"
        );
    }
}
