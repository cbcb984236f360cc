package mcpauth.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Builder;
import org.springframework.lang.Nullable;

/**
 * <a href="https://datatracker.ietf.org/doc/html/rfc9728#section-2">RFC 9728 Protected Resource Metadata</a>
 *
 * @param resource               identifier of the protected resource
 * @param authorizationServers   issuer identifiers of servers that can issue tokens for this resource
 * @param scopesSupported
 * @param bearerMethodsSupported header, body, query
 * @param resourceName           human-readable name
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProtectedResourceMetadata(
    @Nullable
    @JsonProperty("resource")
    String resource,

    @Nullable
    @JsonProperty("authorization_servers")
    List<String> authorizationServers,

    @Nullable
    @JsonProperty("scopes_supported")
    List<String> scopesSupported,

    @Nullable
    @JsonProperty("bearer_methods_supported")
    List<String> bearerMethodsSupported,

    @Nullable
    @JsonProperty("resource_name")
    String resourceName
) {

    public List<String> authorizationServersOrEmpty() {
        return authorizationServers != null ? authorizationServers : List.of();
    }
}
