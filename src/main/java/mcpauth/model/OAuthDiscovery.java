package mcpauth.model;

import java.util.List;
import lombok.Builder;
import org.springframework.lang.Nullable;

/**
 * Outcome of a full discovery run. Only produced once the metadata has passed the security gates.
 *
 * @param resource            resource indicator to request tokens for
 * @param authorizationServer issuer URL that was selected
 * @param metadata
 * @param discoveryMethod
 * @param resourceMetadataUrl where the protected resource metadata came from, if any
 * @param scopes              from the challenge, else from the resource metadata
 */
@Builder
public record OAuthDiscovery(
    String resource,
    String authorizationServer,
    AuthorizationServerMetadata metadata,
    DiscoveryMethod discoveryMethod,
    @Nullable
    String resourceMetadataUrl,
    List<String> scopes
) {

}
