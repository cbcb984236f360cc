package mcpauth.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import org.springframework.lang.Nullable;

/**
 * <a href="https://datatracker.ietf.org/doc/html/rfc8414#section-2">RFC 8414 Authorization Server Metadata</a>,
 * also populated from OpenID Connect discovery documents.
 *
 * @param fallback true when no document could be retrieved and the endpoints were synthesized
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(Include.NON_NULL)
public record AuthorizationServerMetadata(
    @JsonProperty("issuer")
    String issuer,

    @JsonProperty("authorization_endpoint")
    String authorizationEndpoint,

    @JsonProperty("token_endpoint")
    String tokenEndpoint,

    @Nullable
    @JsonProperty("registration_endpoint")
    String registrationEndpoint,

    @Nullable
    @JsonProperty("revocation_endpoint")
    String revocationEndpoint,

    @Nullable
    @JsonProperty("introspection_endpoint")
    String introspectionEndpoint,

    @Nullable
    @JsonProperty("code_challenge_methods_supported")
    List<String> codeChallengeMethodsSupported,

    @Nullable
    @JsonProperty("scopes_supported")
    List<String> scopesSupported,

    @Nullable
    @JsonProperty("response_types_supported")
    List<String> responseTypesSupported,

    @Nullable
    @JsonProperty("grant_types_supported")
    List<String> grantTypesSupported,

    @Nullable
    @JsonProperty("token_endpoint_auth_methods_supported")
    List<String> tokenEndpointAuthMethodsSupported,

    @JsonInclude(Include.NON_DEFAULT)
    @JsonProperty("client_id_metadata_document_supported")
    boolean clientIdMetadataDocumentSupported,

    @JsonProperty("fallback")
    boolean fallback
) {

    public static final String ISSUER = "issuer";
    public static final String AUTHORIZATION_ENDPOINT = "authorization_endpoint";
    public static final String TOKEN_ENDPOINT = "token_endpoint";
    public static final String REGISTRATION_ENDPOINT = "registration_endpoint";
    public static final String REVOCATION_ENDPOINT = "revocation_endpoint";
    public static final String INTROSPECTION_ENDPOINT = "introspection_endpoint";

    /**
     * Endpoints rooted at the origin only. Resource paths belong to the resource server, so they are never
     * carried over into authorization server endpoints.
     *
     * @param origin scheme, host and optional port without a trailing slash
     */
    public static AuthorizationServerMetadata fallbackFor(String origin) {
        return AuthorizationServerMetadata.builder()
            .issuer(origin)
            .authorizationEndpoint(origin + "/authorize")
            .tokenEndpoint(origin + "/token")
            .registrationEndpoint(origin + "/register")
            .fallback(true)
            .build();
    }

    /**
     * @return the URL-valued fields keyed by their metadata name, omitting absent ones, in validation order
     */
    public Map<String, String> endpoints() {
        final Map<String, String> endpoints = new LinkedHashMap<>();
        putIfPresent(endpoints, AUTHORIZATION_ENDPOINT, authorizationEndpoint);
        putIfPresent(endpoints, TOKEN_ENDPOINT, tokenEndpoint);
        putIfPresent(endpoints, REGISTRATION_ENDPOINT, registrationEndpoint);
        putIfPresent(endpoints, REVOCATION_ENDPOINT, revocationEndpoint);
        putIfPresent(endpoints, INTROSPECTION_ENDPOINT, introspectionEndpoint);
        putIfPresent(endpoints, ISSUER, issuer);
        return endpoints;
    }

    private static void putIfPresent(Map<String, String> endpoints, String key, @Nullable String value) {
        if (value != null && !value.isEmpty()) {
            endpoints.put(key, value);
        }
    }
}
