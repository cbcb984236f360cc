package mcpauth.services;

import com.nimbusds.jose.util.Base64URL;
import com.nimbusds.jose.util.JSONObjectUtils;
import java.text.ParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import mcpauth.config.McpAuthProperties;
import mcpauth.model.AuthorizationServerMetadata;
import org.springframework.lang.Nullable;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Security gates that must pass before a discovered endpoint is used for a live request.
 */
@Slf4j
public class OAuthSecurityValidator {

    public static final String PKCE_S256 = "S256";
    public static final String PKCE_PLAIN = "plain";
    public static final String BEARER = "Bearer";

    static final List<String> ENDPOINT_KEYS = List.of(
        AuthorizationServerMetadata.AUTHORIZATION_ENDPOINT,
        AuthorizationServerMetadata.TOKEN_ENDPOINT,
        AuthorizationServerMetadata.REGISTRATION_ENDPOINT,
        AuthorizationServerMetadata.REVOCATION_ENDPOINT,
        AuthorizationServerMetadata.INTROSPECTION_ENDPOINT,
        AuthorizationServerMetadata.ISSUER
    );

    private static final Set<String> LOOPBACK_HOSTS = Set.of("localhost", "127.0.0.1", "::1", "[::1]");

    private final boolean allowLocalhost;

    public OAuthSecurityValidator(McpAuthProperties properties) {
        this.allowLocalhost = properties.allowLocalhost();
    }

    public void validateHttpsUrl(String url) {
        validateHttpsUrl(url, allowLocalhost);
    }

    /**
     * @param allowLocalhost when true, {@code http://} is accepted for localhost, 127.0.0.1 and ::1
     * @throws OAuthSecurityException unless the URL is HTTPS or an allowed loopback URL
     */
    public static void validateHttpsUrl(String url, boolean allowLocalhost) {
        // only scheme and host matter here, so unencoded paths such as "/{tenant}/token" are fine
        final UriComponents uri;
        try {
            uri = UriComponentsBuilder.fromUriString(url).build();
        } catch (IllegalArgumentException e) {
            throw new OAuthSecurityException("OAuth URL is not a valid URL: " + url, e);
        }

        final String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : "";
        if (scheme.equals("https")) {
            return;
        }
        if (allowLocalhost && scheme.equals("http") && uri.getHost() != null
            && LOOPBACK_HOSTS.contains(uri.getHost().toLowerCase(Locale.ROOT))) {
            return;
        }
        throw new OAuthSecurityException("OAuth URL must use HTTPS: " + url);
    }

    public void validateOAuthEndpoints(AuthorizationServerMetadata metadata) {
        validateOAuthEndpoints(metadata.endpoints(), allowLocalhost);
    }

    public void validateOAuthEndpoints(Map<String, String> config) {
        validateOAuthEndpoints(config, allowLocalhost);
    }

    /**
     * Checks each known endpoint key that is present, stopping at the first violation.
     *
     * @throws OAuthSecurityException naming the offending key
     */
    public static void validateOAuthEndpoints(Map<String, String> config, boolean allowLocalhost) {
        for (String key : ENDPOINT_KEYS) {
            final String url = config.get(key);
            if (url == null || url.isEmpty()) {
                continue;
            }
            try {
                validateHttpsUrl(url, allowLocalhost);
            } catch (OAuthSecurityException e) {
                log.warn("Rejecting insecure {}={}", key, url);
                throw new OAuthSecurityException("Insecure " + key + ": " + e.getMessage(), e);
            }
        }
    }

    public void validatePkceSupport(AuthorizationServerMetadata metadata, String integrationId) {
        validatePkceMethods(metadata.codeChallengeMethodsSupported(), integrationId);
    }

    /**
     * S256 must be advertised. A server that doesn't list {@code code_challenge_methods_supported} gives no
     * confirmation, so it is rejected like one that only offers plain.
     *
     * @param codeChallengeMethods the server's {@code code_challenge_methods_supported}
     * @throws OAuthSecurityException when S256 isn't confirmed
     */
    public static void validatePkceMethods(@Nullable List<String> codeChallengeMethods, String integrationId) {
        if (codeChallengeMethods == null || codeChallengeMethods.isEmpty()) {
            log.warn("Authorization server for {} doesn't advertise PKCE support", integrationId);
            throw new OAuthSecurityException(
                "Authorization server for %s is missing code_challenge_methods_supported; S256 PKCE support is required"
                    .formatted(integrationId));
        }
        if (codeChallengeMethods.contains(PKCE_S256)) {
            return;
        }
        log.warn("Authorization server for {} lacks S256 PKCE, supports={}", integrationId, codeChallengeMethods);
        if (codeChallengeMethods.stream().allMatch(PKCE_PLAIN::equals)) {
            throw new OAuthSecurityException(
                "Authorization server for %s only supports plain PKCE, which is insecure; S256 is required"
                    .formatted(integrationId));
        }
        throw new OAuthSecurityException(
            "Authorization server for %s does not support S256 PKCE, supported methods are %s"
                .formatted(integrationId, codeChallengeMethods));
    }

    /**
     * Compares the {@code iss} claim of a JWT access token with the expected issuer, ignoring trailing slashes.
     * The signature is not verified. Tokens that aren't JWTs, or can't be decoded, can't be checked this way and
     * pass.
     *
     * @return false only when the token names a different issuer
     */
    public static boolean validateJwtIssuer(String accessToken, String expectedIssuer) {
        final String[] segments = accessToken.split("\\.", -1);
        if (segments.length != 3) {
            return true;
        }

        final Object issuer;
        try {
            final Map<String, Object> claims = JSONObjectUtils.parse(new Base64URL(segments[1]).decodeToString());
            issuer = claims.get("iss");
        } catch (ParseException | RuntimeException e) {
            log.debug("Access token looked like a JWT but could not be decoded: {}", e.toString());
            return true;
        }
        if (issuer == null) {
            return true;
        }

        final boolean matches = Objects.equals(
            WellKnown.stripTrailingSlash(issuer.toString()),
            WellKnown.stripTrailingSlash(expectedIssuer)
        );
        if (!matches) {
            log.warn("Access token issuer={} does not match expected issuer={}", issuer, expectedIssuer);
        }
        return matches;
    }

    /**
     * @param tokens decoded token endpoint response
     * @throws IllegalArgumentException when access_token or token_type is missing, or the type isn't Bearer
     */
    public static void validateTokenResponse(Map<String, ?> tokens, String integrationId) {
        final Object accessToken = tokens.get("access_token");
        if (accessToken == null || accessToken.toString().isEmpty()) {
            throw new IllegalArgumentException("Token response for %s is missing access_token".formatted(integrationId));
        }
        final Object tokenType = tokens.get("token_type");
        if (tokenType == null || tokenType.toString().isEmpty()) {
            throw new IllegalArgumentException("Token response for %s is missing token_type".formatted(integrationId));
        }
        if (!BEARER.equalsIgnoreCase(tokenType.toString())) {
            throw new IllegalArgumentException("Token response for %s has token_type=%s, only %s is supported"
                .formatted(integrationId, tokenType, BEARER));
        }
    }
}
