package mcpauth.services;

import static mcpauth.services.OAuthFixtures.AUTH_SERVER_URL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import mcpauth.model.AuthorizationServerMetadata;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class OAuthSecurityValidatorTest {

    @Nested
    @DisplayName("HTTPS enforcement")
    class Https {

        @ParameterizedTest
        @ValueSource(strings = {
            "https://auth.example.com/token",
            "HTTPS://auth.example.com",
            "http://localhost:8080/callback",
            "http://127.0.0.1/token",
            "http://[::1]:9000/token",
            "https://auth.example.com/a b",
            "https://auth.example.com/{tenant}/token",
            "https://auth.example.com/a|b"
        })
        void acceptsSecureOrLoopback(String url) {
            assertThatCode(() -> OAuthSecurityValidator.validateHttpsUrl(url, true))
                .doesNotThrowAnyException();
        }

        @ParameterizedTest
        @ValueSource(strings = {
            "http://auth.example.com/token",
            "ftp://auth.example.com/token",
            "http://localhost.evil.com/token",
            "http://localhost@evil.com/token",
            "http://auth.example.com/{tenant}/token",
            "auth.example.com/token"
        })
        void rejectsInsecure(String url) {
            assertThatThrownBy(() -> OAuthSecurityValidator.validateHttpsUrl(url, true))
                .isInstanceOf(OAuthSecurityException.class)
                .hasMessageContaining("HTTPS");
        }

        @Test
        void loopbackNeedsPermission() {
            assertThatThrownBy(() -> OAuthSecurityValidator.validateHttpsUrl("http://localhost:8080/token", false))
                .isInstanceOf(OAuthSecurityException.class)
                .hasMessage("OAuth URL must use HTTPS: http://localhost:8080/token");
        }

        @Test
        void instanceUsesConfiguredPermission() {
            final OAuthSecurityValidator validator = new OAuthSecurityValidator(OAuthFixtures.properties());

            assertThatCode(() -> validator.validateHttpsUrl("http://localhost/token")).doesNotThrowAnyException();
        }
    }

    @Nested
    @DisplayName("endpoint validation")
    class Endpoints {

        @Test
        void namesOffendingKey() {
            final Map<String, String> config = new LinkedHashMap<>();
            config.put("authorization_endpoint", "https://auth.example.com/authorize");
            config.put("token_endpoint", "http://auth.example.com/token");

            assertThatThrownBy(() -> OAuthSecurityValidator.validateOAuthEndpoints(config, true))
                .isInstanceOf(OAuthSecurityException.class)
                .hasMessageStartingWith("Insecure token_endpoint");
        }

        @Test
        void skipsAbsentAndUnknownKeys() {
            final Map<String, String> config = new LinkedHashMap<>();
            config.put("authorization_endpoint", "https://auth.example.com/authorize");
            config.put("registration_endpoint", "");
            config.put("service_documentation", "http://docs.example.com");

            assertThatCode(() -> OAuthSecurityValidator.validateOAuthEndpoints(config, true))
                .doesNotThrowAnyException();
        }

        @Test
        void checksMetadataIssuer() {
            final AuthorizationServerMetadata metadata = AuthorizationServerMetadata.builder()
                .issuer("http://auth.example.com")
                .authorizationEndpoint("https://auth.example.com/authorize")
                .tokenEndpoint("https://auth.example.com/token")
                .build();

            assertThatThrownBy(() -> new OAuthSecurityValidator(OAuthFixtures.properties())
                .validateOAuthEndpoints(metadata))
                .isInstanceOf(OAuthSecurityException.class)
                .hasMessageContaining("issuer");
        }
    }

    @Nested
    @DisplayName("PKCE")
    class Pkce {

        @Test
        void acceptsS256() {
            assertThatCode(() -> OAuthSecurityValidator.validatePkceMethods(List.of("plain", "S256"), "github"))
                .doesNotThrowAnyException();
        }

        @Test
        void rejectsMissing() {
            assertThatThrownBy(() -> OAuthSecurityValidator.validatePkceMethods(null, "github"))
                .isInstanceOf(OAuthSecurityException.class)
                .hasMessageContaining("github")
                .hasMessageContaining("S256");
        }

        @Test
        void rejectsEmpty() {
            assertThatThrownBy(() -> OAuthSecurityValidator.validatePkceMethods(List.of(), "github"))
                .isInstanceOf(OAuthSecurityException.class)
                .hasMessageContaining("missing code_challenge_methods_supported");
        }

        @Test
        void rejectsPlainOnly() {
            assertThatThrownBy(() -> OAuthSecurityValidator.validatePkceMethods(List.of("plain"), "github"))
                .isInstanceOf(OAuthSecurityException.class)
                .hasMessageContaining("plain")
                .hasMessageContaining("insecure");
        }

        @Test
        void rejectsUnknownMethods() {
            assertThatThrownBy(() -> OAuthSecurityValidator.validatePkceMethods(List.of("S512"), "github"))
                .isInstanceOf(OAuthSecurityException.class)
                .hasMessageContaining("[S512]");
        }

        @Test
        void fallbackMetadataFails() {
            final OAuthSecurityValidator validator = new OAuthSecurityValidator(OAuthFixtures.properties());

            assertThatThrownBy(() -> validator.validatePkceSupport(
                AuthorizationServerMetadata.fallbackFor(AUTH_SERVER_URL), "example"))
                .isInstanceOf(OAuthSecurityException.class);
        }
    }

    @Nested
    @DisplayName("JWT issuer")
    class JwtIssuer {

        @Test
        void matchingIssuer() {
            assertThat(OAuthSecurityValidator.validateJwtIssuer(OAuthFixtures.jwt(AUTH_SERVER_URL), AUTH_SERVER_URL))
                .isTrue();
        }

        @Test
        void ignoresTrailingSlash() {
            assertThat(OAuthSecurityValidator.validateJwtIssuer(
                OAuthFixtures.jwt(AUTH_SERVER_URL + "/"), AUTH_SERVER_URL)).isTrue();
            assertThat(OAuthSecurityValidator.validateJwtIssuer(
                OAuthFixtures.jwt(AUTH_SERVER_URL), AUTH_SERVER_URL + "/")).isTrue();
        }

        @Test
        void mismatchedIssuer() {
            assertThat(OAuthSecurityValidator.validateJwtIssuer(
                OAuthFixtures.jwt("https://evil.example.com"), AUTH_SERVER_URL)).isFalse();
        }

        @Test
        void opaqueTokenPasses() {
            assertThat(OAuthSecurityValidator.validateJwtIssuer("gho_opaque_token", AUTH_SERVER_URL)).isTrue();
        }

        @Test
        void undecodableTokenPasses() {
            assertThat(OAuthSecurityValidator.validateJwtIssuer("invalid.jwt.token", AUTH_SERVER_URL)).isTrue();
        }

        @Test
        void tokenWithoutIssuerPasses() {
            final String payload = java.util.Base64.getUrlEncoder().withoutPadding()
                .encodeToString("{\"sub\":\"user-123\"}".getBytes(java.nio.charset.StandardCharsets.UTF_8));

            assertThat(OAuthSecurityValidator.validateJwtIssuer("e30." + payload + ".sig", AUTH_SERVER_URL))
                .isTrue();
        }
    }

    @Nested
    @DisplayName("token response")
    class TokenResponse {

        @Test
        void acceptsBearer() {
            assertThatCode(() -> OAuthSecurityValidator.validateTokenResponse(
                Map.of("access_token", "abc", "token_type", "bearer"), "github"))
                .doesNotThrowAnyException();
        }

        @Test
        void requiresAccessToken() {
            assertThatThrownBy(() -> OAuthSecurityValidator.validateTokenResponse(
                Map.of("token_type", "Bearer"), "github"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("access_token");
        }

        @Test
        void requiresTokenType() {
            assertThatThrownBy(() -> OAuthSecurityValidator.validateTokenResponse(
                Map.of("access_token", "abc"), "github"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("token_type");
        }

        @Test
        void rejectsOtherTypes() {
            assertThatThrownBy(() -> OAuthSecurityValidator.validateTokenResponse(
                Map.of("access_token", "abc", "token_type", "mac"), "github"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Bearer");
        }
    }
}
