package mcpauth.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import mcpauth.config.McpAuthProperties;
import mcpauth.messages.TokenOperationRequest;
import mcpauth.model.ClientCredentials;
import mcpauth.model.OAuthErrorResponse;
import mcpauth.model.TokenIntrospectionResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;

/**
 * Token maintenance after the authorization flow. Both operations are best-effort: failures are logged and turned
 * into a negative result, never an error signal, so that a logout can't be blocked by an unreachable server.
 */
@Slf4j
public class TokenOperationsService {

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    private final McpHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final OAuthSecurityValidator securityValidator;
    private final OAuthErrorParser errorParser;
    private final McpAuthProperties properties;

    public TokenOperationsService(McpHttpClient httpClient, ObjectMapper objectMapper,
        OAuthSecurityValidator securityValidator, OAuthErrorParser errorParser, McpAuthProperties properties
    ) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.securityValidator = securityValidator;
        this.errorParser = errorParser;
        this.properties = properties;
    }

    public Mono<Boolean> revokeToken(String revocationEndpoint, String token) {
        return revokeToken(revocationEndpoint, token, TokenOperationRequest.ACCESS_TOKEN_HINT, ClientCredentials.none());
    }

    /**
     * <a href="https://datatracker.ietf.org/doc/html/rfc7009#section-2.2">RFC 7009 2.2</a>: any 200 means success,
     * including when the token was already invalid.
     *
     * @return true on a 200 response, false for any other status or failure
     */
    public Mono<Boolean> revokeToken(String revocationEndpoint, String token, String tokenTypeHint,
        ClientCredentials credentials
    ) {
        return send(revocationEndpoint, token, tokenTypeHint, credentials)
            .map(entity -> {
                if (McpHttpClient.isStatus(entity, HttpStatus.OK.value())) {
                    log.debug("Revoked {} at url={}", tokenTypeHint, revocationEndpoint);
                    return true;
                }
                final OAuthErrorResponse error = errorParser.parse(entity);
                log.warn("Token revocation at url={} failed with status={} error={} description={}",
                    revocationEndpoint, error.statusCode(), error.error(), error.errorDescription());
                return false;
            })
            .onErrorResume(e -> {
                log.warn("Token revocation at url={} failed: {}", revocationEndpoint, e.toString());
                return Mono.just(false);
            });
    }

    public Mono<TokenIntrospectionResult> introspectToken(String introspectionEndpoint, String token) {
        return introspectToken(introspectionEndpoint, token, TokenOperationRequest.ACCESS_TOKEN_HINT,
            ClientCredentials.none());
    }

    /**
     * <a href="https://datatracker.ietf.org/doc/html/rfc7662#section-2">RFC 7662 2</a>
     *
     * @return the introspection response, or empty when it couldn't be obtained. An empty result means "unknown"
     * and must not be read as an inactive token.
     */
    public Mono<TokenIntrospectionResult> introspectToken(String introspectionEndpoint, String token,
        String tokenTypeHint, ClientCredentials credentials
    ) {
        return send(introspectionEndpoint, token, tokenTypeHint, credentials)
            .flatMap(entity -> {
                if (!McpHttpClient.isStatus(entity, HttpStatus.OK.value())) {
                    final OAuthErrorResponse error = errorParser.parse(entity);
                    log.warn("Token introspection at url={} failed with status={} error={} description={}",
                        introspectionEndpoint, error.statusCode(), error.error(), error.errorDescription());
                    return Mono.empty();
                }
                return parseIntrospection(introspectionEndpoint, entity);
            })
            .onErrorResume(e -> {
                log.warn("Token introspection at url={} failed: {}", introspectionEndpoint, e.toString());
                return Mono.empty();
            });
    }

    private Mono<TokenIntrospectionResult> parseIntrospection(String introspectionEndpoint,
        ResponseEntity<String> entity
    ) {
        final String body = entity.getBody();
        if (body == null || body.isBlank()) {
            log.warn("Token introspection at url={} returned an empty body", introspectionEndpoint);
            return Mono.empty();
        }
        try {
            final Map<String, Object> json = objectMapper.readValue(body, JSON_OBJECT);
            if (json == null || !(json.get(TokenIntrospectionResult.ACTIVE) instanceof Boolean)) {
                log.warn("Token introspection at url={} returned no active flag", introspectionEndpoint);
                return Mono.empty();
            }
            return Mono.just(TokenIntrospectionResult.from(json));
        } catch (JsonProcessingException e) {
            log.warn("Token introspection at url={} returned an unreadable body: {}", introspectionEndpoint,
                e.toString());
            return Mono.empty();
        }
    }

    private Mono<ResponseEntity<String>> send(String endpoint, String token, String tokenTypeHint,
        ClientCredentials credentials
    ) {
        return Mono.defer(() -> {
            securityValidator.validateHttpsUrl(endpoint);

            final TokenOperationRequest request = TokenOperationRequest.builder()
                .token(token)
                .tokenTypeHint(tokenTypeHint)
                // confidential clients authenticate with HTTP Basic instead
                .clientId(credentials.isConfidential() ? null : credentials.clientId())
                .build();
            log.debug("Sending {} to url={}", request, endpoint);

            return httpClient.postForm(URI.create(endpoint), request.toFormData(), credentials,
                properties.tokenTimeout());
        });
    }
}
