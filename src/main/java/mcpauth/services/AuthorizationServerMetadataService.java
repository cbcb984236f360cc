package mcpauth.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import mcpauth.config.FallbackPolicy;
import mcpauth.config.McpAuthProperties;
import mcpauth.model.AuthorizationServerMetadata;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Retrieves <a href="https://datatracker.ietf.org/doc/html/rfc8414">RFC 8414</a> authorization server metadata,
 * also accepting OpenID Connect discovery documents.
 */
@Slf4j
public class AuthorizationServerMetadataService {

    private final McpHttpClient httpClient;
    private final MetadataReader metadataReader;
    private final McpAuthProperties properties;

    public AuthorizationServerMetadataService(McpHttpClient httpClient, ObjectMapper objectMapper,
        McpAuthProperties properties
    ) {
        this.httpClient = httpClient;
        this.metadataReader = new MetadataReader(objectMapper);
        this.properties = properties;
    }

    /**
     * For an issuer with a path, such as {@code https://host/tenant1}:
     * <ol>
     *     <li>{@code https://host/.well-known/oauth-authorization-server/tenant1}</li>
     *     <li>{@code https://host/.well-known/openid-configuration/tenant1}</li>
     *     <li>{@code https://host/tenant1/.well-known/openid-configuration}</li>
     *     <li>{@code https://host/.well-known/oauth-authorization-server}</li>
     *     <li>{@code https://host/.well-known/openid-configuration}</li>
     * </ol>
     * Only the last two apply to an issuer without a path.
     */
    public static List<String> candidateUrls(URI issuerUri) {
        final String origin = WellKnown.origin(issuerUri);
        final String path = WellKnown.path(issuerUri);

        final List<String> candidates = new ArrayList<>(5);
        if (!path.isEmpty()) {
            candidates.add(origin + WellKnown.AUTHORIZATION_SERVER + path);
            candidates.add(origin + WellKnown.OPENID_CONFIGURATION + path);
            candidates.add(origin + path + WellKnown.OPENID_CONFIGURATION);
        }
        candidates.add(origin + WellKnown.AUTHORIZATION_SERVER);
        candidates.add(origin + WellKnown.OPENID_CONFIGURATION);
        return candidates;
    }

    /**
     * Returns the first candidate answering with a JSON object. Members of the wrong type are ignored rather than
     * failing the document. When no candidate does, the outcome follows the configured {@link FallbackPolicy}.
     */
    public Mono<AuthorizationServerMetadata> fetchAuthServerMetadata(String issuerUrl) {
        final URI issuerUri;
        try {
            issuerUri = WellKnown.parse(issuerUrl);
        } catch (IllegalArgumentException e) {
            return Mono.error(new OAuthDiscoveryException("Invalid issuer URL: " + issuerUrl, issuerUrl, e));
        }

        return Flux.fromIterable(candidateUrls(issuerUri))
            .concatMap(this::tryCandidate)
            .next()
            .switchIfEmpty(Mono.defer(() -> fallback(issuerUrl, issuerUri)));
    }

    private Mono<AuthorizationServerMetadata> tryCandidate(String candidateUrl) {
        return httpClient.getJson(URI.create(candidateUrl), properties.discoveryTimeout())
            .flatMap(entity -> parse(candidateUrl, entity))
            .onErrorResume(e -> {
                log.debug("Authorization server metadata candidate url={} failed: {}", candidateUrl, e.toString());
                return Mono.empty();
            });
    }

    private Mono<AuthorizationServerMetadata> parse(String candidateUrl, ResponseEntity<String> entity) {
        if (!McpHttpClient.isStatus(entity, HttpStatus.OK.value())) {
            log.debug("Authorization server metadata candidate url={} answered status={}",
                candidateUrl, entity.getStatusCode());
            return Mono.empty();
        }
        final ObjectNode document = metadataReader.readObject(entity.getBody());
        if (document == null) {
            log.debug("Authorization server metadata candidate url={} did not return a JSON object", candidateUrl);
            return Mono.empty();
        }
        try {
            final AuthorizationServerMetadata metadata = metadataReader.map(document,
                AuthorizationServerMetadata.class);
            log.debug("Fetched authorization server metadata from url={}", candidateUrl);
            return Mono.just(metadata.fallback() ? metadata.toBuilder().fallback(false).build() : metadata);
        } catch (JsonProcessingException e) {
            log.debug("Authorization server metadata from url={} could not be mapped: {}", candidateUrl,
                e.getOriginalMessage());
            return Mono.empty();
        }
    }

    private Mono<AuthorizationServerMetadata> fallback(String issuerUrl, URI issuerUri) {
        if (properties.fallbackPolicy() == FallbackPolicy.DISABLED) {
            return Mono.error(new OAuthDiscoveryException(
                "No authorization server metadata could be retrieved for issuer " + issuerUrl, issuerUrl));
        }
        final String origin = WellKnown.origin(issuerUri);
        log.info("No authorization server metadata found for issuer={}, using default endpoints on origin={}",
            issuerUrl, origin);
        return Mono.just(AuthorizationServerMetadata.fallbackFor(origin));
    }
}
