package mcpauth.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import mcpauth.config.McpAuthProperties;
import mcpauth.model.ProtectedResourceMetadata;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Locates and retrieves <a href="https://datatracker.ietf.org/doc/html/rfc9728">RFC 9728</a> protected resource
 * metadata.
 */
@Slf4j
public class ProtectedResourceMetadataService {

    private final McpHttpClient httpClient;
    private final MetadataReader metadataReader;
    private final McpAuthProperties properties;

    public ProtectedResourceMetadataService(McpHttpClient httpClient, ObjectMapper objectMapper,
        McpAuthProperties properties
    ) {
        this.httpClient = httpClient;
        this.metadataReader = new MetadataReader(objectMapper);
        this.properties = properties;
    }

    /**
     * Path-aware location first, then the origin's root location, as required by
     * <a href="https://datatracker.ietf.org/doc/html/rfc9728#section-3.1">RFC 9728 3.1</a>.
     */
    public static List<String> candidateUrls(URI resourceUri) {
        final String origin = WellKnown.origin(resourceUri);
        final String path = WellKnown.path(resourceUri);

        final List<String> candidates = new ArrayList<>(2);
        if (!path.isEmpty()) {
            candidates.add(origin + WellKnown.PROTECTED_RESOURCE + path);
        }
        candidates.add(origin + WellKnown.PROTECTED_RESOURCE);
        return candidates;
    }

    /**
     * Candidates are tried one at a time, in order.
     *
     * @return the URL of the first candidate serving a metadata document, or empty when none does
     */
    public Mono<String> findProtectedResourceMetadata(String resourceUrl) {
        final URI resourceUri;
        try {
            resourceUri = WellKnown.parse(resourceUrl);
        } catch (IllegalArgumentException e) {
            return Mono.error(e);
        }

        return Flux.fromIterable(candidateUrls(resourceUri))
            .concatMap(this::tryCandidate)
            .next()
            .doOnNext(url -> log.debug("Located protected resource metadata for resource={} at url={}",
                resourceUrl, url))
            .switchIfEmpty(Mono.fromRunnable(() ->
                log.debug("No protected resource metadata found for resource={}", resourceUrl)));
    }

    private Mono<String> tryCandidate(String candidateUrl) {
        return httpClient.getJson(URI.create(candidateUrl), properties.discoveryTimeout())
            .filter(entity -> isMetadataDocument(candidateUrl, entity))
            .map(entity -> candidateUrl)
            .onErrorResume(e -> {
                log.debug("Protected resource metadata candidate url={} failed: {}", candidateUrl, e.toString());
                return Mono.empty();
            });
    }

    private boolean isMetadataDocument(String candidateUrl, ResponseEntity<String> entity) {
        if (!McpHttpClient.isStatus(entity, HttpStatus.OK.value())) {
            log.debug("Protected resource metadata candidate url={} answered status={}",
                candidateUrl, entity.getStatusCode());
            return false;
        }
        final ObjectNode body = metadataReader.readObject(entity.getBody());
        // a 200 from a catch-all route is common, so the document must look like resource metadata
        return body != null && (body.has("authorization_servers") || body.has("resource"));
    }

    /**
     * @throws OAuthDiscoveryException via the returned mono when the document can't be retrieved or parsed
     */
    public Mono<ProtectedResourceMetadata> fetchProtectedResourceMetadata(String metadataUrl) {
        final URI metadataUri;
        try {
            metadataUri = WellKnown.parse(metadataUrl);
        } catch (IllegalArgumentException e) {
            return Mono.error(new OAuthDiscoveryException(
                "Invalid protected resource metadata URL: " + metadataUrl, metadataUrl, e));
        }

        return httpClient.getJson(metadataUri, properties.discoveryTimeout())
            .<ProtectedResourceMetadata>handle((entity, sink) -> {
                if (!McpHttpClient.isStatus(entity, HttpStatus.OK.value())) {
                    sink.error(new OAuthDiscoveryException(
                        "Failed to fetch protected resource metadata from %s, status=%d"
                            .formatted(metadataUrl, entity.getStatusCode().value()),
                        metadataUrl
                    ));
                    return;
                }
                final ObjectNode document = metadataReader.readObject(entity.getBody());
                if (document == null) {
                    sink.error(new OAuthDiscoveryException(
                        "Protected resource metadata at " + metadataUrl + " is not a valid JSON object", metadataUrl));
                    return;
                }
                try {
                    final ProtectedResourceMetadata metadata = metadataReader.map(document,
                        ProtectedResourceMetadata.class);
                    log.debug("Fetched protected resource metadata from url={}: {}", metadataUrl, metadata);
                    sink.next(metadata);
                } catch (JsonProcessingException e) {
                    sink.error(new OAuthDiscoveryException(
                        "Protected resource metadata at " + metadataUrl + " could not be read", metadataUrl, e));
                }
            });
    }
}
