package mcpauth.services;

import java.net.URI;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import mcpauth.config.McpAuthProperties;
import mcpauth.model.AuthChallenge;
import mcpauth.model.AuthType;
import mcpauth.model.AuthorizationServerMetadata;
import mcpauth.model.DiscoveryMethod;
import mcpauth.model.OAuthDiscovery;
import mcpauth.model.ProbeResult;
import mcpauth.model.ProtectedResourceMetadata;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

/**
 * Composes the discovery steps: challenge, protected resource metadata, server selection, authorization server
 * metadata and finally the security gates.
 */
@Slf4j
public class OAuthDiscoveryService {

    private final AuthChallengeService challengeService;
    private final ProtectedResourceMetadataService resourceMetadataService;
    private final AuthorizationServerMetadataService serverMetadataService;
    private final OAuthSecurityValidator securityValidator;
    private final McpAuthProperties properties;

    public OAuthDiscoveryService(AuthChallengeService challengeService,
        ProtectedResourceMetadataService resourceMetadataService,
        AuthorizationServerMetadataService serverMetadataService,
        OAuthSecurityValidator securityValidator,
        McpAuthProperties properties
    ) {
        this.challengeService = challengeService;
        this.resourceMetadataService = resourceMetadataService;
        this.serverMetadataService = serverMetadataService;
        this.securityValidator = securityValidator;
        this.properties = properties;
    }

    /**
     * Reports whether a resource wants OAuth. Never errors: an unreachable resource is reported through
     * {@link ProbeResult#error()}.
     */
    public Mono<ProbeResult> probeConnection(String resourceUrl) {
        return challengeService.extractAuthChallenge(resourceUrl)
            .map(challenge -> challenge.isEmpty() ?
                ProbeResult.builder()
                    .requiresAuth(false)
                    .authType(AuthType.NONE)
                    .build()
                : ProbeResult.builder()
                    .requiresAuth(true)
                    .authType(AuthType.OAUTH)
                    .challenge(challenge)
                    .build()
            )
            .onErrorResume(e -> {
                log.warn("Unable to connect to resource url={}: {}", resourceUrl, e.toString());
                return Mono.just(ProbeResult.builder()
                    .requiresAuth(false)
                    .authType(AuthType.NONE)
                    .error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build());
            });
    }

    public Mono<OAuthDiscovery> discover(String resourceUrl) {
        return discover(resourceUrl, null);
    }

    /**
     * @param preferredServer chosen when the resource lists it among several authorization servers
     * @return the validated discovery. Errors with {@link OAuthSecurityException} when the metadata fails a
     * security gate and {@link OAuthDiscoveryException} when no authorization server can be resolved.
     */
    public Mono<OAuthDiscovery> discover(String resourceUrl, @Nullable String preferredServer) {
        return challengeService.extractAuthChallenge(resourceUrl)
            .flatMap(challenge -> {
                if (challenge.resourceMetadata() != null) {
                    log.debug("Resource url={} named its metadata url={} in the challenge",
                        resourceUrl, challenge.resourceMetadata());
                    return discoverViaResourceMetadata(resourceUrl, challenge.resourceMetadata(),
                        DiscoveryMethod.WWW_AUTHENTICATE, challenge, preferredServer);
                }
                return resourceMetadataService.findProtectedResourceMetadata(resourceUrl)
                    .flatMap(metadataUrl -> discoverViaResourceMetadata(resourceUrl, metadataUrl,
                        DiscoveryMethod.RFC9728_PRM, challenge, preferredServer))
                    .switchIfEmpty(Mono.defer(() -> discoverDirect(resourceUrl, challenge)));
            })
            .map(this::checkSecurity)
            .doOnNext(discovery -> log.info("Discovered authorization server={} for resource={} via method={}{}",
                discovery.authorizationServer(), discovery.resource(), discovery.discoveryMethod(),
                discovery.metadata().fallback() ? " (fallback endpoints)" : ""
            ));
    }

    private Mono<OAuthDiscovery> discoverViaResourceMetadata(String resourceUrl, String metadataUrl,
        DiscoveryMethod method, AuthChallenge challenge, @Nullable String preferredServer
    ) {
        return resourceMetadataService.fetchProtectedResourceMetadata(metadataUrl)
            .flatMap(resourceMetadata -> {
                final String server = AuthorizationServerSelector.selectAuthorizationServer(
                    resourceMetadata.authorizationServersOrEmpty(), preferredServer);
                log.debug("Selected authorization server={} for resource={}", server, resourceUrl);

                return serverMetadataService.fetchAuthServerMetadata(server)
                    .map(metadata -> OAuthDiscovery.builder()
                        .resource(resourceMetadata.resource() != null ? resourceMetadata.resource() : resourceUrl)
                        .authorizationServer(server)
                        .metadata(metadata)
                        .discoveryMethod(method)
                        .resourceMetadataUrl(metadataUrl)
                        .scopes(scopes(challenge, resourceMetadata))
                        .build()
                    );
            });
    }

    /**
     * Without resource metadata the resource's own origin is the only candidate issuer.
     */
    private Mono<OAuthDiscovery> discoverDirect(String resourceUrl, AuthChallenge challenge) {
        final String origin = WellKnown.origin(URI.create(resourceUrl));
        log.debug("No protected resource metadata for resource={}, trying origin={} as issuer", resourceUrl, origin);

        return serverMetadataService.fetchAuthServerMetadata(origin)
            .map(metadata -> OAuthDiscovery.builder()
                .resource(resourceUrl)
                .authorizationServer(origin)
                .metadata(metadata)
                .discoveryMethod(DiscoveryMethod.DIRECT_OAUTH)
                .scopes(challenge.scopes())
                .build()
            );
    }

    private OAuthDiscovery checkSecurity(OAuthDiscovery discovery) {
        final AuthorizationServerMetadata metadata = discovery.metadata();
        securityValidator.validateOAuthEndpoints(metadata);
        securityValidator.validatePkceSupport(metadata, discovery.resource());
        return discovery;
    }

    private static List<String> scopes(AuthChallenge challenge, ProtectedResourceMetadata resourceMetadata) {
        if (!challenge.scopes().isEmpty()) {
            return challenge.scopes();
        }
        return resourceMetadata.scopesSupported() != null ? resourceMetadata.scopesSupported() : List.of();
    }

    /**
     * URL of this client's <a href="https://datatracker.ietf.org/doc/draft-ietf-oauth-client-id-metadata-document/">
     * client ID metadata document</a>, for servers that advertise {@code client_id_metadata_document_supported}.
     */
    public String clientMetadataDocumentUrl(String apiBaseUrl) {
        return WellKnown.stripTrailingSlash(apiBaseUrl) + properties.clientMetadataPath();
    }
}
