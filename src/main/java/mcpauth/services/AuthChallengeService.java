package mcpauth.services;

import java.net.URI;
import lombok.extern.slf4j.Slf4j;
import mcpauth.config.McpAuthProperties;
import mcpauth.model.AuthChallenge;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import reactor.core.publisher.Mono;

/**
 * Probes a resource without credentials and reads the challenge it answers with.
 */
@Slf4j
public class AuthChallengeService {

    private final McpHttpClient httpClient;
    private final McpAuthProperties properties;

    public AuthChallengeService(McpHttpClient httpClient, McpAuthProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    /**
     * @return {@link AuthChallenge#empty()} when the resource didn't answer 401 or the probe timed out. Errors with
     * the transport exception when the connection itself failed, since that usually means a misconfigured URL.
     */
    public Mono<AuthChallenge> extractAuthChallenge(String resourceUrl) {
        final URI resourceUri;
        try {
            resourceUri = WellKnown.parse(resourceUrl);
        } catch (IllegalArgumentException e) {
            return Mono.error(e);
        }

        return httpClient.get(resourceUri, properties.probeTimeout())
            .map(entity -> {
                if (!McpHttpClient.isStatus(entity, HttpStatus.UNAUTHORIZED.value())) {
                    log.debug("Resource url={} answered status={}, no auth challenge", resourceUrl,
                        entity.getStatusCode());
                    return AuthChallenge.empty();
                }
                final String header = entity.getHeaders().getFirst(HttpHeaders.WWW_AUTHENTICATE);
                final AuthChallenge challenge = WwwAuthenticateParser.parse(header != null ? header : "");
                log.debug("Resource url={} requires auth, challenge={}", resourceUrl, challenge);
                return challenge;
            })
            .onErrorResume(e -> !McpHttpClient.isConnectionFailure(e), e -> {
                log.debug("Unable to probe url={} for auth challenge: {}", resourceUrl, e.toString());
                return Mono.just(AuthChallenge.empty());
            });
    }
}
