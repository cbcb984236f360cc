package mcpauth.services;

import io.netty.channel.ChannelOption;
import io.netty.channel.ConnectTimeoutException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.URI;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import mcpauth.config.McpAuthProperties;
import mcpauth.model.ClientCredentials;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.reactive.ClientHttpConnector;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.lang.Nullable;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

/**
 * Issues the engine's outbound requests. Responses of any status are returned as entities so that callers
 * decide what a 401 or 404 means; only transport failures and timeouts surface as errors.
 */
@Slf4j
public class McpHttpClient {

    public static final String PROTOCOL_VERSION_HEADER = "MCP-Protocol-Version";

    private final WebClient.Builder webClientBuilder;
    private final Map<Duration, ClientHttpConnector> connectors = new ConcurrentHashMap<>();

    public McpHttpClient(WebClient.Builder webClientBuilder, McpAuthProperties properties) {
        this.webClientBuilder = webClientBuilder.clone()
            .defaultHeader(PROTOCOL_VERSION_HEADER, properties.protocolVersion())
            .filter((request, next) -> {
                log.debug("Starting {} {}", request.method(), request.url());
                return next.exchange(request);
            });
    }

    /**
     * Plain GET without an Accept preference, as used for probing a resource.
     */
    public Mono<ResponseEntity<String>> get(URI uri, Duration timeout) {
        return Mono.defer(() -> newClient(timeout)
                .get()
                .uri(uri)
                .exchangeToMono(response -> response.toEntity(String.class))
            )
            .timeout(timeout)
            .doOnNext(entity -> log.debug("Response status={} from url={}", entity.getStatusCode(), uri));
    }

    public Mono<ResponseEntity<String>> getJson(URI uri, Duration timeout) {
        return Mono.defer(() -> newClient(timeout)
                .get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(response -> response.toEntity(String.class))
            )
            .timeout(timeout)
            .doOnNext(entity -> log.debug("Response status={} from url={}", entity.getStatusCode(), uri));
    }

    /**
     * POSTs a form, authenticating with HTTP Basic when the credentials are {@link ClientCredentials#isConfidential()
     * confidential}.
     */
    public Mono<ResponseEntity<String>> postForm(URI uri, MultiValueMap<String, String> form,
        @Nullable ClientCredentials credentials, Duration timeout
    ) {
        return Mono.defer(() -> newClient(timeout)
                .post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .headers(headers -> {
                    if (credentials != null && credentials.isConfidential()) {
                        headers.setBasicAuth(credentials.clientId(), credentials.clientSecret(),
                            StandardCharsets.UTF_8);
                    }
                })
                .body(BodyInserters.fromFormData(form))
                .exchangeToMono(response -> response.toEntity(String.class))
            )
            .timeout(timeout)
            .doOnNext(entity -> log.debug("Response status={} from url={}", entity.getStatusCode(), uri));
    }

    /**
     * A fresh client per call keeps per-call state, such as headers, from leaking between requests. Only this clone
     * gets the connector, so the application's own builder keeps whatever connector it was given.
     */
    private WebClient newClient(Duration timeout) {
        return webClientBuilder.clone()
            .clientConnector(connectors.computeIfAbsent(timeout,
                tier -> new ReactorClientHttpConnector(httpClientFor(tier))))
            .build();
    }

    /**
     * Connect and response timeouts follow the call's own tier. {@link HttpClient#create()} shares Reactor Netty's
     * global connection pool, so one client per tier costs no extra connections.
     */
    static HttpClient httpClientFor(Duration timeout) {
        return HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
            .responseTimeout(timeout);
    }

    public static boolean isStatus(ResponseEntity<?> entity, int status) {
        final HttpStatusCode statusCode = entity.getStatusCode();
        return statusCode.value() == status;
    }

    /**
     * Distinguishes a refused connection or unresolvable host, which usually means a misconfigured URL, from a
     * timeout or protocol problem.
     */
    public static boolean isConnectionFailure(Throwable throwable) {
        Throwable current = throwable;
        while (current != null) {
            if (current instanceof ConnectTimeoutException) {
                return false;
            }
            if (current instanceof ConnectException
                || current instanceof UnknownHostException
                || current instanceof NoRouteToHostException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
