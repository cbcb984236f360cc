package mcpauth.services;

import lombok.Getter;
import org.springframework.lang.Nullable;

/**
 * No usable authorization server could be resolved for a resource.
 */
@Getter
public class OAuthDiscoveryException extends RuntimeException {

    /**
     * The URL that was being resolved or fetched, when there was one
     */
    @Nullable
    private final String url;

    public OAuthDiscoveryException(String message) {
        this(message, null, null);
    }

    public OAuthDiscoveryException(String message, @Nullable String url) {
        this(message, url, null);
    }

    public OAuthDiscoveryException(String message, @Nullable String url, @Nullable Throwable cause) {
        super(message, cause);
        this.url = url;
    }
}
