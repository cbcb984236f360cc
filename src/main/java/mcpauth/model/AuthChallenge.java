package mcpauth.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import lombok.Builder;
import org.springframework.lang.Nullable;

/**
 * Parsed {@code WWW-Authenticate} challenge from a 401 response. Only {@code raw} is guaranteed; the other
 * fields are set when the corresponding quoted parameter was present.
 *
 * @param raw              the header value as received, null only for {@link #empty()}
 * @param resourceMetadata URL of the protected resource metadata document
 *                         <a href="https://datatracker.ietf.org/doc/html/rfc9728#section-5.1">RFC 9728 5.1</a>
 * @param scope            space-delimited scopes the resource requires
 * @param error            such as invalid_token or insufficient_scope
 * @param errorDescription
 */
@Builder
public record AuthChallenge(
    @Nullable
    String raw,
    @Nullable
    String resourceMetadata,
    @Nullable
    String scope,
    @Nullable
    String error,
    @Nullable
    String errorDescription
) {

    public static final String INSUFFICIENT_SCOPE = "insufficient_scope";

    private static final AuthChallenge EMPTY = new AuthChallenge(null, null, null, null, null);

    /**
     * Signals that the resource did not ask for authentication, or that it couldn't be determined.
     */
    public static AuthChallenge empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return raw == null;
    }

    /**
     * A 403 or 401 carrying {@code insufficient_scope} asks the client to step up to {@link #scopes()}.
     */
    public boolean isInsufficientScope() {
        return Objects.equals(error, INSUFFICIENT_SCOPE);
    }

    public List<String> scopes() {
        if (scope == null || scope.isBlank()) {
            return List.of();
        }
        return Arrays.stream(scope.trim().split("\\s+"))
            .toList();
    }
}
