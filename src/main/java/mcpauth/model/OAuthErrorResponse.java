package mcpauth.model;

import org.springframework.lang.Nullable;

/**
 * <a href="https://datatracker.ietf.org/doc/html/rfc6749#section-5.2">RFC 6749 5.2</a> error response
 *
 * @param error            never null, {@value #UNKNOWN_ERROR} when the body couldn't be interpreted
 * @param errorDescription
 * @param errorUri
 * @param statusCode       HTTP status of the response
 */
public record OAuthErrorResponse(
    String error,
    @Nullable
    String errorDescription,
    @Nullable
    String errorUri,
    int statusCode
) {

    public static final String UNKNOWN_ERROR = "unknown_error";
}
