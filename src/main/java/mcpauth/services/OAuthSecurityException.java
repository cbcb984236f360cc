package mcpauth.services;

/**
 * A security precondition failed: an endpoint isn't HTTPS, S256 PKCE isn't available, or a token names the
 * wrong issuer. The calling flow must stop before any token exchange.
 */
public class OAuthSecurityException extends RuntimeException {

    public OAuthSecurityException(String message) {
        super(message);
    }

    public OAuthSecurityException(String message, Throwable cause) {
        super(message, cause);
    }
}
