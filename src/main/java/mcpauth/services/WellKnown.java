package mcpauth.services;

import java.net.URI;

/**
 * Well-known URI suffixes and the URL arithmetic used to build discovery candidates.
 */
public final class WellKnown {

    /**
     * <a href="https://datatracker.ietf.org/doc/html/rfc9728#section-3">RFC 9728 3</a>
     */
    public static final String PROTECTED_RESOURCE = "/.well-known/oauth-protected-resource";

    /**
     * <a href="https://datatracker.ietf.org/doc/html/rfc8414#section-3">RFC 8414 3</a>
     */
    public static final String AUTHORIZATION_SERVER = "/.well-known/oauth-authorization-server";

    /**
     * <a href="https://openid.net/specs/openid-connect-discovery-1_0.html#ProviderConfig">OIDC Discovery 4</a>
     */
    public static final String OPENID_CONFIGURATION = "/.well-known/openid-configuration";

    private WellKnown() {}

    /**
     * @return scheme, host and port, if any, without user info or a trailing slash
     */
    public static String origin(URI uri) {
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new IllegalArgumentException("Not an absolute URL: " + uri);
        }
        final StringBuilder origin = new StringBuilder()
            .append(uri.getScheme())
            .append("://")
            .append(uri.getHost());
        if (uri.getPort() != -1) {
            origin.append(':').append(uri.getPort());
        }
        return origin.toString();
    }

    /**
     * @return raw path without trailing slashes, empty for the root
     */
    public static String path(URI uri) {
        final String path = uri.getRawPath();
        return path != null ? stripTrailingSlash(path) : "";
    }

    public static String stripTrailingSlash(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }

    /**
     * @throws IllegalArgumentException if the value is not an absolute URL
     */
    public static URI parse(String url) {
        final URI uri = URI.create(url);
        origin(uri);
        return uri;
    }
}
