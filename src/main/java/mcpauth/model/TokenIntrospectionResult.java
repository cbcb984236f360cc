package mcpauth.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.lang.Nullable;

/**
 * Body of a <a href="https://datatracker.ietf.org/doc/html/rfc7662#section-2.2">RFC 7662</a> introspection
 * response. All members are kept in {@code claims}; the accessors cover the common ones.
 */
public record TokenIntrospectionResult(
    boolean active,
    Map<String, Object> claims
) {

    public static final String ACTIVE = "active";
    public static final String SCOPE = "scope";
    public static final String CLIENT_ID = "client_id";
    public static final String EXPIRES_AT = "exp";
    public static final String ISSUED_AT = "iat";
    public static final String SUBJECT = "sub";
    public static final String TOKEN_TYPE = "token_type";

    public TokenIntrospectionResult {
        claims = Collections.unmodifiableMap(new LinkedHashMap<>(claims));
    }

    public static TokenIntrospectionResult from(Map<String, Object> body) {
        return new TokenIntrospectionResult(Boolean.TRUE.equals(body.get(ACTIVE)), body);
    }

    @Nullable
    public String scope() {
        return stringClaim(SCOPE);
    }

    @Nullable
    public String clientId() {
        return stringClaim(CLIENT_ID);
    }

    @Nullable
    public String sub() {
        return stringClaim(SUBJECT);
    }

    @Nullable
    public String tokenType() {
        return stringClaim(TOKEN_TYPE);
    }

    @Nullable
    public Long exp() {
        return longClaim(EXPIRES_AT);
    }

    @Nullable
    public Long iat() {
        return longClaim(ISSUED_AT);
    }

    @Nullable
    private String stringClaim(String name) {
        final Object value = claims.get(name);
        return value != null ? value.toString() : null;
    }

    @Nullable
    private Long longClaim(String name) {
        final Object value = claims.get(name);
        if (value instanceof Number n) {
            return n.longValue();
        }
        return null;
    }
}
