package mcpauth.messages;

import lombok.Builder;
import org.springframework.lang.Nullable;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

/**
 * Form body shared by <a href="https://datatracker.ietf.org/doc/html/rfc7009#section-2.1">RFC 7009</a>
 * revocation and <a href="https://datatracker.ietf.org/doc/html/rfc7662#section-2.1">RFC 7662</a>
 * introspection requests.
 *
 * @param token
 * @param tokenTypeHint access_token or refresh_token
 * @param clientId      only included for public clients, confidential clients authenticate with HTTP Basic
 */
@Builder
public record TokenOperationRequest(
    String token,
    String tokenTypeHint,
    @Nullable
    String clientId
) {

    public static final String TOKEN = "token";
    public static final String TOKEN_TYPE_HINT = "token_type_hint";
    public static final String CLIENT_ID = "client_id";

    public static final String ACCESS_TOKEN_HINT = "access_token";
    public static final String REFRESH_TOKEN_HINT = "refresh_token";

    public MultiValueMap<String, String> toFormData() {
        final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add(TOKEN, token);
        form.add(TOKEN_TYPE_HINT, tokenTypeHint);
        if (clientId != null) {
            form.add(CLIENT_ID, clientId);
        }
        return form;
    }

    @Override
    public String toString() {
        return "TokenOperationRequest[tokenTypeHint=" + tokenTypeHint + ", clientId=" + clientId + "]";
    }
}
