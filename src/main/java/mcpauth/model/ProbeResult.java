package mcpauth.model;

import lombok.Builder;
import org.springframework.lang.Nullable;

/**
 * @param requiresAuth
 * @param authType
 * @param challenge    present when the resource answered 401
 * @param error        set when the resource couldn't be reached
 */
@Builder
public record ProbeResult(
    boolean requiresAuth,
    AuthType authType,
    @Nullable
    AuthChallenge challenge,
    @Nullable
    String error
) {

}
