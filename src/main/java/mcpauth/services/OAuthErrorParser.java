package mcpauth.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import mcpauth.model.OAuthErrorResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.Nullable;

/**
 * Interprets <a href="https://datatracker.ietf.org/doc/html/rfc6749#section-5.2">RFC 6749 5.2</a> error bodies.
 */
@Slf4j
public class OAuthErrorParser {

    static final int MAX_DESCRIPTION_LENGTH = 500;

    private final ObjectMapper objectMapper;

    public OAuthErrorParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * The body is parsed as JSON whatever its declared content type, since servers often mislabel error
     * responses. A body that isn't a JSON object becomes the description of an
     * {@value OAuthErrorResponse#UNKNOWN_ERROR}.
     */
    public OAuthErrorResponse parse(ResponseEntity<String> response) {
        final int status = response.getStatusCode().value();
        final String body = response.getBody();

        if (body != null && !body.isBlank()) {
            try {
                final JsonNode json = objectMapper.readTree(body);
                if (json != null && json.isObject()) {
                    return new OAuthErrorResponse(
                        textOr(json, "error", OAuthErrorResponse.UNKNOWN_ERROR),
                        textOr(json, "error_description", null),
                        textOr(json, "error_uri", null),
                        status
                    );
                }
            } catch (JsonProcessingException e) {
                log.trace("Error body from status={} is not JSON: {}", status, e.getOriginalMessage());
            }
        }

        return new OAuthErrorResponse(
            OAuthErrorResponse.UNKNOWN_ERROR,
            body != null && !body.isBlank() ? truncate(body) : "HTTP " + status,
            null,
            status
        );
    }

    private static String truncate(String body) {
        return body.length() > MAX_DESCRIPTION_LENGTH ? body.substring(0, MAX_DESCRIPTION_LENGTH) : body;
    }

    private static String textOr(JsonNode json, String field, @Nullable String defaultValue) {
        final JsonNode value = json.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return value.asText();
    }
}
