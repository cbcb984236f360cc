package mcpauth.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map.Entry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

/**
 * Maps metadata documents onto their records without letting one malformed member discard the whole document.
 * A single value is accepted where a list is expected, and any member that still can't be mapped is treated as
 * absent.
 */
@Slf4j
class MetadataReader {

    private final ObjectMapper objectMapper;

    MetadataReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * @return the body as a JSON object, or null when it is not one
     */
    @Nullable
    ObjectNode readObject(@Nullable String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            final JsonNode json = objectMapper.readTree(body);
            return json instanceof ObjectNode object ? object : null;
        } catch (JsonProcessingException e) {
            log.trace("Metadata body is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    /**
     * @throws JsonProcessingException only when the members that map on their own can't be combined
     */
    <T> T map(ObjectNode document, Class<T> type) throws JsonProcessingException {
        try {
            return objectMapper.treeToValue(document, type);
        } catch (JsonProcessingException e) {
            log.debug("Metadata document didn't map onto {} as a whole: {}", type.getSimpleName(),
                e.getOriginalMessage());
        }

        final ObjectNode usable = objectMapper.createObjectNode();
        final List<String> dropped = new ArrayList<>();
        final Iterator<Entry<String, JsonNode>> fields = document.fields();
        while (fields.hasNext()) {
            final Entry<String, JsonNode> field = fields.next();
            final ObjectNode single = objectMapper.createObjectNode();
            single.set(field.getKey(), field.getValue());
            try {
                objectMapper.treeToValue(single, type);
                usable.set(field.getKey(), field.getValue());
            } catch (JsonProcessingException e) {
                dropped.add(field.getKey());
            }
        }
        log.debug("Ignoring malformed metadata members={} for {}", dropped, type.getSimpleName());

        return objectMapper.treeToValue(usable, type);
    }
}
