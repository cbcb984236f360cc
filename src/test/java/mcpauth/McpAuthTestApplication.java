package mcpauth;

import org.springframework.boot.SpringBootConfiguration;

/**
 * Anchor for sliced tests, such as {@code @JsonTest}, since the library itself has no application class.
 */
@SpringBootConfiguration
public class McpAuthTestApplication {

}
