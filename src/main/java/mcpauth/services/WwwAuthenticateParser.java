package mcpauth.services;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import mcpauth.model.AuthChallenge;

/**
 * Tokenizer for the {@code key="value"} parameters of a {@code WWW-Authenticate} header. Quoted values may
 * contain backslash escapes, so {@code error_description="bad \"thing\""} yields {@code bad "thing"}.
 */
public final class WwwAuthenticateParser {

    public static final String RESOURCE_METADATA = "resource_metadata";
    public static final String SCOPE = "scope";
    public static final String ERROR = "error";
    public static final String ERROR_DESCRIPTION = "error_description";

    // parameter name must start the header or follow whitespace/comma, so "scope" never matches inside "xscope".
    // The value is matched with possessive quantifiers only; long values must not grow the matcher's stack.
    private static final Pattern QUOTED_PARAMETER = Pattern.compile(
        "(?:^|[\\s,])([A-Za-z0-9_.-]+)\\s*=\\s*\"([^\"\\\\]*+(?:\\\\.[^\"\\\\]*+)*+)\"");

    private static final Pattern ESCAPE = Pattern.compile("\\\\(.)");

    private WwwAuthenticateParser() {}

    /**
     * @return lower-cased parameter names mapped to their unescaped values. The first occurrence of a name wins.
     */
    public static Map<String, String> quotedParameters(String header) {
        final Map<String, String> parameters = new LinkedHashMap<>();
        final Matcher matcher = QUOTED_PARAMETER.matcher(header);
        while (matcher.find()) {
            parameters.putIfAbsent(
                matcher.group(1).toLowerCase(Locale.ROOT),
                unescape(matcher.group(2))
            );
        }
        return parameters;
    }

    public static AuthChallenge parse(String header) {
        final Map<String, String> parameters = quotedParameters(header);
        return AuthChallenge.builder()
            .raw(header)
            .resourceMetadata(parameters.get(RESOURCE_METADATA))
            .scope(parameters.get(SCOPE))
            .error(parameters.get(ERROR))
            .errorDescription(parameters.get(ERROR_DESCRIPTION))
            .build();
    }

    static String unescape(String quoted) {
        return ESCAPE.matcher(quoted).replaceAll(result -> Matcher.quoteReplacement(result.group(1)));
    }
}
