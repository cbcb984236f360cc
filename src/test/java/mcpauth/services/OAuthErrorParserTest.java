package mcpauth.services;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import mcpauth.model.OAuthErrorResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class OAuthErrorParserTest {

    private final OAuthErrorParser parser = new OAuthErrorParser(new ObjectMapper());

    @Test
    void parsesStandardError() {
        final OAuthErrorResponse error = parser.parse(ResponseEntity.status(HttpStatus.BAD_REQUEST).body("""
            {"error":"invalid_grant","error_description":"Code expired","error_uri":"https://docs.example.com/e"}
            """));

        assertThat(error.error()).isEqualTo("invalid_grant");
        assertThat(error.errorDescription()).isEqualTo("Code expired");
        assertThat(error.errorUri()).isEqualTo("https://docs.example.com/e");
        assertThat(error.statusCode()).isEqualTo(400);
    }

    @Test
    void jsonWithoutErrorMember() {
        final OAuthErrorResponse error = parser.parse(ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body("{\"message\":\"bad\"}"));

        assertThat(error.error()).isEqualTo(OAuthErrorResponse.UNKNOWN_ERROR);
        assertThat(error.errorDescription()).isNull();
    }

    @Test
    void plainTextBecomesDescription() {
        final OAuthErrorResponse error = parser.parse(ResponseEntity.status(HttpStatus.BAD_GATEWAY)
            .body("Bad Gateway"));

        assertThat(error.error()).isEqualTo(OAuthErrorResponse.UNKNOWN_ERROR);
        assertThat(error.errorDescription()).isEqualTo("Bad Gateway");
        assertThat(error.statusCode()).isEqualTo(502);
    }

    @Test
    void truncatesLongBodies() {
        final OAuthErrorResponse error = parser.parse(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body("x".repeat(2000)));

        assertThat(error.errorDescription()).hasSize(OAuthErrorParser.MAX_DESCRIPTION_LENGTH);
    }

    @Test
    void emptyBodyDescribesStatus() {
        final OAuthErrorResponse error = parser.parse(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build());

        assertThat(error.error()).isEqualTo(OAuthErrorResponse.UNKNOWN_ERROR);
        assertThat(error.errorDescription()).isEqualTo("HTTP 503");
    }
}
