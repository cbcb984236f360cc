package mcpauth.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import mcpauth.services.AuthChallengeService;
import mcpauth.services.AuthorizationServerMetadataService;
import mcpauth.services.McpHttpClient;
import mcpauth.services.OAuthDiscoveryService;
import mcpauth.services.OAuthErrorParser;
import mcpauth.services.OAuthSecurityValidator;
import mcpauth.services.ProtectedResourceMetadataService;
import mcpauth.services.TokenOperationsService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.web.reactive.function.client.WebClientAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.web.reactive.function.client.WebClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class McpAuthAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(
            JacksonAutoConfiguration.class,
            WebClientAutoConfiguration.class,
            McpAuthAutoConfiguration.class
        ));

    @Test
    void registersEngine() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(McpHttpClient.class);
            assertThat(context).hasSingleBean(OAuthErrorParser.class);
            assertThat(context).hasSingleBean(OAuthSecurityValidator.class);
            assertThat(context).hasSingleBean(AuthChallengeService.class);
            assertThat(context).hasSingleBean(ProtectedResourceMetadataService.class);
            assertThat(context).hasSingleBean(AuthorizationServerMetadataService.class);
            assertThat(context).hasSingleBean(TokenOperationsService.class);
            assertThat(context).hasSingleBean(OAuthDiscoveryService.class);
        });
    }

    @Test
    void defaults() {
        contextRunner.run(context -> {
            final McpAuthProperties properties = context.getBean(McpAuthProperties.class);
            assertThat(properties).isEqualTo(McpAuthProperties.defaults());
        });
    }

    @Test
    void bindsProperties() {
        contextRunner
            .withPropertyValues(
                "mcp.auth.protocol-version=2025-06-18",
                "mcp.auth.probe-timeout=2s",
                "mcp.auth.discovery-timeout=45s",
                "mcp.auth.allow-localhost=false",
                "mcp.auth.fallback-policy=disabled",
                "mcp.auth.client-metadata-path=/oauth/client.json"
            )
            .run(context -> {
                final McpAuthProperties properties = context.getBean(McpAuthProperties.class);
                assertThat(properties.protocolVersion()).isEqualTo("2025-06-18");
                assertThat(properties.probeTimeout()).isEqualTo(Duration.ofSeconds(2));
                assertThat(properties.discoveryTimeout()).isEqualTo(Duration.ofSeconds(45));
                assertThat(properties.tokenTimeout()).isEqualTo(Duration.ofSeconds(30));
                assertThat(properties.allowLocalhost()).isFalse();
                assertThat(properties.fallbackPolicy()).isEqualTo(FallbackPolicy.DISABLED);

                assertThat(context.getBean(OAuthDiscoveryService.class)
                    .clientMetadataDocumentUrl("https://app.example.com"))
                    .isEqualTo("https://app.example.com/oauth/client.json");
            });
    }

    @Test
    void leavesApplicationWebClientsAlone() {
        contextRunner
            .withUserConfiguration(RecordingConnectorConfig.class)
            .run(context -> {
                final RecordingConnectorConfig config = context.getBean(RecordingConnectorConfig.class);
                assertThat(context.getBeansOfType(WebClientCustomizer.class)).containsOnlyKeys("recordingConnector");

                StepVerifier.create(context.getBean(WebClient.Builder.class).build()
                        .get()
                        .uri("https://app.example.com/api")
                        .retrieve()
                        .toBodilessEntity())
                    .expectError()
                    .verify();

                assertThat(config.requested).containsExactly(URI.create("https://app.example.com/api"));
            });
    }

    @Test
    void backsOffForUserBeans() {
        contextRunner
            .withUserConfiguration(CustomValidatorConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(OAuthSecurityValidator.class);
                assertThat(context.getBean(OAuthSecurityValidator.class))
                    .isSameAs(context.getBean(CustomValidatorConfig.class).validator);
            });
    }

    @Configuration(proxyBeanMethods = false)
    static class RecordingConnectorConfig {

        final List<URI> requested = new CopyOnWriteArrayList<>();

        @Bean
        WebClientCustomizer recordingConnector() {
            return builder -> builder.clientConnector((method, uri, requestCallback) -> {
                requested.add(uri);
                return Mono.error(new IllegalStateException("not connected"));
            });
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomValidatorConfig {

        final OAuthSecurityValidator validator = new OAuthSecurityValidator(McpAuthProperties.defaults());

        @Bean
        OAuthSecurityValidator customValidator() {
            return validator;
        }
    }
}
