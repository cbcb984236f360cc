package mcpauth.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import mcpauth.services.AuthChallengeService;
import mcpauth.services.AuthorizationServerMetadataService;
import mcpauth.services.McpHttpClient;
import mcpauth.services.OAuthDiscoveryService;
import mcpauth.services.OAuthErrorParser;
import mcpauth.services.OAuthSecurityValidator;
import mcpauth.services.ProtectedResourceMetadataService;
import mcpauth.services.TokenOperationsService;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.web.reactive.function.client.WebClientAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.reactive.function.client.WebClient;

/** Wires the discovery engine on top of the application's {@link WebClient.Builder} and {@link ObjectMapper}. */
@AutoConfiguration(after = {JacksonAutoConfiguration.class, WebClientAutoConfiguration.class})
@ConditionalOnClass(WebClient.class)
@EnableConfigurationProperties(McpAuthProperties.class)
public class McpAuthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public McpHttpClient mcpHttpClient(WebClient.Builder webClientBuilder, McpAuthProperties properties) {
        return new McpHttpClient(webClientBuilder, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public OAuthErrorParser oAuthErrorParser(ObjectMapper objectMapper) {
        return new OAuthErrorParser(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public OAuthSecurityValidator oAuthSecurityValidator(McpAuthProperties properties) {
        return new OAuthSecurityValidator(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public AuthChallengeService authChallengeService(McpHttpClient httpClient, McpAuthProperties properties) {
        return new AuthChallengeService(httpClient, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProtectedResourceMetadataService protectedResourceMetadataService(McpHttpClient httpClient,
        ObjectMapper objectMapper, McpAuthProperties properties
    ) {
        return new ProtectedResourceMetadataService(httpClient, objectMapper, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public AuthorizationServerMetadataService authorizationServerMetadataService(McpHttpClient httpClient,
        ObjectMapper objectMapper, McpAuthProperties properties
    ) {
        return new AuthorizationServerMetadataService(httpClient, objectMapper, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenOperationsService tokenOperationsService(McpHttpClient httpClient, ObjectMapper objectMapper,
        OAuthSecurityValidator securityValidator, OAuthErrorParser errorParser, McpAuthProperties properties
    ) {
        return new TokenOperationsService(httpClient, objectMapper, securityValidator, errorParser, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public OAuthDiscoveryService oAuthDiscoveryService(AuthChallengeService challengeService,
        ProtectedResourceMetadataService resourceMetadataService,
        AuthorizationServerMetadataService serverMetadataService,
        OAuthSecurityValidator securityValidator,
        McpAuthProperties properties
    ) {
        return new OAuthDiscoveryService(challengeService, resourceMetadataService, serverMetadataService,
            securityValidator, properties);
    }
}
