package com.example.nexusmods.config;

import com.example.nexusmods.service.NexusModsClient;
import com.example.nexusmods.service.RateLimitListener;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.web.client.RestClientAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.client.RestClient;

/**
 * Registers a {@link NexusModsClient} when {@code nexusmods.api-key} is set.
 */
@AutoConfiguration(after = RestClientAutoConfiguration.class)
@ConditionalOnClass(RestClient.class)
@EnableConfigurationProperties(NexusModsProperties.class)
public class NexusModsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "nexusmods", name = "api-key")
    public NexusModsClient nexusModsClient(ObjectProvider<RestClient.Builder> restClientBuilder,
            NexusModsProperties properties, ObjectProvider<RateLimitListener> rateLimitListener) {
        return new NexusModsClient(
                restClientBuilder.getIfAvailable(RestClient::builder),
                properties,
                rateLimitListener.getIfAvailable(() -> RateLimitListener.NONE));
    }
}
