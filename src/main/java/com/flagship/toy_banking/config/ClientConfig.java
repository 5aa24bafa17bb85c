package com.flagship.toy_banking.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.toy_banking.discovery.RegistryClient;
import com.flagship.toy_banking.protocol.HttpParticipantClient;
import com.flagship.toy_banking.protocol.ParticipantClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Optional;

/**
 * Outbound HTTP clients: the registry and remote participants.
 *
 * The clients are plain classes; they are registered here so tests can build them
 * around a stubbed WebClient.
 */
@Configuration
@EnableConfigurationProperties(BankProperties.class)
public class ClientConfig {

    @Bean
    public RegistryClient registryClient(WebClient.Builder builder,
                                         BankProperties properties,
                                         Optional<RedisTemplate<String, String>> redisTemplate,
                                         ObjectMapper objectMapper) {
        WebClient webClient = builder.clone()
                .baseUrl(properties.getRegistry().getBaseUrl())
                .build();
        return new RegistryClient(webClient, properties.getRegistry(), redisTemplate, objectMapper);
    }

    @Bean
    public ParticipantClient participantClient(WebClient.Builder builder, BankProperties properties) {
        return new HttpParticipantClient(builder.clone().build(), properties.getProtocol().getRequestTimeout());
    }
}
