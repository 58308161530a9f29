package com.conduit.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.List;

/**
 * Shared WebClient for every provider adapter.
 *
 * The connection pool holds as many connections as the providers may have calls in
 * flight together (sum of {@code max-concurrency}), so the registry's admission limit
 * is the one that bites. Per-provider response timeouts are applied by the adapters;
 * {@code default-timeout} is the outer bound.
 */
@Slf4j
@Configuration
public class WebClientConfiguration {

    static final int MAX_RESPONSE_BYTES = 4 * 1024 * 1024;
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration MAX_IDLE_TIME = Duration.ofSeconds(30);

    private final ConduitProperties properties;

    public WebClientConfiguration(ConduitProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient webClient(ObjectMapper objectMapper) {
        int poolSize = connectionPoolSize(properties.getProviders());
        Duration responseTimeout = properties.getDefaultTimeout();

        ConnectionProvider pool = ConnectionProvider.builder("conduit-providers")
                .maxConnections(poolSize)
                .pendingAcquireTimeout(responseTimeout)
                .maxIdleTime(MAX_IDLE_TIME)
                .evictInBackground(MAX_IDLE_TIME)
                .build();

        HttpClient httpClient = HttpClient.create(pool)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) CONNECT_TIMEOUT.toMillis())
                .responseTimeout(responseTimeout);

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(codecs -> {
                    codecs.defaultCodecs().jackson2JsonDecoder(
                            new Jackson2JsonDecoder(objectMapper, MediaType.APPLICATION_JSON));
                    codecs.defaultCodecs().jackson2JsonEncoder(
                            new Jackson2JsonEncoder(objectMapper, MediaType.APPLICATION_JSON));
                    codecs.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES);
                })
                .build();

        log.info("Provider connection pool: max-connections={}, response-timeout={}", poolSize, responseTimeout);
        return WebClient.builder()
                .exchangeStrategies(strategies)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    /**
     * Connections needed for every provider to run at its {@code max-concurrency}; at least one.
     */
    static int connectionPoolSize(List<ConduitProperties.ProviderConfig> providers) {
        long total = providers.stream()
                .mapToLong(provider -> Math.max(0, provider.getMaxConcurrency()))
                .sum();
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, total));
    }
}
