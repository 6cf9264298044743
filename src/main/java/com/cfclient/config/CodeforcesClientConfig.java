package com.cfclient.config;

import com.cfclient.client.CodeforcesClient;
import com.cfclient.client.CodeforcesClientBuilder;
import com.cfclient.client.ReactiveCodeforcesClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.web.reactive.function.client.WebClientAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Client beans built from {@link CodeforcesClientProperties}. The blocking client wraps the reactive one,
 * so both share one connection pool; closing either releases it.
 * <p>
 * The application's {@link WebClient.Builder} is reused when present. Its ObjectMapper is not: response
 * decoding keeps its own mapper so host {@code spring.jackson.*} settings cannot change the wire format.
 */
@Slf4j
@AutoConfiguration(after = {JacksonAutoConfiguration.class, WebClientAutoConfiguration.class})
@EnableConfigurationProperties(CodeforcesClientProperties.class)
public class CodeforcesClientConfig {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ReactiveCodeforcesClient reactiveCodeforcesClient(CodeforcesClientProperties properties,
                                                             ObjectProvider<WebClient.Builder> webClientBuilder) {
        CodeforcesClientBuilder builder = properties.toBuilder();
        webClientBuilder.ifAvailable(builder::webClientBuilder);
        log.info("Codeforces client: baseUrl={}, signed={}, maxConnections={}",
                properties.getBaseUrl(), properties.getAuth().isEnabled(), properties.getMaxConnections());
        return builder.buildReactive();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public CodeforcesClient codeforcesClient(ReactiveCodeforcesClient reactiveCodeforcesClient) {
        return new CodeforcesClient(reactiveCodeforcesClient);
    }
}
