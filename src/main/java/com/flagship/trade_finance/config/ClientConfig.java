package com.flagship.trade_finance.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP clients for the ledger gateway and the query service.
 *
 * The ledger gateway's read timeout must outlast the coordinator's
 * confirmation timeout, since receipt calls block until confirmed.
 */
@Configuration
public class ClientConfig {

    @Bean
    public RestTemplate ledgerRestTemplate(RestTemplateBuilder builder,
                                           @Value("${ledger.gateway.connect-timeout-ms:2000}") long connectTimeoutMs,
                                           @Value("${ledger.gateway.read-timeout-ms:60000}") long readTimeoutMs) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }

    @Bean
    public RestTemplate queryRestTemplate(RestTemplateBuilder builder,
                                          @Value("${query.service.connect-timeout-ms:2000}") long connectTimeoutMs,
                                          @Value("${query.service.read-timeout-ms:10000}") long readTimeoutMs) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }
}
