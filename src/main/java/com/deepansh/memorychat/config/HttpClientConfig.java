package com.deepansh.memorychat.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.TimeValue;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Pooled Apache HttpClient behind the RestClient used for provider calls.
 *
 * Every outbound call carries a connect timeout and a response (socket read)
 * timeout. An expired timeout surfaces as a ResourceAccessException, which the
 * LLM client maps to a transient provider error so the retry policy applies.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Value("${memorychat.http.connect-timeout-ms:5000}")
    private long connectTimeoutMs;

    @Value("${memorychat.http.response-timeout-ms:60000}")
    private long responseTimeoutMs;

    @Value("${memorychat.http.max-connections:50}")
    private int maxConnections;

    @Bean("llmRestClientBuilder")
    public RestClient.Builder llmRestClientBuilder() {
        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(connectTimeoutMs))
                .setSocketTimeout(Timeout.ofMilliseconds(responseTimeoutMs))
                .build();

        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setDefaultConnectionConfig(connectionConfig)
                                .setMaxConnTotal(maxConnections)
                                .setMaxConnPerRoute(maxConnections)
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(responseTimeoutMs))
                        .build())
                .evictIdleConnections(TimeValue.ofSeconds(30))
                .build();

        log.info("HttpClient configured [connectTimeout={}ms, responseTimeout={}ms, maxConnections={}]",
                connectTimeoutMs, responseTimeoutMs, maxConnections);
        return RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
