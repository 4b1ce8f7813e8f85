package com.deepansh.conversation.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Configures the pooled Apache HttpClient behind every provider RestClient.
 *
 * Timeouts are enforced here, at the transport: the conversation layer never
 * waits on its own and never retries.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean
    public RequestFactoryCache llmRequestFactories(LlmProperties properties) {
        LlmProperties.Http http = properties.getHttp();
        return new RequestFactoryCache(http.getConnectTimeout(), http.getMaxConnections(),
                http.getMaxResponseTimeout());
    }

    @Bean
    public RestClient.Builder llmRestClientBuilder(LlmProperties properties, RequestFactoryCache llmRequestFactories) {
        LlmProperties.Http http = properties.getHttp();
        log.info("HttpClient configured [connectTimeout={}, responseTimeout={}, maxConnections={}]",
                http.getConnectTimeout(), http.getResponseTimeout(), http.getMaxConnections());
        return RestClient.builder()
                .requestFactory(llmRequestFactories.forTimeout(http.getResponseTimeout()));
    }

    static HttpComponentsClientHttpRequestFactory requestFactory(Duration connectTimeout,
                                                                 Duration responseTimeout,
                                                                 int maxConnections) {
        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(
                        PoolingHttpClientConnectionManagerBuilder.create()
                                .setMaxConnTotal(maxConnections)
                                .setMaxConnPerRoute(maxConnections)
                                .setDefaultConnectionConfig(ConnectionConfig.custom()
                                        .setConnectTimeout(Timeout.ofMilliseconds(connectTimeout.toMillis()))
                                        .build())
                                .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(responseTimeout.toMillis()))
                        .build())
                .build();

        return new HttpComponentsClientHttpRequestFactory(httpClient);
    }
}
