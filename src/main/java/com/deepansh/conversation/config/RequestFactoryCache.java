package com.deepansh.conversation.config;

import com.deepansh.conversation.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One pooled HTTP client per distinct response timeout, shared by every provider and session.
 *
 * Timeouts are rounded up to whole seconds and capped by {@code llm.http.max-response-timeout},
 * so the number of pools stays bounded. All pools are closed when the context shuts down.
 */
@Slf4j
public class RequestFactoryCache implements DisposableBean {

    private final Duration connectTimeout;
    private final int maxConnections;
    private final Duration maxResponseTimeout;
    private final Map<Duration, HttpComponentsClientHttpRequestFactory> factories = new ConcurrentHashMap<>();

    public RequestFactoryCache(Duration connectTimeout, int maxConnections, Duration maxResponseTimeout) {
        this.connectTimeout = connectTimeout;
        this.maxConnections = maxConnections;
        this.maxResponseTimeout = maxResponseTimeout;
    }

    /**
     * @throws ValidationException if the timeout is not positive or exceeds the configured maximum
     */
    public HttpComponentsClientHttpRequestFactory forTimeout(Duration responseTimeout) {
        if (responseTimeout == null || responseTimeout.isZero() || responseTimeout.isNegative()) {
            throw new ValidationException("timeout must be greater than 0");
        }
        if (responseTimeout.compareTo(maxResponseTimeout) > 0) {
            throw new ValidationException("timeout must not exceed " + maxResponseTimeout.toSeconds() + " seconds");
        }
        Duration key = Duration.ofSeconds((responseTimeout.toMillis() + 999) / 1000);
        return factories.computeIfAbsent(key, timeout -> {
            log.info("HttpClient pool created [connectTimeout={}, responseTimeout={}, maxConnections={}]",
                    connectTimeout, timeout, maxConnections);
            return HttpClientConfig.requestFactory(connectTimeout, timeout, maxConnections);
        });
    }

    public int size() {
        return factories.size();
    }

    @Override
    public void destroy() {
        log.info("Closing {} HttpClient pool(s)", factories.size());
        factories.forEach((timeout, factory) -> {
            try {
                factory.destroy();
            } catch (Exception e) {
                log.warn("Failed to close HttpClient pool [responseTimeout={}]: {}", timeout, e.getMessage());
            }
        });
        factories.clear();
    }
}
