package com.team.detection.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link PageFetcher} backed by the JDK HTTP client.
 *
 * Usage:
 * <pre>
 * PageFetcher fetcher = HttpPageFetcher.builder()
 *     .requestTimeout(Duration.ofSeconds(20))
 *     .build();
 * </pre>
 */
public class HttpPageFetcher implements PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(HttpPageFetcher.class);

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final String DEFAULT_USER_AGENT = "team-detection/1.0";

    private final Duration requestTimeout;
    private final String userAgent;
    private final HttpClient httpClient;

    private HttpPageFetcher(Builder builder) {
        Duration connectTimeout = builder.connectTimeout != null ? builder.connectTimeout : DEFAULT_CONNECT_TIMEOUT;
        this.requestTimeout = builder.requestTimeout != null ? builder.requestTimeout : DEFAULT_REQUEST_TIMEOUT;
        this.userAgent = builder.userAgent != null ? builder.userAgent : DEFAULT_USER_AGENT;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public String fetch(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url cannot be empty");
        }
        log.debug("fetch.request url={}", url);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(requestTimeout)
                .header("User-Agent", userAgent)
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransportException(url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(url, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            log.warn("fetch.failed url={} status={}", url, status);
            throw new TransportException(url, status);
        }
        log.debug("fetch.completed url={} bytes={}", url, response.body().length());
        return response.body();
    }

    public static HttpPageFetcher createDefault() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration connectTimeout;
        private Duration requestTimeout;
        private String userAgent;

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public HttpPageFetcher build() {
            return new HttpPageFetcher(this);
        }
    }
}
