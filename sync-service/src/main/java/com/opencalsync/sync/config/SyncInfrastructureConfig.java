package com.opencalsync.sync.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class SyncInfrastructureConfig {

    /**
     * Redirects stay disabled here; FeedClient follows them itself with a hop limit.
     */
    @Bean
    public HttpClient feedHttpClient(
            @Value("${calendar-sync.feed.connect-timeout-ms:10000}") long connectTimeoutMs) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
