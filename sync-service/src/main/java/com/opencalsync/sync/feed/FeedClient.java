package com.opencalsync.sync.feed;

import com.opencalsync.sync.exception.FeedException;
import com.opencalsync.sync.exception.FeedFetchException;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Downloads calendar feeds and hands them to {@link ICalendarFeedParser}.
 *
 * Redirects are followed by hand so the hop count can be bounded; every request carries a hard timeout
 * so a hung feed server cannot pin a sync worker.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeedClient {

    private static final Set<Integer> REDIRECT_STATUSES = Set.of(301, 302, 303, 307, 308);

    private final HttpClient feedHttpClient;
    private final ICalendarFeedParser parser;

    @Value("${calendar-sync.feed.request-timeout-ms:30000}")
    private long requestTimeoutMs = 30_000;

    @Value("${calendar-sync.feed.max-redirects:5}")
    private int maxRedirects = 5;

    @Value("${calendar-sync.feed.max-body-bytes:5242880}")
    private int maxBodyBytes = 5 * 1024 * 1024;

    /**
     * Fetches and parses a feed. Transient fetch failures are retried by the {@code feed-client} retry instance.
     *
     * @throws FeedException on fetch, parse or empty-feed failure
     */
    @Retry(name = "feed-client")
    public List<RawFeedEntry> fetch(String url) {
        String body = download(url);
        return parser.parse(body, url);
    }

    /**
     * Fetch + parse without side effects. Never throws for feed problems; the outcome is in the result.
     */
    public FeedValidationResult validate(String url) {
        try {
            List<RawFeedEntry> entries = parser.parse(download(url), url);
            return FeedValidationResult.ok(entries.size());
        } catch (FeedException e) {
            log.info("Feed validation failed for {}: {}", url, e.getMessage());
            return FeedValidationResult.failed(e.getMessage(), e.getErrorCode());
        }
    }

    String download(String url) {
        URI current = toUri(url);
        int redirects = 0;
        while (true) {
            HttpResponse<InputStream> response = send(current, url);
            int status = response.statusCode();

            if (REDIRECT_STATUSES.contains(status)) {
                closeQuietly(response.body());
                if (redirects >= maxRedirects) {
                    throw new FeedFetchException("Too many redirects (" + maxRedirects + ") fetching feed " + url);
                }
                final URI from = current;
                String location = response.headers().firstValue("Location")
                        .orElseThrow(() -> new FeedFetchException("Redirect without Location header from " + from));
                current = from.resolve(location);
                redirects++;
                log.debug("Following redirect {} -> {}", from, current);
                continue;
            }

            if (status < 200 || status >= 300) {
                closeQuietly(response.body());
                throw new FeedFetchException("Feed server returned HTTP " + status + " for " + url);
            }
            return readBody(response.body(), url);
        }
    }

    private HttpResponse<InputStream> send(URI uri, String url) {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofMillis(requestTimeoutMs))
                .header("Accept", "text/calendar, text/plain, */*")
                .GET()
                .build();
        try {
            return feedHttpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (HttpTimeoutException e) {
            throw new FeedFetchException("Timed out after " + requestTimeoutMs + " ms fetching feed " + url, e);
        } catch (IOException e) {
            throw new FeedFetchException("Failed to fetch feed " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FeedFetchException("Interrupted while fetching feed " + url, e);
        }
    }

    private String readBody(InputStream body, String url) {
        try (InputStream in = body) {
            byte[] bytes = in.readNBytes(maxBodyBytes + 1);
            if (bytes.length > maxBodyBytes) {
                throw new FeedFetchException("Feed " + url + " exceeds " + maxBodyBytes + " bytes");
            }
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FeedFetchException("Failed to read feed " + url + ": " + e.getMessage(), e);
        }
    }

    /**
     * Accepts http, https and the webcal alias (fetched over https).
     */
    static URI toUri(String url) {
        if (url == null || url.isBlank()) {
            throw new FeedFetchException("Feed URL is empty");
        }
        String trimmed = url.trim();
        if (trimmed.toLowerCase(Locale.ROOT).startsWith("webcal://")) {
            trimmed = "https://" + trimmed.substring("webcal://".length());
        }
        URI uri;
        try {
            uri = URI.create(trimmed);
        } catch (IllegalArgumentException e) {
            throw new FeedFetchException("Malformed feed URL: " + url, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if ((!scheme.equals("http") && !scheme.equals("https")) || uri.getHost() == null) {
            throw new FeedFetchException("Unsupported feed URL: " + url);
        }
        return uri;
    }

    private static void closeQuietly(InputStream body) {
        try {
            body.close();
        } catch (IOException e) {
            log.debug("Failed to close response body: {}", e.getMessage());
        }
    }
}
