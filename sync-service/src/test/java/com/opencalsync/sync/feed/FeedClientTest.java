package com.opencalsync.sync.feed;

import com.opencalsync.sync.exception.FeedFetchException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Exercises {@link FeedClient} against a local HTTP server.
 */
class FeedClientTest {

    private static final String FEED = """
            BEGIN:VCALENDAR
            VERSION:2.0
            PRODID:-//Test//EN
            BEGIN:VEVENT
            UID:x
            DTSTART;VALUE=DATE:20250601
            DTEND;VALUE=DATE:20250605
            SUMMARY:Reserved
            STATUS:CONFIRMED
            END:VEVENT
            END:VCALENDAR
            """;

    private static final String EMPTY_FEED = """
            BEGIN:VCALENDAR
            VERSION:2.0
            PRODID:-//Test//EN
            END:VCALENDAR
            """;

    private HttpServer server;
    private String baseUrl;
    private FeedClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/feed.ics", exchange -> respond(exchange, 200, FEED));
        server.createContext("/empty.ics", exchange -> respond(exchange, 200, EMPTY_FEED));
        server.createContext("/moved.ics", exchange -> redirect(exchange, "/feed.ics"));
        server.createContext("/loop.ics", exchange -> redirect(exchange, "/loop.ics"));
        server.createContext("/missing.ics", exchange -> respond(exchange, 404, "not found"));
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        client = new FeedClient(httpClient, new ICalendarFeedParser());
        ReflectionTestUtils.setField(client, "requestTimeoutMs", 2000L);
        ReflectionTestUtils.setField(client, "maxRedirects", 3);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    @DisplayName("fetch() returns the parsed entries of a reachable feed")
    void fetch_success() {
        List<RawFeedEntry> entries = client.fetch(baseUrl + "/feed.ics");

        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).uid()).isEqualTo("x");
    }

    @Test
    @DisplayName("fetch() follows redirects up to the limit")
    void fetch_followsRedirect() {
        List<RawFeedEntry> entries = client.fetch(baseUrl + "/moved.ics");

        assertThat(entries).extracting(RawFeedEntry::uid).containsExactly("x");
    }

    @Test
    @DisplayName("fetch() gives up on redirect loops")
    void fetch_redirectLoop_fails() {
        assertThatThrownBy(() -> client.fetch(baseUrl + "/loop.ics"))
                .isInstanceOf(FeedFetchException.class)
                .hasMessageContaining("Too many redirects");
    }

    @Test
    @DisplayName("non-2xx responses are fetch errors")
    void fetch_notFound_fails() {
        assertThatThrownBy(() -> client.fetch(baseUrl + "/missing.ics"))
                .isInstanceOf(FeedFetchException.class)
                .hasMessageContaining("404");
    }

    @Test
    @DisplayName("bodies beyond the size cap are rejected")
    void fetch_oversizedBody_fails() {
        ReflectionTestUtils.setField(client, "maxBodyBytes", 16);

        assertThatThrownBy(() -> client.fetch(baseUrl + "/feed.ics"))
                .isInstanceOf(FeedFetchException.class)
                .hasMessageContaining("exceeds");
    }

    @Test
    @DisplayName("validate() reports failures with their error code instead of throwing")
    void validate_reportsOutcome() {
        FeedValidationResult ok = client.validate(baseUrl + "/feed.ics");
        FeedValidationResult empty = client.validate(baseUrl + "/empty.ics");
        FeedValidationResult missing = client.validate(baseUrl + "/missing.ics");

        assertThat(ok.valid()).isTrue();
        assertThat(ok.entryCount()).isEqualTo(1);
        assertThat(empty.valid()).isFalse();
        assertThat(empty.errorCode()).isEqualTo("FEED_EMPTY");
        assertThat(missing.valid()).isFalse();
        assertThat(missing.errorCode()).isEqualTo("FEED_FETCH_FAILED");
    }

    @Test
    @DisplayName("webcal URLs are fetched over https; other schemes are rejected")
    void toUri_handlesSchemes() {
        assertThat(FeedClient.toUri("webcal://calendar.example.com/a.ics").toString())
                .isEqualTo("https://calendar.example.com/a.ics");
        assertThatThrownBy(() -> FeedClient.toUri("ftp://calendar.example.com/a.ics"))
                .isInstanceOf(FeedFetchException.class);
        assertThatThrownBy(() -> FeedClient.toUri(" "))
                .isInstanceOf(FeedFetchException.class);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "text/calendar");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static void redirect(HttpExchange exchange, String location) throws IOException {
        exchange.getResponseHeaders().add("Location", location);
        exchange.sendResponseHeaders(302, -1);
        exchange.close();
    }
}
