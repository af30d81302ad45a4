package com.sitewatch.core.time;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NetworkTimeSourceTest {

    private HttpServer server;
    private final AtomicInteger hits = new AtomicInteger();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        route("/ok", 200, "{\"year\":2024,\"dateTime\":\"2024-05-01T12:34:56.789\",\"timeZone\":\"UTC\"}");
        route("/nofield", 200, "{\"year\":2024}");
        route("/garbage", 200, "not json");
        route("/down", 503, "{}");
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void route(String path, int status, String body) {
        server.createContext(path, ex -> {
            hits.incrementAndGet();
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            ex.getResponseHeaders().add("Content-Type", "application/json");
            ex.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = ex.getResponseBody()) { os.write(bytes); }
        });
    }

    private NetworkTimeSource source(String path, Map<String, String> env) {
        URI uri = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
        return new NetworkTimeSource(uri, HttpClient.newHttpClient(), env::get);
    }

    @Test
    void returns_date_time_field_verbatim() throws Exception {
        assertThat(source("/ok", Map.of()).fetchUtcTimestamp()).isEqualTo("2024-05-01T12:34:56.789");
    }

    @Test
    void fake_time_env_short_circuits_network() throws Exception {
        String ts = source("/ok", Map.of(NetworkTimeSource.FAKE_TIME_ENV, "1")).fetchUtcTimestamp();

        assertThat(ts).isEqualTo("2020-01-01T00:00:00Z");
        assertThat(hits.get()).isZero();
    }

    @Test
    void missing_field_bad_json_and_error_status_fail() {
        assertThatThrownBy(() -> source("/nofield", Map.of()).fetchUtcTimestamp())
                .isInstanceOf(TimeSourceException.class).hasMessageContaining("dateTime");
        assertThatThrownBy(() -> source("/garbage", Map.of()).fetchUtcTimestamp())
                .isInstanceOf(TimeSourceException.class).hasMessageContaining("parse");
        assertThatThrownBy(() -> source("/down", Map.of()).fetchUtcTimestamp())
                .isInstanceOf(TimeSourceException.class).hasMessageContaining("HTTP 503");
    }

    @Test
    void unreachable_endpoint_fails() {
        NetworkTimeSource ts = new NetworkTimeSource(URI.create("http://127.0.0.1:1/time"),
                HttpClient.newHttpClient(), k -> null);
        assertThatThrownBy(ts::fetchUtcTimestamp).isInstanceOf(TimeSourceException.class);
    }
}
