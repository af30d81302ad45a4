package com.sitewatch.core.service;

import com.sitewatch.core.http.HttpProber;
import com.sitewatch.core.model.BatchSummary;
import com.sitewatch.core.model.CheckOutcome;
import com.sitewatch.core.model.ProbeResult;
import com.sitewatch.core.model.RunConfig;
import com.sitewatch.core.time.FixedTimeSource;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/** 실제 HttpServer + java.net.http 프로버로 배치 전체 경로 확인 */
class CheckServiceIntegrationTest {

    private HttpServer server;
    private String base;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        route("/home", 200, "text/html; charset=utf-8", "<html><h1>Welcome</h1> please Login</html>");
        route("/api", 200, "application/json", "{\"status\":\"none\"}");
        route("/gone", 404, "text/html", "<p>Not here. Welcome anyway</p>");
        route("/image", 200, "image/png", "PNG");
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void route(String path, int status, String contentType, String body) {
        server.createContext(path, ex -> {
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            ex.getResponseHeaders().add("Content-Type", contentType);
            ex.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = ex.getResponseBody()) { os.write(bytes); }
        });
    }

    private static int closedPort() throws IOException {
        try (ServerSocket s = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            return s.getLocalPort();
        }
    }

    @Test
    @DisplayName("성공/HTTP 에러/전송 에러가 섞인 배치")
    void mixed_batch_end_to_end() throws IOException {
        RunConfig cfg = RunConfig.builder()
                .httpsRequired(false)
                .bodyContainsAll(List.of("Welcome"))
                .bodyContainsAny(List.of("Login", "Sign in"))
                .workerCount(4)
                .maxRetries(1)
                .requestTimeoutMs(2000)
                .build();
        List<String> targets = List.of(
                base + "/home",
                base + "/api",
                base + "/gone",
                base + "/image",
                "http://127.0.0.1:" + closedPort() + "/");

        CheckService svc = new CheckService(new HttpProber(cfg), new FixedTimeSource("T0"));
        List<ProbeResult> out = svc.checkAll(targets, cfg);

        assertThat(out).extracting(ProbeResult::target).containsExactlyElementsOf(targets);

        ProbeResult home = out.get(0);
        assertThat(home.outcome()).isEqualTo(new CheckOutcome.Success(200));
        assertThat(home.validation().isOverallOk()).isTrue();

        ProbeResult api = out.get(1);
        assertThat(api.validation().isHeaderOk()).isTrue();
        assertThat(api.validation().isBodyOk()).isFalse();
        assertThat(api.validation().getIssues()).contains(
                "Body missing required text: 'Welcome'",
                "Body did not contain ANY of: [\"Login\", \"Sign in\"]");

        ProbeResult gone = out.get(2);
        assertThat(gone.outcome()).isEqualTo(new CheckOutcome.HttpError(404));
        assertThat(gone.validation().isHeaderOk()).isTrue();

        ProbeResult image = out.get(3);
        assertThat(image.validation().getIssues()).contains("Content-Type not allowed: image/png");

        ProbeResult down = out.get(4);
        assertThat(down.outcome().kind()).isEqualTo(CheckOutcome.Kind.TRANSPORT);
        assertThat(down.validation().getIssues()).anyMatch(s -> s.startsWith("Transport error: "));

        BatchSummary s = SummaryAggregator.summarize(out);
        assertThat(s.total()).isEqualTo(5);
        assertThat(s.successes()).isEqualTo(3);
        assertThat(s.httpErrors()).isEqualTo(1);
        assertThat(s.transportErrors()).isEqualTo(1);
        assertThat(s.uptimePct()).isEqualTo(60.0);
        assertThat(svc.getRuntimeSnapshot().retriesTotal()).isEqualTo(1);
    }
}
