package com.sitewatch.core.http;

import com.sitewatch.core.api.IHttpProber;
import com.sitewatch.core.model.HttpResponseData;
import com.sitewatch.core.model.RunConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/** java.net.http 기반 프로버: GET 전송 후 HttpResponseData 로 매핑 */
public class HttpProber implements IHttpProber {

    private static final Logger LOG = LoggerFactory.getLogger(HttpProber.class);

    static final String USER_AGENT = "SiteWatch/0.3";

    /** 본문 읽기 전용 데몬 스레드(워커가 멈춘 스트림에 묶이지 않도록) */
    private static final ExecutorService BODY_READERS = Executors.newCachedThreadPool(new ThreadFactory() {
        private final AtomicInteger seq = new AtomicInteger(1);
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "body-reader-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    });

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<InputStream> send(HttpRequest req) throws Exception;
    }

    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)

    public HttpProber(RunConfig config) {
        Objects.requireNonNull(config, "config");
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getRequestTimeout())
                .build();
        this.sender = null;
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpProber(HttpSender testSender) {
        this.client = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public HttpResponseData fetch(String target, RunConfig cfg) throws TransportException {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(cfg, "cfg");
        URI uri = toUri(target);

        // 헤더 대기 + 본문 읽기 전체를 requestTimeout 하나로 묶는다
        final long deadline = System.nanoTime() + cfg.getRequestTimeout().toNanos();
        HttpResponse<InputStream> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder(uri)
                    .timeout(cfg.getRequestTimeout())
                    .header("User-Agent", USER_AGENT)
                    .GET()
                    .build();
            resp = (sender != null)
                    ? sender.send(req)
                    : client.send(req, HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransportException("interrupted", ie);
        } catch (Exception e) {
            throw new TransportException(describe(e), e);
        }

        Map<String, List<String>> headers = resp.headers().map();
        HttpResponseData.Builder b = HttpResponseData.builder()
                .target(target)
                .statusCode(resp.statusCode())
                .headers(headers);

        // 본문: 규칙이 있을 때만 상한까지 읽고, 없으면 읽지 않고 닫는다
        InputStream in = resp.body();
        if (cfg.needsBody()) {
            try {
                b.body(in == null ? new byte[0] : readBounded(in, cfg.getMaxBodyBytes(), deadline, cfg));
            } catch (IOException e) {
                b.bodyReadError(describe(e));
            } finally {
                closeQuietly(in);
            }
        } else {
            closeQuietly(in);
        }

        return b.build();
    }

    /**
     * 본문을 최대 maxBytes 까지 읽되 deadline 을 넘기면 스트림을 닫고 타임아웃으로 처리한다.
     * 읽기는 body-reader 스레드에서 돌고, 워커는 남은 시간만큼만 기다린다.
     */
    static byte[] readBounded(InputStream in, int maxBytes, long deadline, RunConfig cfg)
            throws IOException, TransportException {
        Future<byte[]> f = BODY_READERS.submit(() -> in.readNBytes(maxBytes));
        try {
            return f.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException te) {
            f.cancel(true);
            closeQuietly(in);
            throw new TransportException("HttpTimeoutException: body read timed out after "
                    + cfg.getRequestTimeout().toMillis() + " ms", te);
        } catch (InterruptedException ie) {
            f.cancel(true);
            closeQuietly(in);
            Thread.currentThread().interrupt();
            throw new TransportException("interrupted", ie);
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof IOException io) throw io;
            throw new IOException(describe(cause != null ? cause : ee), cause);
        }
    }

    static URI toUri(String target) throws TransportException {
        URI uri;
        try {
            uri = URI.create(target.trim());
        } catch (IllegalArgumentException e) {
            throw new TransportException("Invalid URL: " + e.getMessage(), e);
        }
        String scheme = uri.getScheme();
        if (scheme == null || uri.getHost() == null
                || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            throw new TransportException("Invalid URL: " + target);
        }
        return uri;
    }

    /** 예외 → 사람이 읽을 메시지(클래스명 + 메시지). 메시지 없는 예외(ConnectException 등) 대비 */
    static String describe(Throwable e) {
        String msg = e.getMessage();
        String name = e.getClass().getSimpleName();
        if (msg == null || msg.isBlank()) {
            Throwable c = e.getCause();
            return (c != null && c != e) ? name + ": " + describe(c) : name;
        }
        return name + ": " + msg;
    }

    static void closeQuietly(InputStream in) {
        if (in == null) return;
        try {
            in.close();
        } catch (IOException e) {
            // 읽지 않은 본문 스트림 정리 실패는 결과에 영향 없음
            LOG.debug("body stream close failed: {}", e.toString());
        }
    }
}
