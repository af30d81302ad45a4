package com.sitewatch.core.time;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitewatch.core.api.ITimeSource;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * 네트워크 시간 API(기본 timeapi.io)에서 현재 UTC 시각을 가져온다.
 * 응답 JSON 의 "dateTime" 필드를 그대로 돌려준다.
 * 환경변수 TEST_FAKE_TIME 이 있으면 네트워크 없이 고정값 반환(통합 테스트용).
 */
public final class NetworkTimeSource implements ITimeSource {

    public static final String FAKE_TIME_ENV = "TEST_FAKE_TIME";
    public static final String FAKE_TIMESTAMP = "2020-01-01T00:00:00Z";
    static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ObjectMapper om = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final URI endpoint;
    private final HttpClient client;
    private final Function<String, String> env;

    public NetworkTimeSource(URI endpoint) {
        this(endpoint, HttpClient.newBuilder().connectTimeout(TIMEOUT).build(), System::getenv);
    }

    NetworkTimeSource(URI endpoint, HttpClient client, Function<String, String> env) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.client = Objects.requireNonNull(client, "client");
        this.env = Objects.requireNonNull(env, "env");
    }

    @Override
    public String fetchUtcTimestamp() throws TimeSourceException {
        if (env.apply(FAKE_TIME_ENV) != null) {
            return FAKE_TIMESTAMP;
        }

        HttpResponse<String> res;
        try {
            HttpRequest req = HttpRequest.newBuilder(endpoint)
                    .timeout(TIMEOUT)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            res = client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TimeSourceException("Time request interrupted", ie);
        } catch (Exception e) {
            throw new TimeSourceException("Time request failed: " + e, e);
        }

        if (res.statusCode() < 200 || res.statusCode() > 299) {
            throw new TimeSourceException("Time request failed: HTTP " + res.statusCode());
        }
        try {
            JsonNode root = om.readTree(res.body());
            JsonNode dt = (root == null) ? null : root.get("dateTime");
            if (dt == null || !dt.isTextual() || dt.asText().isBlank()) {
                throw new TimeSourceException("Failed to parse time JSON: missing dateTime");
            }
            return dt.asText();
        } catch (TimeSourceException e) {
            throw e;
        } catch (Exception e) {
            throw new TimeSourceException("Failed to parse time JSON: " + e.getMessage(), e);
        }
    }
}
