package com.sitewatch.core.probe;

import com.sitewatch.core.http.TransportException;
import com.sitewatch.core.model.CheckOutcome;
import com.sitewatch.core.model.HttpResponseData;
import com.sitewatch.core.model.ProbeResult;
import com.sitewatch.core.model.RunConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ProbeTest {

    private static HttpResponseData html(String target, int status) {
        return HttpResponseData.builder()
                .target(target)
                .statusCode(status)
                .headers(Map.of("Content-Type", List.of("text/html")))
                .build();
    }

    @Test
    void not_found_with_valid_headers_is_http_error_but_validation_passes() {
        Probe probe = new Probe((t, c) -> html(t, 404));

        ProbeResult r = probe.run("https://example.com/missing", RunConfig.defaults(), "TS");

        assertThat(r.outcome()).isEqualTo(new CheckOutcome.HttpError(404));
        assertThat(r.validation().isHeaderOk()).isTrue();
        assertThat(r.validation().isBodyOk()).isTrue();
        assertThat(r.validation().isOverallOk()).isTrue();
        assertThat(r.timestampUtc()).isEqualTo("TS");
    }

    @Test
    void http_target_under_https_policy_is_still_requested() {
        int[] calls = {0};
        Probe probe = new Probe((t, c) -> { calls[0]++; return html(t, 200); });

        ProbeResult r = probe.run("http://example.com", RunConfig.defaults(), "TS");

        assertThat(calls[0]).isEqualTo(1);
        assertThat(r.outcome()).isEqualTo(new CheckOutcome.Success(200));
        assertThat(r.validation().isHttpsPolicyOk()).isFalse();
        assertThat(r.validation().isOverallOk()).isFalse();
        assertThat(r.validation().getIssues()).containsExactly("HTTPS required by policy, but URL is not https");
    }

    @Test
    void transport_failure_forces_header_and_body_false() {
        Probe probe = new Probe((t, c) -> { throw new TransportException("ConnectException: refused"); });

        ProbeResult r = probe.run("https://down.example", RunConfig.defaults(), "TS");

        assertThat(r.outcome()).isEqualTo(new CheckOutcome.Transport("ConnectException: refused"));
        assertThat(r.validation().isHeaderOk()).isFalse();
        assertThat(r.validation().isBodyOk()).isFalse();
        assertThat(r.validation().isHttpsPolicyOk()).isTrue();
        assertThat(r.validation().getIssues()).containsExactly("Transport error: ConnectException: refused");
        assertThat(r.elapsedMillis()).isGreaterThanOrEqualTo(0L);
    }
}
