package com.sitewatch.core.model;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpResponseDataTest {

    @Test
    void headers_are_copied_at_build_time() {
        List<String> values = new ArrayList<>(List.of("text/html"));
        Map<String, List<String>> src = new HashMap<>();
        src.put("Content-Type", values);

        HttpResponseData d = HttpResponseData.builder().target("https://a").statusCode(200).headers(src).build();
        values.set(0, "image/png");
        src.put("X-Late", List.of("1"));

        assertThat(d.getContentType()).isEqualTo("text/html");
        assertThat(d.header("X-Late")).isNull();
        assertThatThrownBy(() -> d.getHeaders().put("X", List.of()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void header_lookup_is_case_insensitive() {
        HttpResponseData d = HttpResponseData.builder()
                .target("https://a")
                .headers(Map.of("content-type", List.of("application/json")))
                .build();

        assertThat(d.header("Content-Type")).isEqualTo("application/json");
        assertThat(d.header("missing")).isNull();
    }

    @Test
    void body_bytes_are_isolated() {
        byte[] raw = "hello".getBytes(StandardCharsets.UTF_8);
        HttpResponseData d = HttpResponseData.builder().target("https://a").body(raw).build();
        raw[0] = 'J';
        d.getBody()[1] = 'X';

        assertThat(new String(d.getBody(), StandardCharsets.UTF_8)).isEqualTo("hello");
        assertThat(d.isBodyRead()).isTrue();
        assertThat(HttpResponseData.builder().target("https://a").build().isBodyRead()).isFalse();
    }
}
