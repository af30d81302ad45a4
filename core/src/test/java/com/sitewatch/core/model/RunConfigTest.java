package com.sitewatch.core.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunConfigTest {

    @Test
    void defaults() {
        RunConfig c = RunConfig.defaults();

        assertThat(c.isHttpsRequired()).isTrue();
        assertThat(c.getRequiredHeaders()).containsExactly("Content-Type");
        assertThat(c.getContentTypeAllowlist()).containsExactly("text/html", "application/json");
        assertThat(c.getHeaderEquals()).isEmpty();
        assertThat(c.getHeaderContains()).isEmpty();
        assertThat(c.getMaxBodyBytes()).isEqualTo(64 * 1024);
        assertThat(c.needsBody()).isFalse();
        assertThat(c.getWorkerCount()).isEqualTo(50);
        assertThat(c.getMaxRetries()).isEqualTo(1);
        assertThat(c.getRequestTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(c.isFollowRedirects()).isTrue();
        assertThat(c.getTargetsFile()).isEqualTo(Path.of("website_list.txt"));
        assertThat(c.getInterval()).isEqualTo(Duration.ofSeconds(30));
        assertThat(c.isJsonOutput()).isFalse();
        assertThat(c.getTimeSourceUrl()).isEqualTo(RunConfig.DEFAULT_TIME_API);
    }

    @Test
    void worker_count_is_clamped_to_one() {
        assertThat(RunConfig.builder().workerCount(0).build().getWorkerCount()).isEqualTo(1);
        assertThat(RunConfig.builder().workerCount(-7).build().getWorkerCount()).isEqualTo(1);
    }

    @Test
    void invalid_values_are_rejected() {
        assertThatThrownBy(() -> RunConfig.builder().maxBodyBytes(0).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("maxBodyBytes");
        assertThatThrownBy(() -> RunConfig.builder().maxRetries(-1).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("maxRetries");
        assertThatThrownBy(() -> RunConfig.builder().requestTimeout(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("requestTimeout");
        assertThatThrownBy(() -> RunConfig.builder().interval(Duration.ofSeconds(-1)).build())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("interval");
        assertThatThrownBy(() -> RunConfig.builder().requiredHeaders(null).build())
                .isInstanceOf(NullPointerException.class).hasMessageContaining("requiredHeaders");
    }

    @Test
    void body_rules_turn_on_body_reading() {
        assertThat(RunConfig.builder().bodyContainsAny(List.of("x")).build().needsBody()).isTrue();
        assertThat(RunConfig.builder().bodyContainsAll(List.of("x")).build().needsBody()).isTrue();
    }

    @Test
    void built_config_is_immutable_and_to_builder_copies() {
        RunConfig a = RunConfig.builder().addHeaderEquals("X", "1").build();
        RunConfig b = a.toBuilder().addHeaderEquals("Y", "2").maxRetries(3).build();

        assertThat(a.getHeaderEquals()).hasSize(1);
        assertThat(b.getHeaderEquals()).extracting(RunConfig.HeaderRule::name).containsExactly("X", "Y");
        assertThat(a.getMaxRetries()).isEqualTo(1);
        assertThatThrownBy(() -> a.getRequiredHeaders().add("X"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
