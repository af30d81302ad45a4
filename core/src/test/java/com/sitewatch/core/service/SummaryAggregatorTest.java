package com.sitewatch.core.service;

import com.sitewatch.core.model.BatchSummary;
import com.sitewatch.core.model.CheckOutcome;
import com.sitewatch.core.model.ProbeResult;
import com.sitewatch.core.model.ValidationReport;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SummaryAggregatorTest {

    private static ProbeResult r(CheckOutcome o, long ms) {
        return new ProbeResult("https://x", o, Duration.ofMillis(ms), "T", ValidationReport.builder().build());
    }

    @Test
    void counts_average_and_uptime() {
        BatchSummary s = SummaryAggregator.summarize(List.of(
                r(new CheckOutcome.Success(200), 100),
                r(new CheckOutcome.Success(204), 200),
                r(new CheckOutcome.HttpError(404), 300),
                r(new CheckOutcome.Transport("timeout"), 1000)));

        assertThat(s.total()).isEqualTo(4);
        assertThat(s.successes()).isEqualTo(2);
        assertThat(s.httpErrors()).isEqualTo(1);
        assertThat(s.transportErrors()).isEqualTo(1);
        assertThat(s.successes() + s.httpErrors() + s.transportErrors()).isEqualTo(s.total());
        assertThat(s.avgResponseMillis()).isCloseTo(400.0, within(1e-9));
        assertThat(s.uptimePct()).isCloseTo(50.0, within(1e-9));
    }

    @Test
    void empty_batch_is_all_zero() {
        assertThat(SummaryAggregator.summarize(List.of())).isEqualTo(BatchSummary.EMPTY);
        assertThat(SummaryAggregator.summarize(null)).isEqualTo(BatchSummary.EMPTY);
    }
}
