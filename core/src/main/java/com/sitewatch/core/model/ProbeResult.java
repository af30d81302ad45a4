package com.sitewatch.core.model;

import java.time.Duration;
import java.util.Objects;

/** 워커 → 수집기로 전달되는 타깃 1건의 최종 결과 */
public record ProbeResult(
        String target,
        CheckOutcome outcome,
        Duration elapsed,
        String timestampUtc,
        ValidationReport validation
) {
    public ProbeResult {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(elapsed, "elapsed");
        Objects.requireNonNull(timestampUtc, "timestampUtc");
        Objects.requireNonNull(validation, "validation");
    }

    public long elapsedMillis() { return elapsed.toMillis(); }
}
