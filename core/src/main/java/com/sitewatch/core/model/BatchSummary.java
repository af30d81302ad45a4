package com.sitewatch.core.model;

/** 배치 1회 결과 요약. total == 0 이면 평균/가동률 모두 0. */
public record BatchSummary(
        int total,
        int successes,
        int httpErrors,
        int transportErrors,
        double avgResponseMillis,
        double uptimePct
) {
    public static final BatchSummary EMPTY = new BatchSummary(0, 0, 0, 0, 0.0, 0.0);
}
