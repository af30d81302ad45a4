package com.sitewatch.core.service;

import com.sitewatch.core.model.BatchSummary;
import com.sitewatch.core.model.ProbeResult;

import java.util.List;

/** 배치 결과 → 요약 통계. 순수 함수(I/O 없음). */
public final class SummaryAggregator {
    private SummaryAggregator() {}

    public static BatchSummary summarize(List<ProbeResult> results) {
        if (results == null || results.isEmpty()) return BatchSummary.EMPTY;

        int successes = 0, httpErrors = 0, transportErrors = 0;
        long totalMs = 0;

        for (ProbeResult r : results) {
            totalMs += r.elapsedMillis();
            switch (r.outcome().kind()) {
                case SUCCESS -> successes++;
                case HTTP_ERROR -> httpErrors++;
                case TRANSPORT -> transportErrors++;
            }
        }

        int total = results.size();
        double avg = (double) totalMs / (double) total;
        double uptime = successes * 100.0 / total;
        return new BatchSummary(total, successes, httpErrors, transportErrors, avg, uptime);
    }
}
