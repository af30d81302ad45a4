package com.sitewatch.core.http;

import com.sitewatch.core.model.CheckOutcome;

/** Transport 결과에서만 재시도, 대기 없음. maxRetries=1 이면 최대 2번 시도. */
public final class TransportRetryPolicy implements RetryPolicy {
    private final int maxRetries;

    public TransportRetryPolicy(int maxRetries) {
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        this.maxRetries = maxRetries;
    }

    @Override public boolean shouldRetry(CheckOutcome outcome, int attempt) {
        return switch (outcome.kind()) {
            case TRANSPORT -> attempt <= maxRetries;   // 이전 재시도 수(attempt-1) < maxRetries
            case SUCCESS, HTTP_ERROR -> false;
        };
    }

    /** maxRetries + 1, Integer.MAX_VALUE 에서 포화 */
    @Override public int maxAttempts() {
        return (maxRetries == Integer.MAX_VALUE) ? Integer.MAX_VALUE : maxRetries + 1;
    }
}
