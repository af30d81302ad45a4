package com.sitewatch.core.http;

import com.sitewatch.core.model.CheckOutcome;

import java.util.Objects;

/**
 * RetryPolicy를 감싸 재시도 횟수를 집계하는 얇은 데코레이터.
 * 타깃 1건마다 새로 만들어 쓴다(워커 간 공유 금지).
 */
public final class CountingRetryPolicy implements RetryPolicy {
    private final RetryPolicy delegate;
    private int retries = 0; // shouldRetry(...)가 true를 반환한 횟수

    public CountingRetryPolicy(RetryPolicy delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public boolean shouldRetry(CheckOutcome outcome, int attempt) {
        boolean again = delegate.shouldRetry(outcome, attempt);
        if (again) retries++;
        return again;
    }

    @Override
    public int maxAttempts() {
        return delegate.maxAttempts();
    }

    public int getRetryCount() {
        return retries;
    }
}
