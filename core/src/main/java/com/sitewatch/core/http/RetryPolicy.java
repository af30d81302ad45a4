package com.sitewatch.core.http;

import com.sitewatch.core.model.CheckOutcome;

/** 재시도 조건을 결정하는 정책 */
public interface RetryPolicy {
    /** attempt는 1부터 시작(방금 끝난 시도 번호). true면 같은 워커에서 즉시 재시도. */
    boolean shouldRetry(CheckOutcome outcome, int attempt);
    /** 최대 시도 횟수(첫 시도 포함). */
    int maxAttempts();
}
