package com.sitewatch.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 배치 실행 중 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class RunStats {
    private final AtomicLong attemptsTotal = new AtomicLong(0);   // 프로브 시도(재시도 포함) 총합
    private final AtomicLong retriesTotal  = new AtomicLong(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void addAttempts(long attempts) { attemptsTotal.addAndGet(attempts); }
    public void addRetries(long retries) { retriesTotal.addAndGet(retries); }

    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        return new Snapshot(attemptsTotal.get(), retriesTotal.get(), maxObservedConcurrency.get());
    }

    /** 불변 스냅샷 */
    public record Snapshot(long attemptsTotal, long retriesTotal, int maxObservedConcurrency) {}
}
