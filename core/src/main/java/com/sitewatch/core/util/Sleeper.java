package com.sitewatch.core.util;

import java.time.Duration;

/** 대기 추상화(모니터 루프의 배치 간 휴지). 테스트에서는 기록용 구현으로 교체. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    Sleeper SYSTEM = d -> {
        long ms = Math.max(0, d.toMillis());
        if (ms > 0) Thread.sleep(ms);
    };
}
