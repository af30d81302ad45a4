package com.sitewatch.core.time;

import com.sitewatch.core.api.ITimeSource;

import java.util.Objects;

/** 고정 타임스탬프(오프라인 실행/테스트용) */
public final class FixedTimeSource implements ITimeSource {
    private final String timestamp;

    public FixedTimeSource(String timestamp) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    @Override
    public String fetchUtcTimestamp() {
        return timestamp;
    }
}
