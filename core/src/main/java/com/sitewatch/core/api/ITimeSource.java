// ITimeSource.java
package com.sitewatch.core.api;

import com.sitewatch.core.time.TimeSourceException;

/** 배치 타임스탬프 공급자: ISO-8601 UTC 문자열. */
@FunctionalInterface
public interface ITimeSource {
    String fetchUtcTimestamp() throws TimeSourceException;
}
