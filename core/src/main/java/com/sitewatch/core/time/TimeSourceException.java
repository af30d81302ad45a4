package com.sitewatch.core.time;

/** 시간 API 호출/파싱 실패. 호출 측은 센티널("unknown")로 대체한다. */
public class TimeSourceException extends Exception {
    public TimeSourceException(String message) {
        super(message);
    }

    public TimeSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
