package com.sitewatch.core.model;

import java.util.Objects;

/**
 * 한 타깃 점검 결과의 종류. 세 가지 중 정확히 하나.
 * 소비 측(집계/재시도 정책)은 {@link #kind()} 에 대한 switch 식으로 빠짐없이 분기한다.
 */
public sealed interface CheckOutcome
        permits CheckOutcome.Success, CheckOutcome.HttpError, CheckOutcome.Transport {

    enum Kind { SUCCESS, HTTP_ERROR, TRANSPORT }

    Kind kind();

    /** 2xx 응답 */
    record Success(int statusCode) implements CheckOutcome {
        @Override public Kind kind() { return Kind.SUCCESS; }
    }

    /** 응답은 받았지만 2xx가 아님 */
    record HttpError(int statusCode) implements CheckOutcome {
        @Override public Kind kind() { return Kind.HTTP_ERROR; }
    }

    /** 해석 가능한 응답 자체가 없음(DNS/TLS/타임아웃/깨진 응답/연결 리셋 등) */
    record Transport(String message) implements CheckOutcome {
        public Transport {
            Objects.requireNonNull(message, "message");
        }
        @Override public Kind kind() { return Kind.TRANSPORT; }
    }

    static CheckOutcome fromStatus(int statusCode) {
        return (statusCode >= 200 && statusCode <= 299)
                ? new Success(statusCode)
                : new HttpError(statusCode);
    }
}
