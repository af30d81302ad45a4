package com.sitewatch.core.http;

/** 해석 가능한 HTTP 응답을 얻지 못함(연결 거부/DNS/TLS/타임아웃/깨진 응답). */
public class TransportException extends Exception {
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
