package com.sitewatch.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 상태 코드를 받은 HTTP 응답 캡처(2xx 여부와 무관).
 * 본문은 본문 규칙이 있을 때만 maxBodyBytes 까지 읽어 바이트로 보관한다.
 */
public final class HttpResponseData {
    private static final byte[] EMPTY = new byte[0];

    private final String target;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final byte[] body;
    private final boolean bodyRead;
    private final String bodyReadError;

    private HttpResponseData(Builder b) {
        this.target = b.target;
        this.statusCode = b.statusCode;
        this.headers = copyHeaders(b.headers);
        this.body = (b.body == null) ? EMPTY : b.body.clone();
        this.bodyRead = b.bodyRead;
        this.bodyReadError = b.bodyReadError;
    }

    public String getTarget() { return target; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }

    /** 읽어 둔 본문 바이트(읽지 않았으면 빈 배열). 복사본을 돌려준다. */
    public byte[] getBody() { return body.clone(); }

    /** 본문을 실제로 읽었는지(본문 규칙이 없으면 false) */
    public boolean isBodyRead() { return bodyRead; }

    /** 헤더 수신 후 본문 읽기에 실패했다면 그 메시지, 아니면 null */
    public String getBodyReadError() { return bodyReadError; }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        for (var e : headers.entrySet()) {
            final String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                final List<String> vs = e.getValue();
                return (vs == null || vs.isEmpty()) ? null : vs.get(0);
            }
        }
        return null;
    }

    public String getContentType() { return header("Content-Type"); }

    /** 호출 측 맵과 분리된 읽기 전용 사본(순서 유지) */
    private static Map<String, List<String>> copyHeaders(Map<String, List<String>> in) {
        if (in == null || in.isEmpty()) return Map.of();
        Map<String, List<String>> copy = new LinkedHashMap<>();
        in.forEach((k, v) -> copy.put(k, (v == null) ? List.of() : List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String target;
        private int statusCode;
        private Map<String, List<String>> headers;
        private byte[] body;
        private boolean bodyRead;
        private String bodyReadError;

        public Builder target(String target) { this.target = target; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(byte[] body) { this.body = body; this.bodyRead = (body != null); return this; }
        public Builder bodyReadError(String err) { this.bodyReadError = err; return this; }

        public HttpResponseData build() {
            Objects.requireNonNull(target, "target");
            return new HttpResponseData(this);
        }
    }
}
