package com.sitewatch.core.model;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 한 번의 실행(배치)에 쓰이는 검증 정책 + 실행 파라미터.
 * 빌더로 한 번 만들고 나면 변경 불가, 워커들이 락 없이 공유한다.
 * (sitewatch.yml 매핑은 YamlConfigLoader 참고)
 */
public final class RunConfig {

    public static final URI DEFAULT_TIME_API =
            URI.create("https://timeapi.io/api/Time/current/zone?timeZone=UTC");

    /** 헤더 이름 + 기대값(정확히 일치 또는 부분 문자열) 쌍 */
    public record HeaderRule(String name, String value) {
        public HeaderRule {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
        }
    }

    // ---------- 검증 정책 ----------
    private final boolean httpsRequired;
    private final Set<String> requiredHeaders;
    private final List<String> contentTypeAllowlist;
    private final List<HeaderRule> headerEquals;
    private final List<HeaderRule> headerContains;
    private final int maxBodyBytes;
    private final List<String> bodyContainsAll;
    private final List<String> bodyContainsAny;

    // ---------- 실행 파라미터 ----------
    private final int workerCount;
    private final int maxRetries;
    private final Duration requestTimeout;
    private final boolean followRedirects;

    // ---------- 모니터 루프/출력(앱에서 사용) ----------
    private final Path targetsFile;
    private final Duration interval;
    private final Path outputDir;
    private final boolean jsonOutput;
    private final URI timeSourceUrl;

    private RunConfig(Builder b) {
        this.httpsRequired = b.httpsRequired;
        this.requiredHeaders = Collections.unmodifiableSet(new LinkedHashSet<>(b.requiredHeaders));
        this.contentTypeAllowlist = List.copyOf(b.contentTypeAllowlist);
        this.headerEquals = List.copyOf(b.headerEquals);
        this.headerContains = List.copyOf(b.headerContains);
        this.maxBodyBytes = b.maxBodyBytes;
        this.bodyContainsAll = List.copyOf(b.bodyContainsAll);
        this.bodyContainsAny = List.copyOf(b.bodyContainsAny);
        this.workerCount = b.workerCount;
        this.maxRetries = b.maxRetries;
        this.requestTimeout = b.requestTimeout;
        this.followRedirects = b.followRedirects;
        this.targetsFile = b.targetsFile;
        this.interval = b.interval;
        this.outputDir = b.outputDir;
        this.jsonOutput = b.jsonOutput;
        this.timeSourceUrl = b.timeSourceUrl;
    }

    // ---------- getters ----------
    public boolean isHttpsRequired() { return httpsRequired; }
    public Set<String> getRequiredHeaders() { return requiredHeaders; }
    public List<String> getContentTypeAllowlist() { return contentTypeAllowlist; }
    public List<HeaderRule> getHeaderEquals() { return headerEquals; }
    public List<HeaderRule> getHeaderContains() { return headerContains; }
    public int getMaxBodyBytes() { return maxBodyBytes; }
    public List<String> getBodyContainsAll() { return bodyContainsAll; }
    public List<String> getBodyContainsAny() { return bodyContainsAny; }

    public int getWorkerCount() { return workerCount; }
    public int getMaxRetries() { return maxRetries; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public boolean isFollowRedirects() { return followRedirects; }

    public Path getTargetsFile() { return targetsFile; }
    public Duration getInterval() { return interval; }
    public Path getOutputDir() { return outputDir; }
    public boolean isJsonOutput() { return jsonOutput; }
    public URI getTimeSourceUrl() { return timeSourceUrl; }

    /** 본문 규칙이 하나라도 있을 때만 본문을 읽는다. */
    public boolean needsBody() {
        return !bodyContainsAll.isEmpty() || !bodyContainsAny.isEmpty();
    }

    public static RunConfig defaults() { return builder().build(); }

    public static Builder builder() { return new Builder(); }

    /** 현재 값을 복사한 빌더(일부만 바꿔 새 설정을 만들 때) */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.httpsRequired = httpsRequired;
        b.requiredHeaders = new ArrayList<>(requiredHeaders);
        b.contentTypeAllowlist = new ArrayList<>(contentTypeAllowlist);
        b.headerEquals = new ArrayList<>(headerEquals);
        b.headerContains = new ArrayList<>(headerContains);
        b.maxBodyBytes = maxBodyBytes;
        b.bodyContainsAll = new ArrayList<>(bodyContainsAll);
        b.bodyContainsAny = new ArrayList<>(bodyContainsAny);
        b.workerCount = workerCount;
        b.maxRetries = maxRetries;
        b.requestTimeout = requestTimeout;
        b.followRedirects = followRedirects;
        b.targetsFile = targetsFile;
        b.interval = interval;
        b.outputDir = outputDir;
        b.jsonOutput = jsonOutput;
        b.timeSourceUrl = timeSourceUrl;
        return b;
    }

    // ----- 빌더 -----
    public static final class Builder {
        private boolean httpsRequired = true;
        private List<String> requiredHeaders = new ArrayList<>(List.of("Content-Type"));
        private List<String> contentTypeAllowlist = new ArrayList<>(List.of("text/html", "application/json"));
        private List<HeaderRule> headerEquals = new ArrayList<>();    // 예: X-Frame-Options=DENY
        private List<HeaderRule> headerContains = new ArrayList<>();  // 예: Cache-Control ⊃ max-age=
        private int maxBodyBytes = 64 * 1024;                         // 64 KB
        private List<String> bodyContainsAll = new ArrayList<>();
        private List<String> bodyContainsAny = new ArrayList<>();

        private int workerCount = 50;
        private int maxRetries = 1;
        private Duration requestTimeout = Duration.ofSeconds(5);
        private boolean followRedirects = true;

        private Path targetsFile = Path.of("website_list.txt");
        private Duration interval = Duration.ofSeconds(30);
        private Path outputDir = Path.of("out");
        private boolean jsonOutput = false;
        private URI timeSourceUrl = DEFAULT_TIME_API;

        private Builder() {}

        public Builder httpsRequired(boolean v) { this.httpsRequired = v; return this; }
        public Builder requiredHeaders(List<String> v) { this.requiredHeaders = copy(v); return this; }
        public Builder contentTypeAllowlist(List<String> v) { this.contentTypeAllowlist = copy(v); return this; }
        public Builder headerEquals(List<HeaderRule> v) { this.headerEquals = copy(v); return this; }
        public Builder headerContains(List<HeaderRule> v) { this.headerContains = copy(v); return this; }
        public Builder addHeaderEquals(String name, String value) { headerEquals.add(new HeaderRule(name, value)); return this; }
        public Builder addHeaderContains(String name, String needle) { headerContains.add(new HeaderRule(name, needle)); return this; }
        public Builder maxBodyBytes(int v) { this.maxBodyBytes = v; return this; }
        public Builder bodyContainsAll(List<String> v) { this.bodyContainsAll = copy(v); return this; }
        public Builder bodyContainsAny(List<String> v) { this.bodyContainsAny = copy(v); return this; }

        /** 0 이하 입력은 1로 보정(하한 1) */
        public Builder workerCount(int v) { this.workerCount = Math.max(1, v); return this; }
        public Builder maxRetries(int v) { this.maxRetries = v; return this; }
        public Builder requestTimeout(Duration v) { this.requestTimeout = v; return this; }
        public Builder requestTimeoutMs(long ms) { this.requestTimeout = Duration.ofMillis(Math.max(1, ms)); return this; }
        public Builder followRedirects(boolean v) { this.followRedirects = v; return this; }

        public Builder targetsFile(Path v) { this.targetsFile = v; return this; }
        public Builder interval(Duration v) { this.interval = v; return this; }
        public Builder outputDir(Path v) { this.outputDir = v; return this; }
        public Builder jsonOutput(boolean v) { this.jsonOutput = v; return this; }
        public Builder timeSourceUrl(URI v) { this.timeSourceUrl = v; return this; }

        public RunConfig build() {
            validate();
            return new RunConfig(this);
        }

        // ---------- validate ----------
        private void validate() {
            Objects.requireNonNull(requiredHeaders, "requiredHeaders");
            Objects.requireNonNull(contentTypeAllowlist, "contentTypeAllowlist");
            Objects.requireNonNull(headerEquals, "headerEquals");
            Objects.requireNonNull(headerContains, "headerContains");
            Objects.requireNonNull(bodyContainsAll, "bodyContainsAll");
            Objects.requireNonNull(bodyContainsAny, "bodyContainsAny");
            if (maxBodyBytes <= 0) throw new IllegalArgumentException("maxBodyBytes must be > 0");
            if (workerCount < 1) throw new IllegalArgumentException("workerCount must be >= 1");
            if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
            if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero())
                throw new IllegalArgumentException("requestTimeout must be > 0");
            if (interval == null || interval.isNegative())
                throw new IllegalArgumentException("interval must be >= 0");
            Objects.requireNonNull(targetsFile, "targetsFile");
            Objects.requireNonNull(outputDir, "outputDir");
            Objects.requireNonNull(timeSourceUrl, "timeSourceUrl");
        }

        private static <T> List<T> copy(List<T> in) {
            return (in == null) ? null : new ArrayList<>(in);
        }
    }
}
