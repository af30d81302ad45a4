package com.sitewatch.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 프로브 1건의 검증 결과(불변). 검증 중에는 {@link Builder} 에 누적하고,
 * ProbeResult 를 만들 때 build() 로 고정한다.
 */
public final class ValidationReport {
    private final boolean headerOk;
    private final boolean bodyOk;
    private final boolean httpsPolicyOk;
    private final List<String> issues;

    private ValidationReport(Builder b) {
        this.headerOk = b.headerOk;
        this.bodyOk = b.bodyOk;
        this.httpsPolicyOk = b.httpsPolicyOk;
        this.issues = List.copyOf(b.issues);
    }

    public boolean isHeaderOk() { return headerOk; }
    public boolean isBodyOk() { return bodyOk; }
    public boolean isHttpsPolicyOk() { return httpsPolicyOk; }

    /** 발생 순서대로의 이슈(수정 불가) */
    public List<String> getIssues() { return issues; }

    public boolean isOverallOk() {
        return headerOk && bodyOk && httpsPolicyOk;
    }

    @Override
    public String toString() {
        return "ValidationReport{headerOk=" + headerOk + ", bodyOk=" + bodyOk
                + ", httpsPolicyOk=" + httpsPolicyOk + ", issues=" + issues + '}';
    }

    // ----- 빌더(검증 중 누적용, 스레드 하나에서만 사용) -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private boolean headerOk;
        private boolean bodyOk;
        private boolean httpsPolicyOk;
        private final List<String> issues = new ArrayList<>();   // 누적만(삭제 API 없음)

        private Builder() {}

        public Builder headerOk(boolean v) { this.headerOk = v; return this; }
        public Builder bodyOk(boolean v) { this.bodyOk = v; return this; }
        public Builder httpsPolicyOk(boolean v) { this.httpsPolicyOk = v; return this; }

        public Builder addIssue(String issue) {
            if (issue != null) issues.add(issue);
            return this;
        }

        public Builder addIssues(List<String> more) {
            if (more != null) for (String s : more) addIssue(s);
            return this;
        }

        public ValidationReport build() {
            return new ValidationReport(this);
        }
    }
}
