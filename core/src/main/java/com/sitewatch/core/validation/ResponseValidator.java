package com.sitewatch.core.validation;

import com.sitewatch.core.model.HttpResponseData;
import com.sitewatch.core.model.RunConfig;
import com.sitewatch.core.model.RunConfig.HeaderRule;
import com.sitewatch.core.model.ValidationReport;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 응답 1건을 설정 규칙으로 검증한다. 공유 상태가 없어 워커에서 동시에 호출해도 안전.
 * 위반은 예외가 아니라 report.issues 에 쌓이고, 한 규칙이 실패해도 나머지 규칙은 계속 평가한다.
 */
public final class ResponseValidator {
    private ResponseValidator() {}

    /** 본문 텍스트 검사 결과 */
    public record BodyCheck(boolean ok, List<String> issues) {
        public BodyCheck {
            issues = List.copyOf(issues);
        }
    }

    /** HTTPS 강제 정책: 위반은 기록만 하고 이후 검사를 막지 않는다. */
    public static void enforceHttpsPolicy(String target, RunConfig cfg, ValidationReport.Builder report) {
        if (!cfg.isHttpsRequired() || isHttps(target)) {
            report.httpsPolicyOk(true);
            return;
        }
        report.httpsPolicyOk(false);
        report.addIssue("HTTPS required by policy, but URL is not https");
    }

    /** 헤더 검사 후, 본문 규칙이 있을 때만 본문 검사. */
    public static void evaluate(HttpResponseData resp, RunConfig cfg, ValidationReport.Builder report) {
        validateHeaders(resp, cfg, report);

        if (!cfg.needsBody()) {
            report.bodyOk(true);
            return;
        }
        if (resp.getBodyReadError() != null) {
            report.bodyOk(false);
            report.addIssue("Failed to read response body: " + resp.getBodyReadError());
            return;
        }
        String text = decodeBody(resp.getBody(), cfg.getMaxBodyBytes());
        BodyCheck bc = checkBodyText(text, cfg);
        report.bodyOk(bc.ok());
        report.addIssues(bc.issues());
    }

    static void validateHeaders(HttpResponseData resp, RunConfig cfg, ValidationReport.Builder report) {
        boolean ok = true;

        // 필수 헤더 존재
        for (String h : cfg.getRequiredHeaders()) {
            if (resp.header(h) == null) {
                ok = false;
                report.addIssue("Missing header: " + h);
            }
        }

        // Content-Type 허용 목록(접두사, 대소문자 무시)
        if (!cfg.getContentTypeAllowlist().isEmpty()) {
            String ct = resp.getContentType();
            if (ct == null) {
                ok = false;
                report.addIssue("Missing header: Content-Type");
            } else {
                String lower = ct.toLowerCase(Locale.ROOT);
                boolean allowed = cfg.getContentTypeAllowlist().stream()
                        .anyMatch(a -> lower.startsWith(a.toLowerCase(Locale.ROOT)));
                if (!allowed) {
                    ok = false;
                    report.addIssue("Content-Type not allowed: " + ct);
                }
            }
        }

        // 정확 일치
        for (HeaderRule r : cfg.getHeaderEquals()) {
            String v = resp.header(r.name());
            if (v == null) {
                ok = false;
                report.addIssue("Missing header: " + r.name());
            } else if (!v.equals(r.value())) {
                ok = false;
                report.addIssue(String.format("Header %s mismatch: got '%s', expected '%s'",
                        r.name(), v, r.value()));
            }
        }

        // 부분 문자열 포함
        for (HeaderRule r : cfg.getHeaderContains()) {
            String v = resp.header(r.name());
            if (v == null) {
                ok = false;
                report.addIssue("Missing header: " + r.name());
            } else if (!v.contains(r.value())) {
                ok = false;
                report.addIssue(String.format("Header %s does not contain '%s': got '%s'",
                        r.name(), r.value(), v));
            }
        }

        report.headerOk(ok);
    }

    /** 순수 함수: 본문 텍스트만 검사(메모리 문자열로 단위 테스트 가능). */
    public static BodyCheck checkBodyText(String text, RunConfig cfg) {
        List<String> issues = new ArrayList<>();

        // ALL-of: 모두 있어야 함
        for (String needle : cfg.getBodyContainsAll()) {
            if (!TokenMatcher.containsToken(text, needle)) {
                issues.add("Body missing required text: '" + needle + "'");
            }
        }
        boolean ok = issues.isEmpty();

        // ANY-of: 하나 이상
        List<String> any = cfg.getBodyContainsAny();
        if (!any.isEmpty()) {
            boolean hit = any.stream().anyMatch(n -> TokenMatcher.containsToken(text, n));
            if (!hit) {
                issues.add("Body did not contain ANY of: " + quoted(any));
            }
            ok = ok && hit;
        }
        return new BodyCheck(ok, issues);
    }

    /** 최대 maxBytes 까지만 UTF-8 로 해석. 잘못된 바이트열은 U+FFFD 로 대체된다. */
    static String decodeBody(byte[] body, int maxBytes) {
        int n = Math.min(body.length, Math.max(0, maxBytes));
        return new String(body, 0, n, StandardCharsets.UTF_8);
    }

    static boolean isHttps(String target) {
        return target != null && target.trim().regionMatches(true, 0, "https://", 0, 8);
    }

    private static String quoted(List<String> items) {
        return items.stream()
                .map(s -> "\"" + s + "\"")
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
