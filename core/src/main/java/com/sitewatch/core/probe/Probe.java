package com.sitewatch.core.probe;

import com.sitewatch.core.api.IHttpProber;
import com.sitewatch.core.http.TransportException;
import com.sitewatch.core.model.CheckOutcome;
import com.sitewatch.core.model.HttpResponseData;
import com.sitewatch.core.model.ProbeResult;
import com.sitewatch.core.model.RunConfig;
import com.sitewatch.core.model.ValidationReport;
import com.sitewatch.core.validation.ResponseValidator;

import java.time.Duration;
import java.util.Objects;

/**
 * 타깃 1건 점검(시도 1회): HTTPS 정책 → GET → 검증 → 배치 타임스탬프 부착.
 * 재시도는 호출 측(CheckService) 책임. 여기서는 시간 API를 부르지 않는다.
 */
public final class Probe {

    private final IHttpProber prober;

    public Probe(IHttpProber prober) {
        this.prober = Objects.requireNonNull(prober, "prober");
    }

    public ProbeResult run(String target, RunConfig cfg, String batchTimestamp) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(cfg, "cfg");
        Objects.requireNonNull(batchTimestamp, "batchTimestamp");

        ValidationReport.Builder report = ValidationReport.builder();

        // 정책 위반이어도 요청은 그대로 진행(기록만)
        ResponseValidator.enforceHttpsPolicy(target, cfg, report);

        long t0 = System.nanoTime();
        CheckOutcome outcome;
        Duration elapsed;
        try {
            HttpResponseData resp = prober.fetch(target, cfg);
            elapsed = Duration.ofNanos(System.nanoTime() - t0);
            outcome = CheckOutcome.fromStatus(resp.getStatusCode());
            // 에러 상태여도 헤더/본문은 검증한다
            ResponseValidator.evaluate(resp, cfg, report);
        } catch (TransportException e) {
            elapsed = Duration.ofNanos(System.nanoTime() - t0);
            String msg = (e.getMessage() == null) ? e.getClass().getSimpleName() : e.getMessage();
            report.headerOk(false);
            report.bodyOk(false);
            report.addIssue("Transport error: " + msg);
            outcome = new CheckOutcome.Transport(msg);
        }

        return new ProbeResult(target, outcome, elapsed, batchTimestamp, report.build());
    }
}
