package com.sitewatch.app;

import com.sitewatch.core.model.BatchSummary;
import com.sitewatch.core.model.ProbeResult;
import com.sitewatch.core.model.RunConfig;
import com.sitewatch.core.service.CheckService;
import com.sitewatch.core.service.SummaryAggregator;
import com.sitewatch.core.service.export.JsonReportExporter;
import com.sitewatch.core.service.export.TextReportRenderer;
import com.sitewatch.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** 모니터 루프: 배치 실행 → 출력 → 요약 → (옵션) JSON 저장 → 휴지 → 반복 */
public final class Monitor {

    private static final Logger LOG = LoggerFactory.getLogger(Monitor.class);

    private final RunConfig cfg;
    private final CheckService service;
    private final List<String> targets;
    private final PrintStream out;
    private final Sleeper sleeper;
    private final JsonReportExporter exporter;   // null이면 JSON 저장 안 함

    public Monitor(RunConfig cfg, CheckService service, List<String> targets,
                   PrintStream out, Sleeper sleeper, JsonReportExporter exporter) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.service = Objects.requireNonNull(service, "service");
        this.targets = List.copyOf(targets);
        this.out = Objects.requireNonNull(out, "out");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.exporter = exporter;
    }

    public BatchSummary runOnce() {
        out.println("=== Running website checks ===");

        List<ProbeResult> results = service.checkAll(targets, cfg);
        out.print(TextReportRenderer.renderAll(results));

        BatchSummary summary = SummaryAggregator.summarize(results);
        out.print(TextReportRenderer.renderSummary(summary));

        if (exporter != null) {
            try {
                Path file = exporter.export(cfg.getOutputDir(), cfg, results, summary, Instant.now());
                out.println("JSON report: " + file.toAbsolutePath());
            } catch (IOException e) {
                // 보고서 저장 실패는 다음 배치를 막지 않는다
                LOG.warn("JSON report export failed: {}", e.toString());
            }
        }
        return summary;
    }

    /** maxBatches <= 0 이면 무한 반복. 인터럽트 시 종료. */
    public int run(int maxBatches) {
        int batches = 0;
        while (maxBatches <= 0 || batches < maxBatches) {
            runOnce();
            batches++;
            if (maxBatches > 0 && batches >= maxBatches) break;

            out.println("Sleeping " + cfg.getInterval().toSeconds() + " seconds before next run...");
            out.println();
            try {
                sleeper.sleep(cfg.getInterval());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                LOG.info("Monitor interrupted after {} batch(es)", batches);
                break;
            }
        }
        return batches;
    }
}
