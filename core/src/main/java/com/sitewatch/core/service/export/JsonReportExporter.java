package com.sitewatch.core.service.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sitewatch.core.model.BatchSummary;
import com.sitewatch.core.model.CheckOutcome;
import com.sitewatch.core.model.ProbeResult;
import com.sitewatch.core.model.RunConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 배치 결과 JSON 보고서.
 * 경로: {outDir}/reports/batch-yyyyMMdd-HHmmss.json (UTC)
 */
public final class JsonReportExporter {

    static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);   // ISO-8601 로

    // ----- 보고서 DTO -----
    public record Report(Meta meta, BatchSummary summary, List<Entry> results) {}

    public record Meta(Instant generatedAt, String batchTimestamp, int workerCount,
                       int maxRetries, long timeoutMs, boolean httpsRequired) {}

    public record Entry(String target, String outcome, Integer statusCode, String error,
                        long elapsedMs, String timestampUtc, boolean overallOk,
                        boolean headerOk, boolean bodyOk, boolean httpsPolicyOk,
                        List<String> issues) {}

    public Path export(Path outDir, RunConfig cfg, List<ProbeResult> results,
                       BatchSummary summary, Instant generatedAt) throws IOException {
        Path dir = (outDir == null ? Path.of("out") : outDir).resolve("reports");
        Files.createDirectories(dir);
        Path file = dir.resolve("batch-" + TS_FMT.format(generatedAt) + ".json");

        Report report = toReport(cfg, results, summary, generatedAt);
        om.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), report);
        return file;
    }

    Report toReport(RunConfig cfg, List<ProbeResult> results, BatchSummary summary, Instant generatedAt) {
        String batchTs = results.isEmpty() ? null : results.get(0).timestampUtc();
        Meta meta = new Meta(generatedAt, batchTs, cfg.getWorkerCount(), cfg.getMaxRetries(),
                cfg.getRequestTimeout().toMillis(), cfg.isHttpsRequired());
        List<Entry> entries = results.stream().map(JsonReportExporter::entry).collect(Collectors.toList());
        return new Report(meta, summary, entries);
    }

    private static Entry entry(ProbeResult r) {
        CheckOutcome o = r.outcome();
        Integer code = null;
        String error = null;
        if (o instanceof CheckOutcome.Success s) code = s.statusCode();
        else if (o instanceof CheckOutcome.HttpError h) code = h.statusCode();
        else if (o instanceof CheckOutcome.Transport t) error = t.message();

        var v = r.validation();
        return new Entry(r.target(), o.kind().name(), code, error, r.elapsedMillis(), r.timestampUtc(),
                v.isOverallOk(), v.isHeaderOk(), v.isBodyOk(), v.isHttpsPolicyOk(), v.getIssues());
    }
}
