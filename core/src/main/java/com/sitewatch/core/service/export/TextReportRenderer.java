package com.sitewatch.core.service.export;

import com.sitewatch.core.model.BatchSummary;
import com.sitewatch.core.model.CheckOutcome;
import com.sitewatch.core.model.ProbeResult;
import com.sitewatch.core.model.ValidationReport;

import java.util.List;
import java.util.Locale;

/** 콘솔 출력용 텍스트 블록 렌더러 */
public final class TextReportRenderer {
    private static final String NL = System.lineSeparator();
    public static final String SEPARATOR = "----------------------------------------";

    private TextReportRenderer() {}

    public static String render(ProbeResult r) {
        StringBuilder sb = new StringBuilder(256);
        line(sb, "URL: " + r.target());
        line(sb, statusLine(r.outcome()));
        line(sb, "Response time (ms): " + r.elapsedMillis());
        line(sb, "Timestamp (UTC): " + r.timestampUtc());

        ValidationReport v = r.validation();
        line(sb, "Validation overall ok? " + v.isOverallOk());
        line(sb, " - Header ok: " + v.isHeaderOk());
        line(sb, " - Body ok: " + v.isBodyOk());
        line(sb, " - HTTPS policy ok: " + v.isHttpsPolicyOk());
        if (!v.getIssues().isEmpty()) {
            line(sb, "Issues:");
            for (String issue : v.getIssues()) line(sb, " * " + issue);
        }
        return sb.toString();
    }

    public static String renderAll(List<ProbeResult> results) {
        StringBuilder sb = new StringBuilder();
        for (ProbeResult r : results) {
            sb.append(render(r));
            line(sb, SEPARATOR);
        }
        return sb.toString();
    }

    public static String renderSummary(BatchSummary s) {
        StringBuilder sb = new StringBuilder(160);
        line(sb, "=== Summary ===");
        line(sb, "Total: " + s.total());
        line(sb, "Successes: " + s.successes());
        line(sb, "HTTP errors: " + s.httpErrors());
        line(sb, "Transport errors: " + s.transportErrors());
        line(sb, String.format(Locale.ROOT, "Avg response time (ms): %.2f", s.avgResponseMillis()));
        line(sb, String.format(Locale.ROOT, "Uptime: %.2f%%", s.uptimePct()));
        return sb.toString();
    }

    static String statusLine(CheckOutcome o) {
        if (o instanceof CheckOutcome.Success s) return "Status: " + s.statusCode() + " (success)";
        if (o instanceof CheckOutcome.HttpError h) return "Status: " + h.statusCode() + " (http error)";
        return "Transport error: " + ((CheckOutcome.Transport) o).message();
    }

    private static void line(StringBuilder sb, String s) {
        sb.append(s).append(NL);
    }
}
