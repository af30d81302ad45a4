package com.sitewatch.core.service;

import com.sitewatch.core.api.IHttpProber;
import com.sitewatch.core.api.ITimeSource;
import com.sitewatch.core.http.CountingRetryPolicy;
import com.sitewatch.core.http.HttpProber;
import com.sitewatch.core.http.RetryPolicy;
import com.sitewatch.core.http.TransportRetryPolicy;
import com.sitewatch.core.model.ProbeResult;
import com.sitewatch.core.model.RunConfig;
import com.sitewatch.core.model.RunStats;
import com.sitewatch.core.probe.Probe;
import com.sitewatch.core.time.NetworkTimeSource;
import com.sitewatch.core.time.TimeSourceException;
import com.sitewatch.core.util.ProgressListener;
import com.sitewatch.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 배치 디스패처:
 *  - 배치 타임스탬프 1회 조회(실패 시 "unknown")
 *  - 고정 스레드풀(워커 수 = max(1, min(workerCount, 타깃 수)))로 팬아웃
 *  - 워커 안에서 Transport 결과만 즉시 재시도(타깃별 로컬 카운터)
 *  - 완료 순서와 무관하게 입력 인덱스 슬롯에 재배치해 반환
 *
 * 작업 큐(ThreadPoolExecutor 큐)와 결과 채널(CompletionService 큐)만이 동기화 지점이다.
 * RunConfig/타임스탬프는 불변이라 락 없이 공유한다.
 */
public final class CheckService {

    public static final String UNKNOWN_TIMESTAMP = "unknown";

    private static final Logger LOG = LoggerFactory.getLogger(CheckService.class);
    private static final StructuredLog SLOG = StructuredLog.get(CheckService.class);

    private final Probe probe;
    private final ITimeSource timeSource;
    private final RunStats stats = new RunStats();

    private volatile int lastWorkerCount = 0;

    /** 기본 구현(java.net.http 프로버 + 네트워크 시간 API) */
    public CheckService(RunConfig config) {
        this(new HttpProber(config), new NetworkTimeSource(config.getTimeSourceUrl()));
    }

    /** DI/테스트용 */
    public CheckService(IHttpProber prober, ITimeSource timeSource) {
        this.probe = new Probe(Objects.requireNonNull(prober, "prober"));
        this.timeSource = Objects.requireNonNull(timeSource, "timeSource");
    }

    public List<ProbeResult> checkAll(List<String> targets, RunConfig cfg) {
        return checkAll(targets, cfg, ProgressListener.NONE);
    }

    /** 입력 순서 == 출력 순서. 타깃마다 최종 결과 정확히 1건. */
    public List<ProbeResult> checkAll(List<String> targets, RunConfig cfg, ProgressListener listener) {
        Objects.requireNonNull(targets, "targets");
        Objects.requireNonNull(cfg, "cfg");
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;

        final int total = targets.size();
        if (total == 0) {
            lastWorkerCount = 0;
            return List.of();
        }

        final int workers = effectiveWorkers(cfg.getWorkerCount(), total);
        lastWorkerCount = workers;

        // ---- 0) 배치 타임스탬프(1회) ----
        final String batchTs = fetchBatchTimestamp();

        LOG.info("Batch start: targets={}, workers={}, maxRetries={}, timeoutMs={}",
                total, workers, cfg.getMaxRetries(), cfg.getRequestTimeout().toMillis());
        SLOG.info("batch-start",
                "targets", total,
                "workers", workers,
                "maxRetries", cfg.getMaxRetries(),
                "ts", batchTs);

        // ---- 1) 고정 스레드풀(+역압) 구성 ----
        ThreadPoolExecutor exec = new ThreadPoolExecutor(
                workers, workers,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(workers * 2),
                new NamedThreadFactory("check-worker"),
                (r, e) -> {
                    try { e.getQueue().put(r); }
                    catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RejectedExecutionException("Interrupted while enqueueing", ie);
                    }
                }
        );
        CompletionService<Indexed> results = new ExecutorCompletionService<>(exec);
        final AtomicInteger inFlight = new AtomicInteger(0);

        final ProbeResult[] slots = new ProbeResult[total];
        try {
            // ---- 2) 작업 제출(인덱스 동반) ----
            for (int i = 0; i < total; i++) {
                final int idx = i;
                final String target = targets.get(i);
                results.submit(() -> {
                    int cur = inFlight.incrementAndGet();
                    stats.observeConcurrency(cur);
                    try {
                        return new Indexed(idx, probeWithRetry(target, cfg, batchTs));
                    } finally {
                        inFlight.decrementAndGet();
                    }
                });
            }

            // ---- 3) 결과 수집 → 입력 인덱스 슬롯 ----
            for (int done = 1; done <= total; done++) {
                Indexed r;
                try {
                    r = results.take().get();
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted while collecting results");
                } catch (ExecutionException e) {
                    Throwable cause = (e.getCause() != null ? e.getCause() : e);
                    SLOG.error("task-failed", cause, "cause", cause.toString());
                    throw new IllegalStateException("check task failed: " + cause, cause);
                }
                if (slots[r.index()] != null) {
                    throw new IllegalStateException("duplicate result for index " + r.index());
                }
                slots[r.index()] = r.result();
                notifyProgress(pl, done, total);
            }
        } catch (RejectedExecutionException ree) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while dispatching");
        } finally {
            // ---- 4) 종료 ----
            exec.shutdownNow();
            try {
                exec.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }

        for (int i = 0; i < total; i++) {
            if (slots[i] == null) throw new IllegalStateException("missing result for index " + i);
        }

        List<ProbeResult> out = List.copyOf(Arrays.asList(slots));
        var summary = SummaryAggregator.summarize(out);
        LOG.info("Batch done. total={}, ok={}, httpErrors={}, transportErrors={}",
                summary.total(), summary.successes(), summary.httpErrors(), summary.transportErrors());
        SLOG.info("batch-done",
                "total", summary.total(),
                "successes", summary.successes(),
                "httpErrors", summary.httpErrors(),
                "transportErrors", summary.transportErrors(),
                "maxObservedCC", stats.snapshot().maxObservedConcurrency());
        pl.onProgress(1.0, "done", total, total);
        return out;
    }

    /** 같은 워커에서 같은 타깃만 재시도. 마지막 시도의 결과만 남는다. */
    private ProbeResult probeWithRetry(String target, RunConfig cfg, String batchTs) {
        CountingRetryPolicy policy = new CountingRetryPolicy(new TransportRetryPolicy(cfg.getMaxRetries()));
        int attempt = 1;
        while (true) {
            LOG.debug("Probe: {} (attempt {})", target, attempt);
            ProbeResult r = probe.run(target, cfg, batchTs);
            if (!shouldRetry(policy, r, attempt)) {
                stats.addAttempts(attempt);
                stats.addRetries(policy.getRetryCount());
                SLOG.debug("probe-done",
                        "target", target,
                        "outcome", r.outcome().kind().name(),
                        "attempts", attempt,
                        "elapsedMs", r.elapsedMillis());
                return r;
            }
            SLOG.info("probe-retry", "target", target, "attempt", attempt, "outcome", String.valueOf(r.outcome()));
            attempt++;
        }
    }

    private static boolean shouldRetry(RetryPolicy policy, ProbeResult r, int attempt) {
        return attempt < policy.maxAttempts() && policy.shouldRetry(r.outcome(), attempt);
    }

    private String fetchBatchTimestamp() {
        try {
            String ts = timeSource.fetchUtcTimestamp();
            return (ts == null || ts.isBlank()) ? UNKNOWN_TIMESTAMP : ts;
        } catch (TimeSourceException | RuntimeException e) {
            LOG.warn("Timestamp fetch failed, using '{}': {}", UNKNOWN_TIMESTAMP, e.getMessage());
            SLOG.warn("time-source-failed", "error", e.toString());
            return UNKNOWN_TIMESTAMP;
        }
    }

    private static void notifyProgress(ProgressListener pl, int done, int total) {
        double p = (double) done / (double) total;
        try {
            pl.onProgress(Math.max(0.0, Math.min(1.0, p)), "check", done, total);
        } catch (RuntimeException e) {
            LOG.debug("progress listener failed: {}", e.toString());
        }
    }

    /** 일감보다 많은 워커는 만들지 않고, 최소 1개는 둔다. */
    static int effectiveWorkers(int configured, int targets) {
        return Math.max(1, Math.min(configured, targets));
    }

    /** 직전 배치의 실제 워커 수(빈 배치면 0) */
    public int getLastWorkerCount() {
        return lastWorkerCount;
    }

    public RunStats.Snapshot getRuntimeSnapshot() {
        return stats.snapshot();
    }

    private record Indexed(int index, ProbeResult result) {}

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
