package com.sitewatch.core.util;

@FunctionalInterface
public interface ProgressListener {
    /**
     * @param progress 0.0~1.0
     * @param phase    "check" | "done"
     * @param done     최종 결과가 확정된 타깃 수
     * @param total    배치의 전체 타깃 수
     */
    void onProgress(double progress, String phase, long done, long total);

    ProgressListener NONE = (p, phase, d, t) -> {};
}
