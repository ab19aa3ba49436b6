package com.qaradar.core.util;

/** 디스커버리 단계별 진행 콜백. 콜백 예외는 실행에 영향을 주지 않는다(서비스가 삼킨 뒤 debug 로그). */
@FunctionalInterface
public interface ProgressListener {

    String PHASE_NORMALIZE = "normalize";
    String PHASE_HOMEPAGE = "homepage";
    String PHASE_FRONTIER = "frontier";
    String PHASE_FETCH = "fetch";
    String PHASE_ASSEMBLE = "assemble";

    /**
     * @param progress 0.0~1.0 (fetch 단계만 의미 있음, 나머지는 0.0 또는 1.0)
     * @param phase    PHASE_* 중 하나
     * @param done     처리한 페이지 수(모르면 0)
     * @param total    대상 페이지 수(모르면 -1)
     */
    void onProgress(double progress, String phase, long done, long total);

    ProgressListener NONE = (p, phase, d, t) -> {};
}
