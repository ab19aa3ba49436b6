package com.qaradar.core.config;

import java.util.List;
import java.util.Objects;

/**
 * 프로세스 전역 읽기 전용 원칙값(증거 기준, 범위 제외 항목, 안내 문구).
 * BriefAssembler와 표현 계층에 주입해서 쓴다.
 */
public final class Doctrine {

    public static final Doctrine DEFAULT = new Doctrine(
            "Only surface indicators that can be tied to observable page evidence. "
                    + "Absence of a signal is recorded as an observation, not as a clean bill of health.",
            List.of(
                    "Page rendering and client-side script execution",
                    "Links outside the target origin",
                    "Authenticated or gated areas",
                    "Legal or regulatory compliance determinations",
                    "Final defect verdicts and severity ratings"
            ),
            "Discovery-level intelligence designed to support senior QA judgment. "
                    + "This system does not issue final assessments, severity ratings, or remediation directives. "
                    + "Final authority rests with the human auditor."
    );

    private final String evidenceBar;
    private final List<String> scopeExclusions;
    private final String notice;

    public Doctrine(String evidenceBar, List<String> scopeExclusions, String notice) {
        this.evidenceBar = Objects.requireNonNull(evidenceBar, "evidenceBar");
        this.scopeExclusions = List.copyOf(Objects.requireNonNull(scopeExclusions, "scopeExclusions"));
        this.notice = Objects.requireNonNull(notice, "notice");
    }

    public String getEvidenceBar() { return evidenceBar; }
    public List<String> getScopeExclusions() { return scopeExclusions; }
    public String getNotice() { return notice; }
}
