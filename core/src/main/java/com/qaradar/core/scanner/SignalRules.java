package com.qaradar.core.scanner;

import com.qaradar.core.model.ConfidenceLevel;
import com.qaradar.core.model.EvidenceType;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 기본 규칙 테이블. 목록 순서가 곧 평가 순서이며 출력 순서다.
 * 규칙 추가는 여기 한 줄 추가로 끝난다(제어 흐름 변경 없음).
 */
public final class SignalRules {
    private SignalRules() {}

    public static final String BETA_LANGUAGE = "BETA_LANGUAGE";
    public static final String MARKETING_CLAIMS = "MARKETING_CLAIMS";
    public static final String MULTIPLE_H1 = "MULTIPLE_H1";
    public static final String POLICY_REFERENCES = "POLICY_REFERENCES";
    public static final String SUPPORT_ESCALATION = "SUPPORT_ESCALATION";

    private static final Pattern P_BETA = Pattern.compile(
            "\\b(beta|preview|early[- ]access|experimental)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern P_CLAIMS = Pattern.compile(
            "(\\bguarantee[ds]?\\b|\\bbest[- ]in[- ]class\\b|#1\\b|\\bnumber one\\b|\\b100\\s?%"
                    + "|\\brisk[- ]free\\b|\\bunbeatable\\b|\\bworld'?s (best|leading)\\b|\\blifetime warranty\\b)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern P_H1 = Pattern.compile("<h1[\\s>/]", Pattern.CASE_INSENSITIVE);

    private static final Pattern P_POLICY = Pattern.compile(
            "\\b(privacy policy|terms of (service|use)|terms (and|&amp;|&) conditions|refund policy"
                    + "|cookie policy|gdpr|hipaa)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern P_SUPPORT = Pattern.compile(
            "\\b(contact (us|support)|customer (service|support)|help ?desk|escalat\\w*"
                    + "|submit a (ticket|request)|live chat)\\b",
            Pattern.CASE_INSENSITIVE);

    public static List<SignalRule> defaults() {
        return List.of(
                SignalRule.ofPattern(BETA_LANGUAGE, P_BETA,
                        "Pre-release (beta / preview) language present",
                        EvidenceType.DIRECT_OBSERVATION,
                        "Visitors may read the product as unfinished; maturity claims elsewhere need to agree with this wording.",
                        ConfidenceLevel.MODERATE),
                SignalRule.ofPattern(MARKETING_CLAIMS, P_CLAIMS,
                        "Superlative or guarantee-style marketing claim",
                        EvidenceType.PATTERN_CONSISTENCY,
                        "Absolute claims raise the bar for substantiation and can erode credibility if unsupported.",
                        ConfidenceLevel.LOW),
                SignalRule.ofCount(MULTIPLE_H1, P_H1, 2,
                        "Multiple top-level headings (<h1>) on one page",
                        EvidenceType.DIRECT_OBSERVATION,
                        "More than one primary heading blurs the page's main message for readers and assistive technology.",
                        ConfidenceLevel.HIGH),
                SignalRule.ofPattern(POLICY_REFERENCES, P_POLICY,
                        "Policy or legal reference",
                        EvidenceType.GROUNDED_PROFESSIONAL_INFERENCE,
                        "Referenced policies create commitments that should be reachable, current and consistent across pages.",
                        ConfidenceLevel.LOW),
                SignalRule.ofPattern(SUPPORT_ESCALATION, P_SUPPORT,
                        "Support or escalation path language",
                        EvidenceType.CLEAR_USER_IMPACT_PATH,
                        "Users in trouble will follow this route; a broken or slow path directly affects them.",
                        ConfidenceLevel.MODERATE)
        );
    }
}
