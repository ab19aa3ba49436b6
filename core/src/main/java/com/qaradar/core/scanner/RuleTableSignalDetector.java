package com.qaradar.core.scanner;

import com.qaradar.core.api.ISignalDetector;
import com.qaradar.core.model.Signal;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 규칙 테이블을 고정 순서로 균일하게 평가하는 탐지기.
 * 규칙끼리 서로 억제하지 않으며, 같은 HTML이면 항상 같은 목록을 낸다.
 */
public final class RuleTableSignalDetector implements ISignalDetector {

    private final List<SignalRule> rules;

    public RuleTableSignalDetector() {
        this(SignalRules.defaults());
    }

    public RuleTableSignalDetector(List<SignalRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    @Override
    public List<Signal> detect(String html) {
        String text = (html == null ? "" : html);
        List<Signal> out = new ArrayList<>(rules.size());
        for (SignalRule r : rules) {
            r.evaluate(text).ifPresent(out::add);
        }
        return List.copyOf(out);
    }

    public List<SignalRule> rules() { return rules; }
}
