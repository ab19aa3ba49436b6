package com.qaradar.core.api;

import com.qaradar.core.model.Signal;

import java.util.List;

/** 신호 탐지 최소 계약: 원본 HTML을 받아 순서가 고정된 신호 목록을 돌려준다. 예외를 던지지 않는다. */
@FunctionalInterface
public interface ISignalDetector {
    List<Signal> detect(String html);
}
