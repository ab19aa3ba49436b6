package com.qaradar.core.model;

/** 디스커버리 실행 중단 사유의 공통 루트 */
public class DiscoveryException extends RuntimeException {
    public DiscoveryException(String message) { super(message); }
    public DiscoveryException(String message, Throwable cause) { super(message, cause); }
}
