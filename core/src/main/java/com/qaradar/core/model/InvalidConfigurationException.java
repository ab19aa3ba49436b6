package com.qaradar.core.model;

/** maxPages 등 설정값 오류 */
public class InvalidConfigurationException extends DiscoveryException {
    public InvalidConfigurationException(String message) { super(message); }
}
