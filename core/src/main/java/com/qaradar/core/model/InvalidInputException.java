package com.qaradar.core.model;

/** 비어있거나 해석 불가능한 origin 입력. 네트워크 접근 전에 발생한다. */
public class InvalidInputException extends DiscoveryException {
    public InvalidInputException(String message) { super(message); }
    public InvalidInputException(String message, Throwable cause) { super(message, cause); }
}
