package com.my.keep.domain.exception;

/**
 * 왜: 자격 증명이 설정되지 않은 상태를 원격 호출 전에 명시적으로 알리기 위함.
 */
public class CredentialsNotConfiguredException extends KeepGatewayException {
    public CredentialsNotConfiguredException(String message) {
        super(message);
    }
}
