package com.my.keep.domain.exception;

/**
 * 왜: 원격 인증이 거부되었거나 도달할 수 없을 때 상위 원인을 담아 전달하기 위함.
 */
public class KeepAuthenticationException extends KeepGatewayException {
    public KeepAuthenticationException(String message) {
        super(message);
    }

    public KeepAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
