package com.my.keep.domain.exception;

/**
 * 왜: 게이트웨이에서 발생하는 실패를 한 계층으로 묶어 REST 경계에서 동일한 오류 응답으로 변환하기 위함.
 */
public abstract class KeepGatewayException extends RuntimeException {

    protected KeepGatewayException(String message) {
        super(message);
    }

    protected KeepGatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
