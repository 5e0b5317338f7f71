package com.my.keep.domain.exception;

/**
 * 왜: 인증 이후 동기화 호출이 실패했음을 인증 실패와 구분해 알리기 위함.
 */
public class KeepSyncException extends KeepGatewayException {
    public KeepSyncException(String message) {
        super(message);
    }

    public KeepSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
