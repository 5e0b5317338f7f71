package com.my.keep.domain.exception;

/**
 * 왜: 저장된 스냅샷이 손상되었을 때 새 인증으로 조용히 넘어가지 않고 실패를 드러내기 위함.
 */
public class SnapshotFormatException extends KeepGatewayException {
    public SnapshotFormatException(String message) {
        super(message);
    }

    public SnapshotFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
