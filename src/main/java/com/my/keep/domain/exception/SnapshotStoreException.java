package com.my.keep.domain.exception;

public class SnapshotStoreException extends KeepGatewayException {
    public SnapshotStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
