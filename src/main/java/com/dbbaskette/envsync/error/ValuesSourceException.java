package com.dbbaskette.envsync.error;

public class ValuesSourceException extends EnvSyncException {

    public ValuesSourceException(String message) {
        super(ErrorCode.VALUES_SOURCE_UNAVAILABLE, message);
    }

    public ValuesSourceException(String message, Throwable cause) {
        super(ErrorCode.VALUES_SOURCE_UNAVAILABLE, message, cause);
    }
}
