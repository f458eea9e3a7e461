package com.dbbaskette.envsync.error;

public class InvalidRequestException extends EnvSyncException {

    public InvalidRequestException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
