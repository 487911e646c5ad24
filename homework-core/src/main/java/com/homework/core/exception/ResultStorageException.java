package com.homework.core.exception;

public class ResultStorageException extends RuntimeException {

    public ResultStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
