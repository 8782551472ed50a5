package com.di.silverline.exception;

public class IngestionCancelledException extends IngestionException {

    public IngestionCancelledException(String message) {
        super(ErrorKind.CANCELLED, message);
    }

    public IngestionCancelledException(String message, Throwable cause) {
        super(ErrorKind.CANCELLED, message, cause);
    }
}
