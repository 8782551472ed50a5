package com.di.silverline.exception;

/**
 * The bronze listing itself could not be performed (missing bucket, permissions, transport).
 * An empty partition is not an error and never raises this.
 */
public class SourceUnavailableException extends IngestionException {

    public SourceUnavailableException(String message, Throwable cause) {
        super(ErrorKind.SOURCE_UNAVAILABLE, message, cause);
    }
}
