package com.di.silverline.exception;

/**
 * Base class for failures the ingestion engine knows how to classify.
 * The coordinator converts every one of these into a Failed outcome for the table concerned.
 */
public abstract class IngestionException extends RuntimeException {

    private final ErrorKind kind;

    protected IngestionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected IngestionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
