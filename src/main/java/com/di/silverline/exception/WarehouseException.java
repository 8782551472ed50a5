package com.di.silverline.exception;

public class WarehouseException extends IngestionException {

    public WarehouseException(String message) {
        super(ErrorKind.WAREHOUSE_ERROR, message);
    }

    public WarehouseException(String message, Throwable cause) {
        super(ErrorKind.WAREHOUSE_ERROR, message, cause);
    }
}
