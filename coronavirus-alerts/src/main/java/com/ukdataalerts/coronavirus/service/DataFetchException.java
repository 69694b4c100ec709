package com.ukdataalerts.coronavirus.service;

/**
 * An upstream dataset could not be retrieved or read.
 */
public class DataFetchException extends RuntimeException {

    public DataFetchException(String message) {
        super(message);
    }

    public DataFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
