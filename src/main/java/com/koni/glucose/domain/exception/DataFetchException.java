package com.koni.glucose.domain.exception;

/**
 * Exception thrown when the measurement data request returns a non-200 status.
 */
public class DataFetchException extends RemoteCallException {

    public DataFetchException(int status, String statusText) {
        super("Data call failed: unexpected response status " + status + " " + statusText, status, statusText);
    }
}
