package com.cfclient.decode;

/**
 * The {status, comment, result} wrapper of every API response.
 *
 * @param comment human-readable error text on FAILED, usually null on OK
 */
public record ApiEnvelope<T>(String status, String comment, ResultShape<T> result) {

    public static final String STATUS_OK = "OK";
    public static final String STATUS_FAILED = "FAILED";

    public boolean isOk() {
        return STATUS_OK.equals(status);
    }
}
