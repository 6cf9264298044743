package com.cfclient.common;

import lombok.Getter;

/**
 * Thrown when the HTTP exchange itself fails (connection, TLS, I/O) or the server
 * answers with a status the transport refuses to hand to the decoder.
 */
@Getter
public class CodeforcesTransportException extends CodeforcesException {

    /** HTTP status code, or null when no response was received. */
    private final Integer statusCode;

    public CodeforcesTransportException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = null;
    }

    public CodeforcesTransportException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }
}
