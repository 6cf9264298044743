package com.cfclient.common;

/**
 * Thrown when a response body is not valid JSON or does not match the expected envelope or result shape.
 */
public class CodeforcesDecodingException extends CodeforcesException {

    public CodeforcesDecodingException(String message) {
        super(message);
    }

    public CodeforcesDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
