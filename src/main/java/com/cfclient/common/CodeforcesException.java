package com.cfclient.common;

/**
 * Base type for every failure raised by the Codeforces client.
 */
public class CodeforcesException extends RuntimeException {

    public CodeforcesException(String message) {
        super(message);
    }

    public CodeforcesException(String message, Throwable cause) {
        super(message, cause);
    }
}
