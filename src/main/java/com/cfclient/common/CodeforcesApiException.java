package com.cfclient.common;

import lombok.Getter;

/**
 * Thrown when the API answers with a non-OK envelope status.
 * Message is the server comment, or {@link #UNKNOWN_API_ERROR} when the comment is absent.
 */
@Getter
public class CodeforcesApiException extends CodeforcesException {

    public static final String UNKNOWN_API_ERROR = "Unknown API error";

    /** Raw comment from the envelope; null when the server sent none. */
    private final String comment;

    public CodeforcesApiException(String comment) {
        super(comment == null ? UNKNOWN_API_ERROR : comment);
        this.comment = comment;
    }
}
