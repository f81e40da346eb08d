package com.ai.quizbot.exception;

/**
 * The question source is missing, unreadable or yielded no usable rows.
 */
public class ContentUnavailableException extends RuntimeException {

    public ContentUnavailableException(String message) {
        super(message);
    }

    public ContentUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
