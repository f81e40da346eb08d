package com.ai.quizbot.exception;

/**
 * Outbound delivery to the messaging provider failed. Never retried here.
 */
public class MessageSendException extends RuntimeException {

    public MessageSendException(String message) {
        super(message);
    }

    public MessageSendException(String message, Throwable cause) {
        super(message, cause);
    }
}
