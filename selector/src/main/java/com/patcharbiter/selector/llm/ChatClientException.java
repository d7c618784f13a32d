package com.patcharbiter.selector.llm;

/**
 * Thrown when the chat provider returns an error status or cannot be reached.
 * {@code statusCode} is -1 when no HTTP response was received.
 */
public class ChatClientException extends RuntimeException {

    private final int     statusCode;
    private final boolean retryable;

    public ChatClientException(int statusCode, String body) {
        super("Chat API error %d: %s".formatted(statusCode, body));
        this.statusCode = statusCode;
        // Rate limits, overload and server errors are worth another try.
        this.retryable  = statusCode == 429 || statusCode >= 500;
    }

    public ChatClientException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.statusCode = -1;
        this.retryable  = retryable;
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
