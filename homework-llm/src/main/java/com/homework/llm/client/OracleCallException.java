package com.homework.llm.client;

/**
 * Failure of a single oracle attempt. Only used inside the retry loop; it never
 * leaves {@link GeminiClient#respond}.
 */
public class OracleCallException extends RuntimeException {

    private final int statusCode;
    private final boolean retryable;

    public OracleCallException(String message, int statusCode, boolean retryable) {
        super(message);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public OracleCallException(String message, int statusCode, boolean retryable, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public boolean isRetryable() { return retryable; }
    public int getStatusCode() { return statusCode; }
}
