package com.sonarrmcp.exception;

/**
 * The base runtime exception for every failure the gateway reports to its callers.
 * <p>
 * Each subclass names one failure category (bad document, unknown tool, bad arguments, failed upstream call),
 * so callers can tell an error apart from a legitimately empty result and decide whether a retry makes sense.
 */
public class ToolGatewayException extends RuntimeException {

    /**
     * Constructs a new ToolGatewayException with the specified detail message.
     *
     * @param message The detail message, which is saved for later retrieval by the
     *                {@link #getMessage()} method.
     */
    public ToolGatewayException(String message) {
        super(message);
    }

    /**
     * Constructs a new ToolGatewayException with the specified detail message and cause.
     * <p>
     * Note that the detail message associated with {@code cause} is not automatically
     * incorporated into this exception's detail message.
     *
     * @param message The detail message (which is saved for later retrieval by the
     *                {@link #getMessage()} method).
     * @param cause   The cause (which is saved for later retrieval by the
     *                {@link #getCause()} method). A {@code null} value is permitted,
     *                and indicates that the cause is nonexistent or unknown.
     */
    public ToolGatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
