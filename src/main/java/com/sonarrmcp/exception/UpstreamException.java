package com.sonarrmcp.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * The upstream API call failed: the connection failed, the call timed out, or the status was not 2xx.
 * <p>
 * The gateway never retries on this exception. The message is safe to show to an agent; it carries no stack trace
 * details, and the error body is cut to {@link #MAX_BODY_LENGTH} characters.
 */
public class UpstreamException extends ToolGatewayException {

    public static final int MAX_BODY_LENGTH = 500;

    private final Integer status;
    private final String responseBody;
    private final boolean timeout;

    private UpstreamException(String message, Integer status, String responseBody, boolean timeout, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.responseBody = responseBody;
        this.timeout = timeout;
    }

    /**
     * The upstream answered with a non-2xx status.
     */
    public static UpstreamException forStatus(String toolName, int status, String responseBody) {
        String body = truncate(responseBody);
        return new UpstreamException("Upstream call for tool '" + toolName + "' failed with status " + status
                + (body.isEmpty() ? "" : ": " + body), status, body, false, null);
    }

    /**
     * The upstream did not answer within the configured timeout.
     */
    public static UpstreamException timeout(String toolName, Duration limit, Throwable cause) {
        return new UpstreamException("Upstream call for tool '" + toolName + "' timed out after "
                + limit.toMillis() + " ms", null, "", true, cause);
    }

    /**
     * The request never produced a response (connection refused, DNS failure, broken connection).
     */
    public static UpstreamException transport(String toolName, String reason, Throwable cause) {
        return new UpstreamException("Upstream call for tool '" + toolName + "' failed: " + reason,
                null, "", false, cause);
    }

    static String truncate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > MAX_BODY_LENGTH ? body.substring(0, MAX_BODY_LENGTH) + "..." : body;
    }

    public Optional<Integer> getStatus() {
        return Optional.ofNullable(status);
    }

    public String getResponseBody() {
        return responseBody;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
