package com.sonarrmcp.exception;

/**
 * The OpenAPI document could not be parsed or indexed. Fatal at startup; never retried.
 */
public class SchemaException extends ToolGatewayException {

    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
