package com.sonarrmcp.exception;

/**
 * No tool catalog has been loaded yet.
 */
public class CatalogUnavailableException extends ToolGatewayException {

    public CatalogUnavailableException() {
        super("The tool catalog has not been loaded. Use the 'reload' command or check mcp.openapi-location.");
    }
}
