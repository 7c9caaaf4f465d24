package com.sonarrmcp.exception;

/**
 * The requested tool does not exist in the catalog. The agent should run discovery again rather than
 * repeat the same call.
 */
public class ToolNotFoundException extends ToolGatewayException {

    private final String toolName;

    public ToolNotFoundException(String toolName) {
        super("Tool not found: '" + toolName + "'. Use discover_tools to find available tools.");
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
