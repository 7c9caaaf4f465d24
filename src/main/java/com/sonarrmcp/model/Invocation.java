package com.sonarrmcp.model;

import java.util.Map;

/**
 * A single call of a tool, as produced by an agent.
 *
 * @param toolName  The name of the tool to call.
 * @param arguments The argument values keyed by parameter name; may be {@code null} for "no arguments".
 */
public record Invocation(String toolName, Map<String, Object> arguments) {
}
