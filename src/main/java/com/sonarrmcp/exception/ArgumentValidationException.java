package com.sonarrmcp.exception;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The arguments of an invocation do not fit the tool's parameters.
 * <p>
 * The exception names every offending field so an agent can correct its call in one go.
 */
public class ArgumentValidationException extends ToolGatewayException {

    private final String toolName;
    private final List<String> missing;
    private final List<String> unknown;
    private final Map<String, String> invalid;

    /**
     * @param toolName The tool whose arguments were rejected.
     * @param missing  Required parameters that were absent or null.
     * @param unknown  Argument names the tool does not declare.
     * @param invalid  Parameters whose value could not be used, mapped to the reason.
     */
    public ArgumentValidationException(String toolName, List<String> missing, List<String> unknown,
                                       Map<String, String> invalid) {
        super(describe(toolName, missing, unknown, invalid));
        this.toolName = toolName;
        this.missing = List.copyOf(missing);
        this.unknown = List.copyOf(unknown);
        this.invalid = Map.copyOf(invalid);
    }

    public static ArgumentValidationException missing(String toolName, String parameter) {
        return new ArgumentValidationException(toolName, List.of(parameter), List.of(), Map.of());
    }

    public static ArgumentValidationException invalid(String toolName, String parameter, String reason) {
        return new ArgumentValidationException(toolName, List.of(), List.of(), Map.of(parameter, reason));
    }

    private static String describe(String toolName, List<String> missing, List<String> unknown,
                                   Map<String, String> invalid) {
        List<String> problems = new ArrayList<>();
        if (!missing.isEmpty()) {
            problems.add("missing required parameters " + missing);
        }
        if (!unknown.isEmpty()) {
            problems.add("unknown parameters " + unknown);
        }
        if (!invalid.isEmpty()) {
            List<String> reasons = new ArrayList<>();
            new TreeMap<>(invalid).forEach((name, reason) -> reasons.add(name + ": " + reason));
            problems.add("invalid values " + reasons);
        }
        return "Invalid arguments for tool '" + toolName + "': " + String.join("; ", problems);
    }

    public String getToolName() {
        return toolName;
    }

    public List<String> getMissing() {
        return missing;
    }

    public List<String> getUnknown() {
        return unknown;
    }

    public Map<String, String> getInvalid() {
        return invalid;
    }
}
