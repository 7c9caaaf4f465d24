package com.sonarrmcp.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sonarrmcp.cli.ui.JsonConsoleFormatter;
import com.sonarrmcp.cli.ui.Spinner;
import com.sonarrmcp.dto.response.CommandResponse;
import com.sonarrmcp.exception.ToolGatewayException;
import com.sonarrmcp.model.ToolDescriptor;
import com.sonarrmcp.model.ToolOperationResult;
import com.sonarrmcp.service.api.ToolOperationHandler;
import java.util.Map;
import org.slf4j.LoggerFactory;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * A Spring Shell component that calls a tool exactly the way an agent does: a tool name plus a JSON object of
 * arguments. The meta-tools ({@code discover_tools}, {@code get_tool_schema}) can be called too.
 */
@ShellComponent
public class CallCommand {

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final ToolOperationHandler toolOperationHandler;
    private final Spinner spinner;
    private final JsonConsoleFormatter formatter;
    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * @param toolOperationHandler The gateway entry point.
     * @param spinner              UI component shown while the upstream call runs.
     * @param formatter            Renders the resulting JSON for the terminal.
     */
    public CallCommand(ToolOperationHandler toolOperationHandler, Spinner spinner, JsonConsoleFormatter formatter) {
        this.toolOperationHandler = toolOperationHandler;
        this.spinner = spinner;
        this.formatter = formatter;
    }

    /**
     * Calls a tool and prints its simplified result.
     *
     * @param toolName  The tool to call, specified with `--tool` or `-t`.
     * @param arguments The arguments as a JSON object, specified with `--args` or `-a`.
     * @param verbose   If true, enables debug logging for the duration of the call, including the upstream request line.
     * @return The colored JSON result, or a red error message.
     */
    @ShellMethod(key = "call", value = "Call a tool with JSON arguments.")
    public String call(
            @ShellOption(value = {"--tool", "-t"}, help = "The tool name.") String toolName,
            @ShellOption(value = {"--args", "-a"}, help = "Arguments as a JSON object, e.g. '{\"id\": 1}'.", defaultValue = "{}") String arguments,
            @ShellOption(value = {"--verbose", "-v"}, help = "Enable verbose debug logging.", defaultValue = "false", arity = 0) boolean verbose
    ) {
        Map<String, Object> parsed;
        try {
            parsed = arguments == null || arguments.isBlank() ? Map.of() : objectMapper.readValue(arguments, ARGUMENTS_TYPE);
        } catch (JsonProcessingException e) {
            return CommandResponse.error("--args must be a JSON object: " + e.getOriginalMessage()).toAnsiString();
        }

        Logger rootLogger = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        Level originalLevel = rootLogger.getLevel();
        if (verbose) {
            rootLogger.setLevel(Level.DEBUG);
        }
        try {
            Map<String, Object> args = parsed == null ? Map.of() : parsed;
            ToolOperationResult result = spinner.spin("Calling " + toolName + "...",
                    () -> toolOperationHandler.call(toolName, args));
            return formatter.format(toJson(result));
        } catch (ToolGatewayException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        } finally {
            if (verbose) {
                rootLogger.setLevel(originalLevel);
            }
        }
    }

    private JsonNode toJson(ToolOperationResult result) {
        if (result instanceof ToolOperationResult.Dispatched dispatched) {
            return dispatched.payload();
        }
        if (result instanceof ToolOperationResult.Discovered discovered) {
            ObjectNode node = objectMapper.createObjectNode();
            node.set("tools", objectMapper.valueToTree(discovered.result().matches()));
            node.put("total_matches", discovered.result().totalMatches());
            return node;
        }
        ToolOperationResult.Resolved resolved = (ToolOperationResult.Resolved) result;
        ToolDescriptor tool = resolved.descriptor();
        ObjectNode node = objectMapper.createObjectNode();
        node.put("name", tool.getName());
        node.put("summary", tool.getSummary());
        if (tool.getMethod() != null) {
            node.put("method", tool.getMethod());
            node.put("path", tool.getPath());
        }
        node.set("tags", objectMapper.valueToTree(tool.getTags()));
        node.set("input_schema", objectMapper.valueToTree(resolved.inputSchema()));
        return node;
    }
}
