package com.sonarrmcp.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sonarrmcp.cli.ui.JsonConsoleFormatter;
import com.sonarrmcp.dto.response.CommandResponse;
import com.sonarrmcp.exception.ToolGatewayException;
import com.sonarrmcp.model.ToolDescriptor;
import com.sonarrmcp.model.ToolOperation;
import com.sonarrmcp.model.ToolOperationResult;
import com.sonarrmcp.model.ToolParameter;
import com.sonarrmcp.service.api.ToolOperationHandler;
import java.util.Locale;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * A Spring Shell component that shows the full definition of one tool: its upstream operation, its parameters and
 * the JSON schema an agent fills in to call it.
 */
@ShellComponent
public class SchemaCommand {

    private final ToolOperationHandler toolOperationHandler;
    private final JsonConsoleFormatter formatter;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public SchemaCommand(ToolOperationHandler toolOperationHandler, JsonConsoleFormatter formatter) {
        this.toolOperationHandler = toolOperationHandler;
        this.formatter = formatter;
    }

    @ShellMethod(key = "schema", value = "Show the parameters and input schema of a tool.")
    public String schema(@ShellOption(value = {"--tool", "-t"}, help = "The tool name.") String toolName) {
        try {
            ToolOperationResult.Resolved resolved =
                    (ToolOperationResult.Resolved) toolOperationHandler.handle(new ToolOperation.Resolve(toolName));
            return render(resolved);
        } catch (ToolGatewayException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        }
    }

    private String render(ToolOperationResult.Resolved resolved) {
        ToolDescriptor tool = resolved.descriptor();
        StringBuilder sb = new StringBuilder();
        sb.append(JsonConsoleFormatter.ANSI_CYAN).append("Tool: ").append(JsonConsoleFormatter.ANSI_YELLOW)
                .append(tool.getName()).append(JsonConsoleFormatter.ANSI_RESET).append("\n");
        if (tool.getMethod() != null) {
            sb.append("  ").append(JsonConsoleFormatter.ANSI_PURPLE).append(tool.getMethod())
                    .append(JsonConsoleFormatter.ANSI_RESET).append(" ").append(tool.getPath()).append("\n");
        }
        sb.append("  Summary: ").append(tool.getSummary()).append("\n");
        sb.append("  Categories: ").append(String.join(", ", tool.getTags())).append("\n");

        if (tool.getParameters().isEmpty()) {
            sb.append("  No parameters.\n");
        } else {
            sb.append(JsonConsoleFormatter.ANSI_CYAN).append("  Parameters:").append(JsonConsoleFormatter.ANSI_RESET).append("\n");
            for (ToolParameter parameter : tool.getParameters()) {
                sb.append("    - ").append(parameter.getName())
                        .append(" (").append(parameter.getLocation().name().toLowerCase(Locale.ROOT))
                        .append(", ").append(parameter.getType())
                        .append(parameter.isRequired() ? ", required" : "").append(")");
                if (parameter.getDescription() != null) {
                    sb.append(": ").append(parameter.getDescription());
                }
                sb.append("\n");
            }
        }

        sb.append(JsonConsoleFormatter.ANSI_CYAN).append("  Input schema:").append(JsonConsoleFormatter.ANSI_RESET).append("\n");
        for (String line : formatter.format(objectMapper.valueToTree(resolved.inputSchema())).split("\n")) {
            sb.append("    ").append(line).append("\n");
        }
        return sb.toString().stripTrailing();
    }
}
