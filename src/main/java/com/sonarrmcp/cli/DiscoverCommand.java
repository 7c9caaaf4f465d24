package com.sonarrmcp.cli;

import com.sonarrmcp.cli.ui.JsonConsoleFormatter;
import com.sonarrmcp.dto.response.CommandResponse;
import com.sonarrmcp.exception.ToolGatewayException;
import com.sonarrmcp.model.DiscoveryMatch;
import com.sonarrmcp.model.DiscoveryQuery;
import com.sonarrmcp.model.DiscoveryResult;
import com.sonarrmcp.model.ToolOperation;
import com.sonarrmcp.model.ToolOperationResult;
import com.sonarrmcp.service.api.ToolOperationHandler;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * A Spring Shell component that lists tools the way an agent discovers them: a handful at a time, by category or
 * keyword, without parameter schemas.
 */
@ShellComponent
public class DiscoverCommand {

    private final ToolOperationHandler toolOperationHandler;

    public DiscoverCommand(ToolOperationHandler toolOperationHandler) {
        this.toolOperationHandler = toolOperationHandler;
    }

    /**
     * Runs a discovery query against the live catalog.
     * <p>
     * Without any option only the core tools are listed. A category narrows the candidates to the tools carrying that
     * tag; a keyword ranks them by relevance.
     *
     * @param category The category tag to filter on, specified with `--category` or `-c`.
     * @param keyword  The text to search for, specified with `--keyword` or `-k`.
     * @param max      The maximum number of tools to list, specified with `--max` or `-m`.
     * @return The listing, or a red error message.
     */
    @ShellMethod(key = "discover", value = "Find tools by category or keyword. Without options, lists the core tools.")
    public String discover(
            @ShellOption(value = {"--category", "-c"}, help = "Category tag, e.g. 'series'.", defaultValue = ShellOption.NULL) String category,
            @ShellOption(value = {"--keyword", "-k"}, help = "Text to search for.", defaultValue = ShellOption.NULL) String keyword,
            @ShellOption(value = {"--max", "-m"}, help = "Maximum number of tools to list.", defaultValue = ShellOption.NULL) Integer max
    ) {
        DiscoveryQuery query = new DiscoveryQuery(category, keyword, max);
        try {
            ToolOperationResult.Discovered discovered =
                    (ToolOperationResult.Discovered) toolOperationHandler.handle(new ToolOperation.Discover(query));
            return render(query, discovered.result());
        } catch (ToolGatewayException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        }
    }

    private String render(DiscoveryQuery query, DiscoveryResult result) {
        if (result.isEmpty()) {
            return JsonConsoleFormatter.ANSI_YELLOW + "No tools matched " + describe(query) + "."
                    + JsonConsoleFormatter.ANSI_RESET;
        }

        StringBuilder sb = new StringBuilder();
        sb.append(JsonConsoleFormatter.ANSI_CYAN)
                .append(query.isUnfiltered() ? "Core tools" : "Tools matching " + describe(query))
                .append(" (").append(result.matches().size()).append(" of ").append(result.totalMatches()).append("):")
                .append(JsonConsoleFormatter.ANSI_RESET).append("\n");
        for (DiscoveryMatch match : result.matches()) {
            sb.append("  ").append(JsonConsoleFormatter.ANSI_GREEN).append(match.name()).append(JsonConsoleFormatter.ANSI_RESET)
                    .append(" ").append(JsonConsoleFormatter.ANSI_PURPLE).append(match.tags()).append(JsonConsoleFormatter.ANSI_RESET);
            if (match.matchScore() > 0) {
                sb.append(JsonConsoleFormatter.ANSI_YELLOW).append(" score=").append(match.matchScore())
                        .append(JsonConsoleFormatter.ANSI_RESET);
            }
            sb.append("\n      ").append(match.summary()).append("\n");
        }
        if (result.isTruncated()) {
            sb.append(JsonConsoleFormatter.ANSI_YELLOW).append("Use --max to see more results.")
                    .append(JsonConsoleFormatter.ANSI_RESET).append("\n");
        }
        return sb.toString().stripTrailing();
    }

    private static String describe(DiscoveryQuery query) {
        StringBuilder sb = new StringBuilder();
        if (query.hasCategory()) {
            sb.append("category '").append(query.category()).append("'");
        }
        if (query.hasKeyword()) {
            sb.append(sb.length() > 0 ? " and " : "").append("keyword '").append(query.keyword()).append("'");
        }
        return sb.length() > 0 ? sb.toString() : "the query";
    }
}
