package com.sonarrmcp.cli;

import com.sonarrmcp.cli.ui.JsonConsoleFormatter;
import com.sonarrmcp.cli.ui.Spinner;
import com.sonarrmcp.config.GatewayProperties;
import com.sonarrmcp.dto.response.CommandResponse;
import com.sonarrmcp.exception.ToolGatewayException;
import com.sonarrmcp.model.CatalogIndex;
import com.sonarrmcp.service.api.CatalogRegistry;
import com.sonarrmcp.service.api.CoreToolCatalog;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

/**
 * A Spring Shell component for managing the live tool catalog.
 */
@ShellComponent
public class CatalogCommand {

    private final CatalogRegistry catalogRegistry;
    private final CoreToolCatalog coreToolCatalog;
    private final GatewayProperties properties;
    private final Spinner spinner;

    public CatalogCommand(CatalogRegistry catalogRegistry, CoreToolCatalog coreToolCatalog,
                          GatewayProperties properties, Spinner spinner) {
        this.catalogRegistry = catalogRegistry;
        this.coreToolCatalog = coreToolCatalog;
        this.properties = properties;
        this.spinner = spinner;
    }

    /**
     * Rebuilds the catalog from an OpenAPI document and swaps it in. Calls already running keep the catalog they
     * started with; if the document is broken the current catalog stays live.
     *
     * @param source The URL or file path of the document; defaults to the configured location.
     * @return A summary of the new catalog, or a red error message.
     */
    @ShellMethod(key = "reload", value = "Rebuild the tool catalog from the OpenAPI document.")
    public String reload(
            @ShellOption(value = {"--source", "-s"}, help = "URL or file path of the OpenAPI document.", defaultValue = ShellOption.NULL) String source
    ) {
        String location = source != null ? source : properties.getOpenapiLocation();
        if (location == null || location.isBlank()) {
            return CommandResponse.error("No OpenAPI document given. Use --source or set mcp.openapi-location.").toAnsiString();
        }
        try {
            CatalogIndex index = spinner.spin("Loading " + location + "...", () -> catalogRegistry.reload(location));
            return CommandResponse.ok("Catalog reloaded from " + location + ": " + index.size() + " tools in "
                    + index.tagCounts().size() + " categories.").toAnsiString();
        } catch (ToolGatewayException e) {
            return CommandResponse.error("Failed to reload the catalog: " + e.getMessage()).toAnsiString();
        }
    }

    @ShellMethod(key = "catalog-info", value = "Show the live catalog: source, categories and core tools.")
    public String catalogInfo() {
        CatalogIndex index;
        try {
            index = catalogRegistry.current();
        } catch (ToolGatewayException e) {
            return CommandResponse.error(e.getMessage()).toAnsiString();
        }

        StringBuilder sb = new StringBuilder();
        sb.append(JsonConsoleFormatter.ANSI_CYAN).append("Catalog: ").append(JsonConsoleFormatter.ANSI_YELLOW)
                .append(index.getTitle()).append(" ").append(index.getVersion()).append(JsonConsoleFormatter.ANSI_RESET)
                .append("\n");
        sb.append("  Built at: ").append(index.getBuiltAt()).append("\n");
        sb.append("  Tools: ").append(index.size()).append("\n");
        sb.append("  Core tools: ").append(String.join(", ", coreToolCatalog.coreTools(index))).append("\n");
        sb.append(JsonConsoleFormatter.ANSI_CYAN).append("  Categories:").append(JsonConsoleFormatter.ANSI_RESET).append("\n");
        index.tagCounts().forEach((tag, count) ->
                sb.append("    - ").append(tag).append(" (").append(count).append(")\n"));
        return sb.toString().stripTrailing();
    }
}
