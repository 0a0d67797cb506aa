package io.surfworks.filebridge.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import io.surfworks.filebridge.license.ActivationResult;
import io.surfworks.filebridge.license.EntitlementContext;
import io.surfworks.filebridge.license.LicenseConfig;
import io.surfworks.filebridge.license.LicenseSetup;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

/**
 * FileBridge MCP server.
 *
 * <p>Serves the workspace tools over STDIO. Every call goes through {@link ToolRegistry}, which
 * asks the license engine before running the tool.
 *
 * <pre>
 * filebridge-server [--activate KEY] [--setup] [--debug-mode] [workspace-dir]
 * </pre>
 */
public class FileBridgeServer {

    private static final Logger LOG = Logger.getLogger(FileBridgeServer.class.getName());
    private static final ObjectMapper JACKSON = new ObjectMapper();

    public static void main(String[] args) throws IOException {
        LicenseConfig config = LicenseConfig.load(args);
        EntitlementContext license = EntitlementContext.create(config);

        if (config.interactiveSetup()) {
            var setup = new LicenseSetup(license,
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.err);
            setup.run();
            license.close();
            return;
        }

        if (activateRequested(args) && config.licenseKey() != null) {
            ActivationResult result = license.activate(config.licenseKey());
            if (result.success()) {
                LOG.info("License activated: " + result.tier().getDisplayName());
            } else {
                LOG.warning("License activation failed (" + result.errorCode() + "): " + result.error());
            }
        }

        ToolRegistry registry = createRegistry(license, workspace(args));

        var transportProvider = new StdioServerTransportProvider(JACKSON);
        var server = McpServer.sync(transportProvider)
            .serverInfo("filebridge", "1.0.0")
            .capabilities(McpSchema.ServerCapabilities.builder()
                .tools(true)
                .build());

        for (ToolRegistry.Tool tool : registry.tools()) {
            server.tool(new McpSchema.Tool(tool.name(), tool.description(), tool.inputSchema()),
                (exchange, toolArgs) -> toCallResult(registry.call(tool.name(), toolArgs)));
        }
        server.build();

        Runtime.getRuntime().addShutdownHook(new Thread(license::close, "filebridge-shutdown"));
        LOG.info("FileBridge server ready with " + registry.tools().size() + " tools");
        // Server keeps running and processing STDIO messages until input stream is closed
    }

    /**
     * The server's tool table.
     */
    static ToolRegistry createRegistry(EntitlementContext license, Path workspace) {
        ToolRegistry.Builder tools = ToolRegistry.builder(license.featureGate());
        new LicenseTools(license).registerAll(tools);
        new FileTools(workspace).registerAll(tools);
        return tools.build(license);
    }

    static McpSchema.CallToolResult toCallResult(ToolResult result) {
        return new McpSchema.CallToolResult(
            List.of(new McpSchema.TextContent(result.text())),
            result.isError()
        );
    }

    private static boolean activateRequested(String[] args) {
        return Arrays.stream(args).anyMatch(arg -> arg.equals(LicenseConfig.ARG_ACTIVATE)
            || arg.startsWith(LicenseConfig.ARG_ACTIVATE + "="));
    }

    private static Path workspace(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals(LicenseConfig.ARG_ACTIVATE)) {
                i++;
            } else if (!arg.startsWith("--")) {
                return Path.of(arg);
            }
        }
        return Path.of(System.getProperty("user.dir"));
    }
}
