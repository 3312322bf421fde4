package im.arun.jsonnav.cli;

import im.arun.jsonnav.JsonNavException;
import im.arun.jsonnav.config.ConfigLoader;
import im.arun.jsonnav.config.JsonNavConfig;
import im.arun.jsonnav.model.LazyNode;
import im.arun.jsonnav.model.NodePath;
import im.arun.jsonnav.model.SearchOptions;
import im.arun.jsonnav.model.SearchResult;
import im.arun.jsonnav.model.StructureInfo;
import im.arun.jsonnav.service.JsonNavigator;
import im.arun.jsonnav.util.ExecutorProvider;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Command-line interface for JsonNav using Picocli.
 */
@Command(
    name = "jsonnav",
    description = "Open a large JSON document, expand paths lazily and search the loaded tree",
    mixinStandardHelpOptions = true,
    version = "JsonNav 1.0"
)
public class JsonNavCLI implements Callable<Integer> {

    @Option(names = {"--file"}, description = "Path to the JSON document", required = true)
    private String filePath;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--stats"}, description = "Print the structure analysis")
    private boolean stats;

    @Option(names = {"--expand"}, description = "JSONPath of a node to expand (repeatable)")
    private List<String> expandPaths = new ArrayList<>();

    @Option(names = {"--search"}, description = "Search the loaded tree for this text")
    private String query;

    @Option(names = {"--regex"}, description = "Treat the search query as a regular expression")
    private boolean regex;

    @Option(names = {"--wildcard"}, description = "Treat the search query as a * / ? wildcard")
    private boolean wildcard;

    @Option(names = {"--case-sensitive"}, description = "Match case when searching")
    private boolean caseSensitive;

    @Option(names = {"--in-paths"}, description = "Also search JSONPath expressions")
    private boolean inPaths;

    @Option(names = {"--limit"}, description = "Children per expansion")
    private Integer limit;

    @Option(names = {"--output"}, description = "Output JSON file for the materialized tree")
    private String outputPath;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Path file = Paths.get(filePath);
        if (!Files.exists(file)) {
            err.println("Error: JSON file not found: " + filePath);
            return 1;
        }

        Map<String, Object> overrides = new HashMap<>();
        // a one-shot run has nothing to evict
        overrides.put("memory_monitor_enabled", false);
        if (limit != null) {
            overrides.put("child_limit", limit);
        }
        JsonNavConfig config = new ConfigLoader(configPath).load(overrides);

        out.println("JsonNav - Large JSON Navigator");
        out.println("=".repeat(50));
        out.println("File: " + filePath);
        out.println();

        try (JsonNavigator navigator = new JsonNavigator(config)) {
            navigator.open(file);

            if (stats) {
                StructureInfo info = navigator.analyze();
                printStats(out, info);
            }

            long timeout = config.getLoadTimeoutMillis();
            LazyNode root = navigator.rootNode();
            navigator.expand(root).get(timeout, TimeUnit.MILLISECONDS);
            for (String expression : expandPaths) {
                NodePath path = NodePath.parse(expression);
                LazyNode node = navigator.expandPath(path).get(timeout, TimeUnit.MILLISECONDS);
                navigator.expand(node).get(timeout, TimeUnit.MILLISECONDS);
            }

            out.println("Tree:");
            for (LazyNode node : navigator.visibleNodes()) {
                printNode(out, node);
            }

            if (query != null) {
                SearchOptions options = SearchOptions.defaults();
                options.setRegex(regex);
                options.setWildcard(wildcard);
                options.setCaseSensitive(caseSensitive);
                options.setInPaths(inPaths);
                List<SearchResult> results = navigator.search(query, options).get();
                out.println();
                out.println("Search results for '" + query + "': " + results.size());
                for (SearchResult result : results) {
                    out.printf("  [%s] %s  %s%n", result.getMatchType(), result.getPathExpression(), result.getContext());
                }
            }

            if (outputPath != null) {
                navigator.save(Paths.get(outputPath));
                out.println();
                out.println("Output written to: " + outputPath);
            }
        } catch (ExecutionException | CompletionException e) {
            err.println("Error: " + e.getCause().getMessage());
            return 1;
        } catch (JsonNavException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        out.flush();
        return 0;
    }

    private static void printStats(PrintWriter out, StructureInfo info) {
        out.println("Structure:");
        out.println("  Nodes:      " + info.getTotalNodes());
        out.println("  Objects:    " + info.getObjectCount());
        out.println("  Arrays:     " + info.getArrayCount());
        out.println("  Strings:    " + info.getStringCount());
        out.println("  Numbers:    " + info.getNumberCount());
        out.println("  Booleans:   " + info.getBooleanCount());
        out.println("  Nulls:      " + info.getNullCount());
        out.println("  Max depth:  " + info.getMaxDepth());
        out.println("  Max array:  " + info.getMaxArrayLength());
        out.println();
    }

    private static void printNode(PrintWriter out, LazyNode node) {
        String marker;
        if (!node.isExpandable()) {
            marker = " ";
        } else {
            marker = node.isExpanded() ? "-" : "+";
        }
        String suffix = node.isPartial() ? "  (" + node.getLoadedChildCount() + " of " + node.getChildCount() + " shown)" : "";
        out.println("  ".repeat(node.getDepth()) + marker + " " + node.getKey() + ": " + node.getDisplayValue() + suffix);
    }

    public static void main(String[] args) {
        try {
            int exitCode = new CommandLine(new JsonNavCLI()).execute(args);
            System.exit(exitCode);
        } finally {
            ExecutorProvider.shutdown();
        }
    }
}
