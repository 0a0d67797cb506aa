package io.surfworks.filebridge.server;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File tools over a workspace directory. Paths are resolved against the workspace and may not
 * leave it.
 */
final class FileTools {

    private static final int MAX_SEARCH_RESULTS = 200;

    private final Path root;

    FileTools(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    void registerAll(ToolRegistry.Builder tools) {
        tools.register("list_files", "List files in a workspace directory",
                ToolSchema.optional("path").toString(), this::listFiles)
            .register("read_file", "Read a text file from the workspace",
                ToolSchema.required("path").toString(), this::readFile)
            .register("search_files", "Find workspace files whose path matches a glob",
                ToolSchema.required("pattern").with("path").toString(), this::searchFiles)
            .register("get_file_stats", "Size and timestamps of a workspace file",
                ToolSchema.required("path").toString(), this::getFileStats)
            .register("write_file", "Create or replace a text file in the workspace",
                ToolSchema.required("path", "content").toString(), this::writeFile);
    }

    String listFiles(Map<String, Object> args) throws IOException {
        Path dir = resolve(ToolArgs.getString(args, "path"));
        if (!Files.isDirectory(dir)) {
            throw new IllegalArgumentException("Not a directory: " + relative(dir));
        }
        try (Stream<Path> entries = Files.list(dir)) {
            List<String> names = entries
                .map(p -> Files.isDirectory(p) ? relative(p) + "/" : relative(p))
                .sorted()
                .collect(Collectors.toList());
            return names.isEmpty() ? "(empty directory)" : String.join("\n", names);
        }
    }

    String readFile(Map<String, Object> args) throws IOException {
        Path file = resolve(ToolArgs.require(args, "path"));
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Not a file: " + relative(file));
        }
        return Files.readString(file);
    }

    String searchFiles(Map<String, Object> args) throws IOException {
        String pattern = ToolArgs.require(args, "pattern");
        Path dir = resolve(ToolArgs.getString(args, "path"));
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        try (Stream<Path> walk = Files.walk(dir)) {
            List<String> matches = walk
                .filter(Files::isRegularFile)
                .filter(p -> matcher.matches(dir.relativize(p)) || matcher.matches(p.getFileName()))
                .limit(MAX_SEARCH_RESULTS)
                .map(this::relative)
                .sorted()
                .collect(Collectors.toList());
            return matches.isEmpty() ? "No files match " + pattern : String.join("\n", matches);
        }
    }

    String getFileStats(Map<String, Object> args) throws IOException {
        Path file = resolve(ToolArgs.require(args, "path"));
        BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
        return String.format("path: %s%ntype: %s%nsize: %d bytes%ncreated: %s%nmodified: %s",
            relative(file),
            attrs.isDirectory() ? "directory" : "file",
            attrs.size(),
            attrs.creationTime(),
            attrs.lastModifiedTime());
    }

    String writeFile(Map<String, Object> args) throws IOException {
        Path file = resolve(ToolArgs.require(args, "path"));
        String content = ToolArgs.getString(args, "content");
        if (content == null) {
            throw new IllegalArgumentException("Missing required argument 'content'");
        }
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, content);
        return "Wrote " + content.length() + " characters to " + relative(file);
    }

    private Path resolve(String path) {
        Path resolved = (path == null || path.isBlank() ? root : root.resolve(path)).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path is outside the workspace: " + path);
        }
        return resolved;
    }

    private String relative(Path path) {
        String rel = root.relativize(path).toString();
        return rel.isEmpty() ? "." : rel;
    }
}
