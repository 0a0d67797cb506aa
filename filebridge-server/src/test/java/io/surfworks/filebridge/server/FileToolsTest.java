package io.surfworks.filebridge.server;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileToolsTest {

    @TempDir
    Path workspace;

    private FileTools tools;

    @BeforeEach
    void setUp() throws IOException {
        tools = new FileTools(workspace);
        Files.createDirectories(workspace.resolve("src/main"));
        Files.writeString(workspace.resolve("README.md"), "# Project");
        Files.writeString(workspace.resolve("src/main/App.java"), "class App {}");
    }

    @Test
    @DisplayName("list_files lists a directory with trailing slashes on subdirectories")
    void listFiles_root() throws IOException {
        String listing = tools.listFiles(Map.of());

        assertTrue(listing.contains("README.md"));
        assertTrue(listing.contains("src/"));
    }

    @Test
    @DisplayName("read_file returns the file content")
    void readFile_returnsContent() throws IOException {
        assertEquals("class App {}", tools.readFile(Map.of("path", "src/main/App.java")));
    }

    @Test
    @DisplayName("search_files matches globs against relative paths and file names")
    void searchFiles_glob() throws IOException {
        assertTrue(tools.searchFiles(Map.of("pattern", "*.java")).contains("App.java"));
        assertTrue(tools.searchFiles(Map.of("pattern", "src/**/*.java")).contains("App.java"));
        assertEquals("No files match *.kt", tools.searchFiles(Map.of("pattern", "*.kt")));
    }

    @Test
    @DisplayName("get_file_stats reports size and type")
    void getFileStats_reportsSize() throws IOException {
        String stats = tools.getFileStats(Map.of("path", "README.md"));

        assertTrue(stats.contains("type: file"));
        assertTrue(stats.contains("size: 9 bytes"));
    }

    @Test
    @DisplayName("write_file creates parent directories")
    void writeFile_createsParents() throws IOException {
        tools.writeFile(Map.of("path", "docs/guide.md", "content", "guide"));

        assertEquals("guide", Files.readString(workspace.resolve("docs/guide.md")));
    }

    @Test
    @DisplayName("Paths may not escape the workspace")
    void resolve_outsideWorkspace_rejected() {
        assertThrows(IllegalArgumentException.class, () -> tools.readFile(Map.of("path", "../secret.txt")));
        assertThrows(IllegalArgumentException.class, () -> tools.listFiles(Map.of("path", "src/../../")));
        assertThrows(IllegalArgumentException.class,
            () -> tools.writeFile(Map.of("path", "/etc/passwd", "content", "x")));
    }

    @Test
    @DisplayName("Missing required arguments are rejected")
    void readFile_missingPath_rejected() {
        assertThrows(IllegalArgumentException.class, () -> tools.readFile(Map.of()));
        assertThrows(IllegalArgumentException.class, () -> tools.writeFile(Map.of("path", "a.txt")));
    }
}
