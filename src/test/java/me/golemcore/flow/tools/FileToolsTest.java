package me.golemcore.flow.tools;

import me.golemcore.flow.domain.model.ToolResult;
import me.golemcore.flow.infrastructure.config.FlowProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileToolsTest {

    private static final String PATH = "path";
    private static final String CONTENT = "content";
    private static final String NOTES_TXT = "notes/summary.txt";

    @TempDir
    Path tempDir;

    private Path root;
    private FileReadTool readTool;
    private FileWriteTool writeTool;
    private ListDirectoryTool listTool;

    @BeforeEach
    void setUp() {
        root = tempDir.resolve("workspace");
        FlowProperties properties = new FlowProperties();
        properties.getTools().getFilesystem().setWorkspace(root.toString());
        WorkspacePathResolver workspace = new WorkspacePathResolver(properties);
        readTool = new FileReadTool(workspace);
        writeTool = new FileWriteTool(workspace);
        listTool = new ListDirectoryTool(workspace);
    }

    @Test
    void shouldWriteThenReadFile() throws Exception {
        ToolResult write = writeTool.execute(Map.of(PATH, NOTES_TXT, CONTENT, "hello")).get();
        assertTrue(write.isSuccess());
        assertEquals(Map.of(FileWriteTool.LAST_WRITTEN_FILE, Path.of("notes", "summary.txt").toString()),
                write.getContextVariables());

        ToolResult read = readTool.execute(Map.of(PATH, NOTES_TXT)).get();
        assertTrue(read.isSuccess());
        assertEquals("hello", read.getOutput());
    }

    @Test
    void shouldAppendWhenRequested() throws Exception {
        writeTool.execute(Map.of(PATH, "log.txt", CONTENT, "a")).get();
        ToolResult append = writeTool.execute(Map.of(PATH, "log.txt", CONTENT, "b", "append", true)).get();

        assertTrue(append.isSuccess());
        assertEquals("ab", Files.readString(root.resolve("log.txt")));
    }

    @Test
    void shouldRejectPathTraversal() throws Exception {
        ToolResult write = writeTool.execute(Map.of(PATH, "../escape.txt", CONTENT, "x")).get();
        assertFalse(write.isSuccess());
        assertTrue(write.getError().contains("within workspace"));
        assertFalse(Files.exists(tempDir.resolve("escape.txt")));

        ToolResult read = readTool.execute(Map.of(PATH, "../../etc/passwd")).get();
        assertFalse(read.isSuccess());
    }

    @Test
    void shouldRejectSymlinkEscape() throws Exception {
        Path outside = Files.createDirectories(tempDir.resolve("outside"));
        Files.writeString(outside.resolve("secret.txt"), "secret");
        try {
            Files.createSymbolicLink(root.resolve("link"), outside);
        } catch (UnsupportedOperationException | IOException e) {
            return; // filesystem without symlink support
        }

        ToolResult read = readTool.execute(Map.of(PATH, "link/secret.txt")).get();
        assertFalse(read.isSuccess());
    }

    @Test
    void shouldFailOnMissingFile() throws Exception {
        ToolResult read = readTool.execute(Map.of(PATH, "missing.txt")).get();
        assertFalse(read.isSuccess());
        assertTrue(read.getError().contains("not found"));
    }

    @Test
    void shouldFailWithoutRequiredParameters() throws Exception {
        assertFalse(readTool.execute(Map.of()).get().isSuccess());
        assertFalse(writeTool.execute(Map.of(PATH, "x.txt")).get().isSuccess());
    }

    @Test
    void shouldListDirectorySortedByName() throws Exception {
        Files.writeString(root.resolve("b.txt"), "b");
        Files.writeString(root.resolve("a.txt"), "a");
        Files.createDirectories(root.resolve("sub"));

        ToolResult result = listTool.execute(Map.of()).get();

        assertTrue(result.isSuccess());
        String output = result.getOutput();
        assertTrue(output.indexOf("a.txt") < output.indexOf("b.txt"));
        assertTrue(output.contains("[DIR]  sub/"));
    }

    @Test
    void shouldBeDisabledByConfiguration() {
        FlowProperties properties = new FlowProperties();
        properties.getTools().getFilesystem().setWorkspace(tempDir.toString());
        properties.getTools().getFilesystem().setEnabled(false);
        WorkspacePathResolver disabled = new WorkspacePathResolver(properties);

        assertFalse(new FileReadTool(disabled).isEnabled());
        assertFalse(new FileWriteTool(disabled).isEnabled());
        assertFalse(new ListDirectoryTool(disabled).isEnabled());
    }
}
