package org.dxworks.fortranframe;

import org.dxworks.fortranframe.export.OutputFormat;
import org.dxworks.fortranframe.model.Node;
import org.dxworks.fortranframe.model.NodeKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @Test
    void wrongArgumentCountPrintsUsage() {
        assertEquals(2, run());
        assertTrue(stderr().startsWith("Usage: "));
        assertEquals(2, run("a.f90", "b.f90"));
    }

    @Test
    void missingInputFileFails() {
        assertEquals(1, run(tempDir.resolve("nope.f90").toString()));
        assertTrue(stderr().contains("Input file does not exist"));
    }

    @Test
    void parsesAndDumpsTree() throws Exception {
        Path source = tempDir.resolve("ok.f90");
        Files.writeString(source, "program p\nx = 1\nend program p\n");

        assertEquals(0, run(source.toString()));
        assertEquals("root\n  program p @1: program p\n    assignment x @2: x = 1\n", stdout());
    }

    @Test
    void parseErrorIsReportedWithLine() throws Exception {
        Path source = tempDir.resolve("broken.f90");
        Files.writeString(source, "program p\ndo i = 1, 2\nend program p\n");

        assertEquals(1, run(source.toString()));
        assertTrue(stderr().startsWith("Error: broken.f90: Line 3: expected open 'program'"), stderr());
        assertEquals("", stdout());
    }

    @Test
    void parseFileAppliesConfiguredPruning() throws Exception {
        Path source = tempDir.resolve("prune.f90");
        Files.writeString(source, "program p\nuse m\ndo i = 1, 2\nend do\nx = 1\nend program p\n");
        FortranframeConfig config = FortranframeConfig.with(OutputFormat.TEXT, List.of(), true, true,
                List.of(), List.of());

        Node root = App.parseFile(source, config, TestUtils.quietLogger());

        List<Node> body = root.children.get(0).children;
        assertEquals(1, body.size());
        assertEquals(NodeKind.ASSIGNMENT, body.get(0).kind);
    }

    @Test
    void parseFileHonoursExtraDiscardPatterns() throws Exception {
        Path source = tempDir.resolve("discard.f90");
        Files.writeString(source, "module m\nprivate\nend module m\n");
        FortranframeConfig config = FortranframeConfig.with(OutputFormat.TEXT, List.of(), false, false,
                List.of(), List.of("^private$"));

        Node root = App.parseFile(source, config, TestUtils.quietLogger());

        assertTrue(root.children.get(0).children.isEmpty());
    }

    private int run(String... args) {
        return App.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
