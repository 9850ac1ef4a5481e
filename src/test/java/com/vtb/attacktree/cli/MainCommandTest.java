package com.vtb.attacktree.cli;

import com.vtb.attacktree.config.AnalyzerConfig;
import com.vtb.attacktree.core.SpecFormat;
import com.vtb.attacktree.core.SpecNormalizer;
import com.vtb.attacktree.models.AttackTree;
import com.vtb.attacktree.models.SampleTrees;
import com.vtb.attacktree.session.AnalysisSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты CLI
 */
class MainCommandTest {

    private ByteArrayOutputStream buffer;
    private AnalysisSession session;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        session = new AnalysisSession(AnalyzerConfig.defaults());
    }

    private int run(String... args) {
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        return new CommandLine(new MainCommand(session, out)).execute(args);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testDemoAnalysis() {
        int exitCode = run("--demo", "pre");

        assertEquals(MainCommand.EXIT_OK, exitCode);
        assertTrue(output().contains("0.8006"), output());
        assertTrue(output().contains("128520.00"), output());
        assertTrue(output().contains("fd_ransom"));
    }

    @Test
    void testFileWithSensitivityApplyAndExport(@TempDir Path dir) throws Exception {
        Path spec = dir.resolve("tree.json");
        Files.write(spec, SampleTrees.resource("worked-example.json"));
        Path exported = dir.resolve("updated.xml");

        int exitCode = run(spec.toString(), "--sensitivity", "weak_cfg", "--multiplier", "3", "--apply",
            "--export", exported.toString(), "-o", dir.resolve("reports").toString());

        assertEquals(MainCommand.EXIT_OK, exitCode);
        AttackTree updated = new SpecNormalizer().normalize(Files.readAllBytes(exported), SpecFormat.XML);
        assertEquals(1.0, updated.getLeaf("weak_cfg").getProbability().getAsDouble(), 0.0);
        assertTrue(Files.exists(dir.resolve("reports").resolve("attack-tree-report.json")));
    }

    @Test
    void testLeafOverrides() {
        int exitCode = run("--demo", "pre", "--prob", "weak_cfg=0.1", "--impact", "hdd_fail=24000");

        assertEquals(MainCommand.EXIT_OK, exitCode);
        assertEquals(0.1, session.getTree().getLeaf("weak_cfg").getProbability().getAsDouble(), 0.0);
        assertEquals(24000.0, session.getTree().getLeaf("hdd_fail").getImpact().getAsDouble(), 0.0);
        assertEquals(0.01, session.getTree().getLeaf("hdd_fail").getProbability().getAsDouble(), 0.0);
    }

    @Test
    void testDanglingReferenceExitCode(@TempDir Path dir) throws Exception {
        Path spec = dir.resolve("broken.yaml");
        Files.write(spec, SampleTrees.resource("dangling-root-child.yaml"));

        assertEquals(MainCommand.EXIT_SPEC_ERROR, run(spec.toString()));
        assertFalse(session.isLoaded());
    }

    @Test
    void testIncompleteDataExitCode(@TempDir Path dir) throws Exception {
        Path spec = dir.resolve("partial.yaml");
        Files.writeString(spec, """
            id: r
            label: Top
            type: OR
            children: [a]
            nodes:
              - {id: a, label: A, type: LEAF, prob: 0.2}
            """);

        assertEquals(MainCommand.EXIT_INCOMPLETE, run(spec.toString()));
        assertTrue(output().contains("a"));
    }

    @Test
    void testOutOfRangeOverride() {
        assertEquals(MainCommand.EXIT_SPEC_ERROR, run("--demo", "pre", "--prob", "weak_cfg=1.5"));
    }

    @Test
    void testMissingInput() {
        assertEquals(MainCommand.EXIT_SPEC_ERROR, run());
        assertEquals(MainCommand.EXIT_SPEC_ERROR, run("does-not-exist.yaml"));
    }
}
