package com.raditha.baker.bake;

import com.raditha.baker.analyzer.DeterminismAnalyzer;
import com.raditha.baker.config.BakerConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchBakerTest {

    @TempDir
    Path tempDir;

    private List<Path> writeUnits(int count) throws IOException {
        List<Path> files = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Path file = tempDir.resolve("unit" + i + ".php");
            String body = i % 2 == 0 ? "echo time();" : "echo 'static';";
            Files.writeString(file, "<?php\nnamespace Acme\\Shop;\n" + body + "\n");
            files.add(file);
        }
        return files;
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 4})
    void testOutcomesKeepInputOrder(int threads) throws Exception {
        List<Path> files = writeUnits(6);
        BatchBaker batch = new BatchBaker(new DeterminismAnalyzer(), threads);

        List<UnitOutcome> outcomes = batch.analyzeAll(files, false);

        assertEquals(6, outcomes.size());
        for (int i = 0; i < files.size(); i++) {
            assertEquals(files.get(i), outcomes.get(i).file());
            assertEquals(i % 2 == 0 ? 1 : 0, outcomes.get(i).getDiagnosticCount());
        }
    }

    @Test
    void testWriteChanges() throws Exception {
        List<Path> files = writeUnits(3);
        BatchBaker batch = new BatchBaker(new DeterminismAnalyzer(), 2);

        List<UnitOutcome> outcomes = batch.analyzeAll(files, true);
        int written = batch.writeChanges(outcomes);

        assertEquals(2, written);
        assertTrue(Files.readString(files.get(0)).contains("Acme\\Shop\\framework\\Cache::noCache();"));
        assertEquals("<?php\nnamespace Acme\\Shop;\necho 'static';\n", Files.readString(files.get(1)));
    }

    @Test
    void testLatin1FileKeepsItsBytes() throws Exception {
        Path utf8 = tempDir.resolve("utf8.php");
        Files.writeString(utf8, "<?php\nnamespace Acme\\Shop;\necho 'caf\u00e9', time();\n");
        Path latin1 = tempDir.resolve("latin1.php");
        Files.writeString(latin1, "<?php\nnamespace Acme\\Shop;\necho 'caf\u00e9', rand();\n", StandardCharsets.ISO_8859_1);
        BatchBaker batch = new BatchBaker(new DeterminismAnalyzer(), 2);

        List<UnitOutcome> outcomes = batch.analyzeAll(List.of(utf8, latin1), true);
        int written = batch.writeChanges(outcomes);

        assertEquals(2, written);
        assertFalse(outcomes.get(0).isFailed());
        assertFalse(outcomes.get(1).isFailed());
        assertEquals("<?php\nAcme\\Shop\\framework\\Cache::noCache();namespace Acme\\Shop;\necho 'caf\u00e9', time();\n",
                Files.readString(utf8));
        assertEquals("<?php\nAcme\\Shop\\framework\\Cache::noCache();namespace Acme\\Shop;\necho 'caf\u00e9', rand();\n",
                Files.readString(latin1, StandardCharsets.ISO_8859_1));
    }

    @Test
    void testNamespaceFailureRecordedPerFile() throws Exception {
        Path broken = tempDir.resolve("broken.php");
        Files.writeString(broken, "<?php echo rand();");
        List<Path> files = new ArrayList<>(writeUnits(1));
        files.add(broken);

        List<UnitOutcome> outcomes = new BatchBaker(new DeterminismAnalyzer(), 2).analyzeAll(files, true);

        assertFalse(outcomes.get(0).isFailed());
        assertTrue(outcomes.get(1).isFailed());
        assertNull(outcomes.get(1).report());
        assertEquals(0, outcomes.get(1).getDiagnosticCount());
    }

    @Test
    void testCheckModeNeedsNoNamespace() throws Exception {
        Path file = tempDir.resolve("plain.php");
        Files.writeString(file, "<?php echo rand();");

        List<UnitOutcome> outcomes = new BatchBaker(new DeterminismAnalyzer(), 1).analyzeAll(List.of(file), false);

        assertFalse(outcomes.get(0).isFailed());
        assertEquals(1, outcomes.get(0).getDiagnosticCount());
    }

    @Test
    void testMissingFilePropagates() {
        BatchBaker batch = new BatchBaker(new DeterminismAnalyzer(BakerConfig.defaults()), 3);
        List<Path> files = List.of(tempDir.resolve("a.php"), tempDir.resolve("b.php"));

        assertThrows(IOException.class, () -> batch.analyzeAll(files, false));
    }

    @Test
    void testInvalidThreads() {
        assertThrows(IllegalArgumentException.class, () -> new BatchBaker(new DeterminismAnalyzer(), 0));
    }
}
