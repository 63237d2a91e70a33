package com.raditha.baker.fix;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DiffGeneratorTest {

    private final DiffGenerator generator = new DiffGenerator();

    @Test
    void testUnchangedProducesEmptyDiff() {
        assertEquals("", generator.generateUnifiedDiff(Path.of("a.php"), "<?php\n", "<?php\n"));
    }

    @Test
    void testMarkerInsertion() {
        String original = "<?php\n$x = time();\necho $x;\n";
        String baked = "<?php\nAcme\\Shop\\framework\\Cache::noCache();$x = time();\necho $x;\n";

        String diff = generator.generateUnifiedDiff(Path.of("src/index.php"), original, baked);

        assertTrue(diff.startsWith("--- a/src/index.php"));
        assertTrue(diff.contains("+++ b/src/index.php"));
        assertTrue(diff.contains("-$x = time();"));
        assertTrue(diff.contains("+Acme\\Shop\\framework\\Cache::noCache();$x = time();"));
    }

    @Test
    void testContextLines() {
        StringBuilder original = new StringBuilder("<?php\n");
        for (int i = 0; i < 10; i++) {
            original.append("echo ").append(i).append(";\n");
        }
        String baked = original.toString().replace("echo 9;", "echo time();");

        String narrow = generator.generateUnifiedDiff(null, original.toString(), baked, 0);
        String wide = generator.generateUnifiedDiff(null, original.toString(), baked, 5);

        assertTrue(narrow.contains("--- a/content"));
        assertFalse(narrow.contains(" echo 8;"));
        assertTrue(wide.contains(" echo 8;"));
    }
}
