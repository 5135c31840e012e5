package de.htwsaar.socialnet.media.security;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StaticRootTest {

    @TempDir
    Path tmp;

    @Test
    void resolvesToAbsoluteCanonicalDirectory() throws IOException {
        StaticRoot root = StaticRoot.of(tmp.resolve("data").toString());

        assertTrue(root.path().isAbsolute());
        assertEquals(tmp.resolve("data").toRealPath(), root.path());
    }

    @Test
    void createsMissingDirectory() {
        Path missing = tmp.resolve("uploads/nested");

        StaticRoot.of(missing.toString());

        assertTrue(Files.isDirectory(missing));
    }

    @Test
    void rejectsBlankConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> StaticRoot.of(" "));
        assertThrows(IllegalArgumentException.class, () -> StaticRoot.of(null));
    }

    @Test
    void rejectsRegularFile() throws IOException {
        Path file = Files.writeString(tmp.resolve("not-a-dir"), "x");

        assertThrows(IllegalStateException.class, () -> StaticRoot.of(file.toString()));
    }

    @Test
    void prefixCheckIsSeparatorAware() throws IOException {
        StaticRoot root = StaticRoot.of(tmp.resolve("data").toString());
        Path sibling = Files.createDirectories(tmp.resolve("database")).toRealPath();

        assertTrue(root.contains(root.path()));
        assertTrue(root.contains(root.path().resolve("a/b.png")));
        assertFalse(root.contains(sibling));
        assertFalse(root.contains(sibling.resolve("dump.sql")));
        assertFalse(root.contains(root.path().getParent()));
    }
}
