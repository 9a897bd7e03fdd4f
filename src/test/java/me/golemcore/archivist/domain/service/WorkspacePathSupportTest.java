package me.golemcore.archivist.domain.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class WorkspacePathSupportTest {

    private static final String STATE_DIR = ".archivist";

    @Test
    void normalizesSeparatorsAndDotSegments() {
        assertEquals("notes/q3/plan.md", WorkspacePathSupport.normalize(" ./notes\\q3//plan.md ", STATE_DIR));
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "   ", "/etc/passwd", "C:\\temp\\a.md", "../outside.md", "notes/../../x.md",
            ".archivist/metadata/a.json", "./.archivist/x" })
    void rejectsInvalidPaths(String path) {
        assertThrows(IllegalArgumentException.class, () -> WorkspacePathSupport.normalize(path, STATE_DIR));
    }

    @Test
    void rejectsNullPath() {
        assertThrows(IllegalArgumentException.class, () -> WorkspacePathSupport.normalize(null, STATE_DIR));
    }

    @Test
    void allowsStateDirectoryNameBelowTopLevel() {
        assertEquals("docs/.archivist/a.md", WorkspacePathSupport.normalize("docs/.archivist/a.md", STATE_DIR));
    }

    @Test
    void extractsFileNameParts() {
        assertEquals("md", WorkspacePathSupport.extension("notes/Plan.MD"));
        assertEquals("", WorkspacePathSupport.extension("Makefile"));
        assertEquals("", WorkspacePathSupport.extension(".gitignore"));
        assertEquals("plan.md", WorkspacePathSupport.fileName("notes/plan.md"));
        assertEquals("plan", WorkspacePathSupport.baseName("notes/plan.md"));
    }
}
