package com.switchyard.git;

import com.switchyard.core.errors.InvalidInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GitNamesTest {

    @Nested
    @DisplayName("branch names")
    class BranchNames {

        @Test
        @DisplayName("accepts slashes, dots, dashes and underscores")
        void acceptsValidNames() {
            assertDoesNotThrow(() -> GitNames.validateBranchName("switchyard/feature_1.2-x"));
        }

        @Test
        @DisplayName("rejects empty, dot-dot, backslash and spaces")
        void rejectsInvalidNames() {
            assertThrows(InvalidInputException.class, () -> GitNames.validateBranchName(""));
            assertThrows(InvalidInputException.class, () -> GitNames.validateBranchName("a..b"));
            assertThrows(InvalidInputException.class, () -> GitNames.validateBranchName("a\\b"));
            assertThrows(InvalidInputException.class, () -> GitNames.validateBranchName("has space"));
        }
    }

    @Nested
    @DisplayName("session names")
    class SessionNames {

        @Test
        @DisplayName("letters, digits, underscore and dash are valid")
        void valid() {
            assertTrue(GitNames.isValidSessionName("fix-login_2"));
        }

        @Test
        @DisplayName("slashes, dots and over-long names are invalid")
        void invalid() {
            assertFalse(GitNames.isValidSessionName("a/b"));
            assertFalse(GitNames.isValidSessionName("a.b"));
            assertFalse(GitNames.isValidSessionName(""));
            assertFalse(GitNames.isValidSessionName("x".repeat(101)));
            assertTrue(GitNames.isValidSessionName("x".repeat(100)));
        }

        @Test
        @DisplayName("validateSessionName reports the field")
        void validateReportsField() {
            var e = assertThrows(InvalidInputException.class, () -> GitNames.validateSessionName("bad name"));
            assertEquals("name", e.field());
        }
    }

    @Test
    @DisplayName("internal paths are the tooling directory and everything under it")
    void internalPaths() {
        assertTrue(GitNames.isInternalPath(".switchyard"));
        assertTrue(GitNames.isInternalPath(".switchyard/worktrees/a"));
        assertFalse(GitNames.isInternalPath(".switchyardrc"));
        assertFalse(GitNames.isInternalPath("src/.switchyard"));
    }
}
