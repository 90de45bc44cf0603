package org.brown.coderunner.workspace;

import org.brown.coderunner.config.RunnerProperties;
import org.brown.coderunner.exception.WorkspaceIOException;
import org.brown.coderunner.language.LanguageProfileRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkspaceManagerTest {

    @TempDir
    Path baseDir;

    private WorkspaceManager workspaceManager;
    private LanguageProfileRegistry registry;

    @BeforeEach
    void setUp() {
        RunnerProperties properties = new RunnerProperties();
        properties.getWorkspace().setBaseDir(baseDir.toString());
        workspaceManager = new WorkspaceManager(properties);
        registry = new LanguageProfileRegistry(properties);
    }

    @Test
    void writesSourceAndStdin() throws Exception {
        try (Workspace workspace = workspaceManager.acquire("exec-1", registry.lookup("python"),
                "name = input()", "Ada\n")) {
            assertThat(workspace.getRootPath()).isEqualTo(baseDir.resolve("exec-1"));
            assertThat(workspace.getSourceFileName()).isEqualTo("program.py");
            assertThat(Files.readString(workspace.getSourceFile())).isEqualTo("name = input()");
            assertThat(workspace.hasStdinFile()).isTrue();
            assertThat(Files.readString(workspace.getStdinFile())).isEqualTo("Ada\n");
        }
    }

    @Test
    void emptyStdinWritesNoInputFile() {
        try (Workspace workspace = workspaceManager.acquire("exec-2", registry.lookup("python"), "print(1)", "")) {
            assertThat(workspace.hasStdinFile()).isFalse();
            assertThat(workspace.getRootPath().resolve("input.txt")).doesNotExist();
        }
    }

    @Test
    void javaSourceUsesPublicClassName() {
        try (Workspace workspace = workspaceManager.acquire("exec-3", registry.lookup("java"),
                "public class Hello { }", null)) {
            assertThat(workspace.getSourceFile().getFileName().toString()).isEqualTo("Hello.java");
        }
    }

    @Test
    void closeRemovesDirectoryOnce() throws Exception {
        Workspace workspace = workspaceManager.acquire("exec-4", registry.lookup("python"), "print(1)", "x");
        Files.createDirectories(workspace.getRootPath().resolve("nested/dir"));
        Files.writeString(workspace.getRootPath().resolve("nested/dir/out.txt"), "data");

        workspace.close();
        workspace.close();

        assertThat(workspace.isReleased()).isTrue();
        assertThat(workspace.getRootPath()).doesNotExist();
    }

    @Test
    void emptyWorkspaceHasNoSource() {
        try (Workspace workspace = workspaceManager.acquireEmpty("session-1")) {
            assertThat(workspace.getRootPath()).isDirectory();
            assertThat(workspace.getSourceFile()).isNull();
            assertThat(workspace.getSourceFileName()).isNull();
        }
    }

    @Test
    void rejectsIdsThatEscapeBaseDir() {
        assertThatThrownBy(() -> workspaceManager.acquireEmpty("../outside"))
                .isInstanceOf(WorkspaceIOException.class);
        assertThatThrownBy(() -> workspaceManager.acquireEmpty(null))
                .isInstanceOf(WorkspaceIOException.class);
    }

    @Test
    void duplicateIdFailsWithoutTouchingExistingWorkspace() throws Exception {
        try (Workspace first = workspaceManager.acquire("dup", registry.lookup("python"), "print(1)", null)) {
            assertThatThrownBy(() -> workspaceManager.acquire("dup", registry.lookup("python"), "print(2)", null))
                    .isInstanceOf(WorkspaceIOException.class);
            assertThat(Files.readString(first.getSourceFile())).isEqualTo("print(1)");
        }
    }
}
