package org.brown.coderunner.workspace;

import lombok.extern.slf4j.Slf4j;
import org.brown.coderunner.config.RunnerProperties;
import org.brown.coderunner.exception.WorkspaceIOException;
import org.brown.coderunner.language.LanguageProfile;
import org.brown.coderunner.language.LanguageProfileRegistry;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * 워크스페이스 생성/삭제
 *
 * 호스트의 {baseDir}/{executionId} 디렉터리를 만들고 소스와 stdin 파일을 쓴다.
 * 컨테이너에는 이 디렉터리가 작업 디렉터리로 마운트된다.
 */
@Slf4j
@Component
public class WorkspaceManager {

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]{0,127}");

    private final Path baseDir;

    public WorkspaceManager(RunnerProperties runnerProperties) {
        this.baseDir = Paths.get(runnerProperties.getWorkspace().getBaseDir()).toAbsolutePath().normalize();
    }

    /**
     * 소스(와 비어 있지 않은 stdin)를 담은 워크스페이스 생성
     *
     * @throws WorkspaceIOException 생성/쓰기 실패. 만들어진 부분은 정리된 뒤 던진다.
     */
    public Workspace acquire(String executionId, LanguageProfile profile, String sourceCode, String stdin) {
        Path root = createRoot(executionId);
        try {
            String fileName = profile.sourceFileName(sourceCode);
            Path sourceFile = root.resolve(fileName);
            Files.writeString(sourceFile, sourceCode != null ? sourceCode : "", StandardCharsets.UTF_8);
            log.debug("Wrote source file: {}", sourceFile);

            Path stdinFile = null;
            if (stdin != null && !stdin.isEmpty()) {
                stdinFile = root.resolve(LanguageProfileRegistry.STDIN_FILE_NAME);
                Files.writeString(stdinFile, stdin, StandardCharsets.UTF_8);
                log.debug("Wrote stdin file: {}", stdinFile);
            }

            return new Workspace(executionId, root, sourceFile, stdinFile, this::release);
        } catch (IOException e) {
            deleteRecursively(root);
            throw new WorkspaceIOException("Failed to write workspace files for " + executionId, e);
        }
    }

    /**
     * 소스 없이 빈 디렉터리만 가진 워크스페이스 (터미널 세션용)
     */
    public Workspace acquireEmpty(String sessionId) {
        Path root = createRoot(sessionId);
        return new Workspace(sessionId, root, null, null, this::release);
    }

    /**
     * 디렉터리를 재귀 삭제한다. 실패는 로그만 남긴다.
     * 직접 호출하기보다 {@link Workspace#close()} 를 쓴다.
     */
    public void release(Workspace workspace) {
        if (deleteRecursively(workspace.getRootPath())) {
            log.debug("Released workspace: {}", workspace.getRootPath());
        }
    }

    private Path createRoot(String id) {
        if (id == null || !SAFE_ID.matcher(id).matches()) {
            throw new WorkspaceIOException("Invalid workspace id: " + id);
        }
        Path root = baseDir.resolve(id).normalize();
        if (!root.getParent().equals(baseDir)) {
            throw new WorkspaceIOException("Workspace path escapes base directory: " + id);
        }
        try {
            Files.createDirectories(baseDir);
            Files.createDirectory(root);
            return root;
        } catch (IOException e) {
            throw new WorkspaceIOException("Failed to create workspace directory: " + root, e);
        }
    }

    private boolean deleteRecursively(Path root) {
        if (!Files.exists(root)) {
            return true;
        }
        try (Stream<Path> paths = Files.walk(root)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    throw new WorkspaceIOException("Failed to delete " + path, e);
                }
            });
            return true;
        } catch (NoSuchFileException e) {
            return true;
        } catch (IOException | UncheckedIOException | WorkspaceIOException e) {
            log.warn("Failed to remove workspace directory: {}", root, e);
            return false;
        }
    }
}
