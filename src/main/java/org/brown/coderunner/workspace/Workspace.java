package org.brown.coderunner.workspace;

import lombok.Getter;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 실행/세션 하나에 묶인 임시 파일 영역
 *
 * try-with-resources 로 사용하며, close() 는 몇 번 호출되어도 release 를 한 번만 수행한다.
 */
@Getter
public class Workspace implements AutoCloseable {

    private final String id;
    private final Path rootPath;
    private final Path sourceFile;  // 빈 터미널 워크스페이스면 null
    private final Path stdinFile;   // stdin 이 비어 있으면 null

    private final AtomicBoolean released = new AtomicBoolean(false);
    private final Consumer<Workspace> releaser;

    Workspace(String id, Path rootPath, Path sourceFile, Path stdinFile, Consumer<Workspace> releaser) {
        this.id = id;
        this.rootPath = rootPath;
        this.sourceFile = sourceFile;
        this.stdinFile = stdinFile;
        this.releaser = releaser;
    }

    public String getSourceFileName() {
        return sourceFile != null ? sourceFile.getFileName().toString() : null;
    }

    public boolean hasStdinFile() {
        return stdinFile != null;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            releaser.accept(this);
        }
    }

    @Override
    public String toString() {
        return String.format("Workspace[id=%s, root=%s, source=%s, stdin=%s]",
                id, rootPath, getSourceFileName(), stdinFile != null);
    }
}
