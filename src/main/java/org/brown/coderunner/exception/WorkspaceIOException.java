package org.brown.coderunner.exception;

import org.brown.coderunner.model.ErrorKind;

/**
 * 워크스페이스 생성/쓰기 실패
 */
public class WorkspaceIOException extends SandboxException {

    public WorkspaceIOException(String message) {
        super(ErrorKind.WORKSPACE_IO_ERROR, message);
    }

    public WorkspaceIOException(String message, Throwable cause) {
        super(ErrorKind.WORKSPACE_IO_ERROR, message, cause);
    }
}
