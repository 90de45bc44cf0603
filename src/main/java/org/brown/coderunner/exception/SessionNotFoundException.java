package org.brown.coderunner.exception;

import org.brown.coderunner.model.ErrorKind;

/**
 * 알 수 없거나 만료된 터미널 세션 ID
 */
public class SessionNotFoundException extends SandboxException {

    public SessionNotFoundException(String message) {
        super(ErrorKind.SESSION_NOT_FOUND, message);
    }

    public SessionNotFoundException(String message, Throwable cause) {
        super(ErrorKind.SESSION_NOT_FOUND, message, cause);
    }
}
