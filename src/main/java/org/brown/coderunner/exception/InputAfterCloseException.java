package org.brown.coderunner.exception;

import org.brown.coderunner.model.ErrorKind;

/**
 * 닫힌(또는 닫히는 중인) 세션으로 이벤트가 전달됨
 */
public class InputAfterCloseException extends SandboxException {

    public InputAfterCloseException(String message) {
        super(ErrorKind.INPUT_AFTER_CLOSE, message);
    }

    public InputAfterCloseException(String message, Throwable cause) {
        super(ErrorKind.INPUT_AFTER_CLOSE, message, cause);
    }
}
