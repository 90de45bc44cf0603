package org.brown.coderunner.exception;

import org.brown.coderunner.model.ErrorKind;

/**
 * 등록되지 않은 언어. 어떤 리소스도 할당하기 전에 던진다.
 */
public class UnsupportedLanguageException extends SandboxException {

    public UnsupportedLanguageException(String message) {
        super(ErrorKind.UNSUPPORTED_LANGUAGE, message);
    }

    public UnsupportedLanguageException(String message, Throwable cause) {
        super(ErrorKind.UNSUPPORTED_LANGUAGE, message, cause);
    }
}
