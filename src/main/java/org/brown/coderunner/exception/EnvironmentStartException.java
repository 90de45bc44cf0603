package org.brown.coderunner.exception;

import org.brown.coderunner.model.ErrorKind;

/**
 * 격리 환경 생성/시작 실패
 */
public class EnvironmentStartException extends SandboxException {

    public EnvironmentStartException(String message) {
        super(ErrorKind.ENVIRONMENT_START_ERROR, message);
    }

    public EnvironmentStartException(String message, Throwable cause) {
        super(ErrorKind.ENVIRONMENT_START_ERROR, message, cause);
    }
}
