package org.brown.coderunner.exception;

import org.brown.coderunner.model.ErrorKind;

/**
 * 격리 백엔드(Docker 데몬)에 아예 연결할 수 없음
 */
public class InfrastructureException extends SandboxException {

    public InfrastructureException(String message) {
        super(ErrorKind.INFRASTRUCTURE_ERROR, message);
    }

    public InfrastructureException(String message, Throwable cause) {
        super(ErrorKind.INFRASTRUCTURE_ERROR, message, cause);
    }
}
