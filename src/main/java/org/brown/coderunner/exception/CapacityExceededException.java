package org.brown.coderunner.exception;

import org.brown.coderunner.model.ErrorKind;

/**
 * 동시 실행 환경 수 한도 초과. 대기 시간 안에 슬롯을 얻지 못했다.
 */
public class CapacityExceededException extends SandboxException {

    public CapacityExceededException(String message) {
        super(ErrorKind.CAPACITY_EXCEEDED, message);
    }

    public CapacityExceededException(String message, Throwable cause) {
        super(ErrorKind.CAPACITY_EXCEEDED, message, cause);
    }
}
