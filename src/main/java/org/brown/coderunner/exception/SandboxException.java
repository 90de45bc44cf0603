package org.brown.coderunner.exception;

import lombok.Getter;
import org.brown.coderunner.model.ErrorKind;

/**
 * 격리 실행 계층의 공통 예외
 *
 * 모든 하위 예외는 호출자가 "사용자 코드 문제"와 "플랫폼 실패"를 구분할 수 있도록
 * {@link ErrorKind} 를 가진다.
 */
@Getter
public class SandboxException extends RuntimeException {

    private final ErrorKind errorKind;

    public SandboxException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    public SandboxException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }
}
