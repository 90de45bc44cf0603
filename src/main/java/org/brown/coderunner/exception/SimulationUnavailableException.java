package org.brown.coderunner.exception;

import org.brown.coderunner.model.ErrorKind;

/**
 * 시뮬레이션 모드(격리 백엔드 비활성)에서는 제공하지 않는 기능 요청
 */
public class SimulationUnavailableException extends SandboxException {

    public SimulationUnavailableException(String message) {
        super(ErrorKind.SIMULATED_EXECUTION, message);
    }
}
