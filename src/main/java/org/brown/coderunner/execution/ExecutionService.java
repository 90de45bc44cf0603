package org.brown.coderunner.execution;

import org.brown.coderunner.model.ExecutionRequest;
import org.brown.coderunner.model.ExecutionResult;

import java.time.Duration;

/**
 * 배치 실행 서비스 인터페이스
 *
 * 실제 격리 실행(Docker)과 시뮬레이션 모드가 같은 계약을 구현한다.
 */
public interface ExecutionService {

    /**
     * 코드를 실행하고 결과를 반환한다.
     *
     * 플랫폼 실패(워크스페이스, 이미지, 환경 시작, 용량 초과)는 예외가 아니라
     * status=error 와 errorKind 를 가진 결과로 돌려준다.
     *
     * @param request 실행 요청
     * @param timeout 벽시계 기준 실행 제한 시간
     * @return 실행 결과 (불변)
     * @throws org.brown.coderunner.exception.UnsupportedLanguageException 등록되지 않은 언어 (리소스 할당 전)
     */
    ExecutionResult run(ExecutionRequest request, Duration timeout);

    /**
     * 상태 조회용 모드 이름
     */
    String getMode();
}
