package org.brown.coderunner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * CodeRunner - 격리 실행 에이전트
 *
 * 주요 기능:
 * - 일회성 배치 실행 (코드 + stdin → 출력 + exitCode)
 * - 장시간 유지되는 인터랙티브 터미널 세션 (STOMP/WebSocket)
 * - 요청마다 새로 생성되는 리소스 제한 컨테이너, 모든 경로에서 정리 보장
 * - Docker를 사용할 수 없을 때의 시뮬레이션 모드
 *
 * @author CodeRunner Team
 */
@SpringBootApplication
@EnableScheduling
public class CodeRunnerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeRunnerApplication.class, args);
    }

}
