package org.brown.coderunner.docker;

import java.io.Closeable;
import java.time.Duration;

/**
 * 실행 중인 환경의 입출력 스트림 연결
 */
public interface EnvironmentAttachment extends Closeable {

    /**
     * 출력 스트림이 끝날 때까지 대기
     *
     * @return 시간 안에 끝났으면 true
     */
    boolean awaitCompletion(Duration timeout) throws InterruptedException;

    /**
     * 연결 해제. 예외를 던지지 않는다.
     */
    @Override
    void close();
}
