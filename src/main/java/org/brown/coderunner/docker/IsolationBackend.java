package org.brown.coderunner.docker;

import java.io.InputStream;
import java.time.Duration;
import java.util.OptionalInt;
import java.util.function.Consumer;

/**
 * 격리 백엔드 인터페이스
 *
 * 컨테이너 엔진, microVM 등 실제 격리 수단을 추상화한다.
 * 데몬에 연결조차 할 수 없으면 구현체는 InfrastructureException 을 던진다.
 */
public interface IsolationBackend {

    boolean isImagePresent(String image);

    /**
     * 이미지 pull (완료까지 블로킹)
     */
    void pullImage(String image) throws InterruptedException;

    /**
     * 환경 생성 (시작하지 않음)
     *
     * @return 백엔드 환경 ID
     */
    String create(EnvironmentSpec spec);

    /**
     * 출력 스트림과 (선택적으로) stdin 을 연결한다. 시작 전에 호출해야 출력이 유실되지 않는다.
     *
     * @param stdin    컨테이너 stdin 으로 복사할 스트림, 없으면 null. 스트림이 끝나면 stdin 이 닫힌다.
     * @param onOutput 출력 청크 콜백 (도착 순서대로 한 스레드에서 호출)
     * @param onEnd    출력 스트림 종료 콜백
     */
    EnvironmentAttachment attach(String environmentId, InputStream stdin,
                                 Consumer<byte[]> onOutput, Runnable onEnd);

    void start(String environmentId);

    /**
     * 자연 종료 대기
     *
     * @return 종료 코드, 시간 안에 끝나지 않으면 empty
     */
    OptionalInt awaitExit(String environmentId, Duration timeout) throws InterruptedException;

    void resize(String environmentId, int cols, int rows);

    void stop(String environmentId, int timeoutSeconds);

    /**
     * 강제 제거. 이미 없으면 조용히 넘어간다.
     */
    void remove(String environmentId);
}
