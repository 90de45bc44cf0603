package org.brown.coderunner.docker;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 격리 환경 생성 파라미터
 *
 * 특정 백엔드(Docker)에 의존하지 않는 형태로 표현하며,
 * {@link IsolationBackend} 구현체가 자기 API 로 변환한다.
 */
@Value
@Builder
public class EnvironmentSpec {

    String name;

    String image;

    List<String> argv;

    String workingDir;

    @Singular
    List<BindMount> bindMounts;

    /**
     * 컨테이너 경로 → tmpfs 옵션
     */
    @Singular("tmpfs")
    Map<String, String> tmpfsMounts;

    ResourceLimits limits;

    NetworkPolicy networkPolicy;

    /**
     * 워크스페이스 마운트 쓰기 가능 여부
     */
    FilesystemPolicy filesystemPolicy;

    boolean readonlyRootfs;

    /**
     * true 면 종료 즉시 강제 제거, false 면 정상 stop 후 제거 (세션 종료 시점)
     */
    boolean autoRemove;

    boolean tty;

    boolean openStdin;

    /**
     * 첫 attach 가 stdin 을 닫으면 컨테이너 stdin 도 닫힌다 (EOF 전달)
     */
    boolean stdinOnce;

    @Singular
    Map<String, String> labels;

    @Value
    public static class BindMount {
        String hostPath;
        String containerPath;
        boolean readOnly;
    }
}
