package org.brown.coderunner.docker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.coderunner.config.RunnerProperties;
import org.brown.coderunner.exception.EnvironmentStartException;
import org.brown.coderunner.exception.InfrastructureException;
import org.brown.coderunner.language.LanguageProfile;
import org.brown.coderunner.workspace.Workspace;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.time.Duration;
import java.util.List;
import java.util.OptionalInt;
import java.util.function.Consumer;

/**
 * 언어 프로파일 + 워크스페이스 → 격리 환경
 *
 * 리소스 제한은 호출 지점이 아니라 설정(runner.limits)에서 결정한다.
 * - BATCH: 네트워크 없음, 읽기 전용 루트 + /tmp tmpfs, 컴파일 언어만 워크스페이스 쓰기 허용
 * - INTERACTIVE: 브리지 네트워크, TTY, 세션이 닫힐 때까지 유지
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnvironmentProvisioner {

    static final String TMPFS_OPTIONS = "rw,exec,nosuid,size=67108864";
    static final String LABEL_WORKSPACE = "coderunner.workspace";
    static final String LABEL_MODE = "coderunner.mode";

    private final IsolationBackend backend;
    private final RunnerProperties runnerProperties;

    /**
     * 환경을 생성한다 (시작은 {@link #start(IsolatedEnvironment)}).
     *
     * @throws EnvironmentStartException 백엔드가 생성을 거부
     * @throws InfrastructureException   백엔드 연결 불가
     */
    public IsolatedEnvironment provision(LanguageProfile profile, Workspace workspace, EnvironmentMode mode) {
        EnvironmentSpec spec = buildSpec(profile, workspace, mode);
        String environmentId;
        try {
            environmentId = backend.create(spec);
        } catch (InfrastructureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EnvironmentStartException(
                    "Failed to create environment " + spec.getName() + ": " + e.getMessage(), e);
        }
        IsolatedEnvironment environment = new IsolatedEnvironment(environmentId, spec, workspace, mode, this::teardown);
        log.info("Provisioned {} environment {} for workspace {} (image={}, network={}, fs={})",
                mode, environmentId, workspace.getId(), spec.getImage(),
                spec.getNetworkPolicy(), spec.getFilesystemPolicy());
        return environment;
    }

    public void start(IsolatedEnvironment environment) {
        try {
            backend.start(environment.getId());
            environment.markStarted();
        } catch (InfrastructureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EnvironmentStartException(
                    "Failed to start environment " + environment.getId() + ": " + e.getMessage(), e);
        }
    }

    /**
     * 출력/stdin 연결. 시작 전에 호출한다. 상태는 {@link #start} 이후에 ATTACHED 가 된다.
     */
    public EnvironmentAttachment attach(IsolatedEnvironment environment, InputStream stdin,
                                        Consumer<byte[]> onOutput, Runnable onEnd) {
        EnvironmentAttachment attachment;
        try {
            attachment = backend.attach(environment.getId(), stdin, onOutput, onEnd);
        } catch (InfrastructureException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EnvironmentStartException(
                    "Failed to attach to environment " + environment.getId() + ": " + e.getMessage(), e);
        }
        environment.markAttached();
        return attachment;
    }

    /**
     * @return 종료 코드, timeout 안에 끝나지 않으면 empty
     */
    public OptionalInt awaitExit(IsolatedEnvironment environment, Duration timeout) throws InterruptedException {
        OptionalInt exitCode = backend.awaitExit(environment.getId(), timeout);
        if (exitCode.isPresent()) {
            environment.markExited();
        }
        return exitCode;
    }

    public void resize(IsolatedEnvironment environment, int cols, int rows) {
        backend.resize(environment.getId(), cols, rows);
    }

    public EnvironmentSpec buildSpec(LanguageProfile profile, Workspace workspace, EnvironmentMode mode) {
        RunnerProperties.LimitsConfig limitsConfig = runnerProperties.getLimits();
        String containerWorkDir = runnerProperties.getDocker().getContainerWorkDir();
        EnvironmentSpec.EnvironmentSpecBuilder builder = EnvironmentSpec.builder()
                .name("coderunner-" + mode.name().toLowerCase() + "-" + workspace.getId())
                .image(profile.getImage())
                .workingDir(containerWorkDir)
                .label(LABEL_WORKSPACE, workspace.getId())
                .label(LABEL_MODE, mode.name());

        if (mode == EnvironmentMode.BATCH) {
            boolean streamStdin = workspace.hasStdinFile()
                    && runnerProperties.getExecution().getStdinMode() == RunnerProperties.StdinMode.STREAM;
            FilesystemPolicy filesystemPolicy = profile.isCompiled() ? FilesystemPolicy.READWRITE : FilesystemPolicy.READONLY;
            return builder
                    .argv(batchCommand(profile, workspace))
                    .bindMount(new EnvironmentSpec.BindMount(workspace.getRootPath().toString(), containerWorkDir,
                            filesystemPolicy == FilesystemPolicy.READONLY))
                    .tmpfs("/tmp", TMPFS_OPTIONS)
                    .limits(new ResourceLimits(limitsConfig.getMemoryBytes(), limitsConfig.getCpuQuotaFraction(),
                            limitsConfig.getPidsLimit()))
                    .networkPolicy(NetworkPolicy.NONE)
                    .filesystemPolicy(filesystemPolicy)
                    .readonlyRootfs(true)
                    .autoRemove(true)
                    .tty(false)
                    .openStdin(streamStdin)
                    .stdinOnce(true)
                    .build();
        }

        return builder
                .argv(profile.getShellCommand())
                .bindMount(new EnvironmentSpec.BindMount(workspace.getRootPath().toString(), containerWorkDir, false))
                .limits(new ResourceLimits(limitsConfig.getMemoryBytes(), limitsConfig.getCpuQuotaFraction(),
                        limitsConfig.getTerminalPidsLimit()))
                .networkPolicy(NetworkPolicy.BRIDGE)
                .filesystemPolicy(FilesystemPolicy.READWRITE)
                .readonlyRootfs(false)
                .autoRemove(false)
                .tty(true)
                .openStdin(true)
                .stdinOnce(false)
                .build();
    }

    private List<String> batchCommand(LanguageProfile profile, Workspace workspace) {
        if (workspace.hasStdinFile()
                && runnerProperties.getExecution().getStdinMode() == RunnerProperties.StdinMode.FILE) {
            return profile.renderInputCommand(workspace.getSourceFileName());
        }
        return profile.renderRunCommand(workspace.getSourceFileName());
    }

    /**
     * 환경 정리. 실패는 로그만 남기고 던지지 않는다 (이미 결정된 결과를 가리지 않도록).
     */
    void teardown(IsolatedEnvironment environment) {
        String environmentId = environment.getId();
        if (!environment.getSpec().isAutoRemove()) {
            try {
                backend.stop(environmentId, runnerProperties.getTerminal().getStopTimeoutSeconds());
                environment.markExited();
            } catch (RuntimeException e) {
                log.warn("Failed to stop environment {}, removing anyway", environmentId, e);
            }
        }
        try {
            backend.remove(environmentId);
            environment.transitionTo(EnvironmentState.REMOVED);
            log.info("Removed environment {} (workspace={})", environmentId, environment.getWorkspace().getId());
        } catch (RuntimeException e) {
            log.warn("Failed to remove environment {}", environmentId, e);
        }
    }
}
