package org.brown.coderunner.execution;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.coderunner.config.RunnerProperties;
import org.brown.coderunner.docker.EnvironmentAttachment;
import org.brown.coderunner.docker.EnvironmentMode;
import org.brown.coderunner.docker.EnvironmentProvisioner;
import org.brown.coderunner.docker.ImageCache;
import org.brown.coderunner.docker.IsolatedEnvironment;
import org.brown.coderunner.exception.SandboxException;
import org.brown.coderunner.language.LanguageProfile;
import org.brown.coderunner.language.LanguageProfileRegistry;
import org.brown.coderunner.model.ErrorKind;
import org.brown.coderunner.model.ExecutionRequest;
import org.brown.coderunner.model.ExecutionResult;
import org.brown.coderunner.model.ExecutionStatus;
import org.brown.coderunner.workspace.Workspace;
import org.brown.coderunner.workspace.WorkspaceManager;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.OptionalInt;
import java.util.UUID;

/**
 * 격리 환경에서 코드를 한 번 실행하는 배치 실행 서비스
 *
 * 실행마다 새 워크스페이스와 새 환경을 만들고, 결과와 상관없이 둘 다 정리한다.
 * 1. 언어 프로파일 조회 (미지원 언어는 아무것도 할당하기 전에 실패)
 * 2. admission permit 획득
 * 3. 워크스페이스 준비 (소스 + input.txt)
 * 4. 이미지 확보 (single-flight pull)
 * 5. 환경 생성 → attach → start
 * 6. 종료 또는 타임아웃까지 대기, 출력 수집
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "runner.simulation.enabled", havingValue = "false", matchIfMissing = true)
public class DockerExecutionService implements ExecutionService {

    private final LanguageProfileRegistry languageProfileRegistry;
    private final AdmissionLimiter admissionLimiter;
    private final WorkspaceManager workspaceManager;
    private final ImageCache imageCache;
    private final EnvironmentProvisioner environmentProvisioner;
    private final RunnerProperties runnerProperties;

    @Override
    public ExecutionResult run(ExecutionRequest request, Duration timeout) {
        LanguageProfile profile = languageProfileRegistry.lookup(request.getLanguage());
        String executionId = request.getExecutionId() != null && !request.getExecutionId().isBlank()
                ? request.getExecutionId()
                : UUID.randomUUID().toString();
        Duration effectiveTimeout = clamp(timeout);
        long startTime = System.currentTimeMillis();

        MDC.put("executionId", executionId);
        MDC.put("language", profile.getId());
        log.info("Starting execution: language={}, timeout={}ms, stdin={}",
                profile.getId(), effectiveTimeout.toMillis(), request.hasStdin());

        try (AdmissionLimiter.Permit permit = admissionLimiter.acquire(executionId);
             Workspace workspace = workspaceManager.acquire(executionId, profile,
                     request.getSourceCode(), request.getStdin())) {

            imageCache.ensureAvailable(profile.getImage());

            try (IsolatedEnvironment environment =
                         environmentProvisioner.provision(profile, workspace, EnvironmentMode.BATCH)) {
                return execute(executionId, environment, request, effectiveTimeout, startTime);
            }

        } catch (SandboxException e) {
            log.error("[FAIL][{}] execution {} failed: {}", e.getErrorKind().getWireName(), executionId, e.getMessage(), e);
            return ExecutionResult.failure(executionId, e.getErrorKind(), e.getMessage(),
                    System.currentTimeMillis() - startTime);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[FAIL][INTERRUPTED] execution {} interrupted", executionId);
            return ExecutionResult.failure(executionId, ErrorKind.INFRASTRUCTURE_ERROR, "Execution interrupted",
                    System.currentTimeMillis() - startTime);

        } catch (RuntimeException e) {
            log.error("[FAIL][UNKNOWN] execution {} failed", executionId, e);
            return ExecutionResult.failure(executionId, ErrorKind.INFRASTRUCTURE_ERROR,
                    "Execution failed: " + e.getMessage(), System.currentTimeMillis() - startTime);

        } finally {
            MDC.remove("executionId");
            MDC.remove("language");
        }
    }

    @Override
    public String getMode() {
        return "docker";
    }

    private ExecutionResult execute(String executionId, IsolatedEnvironment environment, ExecutionRequest request,
                                    Duration timeout, long startTime) throws InterruptedException {
        OutputCollector output = new OutputCollector(runnerProperties.getExecution().getMaxOutputBytes());
        InputStream stdin = environment.getSpec().isOpenStdin()
                ? new ByteArrayInputStream(request.getStdin().getBytes(StandardCharsets.UTF_8))
                : null;

        try (EnvironmentAttachment attachment =
                     environmentProvisioner.attach(environment, stdin, output::append, () -> { })) {
            environmentProvisioner.start(environment);
            log.debug("Environment {} started", environment.getId());

            OptionalInt exitCode = environmentProvisioner.awaitExit(environment, timeout);
            if (exitCode.isEmpty()) {
                // 바깥 try-with-resources 보다 먼저 강제 종료해서 T + ε 안에 돌려준다
                environment.close();
                long durationMillis = System.currentTimeMillis() - startTime;
                log.warn("[TIMEOUT] execution {} exceeded {}ms, environment killed", executionId, timeout.toMillis());
                return ExecutionResult.builder()
                        .executionId(executionId)
                        .status(ExecutionStatus.ERROR)
                        .errorKind(ErrorKind.EXECUTION_TIMEOUT)
                        .output(output.asString() + "\nExecution timed out after " + timeout.toMillis() + "ms")
                        .durationMillis(durationMillis)
                        .build();
            }

            if (!attachment.awaitCompletion(Duration.ofMillis(runnerProperties.getExecution().getOutputDrainMs()))) {
                log.debug("Output stream of {} not drained in time, returning collected output", environment.getId());
            }

            long durationMillis = System.currentTimeMillis() - startTime;
            int code = exitCode.getAsInt();
            log.info("Execution {} finished with exitCode={} in {}ms", executionId, code, durationMillis);
            return ExecutionResult.builder()
                    .executionId(executionId)
                    .status(code == 0 ? ExecutionStatus.SUCCESS : ExecutionStatus.ERROR)
                    .output(output.asString())
                    .exitCode(code)
                    .durationMillis(durationMillis)
                    .build();
        }
    }

    private Duration clamp(Duration timeout) {
        long maxTimeoutMs = runnerProperties.getExecution().getMaxTimeoutMs();
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            return Duration.ofMillis(runnerProperties.getExecution().getDefaultTimeoutMs());
        }
        return timeout.toMillis() > maxTimeoutMs ? Duration.ofMillis(maxTimeoutMs) : timeout;
    }
}
