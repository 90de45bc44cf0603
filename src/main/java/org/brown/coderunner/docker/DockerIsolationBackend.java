package org.brown.coderunner.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.AttachContainerCmd;
import com.github.dockerjava.api.command.CreateContainerResponse;
import com.github.dockerjava.api.command.PullImageCmd;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Volume;
import com.github.dockerjava.api.model.WaitResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.coderunner.exception.InfrastructureException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Docker Engine 기반 격리 백엔드
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DockerIsolationBackend implements IsolationBackend {

    private static final long CPU_PERIOD_MICROS = 100_000L;
    private static final long ATTACH_START_TIMEOUT_SECONDS = 10;

    private final DockerClient dockerClient;

    @Override
    public boolean isImagePresent(String image) {
        try {
            dockerClient.inspectImageCmd(image).exec();
            return true;
        } catch (NotFoundException e) {
            return false;
        } catch (RuntimeException e) {
            throw translate("inspect image " + image, e);
        }
    }

    @Override
    public void pullImage(String image) throws InterruptedException {
        log.info("Pulling image: {}", image);
        try {
            PullImageCmd pullImageCmd;
            int slash = image.lastIndexOf('/');
            int colon = image.lastIndexOf(':');
            if (image.contains("@")) {
                pullImageCmd = dockerClient.pullImageCmd(image);
            } else if (colon > slash) {
                pullImageCmd = dockerClient.pullImageCmd(image.substring(0, colon))
                        .withTag(image.substring(colon + 1));
            } else {
                // 태그가 없으면 모든 태그를 받지 않도록 latest 지정
                pullImageCmd = dockerClient.pullImageCmd(image).withTag("latest");
            }
            pullImageCmd.exec(new PullImageResultCallback()).awaitCompletion();
            log.info("Pulled image: {}", image);
        } catch (RuntimeException e) {
            throw translate("pull image " + image, e);
        }
    }

    @Override
    public String create(EnvironmentSpec spec) {
        HostConfig hostConfig = HostConfig.newHostConfig()
                .withMemory(spec.getLimits().getMemoryBytes())
                .withMemorySwap(spec.getLimits().getMemoryBytes())  // swap 비활성화
                .withCpuPeriod(CPU_PERIOD_MICROS)
                .withCpuQuota(Math.max(1000L, Math.round(CPU_PERIOD_MICROS * spec.getLimits().getCpuQuotaFraction())))
                .withPidsLimit(spec.getLimits().getPidsLimit())
                .withNetworkMode(spec.getNetworkPolicy().getDockerMode())
                .withReadonlyRootfs(spec.isReadonlyRootfs())
                // Docker 의 AutoRemove 는 쓰지 않는다. 빨리 끝난 컨테이너가 wait 전에 사라지면
                // 종료 코드를 읽을 수 없으므로, 제거는 EnvironmentProvisioner 의 teardown 이 맡는다.
                .withBinds(spec.getBindMounts().stream()
                        .map(mount -> new Bind(mount.getHostPath(), new Volume(mount.getContainerPath()),
                                mount.isReadOnly() ? AccessMode.ro : AccessMode.rw))
                        .toArray(Bind[]::new));
        if (!spec.getTmpfsMounts().isEmpty()) {
            hostConfig.withTmpFs(spec.getTmpfsMounts());
        }

        try {
            CreateContainerResponse container = dockerClient.createContainerCmd(spec.getImage())
                    .withName(spec.getName())
                    .withCmd(spec.getArgv())
                    .withWorkingDir(spec.getWorkingDir())
                    .withHostConfig(hostConfig)
                    .withLabels(spec.getLabels())
                    .withTty(spec.isTty())
                    .withStdinOpen(spec.isOpenStdin())
                    .withStdInOnce(spec.isStdinOnce())
                    .withAttachStdin(spec.isOpenStdin())
                    .withAttachStdout(true)
                    .withAttachStderr(true)
                    .exec();
            log.debug("Created container: {} (name={}, image={})", container.getId(), spec.getName(), spec.getImage());
            return container.getId();
        } catch (RuntimeException e) {
            throw translate("create container " + spec.getName(), e);
        }
    }

    @Override
    public EnvironmentAttachment attach(String environmentId, InputStream stdin,
                                        Consumer<byte[]> onOutput, Runnable onEnd) {
        ResultCallback.Adapter<Frame> callback = new ResultCallback.Adapter<>() {
            @Override
            public void onNext(Frame frame) {
                byte[] payload = frame.getPayload();
                if (payload != null && payload.length > 0) {
                    onOutput.accept(payload);
                }
            }

            @Override
            public void onError(Throwable throwable) {
                log.debug("Attach stream error for container {}: {}", environmentId, throwable.getMessage());
                super.onError(throwable);
                onEnd.run();
            }

            @Override
            public void onComplete() {
                super.onComplete();
                onEnd.run();
            }
        };

        try {
            AttachContainerCmd attachCmd = dockerClient.attachContainerCmd(environmentId)
                    .withStdOut(true)
                    .withStdErr(true)
                    .withFollowStream(true);
            if (stdin != null) {
                attachCmd.withStdIn(stdin);
            }
            attachCmd.exec(callback);
            if (!callback.awaitStarted(ATTACH_START_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Attach to container {} not confirmed within {}s", environmentId, ATTACH_START_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeQuietly(callback);
            throw new IllegalStateException("Interrupted while attaching to container " + environmentId, e);
        } catch (RuntimeException e) {
            closeQuietly(callback);
            throw translate("attach container " + environmentId, e);
        }

        return new EnvironmentAttachment() {
            @Override
            public boolean awaitCompletion(Duration timeout) throws InterruptedException {
                return callback.awaitCompletion(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }

            @Override
            public void close() {
                closeQuietly(callback);
            }
        };
    }

    @Override
    public void start(String environmentId) {
        try {
            dockerClient.startContainerCmd(environmentId).exec();
            log.debug("Started container: {}", environmentId);
        } catch (RuntimeException e) {
            throw translate("start container " + environmentId, e);
        }
    }

    @Override
    public OptionalInt awaitExit(String environmentId, Duration timeout) throws InterruptedException {
        AtomicReference<Integer> statusCode = new AtomicReference<>();
        ResultCallback.Adapter<WaitResponse> callback = new ResultCallback.Adapter<>() {
            @Override
            public void onNext(WaitResponse response) {
                statusCode.set(response.getStatusCode());
            }
        };

        try {
            dockerClient.waitContainerCmd(environmentId).exec(callback);
            boolean completed = callback.awaitCompletion(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!completed) {
                return OptionalInt.empty();
            }
        } catch (RuntimeException e) {
            throw translate("wait container " + environmentId, e);
        } finally {
            closeQuietly(callback);
        }

        Integer code = statusCode.get();
        if (code == null) {
            throw new IllegalStateException("Container " + environmentId + " finished without a status code");
        }
        return OptionalInt.of(code);
    }

    @Override
    public void resize(String environmentId, int cols, int rows) {
        try {
            dockerClient.resizeContainerCmd(environmentId)
                    .withSize(rows, cols)
                    .exec();
        } catch (RuntimeException e) {
            throw translate("resize container " + environmentId, e);
        }
    }

    @Override
    public void stop(String environmentId, int timeoutSeconds) {
        try {
            dockerClient.stopContainerCmd(environmentId)
                    .withTimeout(timeoutSeconds)
                    .exec();
            log.debug("Stopped container: {}", environmentId);
        } catch (NotModifiedException | NotFoundException e) {
            log.debug("Container already stopped: {}", environmentId);
        } catch (RuntimeException e) {
            throw translate("stop container " + environmentId, e);
        }
    }

    @Override
    public void remove(String environmentId) {
        try {
            dockerClient.removeContainerCmd(environmentId)
                    .withForce(true)
                    .exec();
            log.debug("Removed container: {}", environmentId);
        } catch (NotFoundException e) {
            log.debug("Container already removed: {}", environmentId);
        } catch (RuntimeException e) {
            throw translate("remove container " + environmentId, e);
        }
    }

    /**
     * 데몬이 응답한 오류는 그대로, 연결 자체가 안 되면 InfrastructureException 으로 변환
     */
    private RuntimeException translate(String action, RuntimeException e) {
        if (e instanceof DockerException) {
            return e;
        }
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof IOException) {
                return new InfrastructureException("Docker daemon unreachable while trying to " + action, e);
            }
        }
        return e;
    }

    private static void closeQuietly(ResultCallback.Adapter<?> callback) {
        try {
            callback.close();
        } catch (IOException e) {
            log.debug("Error closing docker callback", e);
        }
    }
}
