package org.brown.coderunner.docker;

import lombok.Getter;
import org.brown.coderunner.workspace.Workspace;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 실행/세션 하나를 위해 새로 만든 격리 환경. 재사용하지 않는다.
 *
 * close() 는 teardown 을 정확히 한 번 수행한다.
 */
@Getter
public class IsolatedEnvironment implements AutoCloseable {

    private final String id;
    private final EnvironmentSpec spec;
    private final Workspace workspace;
    private final EnvironmentMode mode;
    private volatile EnvironmentState state = EnvironmentState.CREATED;
    private volatile boolean streamsConnected;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Consumer<IsolatedEnvironment> teardown;

    IsolatedEnvironment(String id, EnvironmentSpec spec, Workspace workspace, EnvironmentMode mode,
                        Consumer<IsolatedEnvironment> teardown) {
        this.id = id;
        this.spec = spec;
        this.workspace = workspace;
        this.mode = mode;
        this.teardown = teardown;
    }

    public String getImage() {
        return spec.getImage();
    }

    public ResourceLimits getLimits() {
        return spec.getLimits();
    }

    public NetworkPolicy getNetworkPolicy() {
        return spec.getNetworkPolicy();
    }

    public FilesystemPolicy getFilesystemPolicy() {
        return spec.getFilesystemPolicy();
    }

    void transitionTo(EnvironmentState next) {
        this.state = next;
    }

    void markAttached() {
        streamsConnected = true;
        if (state == EnvironmentState.STARTED) {
            state = EnvironmentState.ATTACHED;
        }
    }

    void markStarted() {
        state = EnvironmentState.STARTED;
        if (streamsConnected) {
            state = EnvironmentState.ATTACHED;
        }
    }

    public void markExited() {
        if (state != EnvironmentState.REMOVED) {
            state = EnvironmentState.EXITED;
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            teardown.accept(this);
        }
    }

    @Override
    public String toString() {
        return String.format("IsolatedEnvironment[id=%s, image=%s, mode=%s, state=%s, network=%s, fs=%s]",
                id, getImage(), mode, state, getNetworkPolicy(), getFilesystemPolicy());
    }
}
