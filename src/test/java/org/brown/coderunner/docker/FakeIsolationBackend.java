package org.brown.coderunner.docker;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * 테스트용 인메모리 격리 백엔드
 *
 * 컨테이너 대신 스레드에서 {@link Program} 을 돌린다.
 */
public class FakeIsolationBackend implements IsolationBackend {

    @FunctionalInterface
    public interface Program {
        int run(FakeProcess process) throws Exception;
    }

    private final Map<String, FakeContainer> containers = new ConcurrentHashMap<>();
    private final Set<String> presentImages = ConcurrentHashMap.newKeySet();
    private final List<EnvironmentSpec> createdSpecs = new CopyOnWriteArrayList<>();
    private final List<String> removedIds = new CopyOnWriteArrayList<>();
    private final List<String> resizes = new CopyOnWriteArrayList<>();
    private final Map<String, Long> inspectDelays = new ConcurrentHashMap<>();
    private final AtomicInteger pullCount = new AtomicInteger();
    private final AtomicInteger idSequence = new AtomicInteger();

    private volatile Program program = process -> 0;
    private volatile long pullDelayMillis;
    private volatile RuntimeException pullFailure;
    private volatile RuntimeException createFailure;
    private volatile RuntimeException startFailure;

    public void setProgram(Program program) {
        this.program = program;
    }

    public void addImage(String image) {
        presentImages.add(image);
    }

    public void setInspectDelayMillis(String image, long delayMillis) {
        inspectDelays.put(image, delayMillis);
    }

    public void setPullDelayMillis(long pullDelayMillis) {
        this.pullDelayMillis = pullDelayMillis;
    }

    public void failPullWith(RuntimeException failure) {
        this.pullFailure = failure;
    }

    public void failCreateWith(RuntimeException failure) {
        this.createFailure = failure;
    }

    public void failStartWith(RuntimeException failure) {
        this.startFailure = failure;
    }

    public int getPullCount() {
        return pullCount.get();
    }

    public List<EnvironmentSpec> getCreatedSpecs() {
        return createdSpecs;
    }

    public List<String> getRemovedIds() {
        return removedIds;
    }

    public List<String> getResizes() {
        return resizes;
    }

    public int liveContainerCount() {
        return containers.size();
    }

    @Override
    public boolean isImagePresent(String image) {
        Long delay = inspectDelays.get(image);
        if (delay != null) {
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return presentImages.contains(image);
    }

    @Override
    public void pullImage(String image) throws InterruptedException {
        pullCount.incrementAndGet();
        if (pullDelayMillis > 0) {
            Thread.sleep(pullDelayMillis);
        }
        if (pullFailure != null) {
            throw pullFailure;
        }
        presentImages.add(image);
    }

    @Override
    public String create(EnvironmentSpec spec) {
        if (createFailure != null) {
            throw createFailure;
        }
        if (!presentImages.contains(spec.getImage())) {
            throw new IllegalStateException("No such image: " + spec.getImage());
        }
        String id = "fake-" + idSequence.incrementAndGet();
        containers.put(id, new FakeContainer(id, spec));
        createdSpecs.add(spec);
        return id;
    }

    @Override
    public EnvironmentAttachment attach(String environmentId, InputStream stdin,
                                        Consumer<byte[]> onOutput, Runnable onEnd) {
        FakeContainer container = container(environmentId);
        container.stdin = stdin;
        container.onOutput = onOutput;
        container.onEnd = onEnd;
        return new EnvironmentAttachment() {
            @Override
            public boolean awaitCompletion(Duration timeout) throws InterruptedException {
                return container.outputDone.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }

            @Override
            public void close() {
                container.detached = true;
            }
        };
    }

    @Override
    public void start(String environmentId) {
        if (startFailure != null) {
            throw startFailure;
        }
        FakeContainer container = container(environmentId);
        container.thread = new Thread(() -> container.execute(program), "fake-" + environmentId);
        container.thread.setDaemon(true);
        container.thread.start();
    }

    @Override
    public OptionalInt awaitExit(String environmentId, Duration timeout) throws InterruptedException {
        FakeContainer container = container(environmentId);
        try {
            return OptionalInt.of(container.exit.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return OptionalInt.empty();
        } catch (ExecutionException e) {
            throw new IllegalStateException(e.getCause());
        }
    }

    @Override
    public void resize(String environmentId, int cols, int rows) {
        container(environmentId);
        resizes.add(environmentId + ":" + cols + "x" + rows);
    }

    @Override
    public void stop(String environmentId, int timeoutSeconds) {
        FakeContainer container = containers.get(environmentId);
        if (container != null) {
            container.kill();
        }
    }

    @Override
    public void remove(String environmentId) {
        FakeContainer container = containers.remove(environmentId);
        if (container != null) {
            container.kill();
            removedIds.add(environmentId);
        }
    }

    private FakeContainer container(String environmentId) {
        FakeContainer container = containers.get(environmentId);
        if (container == null) {
            throw new IllegalStateException("No such container: " + environmentId);
        }
        return container;
    }

    /**
     * 프로그램에서 보는 프로세스 (출력, stdin, 스펙)
     */
    public static final class FakeProcess {

        private final FakeContainer container;
        private BufferedReader reader;

        private FakeProcess(FakeContainer container) {
            this.container = container;
        }

        public EnvironmentSpec spec() {
            return container.spec;
        }

        public void print(String text) {
            if (!container.killed && !container.detached && container.onOutput != null) {
                container.onOutput.accept(text.getBytes(StandardCharsets.UTF_8));
            }
        }

        public void printBytes(byte[] bytes) {
            if (!container.killed && !container.detached && container.onOutput != null) {
                container.onOutput.accept(bytes);
            }
        }

        /**
         * @return 다음 stdin 줄, EOF 거나 stdin 이 없으면 null
         */
        public String readLine() throws IOException {
            if (container.stdin == null) {
                return null;
            }
            if (reader == null) {
                reader = new BufferedReader(new InputStreamReader(container.stdin, StandardCharsets.UTF_8));
            }
            return reader.readLine();
        }

        public boolean isKilled() {
            return container.killed;
        }
    }

    private static final class FakeContainer {

        private final String id;
        private final EnvironmentSpec spec;
        private final CompletableFuture<Integer> exit = new CompletableFuture<>();
        private final CountDownLatch outputDone = new CountDownLatch(1);

        private volatile InputStream stdin;
        private volatile Consumer<byte[]> onOutput;
        private volatile Runnable onEnd;
        private volatile Thread thread;
        private volatile boolean killed;
        private volatile boolean detached;

        private FakeContainer(String id, EnvironmentSpec spec) {
            this.id = id;
            this.spec = spec;
        }

        private void execute(Program program) {
            int code;
            try {
                code = program.run(new FakeProcess(this));
            } catch (InterruptedException e) {
                code = 137;
            } catch (Exception e) {
                code = 1;
            }
            exit.complete(code);
            outputDone.countDown();
            Runnable end = onEnd;
            if (end != null && !detached) {
                end.run();
            }
        }

        private void kill() {
            killed = true;
            Thread running = thread;
            if (running != null) {
                running.interrupt();
            }
            if (stdin != null) {
                try {
                    stdin.close();
                } catch (IOException e) {
                    // 이미 닫힘
                }
            }
        }

        @Override
        public String toString() {
            return "FakeContainer[" + id + "]";
        }
    }
}
