package org.brown.coderunner.terminal;

import lombok.extern.slf4j.Slf4j;
import org.brown.coderunner.docker.EnvironmentAttachment;
import org.brown.coderunner.docker.EnvironmentProvisioner;
import org.brown.coderunner.docker.IsolatedEnvironment;
import org.brown.coderunner.exception.InputAfterCloseException;
import org.brown.coderunner.execution.AdmissionLimiter;
import org.brown.coderunner.model.ErrorKind;
import org.brown.coderunner.workspace.Workspace;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 터미널 세션 하나 = 격리 환경 하나 (세션 수명 동안 유지)
 *
 * 입력, resize, close 는 mailbox 를 통해 세션 actor 스레드 하나가 순서대로 처리한다.
 * 출력 전송과 CLOSING 전이는 같은 outputLock 아래에서 일어나므로 CLOSING 이후에는 출력이 나가지 않는다.
 * created 이벤트 전에 나온 출력(셸의 첫 프롬프트 등)은 모아 두었다가 created 바로 뒤에 보낸다.
 */
@Slf4j
public class TerminalSession {

    private static final int STDIN_PIPE_SIZE = 64 * 1024;

    private final String id;
    private final String ownerId;
    private final String language;
    private final AdmissionLimiter.Permit permit;
    private final Workspace workspace;
    private final IsolatedEnvironment environment;
    private final EnvironmentProvisioner provisioner;
    private final TerminalEventSink sink;

    private final BlockingQueue<TerminalCommand> mailbox = new LinkedBlockingQueue<>();
    private final Object outputLock = new Object();
    private final AtomicBoolean streamEnded = new AtomicBoolean(false);
    private final AtomicBoolean released = new AtomicBoolean(false);
    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
    private ByteBuffer undecoded = ByteBuffer.allocate(0);
    private final List<String> pendingOutput = new ArrayList<>();
    private boolean announced;

    private PipedOutputStream stdinPipe;
    private EnvironmentAttachment attachment;

    private volatile TerminalState state = TerminalState.CREATED;
    private volatile long lastActivityAt = System.currentTimeMillis();
    private volatile long closedAt;

    TerminalSession(String id, String ownerId, String language, AdmissionLimiter.Permit permit, Workspace workspace,
                    IsolatedEnvironment environment, EnvironmentProvisioner provisioner, TerminalEventSink sink) {
        this.id = id;
        this.ownerId = ownerId;
        this.language = language;
        this.permit = permit;
        this.workspace = workspace;
        this.environment = environment;
        this.provisioner = provisioner;
        this.sink = sink;
    }

    /**
     * stdin 파이프 + 출력 스트림 연결 후 환경 시작. 실패하면 호출자가 {@link #release()} 한다.
     */
    void open() throws IOException {
        PipedInputStream stdinSource = new PipedInputStream(STDIN_PIPE_SIZE);
        stdinPipe = new PipedOutputStream(stdinSource);
        attachment = provisioner.attach(environment, stdinSource, this::emitOutput, this::onStreamEnd);
        provisioner.start(environment);

        synchronized (outputLock) {
            state = TerminalState.ACTIVE;
        }
        log.info("Terminal session {} active (owner={}, language={}, environment={})",
                id, ownerId, language, environment.getId());
        if (streamEnded.get()) {
            requestClose("environment exited");
        }
    }

    /**
     * created 이벤트를 소유자에게 보내고 그때까지 쌓인 출력을 순서대로 이어 보낸다.
     */
    void announce() {
        synchronized (outputLock) {
            sink.publish(ownerId, TerminalEvent.created(id, language));
            announced = true;
            pendingOutput.forEach(text -> sink.publish(ownerId, TerminalEvent.output(id, text)));
            pendingOutput.clear();
        }
    }

    /**
     * 입력/resize 를 mailbox 에 넣는다.
     *
     * @throws InputAfterCloseException CLOSING 또는 CLOSED 세션
     */
    void submit(TerminalCommand command) {
        synchronized (outputLock) {
            if (state != TerminalState.ACTIVE) {
                throw new InputAfterCloseException("Terminal session " + id + " is " + state.name().toLowerCase());
            }
            lastActivityAt = System.currentTimeMillis();
            mailbox.add(command);
        }
    }

    /**
     * 세션 종료 요청. 여러 번 호출해도 한 번만 처리된다.
     *
     * @return 이번 호출이 종료를 시작했으면 true
     */
    boolean requestClose(String reason) {
        synchronized (outputLock) {
            if (state != TerminalState.ACTIVE) {
                return false;
            }
            state = TerminalState.CLOSING;
            mailbox.add(new TerminalCommand.Close(reason));
        }
        log.info("Terminal session {} closing: {}", id, reason);
        return true;
    }

    /**
     * actor 루프. Close 명령을 처리하면 끝난다.
     */
    void run() {
        MDC.put("sessionId", id);
        try {
            while (true) {
                TerminalCommand command = mailbox.take();
                if (command instanceof TerminalCommand.Input input) {
                    writeInput(input.data());
                } else if (command instanceof TerminalCommand.Resize resize) {
                    applyResize(resize.cols(), resize.rows());
                } else if (command instanceof TerminalCommand.Close close) {
                    finish(close.reason());
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            synchronized (outputLock) {
                state = TerminalState.CLOSING;
            }
            finish("terminal service shutting down");
        } finally {
            MDC.remove("sessionId");
        }
    }

    private void writeInput(String data) {
        if (state != TerminalState.ACTIVE) {
            return;
        }
        try {
            stdinPipe.write(data.getBytes(StandardCharsets.UTF_8));
            stdinPipe.flush();
        } catch (IOException e) {
            log.warn("Failed to write input to terminal session {}", id, e);
            sink.publish(ownerId, TerminalEvent.error(id, ErrorKind.INFRASTRUCTURE_ERROR.getWireName(),
                    "Terminal input stream is broken"));
            requestClose("input stream broken");
        }
    }

    private void applyResize(int cols, int rows) {
        if (state != TerminalState.ACTIVE) {
            return;
        }
        try {
            provisioner.resize(environment, cols, rows);
            log.debug("Resized terminal session {} to {}x{}", id, cols, rows);
        } catch (RuntimeException e) {
            log.warn("Failed to resize terminal session {} to {}x{}", id, cols, rows, e);
            sink.publish(ownerId, TerminalEvent.error(id, ErrorKind.INFRASTRUCTURE_ERROR.getWireName(),
                    "Resize failed: " + e.getMessage()));
        }
    }

    private void finish(String reason) {
        release();
        closedAt = System.currentTimeMillis();
        state = TerminalState.CLOSED;
        sink.publish(ownerId, TerminalEvent.closed(id, reason));
        log.info("Terminal session {} closed: {}", id, reason);
    }

    /**
     * 보유 리소스를 역순으로 정리 (stdin → 스트림 → 환경 → 워크스페이스 → permit). 한 번만 수행한다.
     */
    void release() {
        if (!released.compareAndSet(false, true)) {
            return;
        }
        if (stdinPipe != null) {
            try {
                stdinPipe.close();
            } catch (IOException e) {
                log.debug("Error closing stdin pipe of session {}", id, e);
            }
        }
        if (attachment != null) {
            attachment.close();
        }
        try {
            environment.close();
        } finally {
            try {
                workspace.close();
            } finally {
                permit.close();
            }
        }
    }

    private void emitOutput(byte[] chunk) {
        synchronized (outputLock) {
            String text = decode(chunk);
            if (state == TerminalState.CLOSING || state == TerminalState.CLOSED || text.isEmpty()) {
                return;
            }
            if (!announced) {
                pendingOutput.add(text);
                return;
            }
            sink.publish(ownerId, TerminalEvent.output(id, text));
        }
    }

    private void onStreamEnd() {
        streamEnded.set(true);
        requestClose("environment exited");
    }

    // 프레임 경계에서 잘린 멀티바이트 문자는 다음 청크와 합쳐서 디코딩
    private String decode(byte[] chunk) {
        ByteBuffer input = ByteBuffer.allocate(undecoded.remaining() + chunk.length);
        input.put(undecoded).put(chunk).flip();
        CharBuffer output = CharBuffer.allocate(input.remaining());
        decoder.decode(input, output, false);
        undecoded = ByteBuffer.allocate(input.remaining()).put(input).flip();
        return output.flip().toString();
    }

    public String getId() {
        return id;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public String getLanguage() {
        return language;
    }

    public TerminalState getState() {
        return state;
    }

    public long getLastActivityAt() {
        return lastActivityAt;
    }

    public long getClosedAt() {
        return closedAt;
    }

    IsolatedEnvironment getEnvironment() {
        return environment;
    }

    @Override
    public String toString() {
        return String.format("TerminalSession[id=%s, owner=%s, language=%s, state=%s]", id, ownerId, language, state);
    }
}
