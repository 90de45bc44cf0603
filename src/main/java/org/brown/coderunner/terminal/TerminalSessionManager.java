package org.brown.coderunner.terminal;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.brown.coderunner.config.RunnerProperties;
import org.brown.coderunner.docker.EnvironmentMode;
import org.brown.coderunner.docker.EnvironmentProvisioner;
import org.brown.coderunner.docker.ImageCache;
import org.brown.coderunner.docker.IsolatedEnvironment;
import org.brown.coderunner.exception.InfrastructureException;
import org.brown.coderunner.exception.SessionNotFoundException;
import org.brown.coderunner.exception.SimulationUnavailableException;
import org.brown.coderunner.exception.WorkspaceIOException;
import org.brown.coderunner.execution.AdmissionLimiter;
import org.brown.coderunner.language.Language;
import org.brown.coderunner.language.LanguageProfile;
import org.brown.coderunner.language.LanguageProfileRegistry;
import org.brown.coderunner.workspace.Workspace;
import org.brown.coderunner.workspace.WorkspaceManager;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 인터랙티브 터미널 세션 관리
 *
 * 세션마다 admission permit, 빈 워크스페이스, INTERACTIVE 환경을 하나씩 잡고
 * 세션이 닫힐 때 모두 정리한다. 세션 actor 는 cached thread pool 에서 돈다.
 * 세션은 만든 연결(ownerId)만 다룰 수 있다. 다른 연결에는 존재하지 않는 세션처럼 보인다.
 */
@Slf4j
@Service
public class TerminalSessionManager {

    private final LanguageProfileRegistry languageProfileRegistry;
    private final AdmissionLimiter admissionLimiter;
    private final WorkspaceManager workspaceManager;
    private final ImageCache imageCache;
    private final EnvironmentProvisioner provisioner;
    private final TerminalSessionRegistry registry;
    private final TerminalEventSink sink;
    private final RunnerProperties runnerProperties;
    private final ExecutorService actorExecutor =
            Executors.newCachedThreadPool(new CustomizableThreadFactory("terminal-session-"));

    public TerminalSessionManager(LanguageProfileRegistry languageProfileRegistry, AdmissionLimiter admissionLimiter,
                                  WorkspaceManager workspaceManager, ImageCache imageCache,
                                  EnvironmentProvisioner provisioner, TerminalSessionRegistry registry,
                                  TerminalEventSink sink, RunnerProperties runnerProperties) {
        this.languageProfileRegistry = languageProfileRegistry;
        this.admissionLimiter = admissionLimiter;
        this.workspaceManager = workspaceManager;
        this.imageCache = imageCache;
        this.provisioner = provisioner;
        this.registry = registry;
        this.sink = sink;
        this.runnerProperties = runnerProperties;
    }

    /**
     * 새 세션 생성. 언어가 비어 있으면 shell. 성공하면 created 이벤트가 소유자에게 간다.
     *
     * 실패하면 그때까지 잡은 리소스를 모두 돌려놓고 원래 예외(SandboxException 하위 타입)를 던진다.
     *
     * @throws SimulationUnavailableException 시뮬레이션 모드. 아무 리소스도 잡지 않는다.
     */
    public TerminalSession create(String ownerId, String languageId) {
        LanguageProfile profile = languageId == null || languageId.isBlank()
                ? languageProfileRegistry.lookup(Language.SHELL)
                : languageProfileRegistry.lookup(languageId);
        if (runnerProperties.getSimulation().isEnabled()) {
            throw new SimulationUnavailableException("Interactive terminal unavailable for " + profile.getId()
                    + ": simulation mode is active and no isolated environment can be started");
        }
        String sessionId = UUID.randomUUID().toString();
        log.info("Creating terminal session {} for owner {} (language={})", sessionId, ownerId, profile.getId());

        AdmissionLimiter.Permit permit = null;
        Workspace workspace = null;
        IsolatedEnvironment environment = null;
        try {
            permit = admissionLimiter.acquire(sessionId);
            workspace = workspaceManager.acquireEmpty(sessionId);
            imageCache.ensureAvailable(profile.getImage());
            environment = provisioner.provision(profile, workspace, EnvironmentMode.INTERACTIVE);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeAll(environment, workspace, permit);
            throw new InfrastructureException("Interrupted while creating terminal session " + sessionId, e);
        } catch (RuntimeException e) {
            closeAll(environment, workspace, permit);
            throw e;
        }

        TerminalSession session = new TerminalSession(sessionId, ownerId, profile.getId(), permit, workspace,
                environment, provisioner, sink);
        try {
            session.open();
        } catch (IOException e) {
            session.release();
            throw new WorkspaceIOException("Failed to open stdin pipe for terminal session " + sessionId, e);
        } catch (RuntimeException e) {
            session.release();
            throw e;
        }

        registry.register(session);
        session.announce();
        actorExecutor.execute(session::run);
        return session;
    }

    public void sendInput(String ownerId, String sessionId, String data) {
        TerminalSession session = find(ownerId, sessionId);
        if (data == null || data.isEmpty()) {
            return;
        }
        session.submit(new TerminalCommand.Input(data));
    }

    public void resize(String ownerId, String sessionId, int cols, int rows) {
        TerminalSession session = find(ownerId, sessionId);
        if (cols <= 0 || rows <= 0) {
            throw new IllegalArgumentException("Terminal size must be positive: " + cols + "x" + rows);
        }
        session.submit(new TerminalCommand.Resize(cols, rows));
    }

    /**
     * 이미 닫히는 중이거나 닫힌 세션이면 아무 일도 하지 않는다.
     */
    public void close(String ownerId, String sessionId) {
        find(ownerId, sessionId).requestClose("closed by client");
    }

    /**
     * 연결이 끊긴 소유자의 세션을 모두 닫는다.
     */
    public int closeOwnedBy(String ownerId) {
        int closed = 0;
        for (TerminalSession session : registry.ownedBy(ownerId)) {
            if (session.requestClose("owner disconnected")) {
                closed++;
            }
        }
        if (closed > 0) {
            log.info("Closed {} terminal session(s) of disconnected owner {}", closed, ownerId);
        }
        return closed;
    }

    /**
     * 유휴 세션 종료 + 오래된 CLOSED 레코드 정리
     */
    @Scheduled(fixedDelayString = "${runner.terminal.reaperFixedDelayMs:30000}")
    public void reap() {
        long now = System.currentTimeMillis();
        RunnerProperties.TerminalConfig config = runnerProperties.getTerminal();
        for (TerminalSession session : registry.all()) {
            if (session.getState() == TerminalState.ACTIVE
                    && now - session.getLastActivityAt() >= config.getIdleTimeoutMs()) {
                session.requestClose("idle timeout");
            } else if (session.getState() == TerminalState.CLOSED
                    && now - session.getClosedAt() >= config.getClosedRetentionMs()) {
                registry.remove(session.getId());
                log.debug("Evicted closed terminal session {}", session.getId());
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down terminal sessions");
        registry.all().forEach(session -> session.requestClose("terminal service shutting down"));
        actorExecutor.shutdown();
        try {
            long waitSeconds = runnerProperties.getTerminal().getStopTimeoutSeconds() + 5L;
            if (!actorExecutor.awaitTermination(waitSeconds, TimeUnit.SECONDS)) {
                log.warn("Terminal session actors did not finish in {}s, interrupting", waitSeconds);
                actorExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            actorExecutor.shutdownNow();
        }
    }

    private TerminalSession find(String ownerId, String sessionId) {
        return registry.find(sessionId)
                .filter(session -> session.getOwnerId().equals(ownerId))
                .orElseThrow(() -> new SessionNotFoundException("Terminal session not found: " + sessionId));
    }

    private static void closeAll(IsolatedEnvironment environment, Workspace workspace, AdmissionLimiter.Permit permit) {
        if (environment != null) {
            environment.close();
        }
        if (workspace != null) {
            workspace.close();
        }
        if (permit != null) {
            permit.close();
        }
    }
}
