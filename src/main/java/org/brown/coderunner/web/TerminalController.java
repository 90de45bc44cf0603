package org.brown.coderunner.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.coderunner.exception.SandboxException;
import org.brown.coderunner.terminal.TerminalEvent;
import org.brown.coderunner.terminal.TerminalEventSink;
import org.brown.coderunner.terminal.TerminalRequest;
import org.brown.coderunner.terminal.TerminalSessionManager;
import org.springframework.context.event.EventListener;
import org.springframework.lang.Nullable;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

/**
 * 터미널 STOMP 컨트롤러
 *
 * 세션의 소유자는 WebSocket 연결(STOMP 세션 ID)이며, 연결이 끊기면 그 연결의 세션을 모두 닫는다.
 * 세션 이벤트(created, output, error, closed)는 모두 소유자의 /user/queue/terminal 로 간다.
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class TerminalController {

    private final TerminalSessionManager terminalSessionManager;
    private final TerminalEventSink terminalEventSink;

    @MessageMapping("/terminal/create")
    public void create(@Payload(required = false) @Nullable TerminalRequest request,
                       SimpMessageHeaderAccessor headerAccessor) {
        String ownerId = headerAccessor.getSessionId();
        String language = request != null ? request.getLanguage() : null;
        try {
            terminalSessionManager.create(ownerId, language);
        } catch (SandboxException e) {
            log.error("[FAIL][{}] Terminal session creation failed for owner {}: {}",
                    e.getErrorKind().getWireName(), ownerId, e.getMessage());
            terminalEventSink.publish(ownerId, TerminalEvent.error(null, e.getErrorKind().getWireName(), e.getMessage()));
        }
    }

    @MessageMapping("/terminal/input")
    public void input(@Payload TerminalRequest request, SimpMessageHeaderAccessor headerAccessor) {
        terminalSessionManager.sendInput(headerAccessor.getSessionId(), request.getSessionId(), request.getData());
    }

    @MessageMapping("/terminal/resize")
    public void resize(@Payload TerminalRequest request, SimpMessageHeaderAccessor headerAccessor) {
        terminalSessionManager.resize(headerAccessor.getSessionId(), request.getSessionId(),
                request.getCols(), request.getRows());
    }

    @MessageMapping("/terminal/close")
    public void close(@Payload TerminalRequest request, SimpMessageHeaderAccessor headerAccessor) {
        terminalSessionManager.close(headerAccessor.getSessionId(), request.getSessionId());
    }

    @MessageExceptionHandler(SandboxException.class)
    @SendToUser("/queue/terminal/errors")
    public TerminalEvent handleSandboxException(SandboxException e) {
        log.warn("Terminal request rejected: {}", e.getMessage());
        return TerminalEvent.error(null, e.getErrorKind().getWireName(), e.getMessage());
    }

    @MessageExceptionHandler(IllegalArgumentException.class)
    @SendToUser("/queue/terminal/errors")
    public TerminalEvent handleInvalidRequest(IllegalArgumentException e) {
        return TerminalEvent.error(null, null, e.getMessage());
    }

    @EventListener
    public void handleWebSocketDisconnect(SessionDisconnectEvent event) {
        String ownerId = event.getSessionId();
        if (ownerId != null) {
            log.info("WebSocket disconnected: {}, closing its terminal sessions", ownerId);
            terminalSessionManager.closeOwnedBy(ownerId);
        }
    }
}
