package org.brown.coderunner.web;

import org.brown.coderunner.exception.CapacityExceededException;
import org.brown.coderunner.exception.InputAfterCloseException;
import org.brown.coderunner.exception.SimulationUnavailableException;
import org.brown.coderunner.terminal.TerminalEvent;
import org.brown.coderunner.terminal.TerminalEventSink;
import org.brown.coderunner.terminal.TerminalRequest;
import org.brown.coderunner.terminal.TerminalSessionManager;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.messaging.Message;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TerminalControllerTest {

    private final TerminalSessionManager manager = mock(TerminalSessionManager.class);
    private final TerminalEventSink sink = mock(TerminalEventSink.class);
    private final TerminalController controller = new TerminalController(manager, sink);

    @Test
    void createIsDelegatedWithConnectionAsOwner() {
        controller.create(new TerminalRequest(null, null, "python", null, 0, 0), headers("ws-1"));

        verify(manager).create("ws-1", "python");
        verifyNoInteractions(sink);
    }

    @Test
    void createFailureIsSentToOwnerAsErrorEvent() {
        when(manager.create("ws-1", null)).thenThrow(new CapacityExceededException("Too many concurrent environments"));

        controller.create(null, headers("ws-1"));

        ArgumentCaptor<TerminalEvent> event = ArgumentCaptor.forClass(TerminalEvent.class);
        verify(sink).publish(eq("ws-1"), event.capture());
        assertThat(event.getValue().getType()).isEqualTo(TerminalEvent.ERROR);
        assertThat(event.getValue().getErrorKind()).isEqualTo("CapacityExceeded");
        assertThat(event.getValue().getMessage()).contains("Too many");
    }

    @Test
    void simulationModeCreateIsReportedAsSimulatedExecution() {
        when(manager.create("ws-1", "shell"))
                .thenThrow(new SimulationUnavailableException("Interactive terminal unavailable for shell"));

        controller.create(new TerminalRequest(null, null, "shell", null, 0, 0), headers("ws-1"));

        ArgumentCaptor<TerminalEvent> event = ArgumentCaptor.forClass(TerminalEvent.class);
        verify(sink).publish(eq("ws-1"), event.capture());
        assertThat(event.getValue().getErrorKind()).isEqualTo("SimulatedExecution");
    }

    @Test
    void inputResizeAndCloseCarryCallingConnection() {
        controller.input(new TerminalRequest("input", "s-1", null, "ls\n", 0, 0), headers("ws-1"));
        controller.resize(new TerminalRequest("resize", "s-1", null, null, 100, 30), headers("ws-1"));
        controller.close(new TerminalRequest("close", "s-1", null, null, 0, 0), headers("ws-2"));

        verify(manager).sendInput("ws-1", "s-1", "ls\n");
        verify(manager).resize("ws-1", "s-1", 100, 30);
        verify(manager).close("ws-2", "s-1");
    }

    @Test
    void sandboxErrorsBecomeErrorEvents() {
        TerminalEvent event = controller.handleSandboxException(new InputAfterCloseException("Terminal session s-1 is closed"));

        assertThat(event.getType()).isEqualTo(TerminalEvent.ERROR);
        assertThat(event.getErrorKind()).isEqualTo("InputAfterClose");
    }

    @Test
    void disconnectClosesOwnedSessions() {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(StompCommand.DISCONNECT);
        accessor.setSessionId("ws-9");
        Message<byte[]> message = MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());

        controller.handleWebSocketDisconnect(new SessionDisconnectEvent(this, message, "ws-9", CloseStatus.NORMAL));

        verify(manager).closeOwnedBy("ws-9");
    }

    private static SimpMessageHeaderAccessor headers(String sessionId) {
        SimpMessageHeaderAccessor accessor = SimpMessageHeaderAccessor.create();
        accessor.setSessionId(sessionId);
        return accessor;
    }
}
