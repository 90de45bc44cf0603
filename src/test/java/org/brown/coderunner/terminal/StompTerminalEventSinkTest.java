package org.brown.coderunner.terminal;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class StompTerminalEventSinkTest {

    private final SimpMessagingTemplate messagingTemplate = mock(SimpMessagingTemplate.class);
    private final StompTerminalEventSink sink = new StompTerminalEventSink(messagingTemplate);

    @Test
    @SuppressWarnings("unchecked")
    void eventsGoOnlyToOwningConnection() {
        TerminalEvent event = TerminalEvent.output("s-1", "$ ");

        sink.publish("ws-1", event);

        ArgumentCaptor<Map<String, Object>> headers = ArgumentCaptor.forClass(Map.class);
        verify(messagingTemplate).convertAndSendToUser(eq("ws-1"), eq("/queue/terminal"), eq(event), headers.capture());
        assertThat(SimpMessageHeaderAccessor.getSessionId(headers.getValue())).isEqualTo("ws-1");
    }

    @Test
    void deliveryFailureIsNotPropagated() {
        doThrow(new MessageDeliveryException("broker stopped"))
                .when(messagingTemplate).convertAndSendToUser(anyString(), anyString(), any(), anyMap());

        assertThatCode(() -> sink.publish("ws-1", TerminalEvent.closed("s-1", "idle timeout")))
                .doesNotThrowAnyException();
    }
}
