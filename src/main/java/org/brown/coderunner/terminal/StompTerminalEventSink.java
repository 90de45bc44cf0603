package org.brown.coderunner.terminal;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessageHeaders;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * 소유자 STOMP 세션의 /user/queue/terminal 로 이벤트 전송
 *
 * 세션 ID 를 user 로 쓰면 그 연결 하나에만 전달된다. 다른 연결은 구독해도 받지 못한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompTerminalEventSink implements TerminalEventSink {

    static final String DESTINATION = "/queue/terminal";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void publish(String ownerId, TerminalEvent event) {
        try {
            messagingTemplate.convertAndSendToUser(ownerId, DESTINATION, event, sessionHeaders(ownerId));
        } catch (RuntimeException e) {
            log.warn("Failed to deliver {} event for session {} to {}", event.getType(), event.getSessionId(), ownerId, e);
        }
    }

    private static MessageHeaders sessionHeaders(String ownerId) {
        SimpMessageHeaderAccessor accessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        accessor.setSessionId(ownerId);
        accessor.setLeaveMutable(true);
        return accessor.getMessageHeaders();
    }
}
