package org.brown.coderunner.terminal;

/**
 * 세션 이벤트를 소유자(WebSocket 연결)에게 전달하는 출구
 *
 * 같은 소유자에게 보낸 이벤트는 publish 호출 순서대로 도착해야 한다.
 */
public interface TerminalEventSink {

    void publish(String ownerId, TerminalEvent event);
}
