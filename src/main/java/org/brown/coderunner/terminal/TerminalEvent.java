package org.brown.coderunner.terminal;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * 서버 → 클라이언트 터미널 이벤트
 *
 * type: created | output | error | closed
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TerminalEvent {

    public static final String CREATED = "created";
    public static final String OUTPUT = "output";
    public static final String ERROR = "error";
    public static final String CLOSED = "closed";

    String type;
    String sessionId;
    String language;
    String data;
    String message;
    String errorKind;

    public static TerminalEvent created(String sessionId, String language) {
        return TerminalEvent.builder().type(CREATED).sessionId(sessionId).language(language).build();
    }

    public static TerminalEvent output(String sessionId, String data) {
        return TerminalEvent.builder().type(OUTPUT).sessionId(sessionId).data(data).build();
    }

    public static TerminalEvent error(String sessionId, String errorKind, String message) {
        return TerminalEvent.builder().type(ERROR).sessionId(sessionId).errorKind(errorKind).message(message).build();
    }

    public static TerminalEvent closed(String sessionId, String reason) {
        return TerminalEvent.builder().type(CLOSED).sessionId(sessionId).message(reason).build();
    }
}
