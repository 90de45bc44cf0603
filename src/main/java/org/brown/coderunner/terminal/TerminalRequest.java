package org.brown.coderunner.terminal;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 클라이언트 → 서버 터미널 메시지
 *
 * create: {language}, input: {sessionId, data}, resize: {sessionId, cols, rows}, close: {sessionId}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TerminalRequest {

    private String type;
    private String sessionId;
    private String language;
    private String data;
    private int cols;
    private int rows;
}
