package org.brown.coderunner.execution;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * 컨테이너 출력 수집기
 *
 * 프레임을 바이트 그대로 모았다가 마지막에 한 번 UTF-8 로 디코딩한다
 * (멀티바이트 문자가 프레임 경계에서 잘려도 깨지지 않는다). 최대 크기를 넘으면 버린다.
 */
class OutputCollector {

    static final String TRUNCATED_MARKER = "\n[output truncated]";

    private final int maxBytes;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private boolean truncated;

    OutputCollector(int maxBytes) {
        this.maxBytes = maxBytes;
    }

    synchronized void append(byte[] chunk) {
        int remaining = maxBytes - buffer.size();
        if (remaining <= 0) {
            truncated = true;
            return;
        }
        int length = Math.min(remaining, chunk.length);
        buffer.write(chunk, 0, length);
        if (length < chunk.length) {
            truncated = true;
        }
    }

    synchronized String asString() {
        String text = buffer.toString(StandardCharsets.UTF_8);
        return truncated ? text + TRUNCATED_MARKER : text;
    }
}
