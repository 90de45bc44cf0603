package org.brown.coderunner.terminal;

/**
 * 터미널 세션 상태. CLOSING 이후로는 되돌아가지 않는다.
 */
public enum TerminalState {
    CREATED,
    ACTIVE,
    CLOSING,
    CLOSED
}
