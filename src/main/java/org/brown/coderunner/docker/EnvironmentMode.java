package org.brown.coderunner.docker;

public enum EnvironmentMode {
    /** 일회성 실행: 네트워크 없음, 종료 후 제거 */
    BATCH,
    /** 터미널 세션: TTY, 브리지 네트워크, 세션 종료 시 제거 */
    INTERACTIVE
}
