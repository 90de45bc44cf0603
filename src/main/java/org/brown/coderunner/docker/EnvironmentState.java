package org.brown.coderunner.docker;

/**
 * CREATED → STARTED → ATTACHED → EXITED → REMOVED
 *
 * 출력 유실을 막기 위해 스트림은 시작 전에 연결하지만, ATTACHED 는 시작된 뒤에만 된다.
 */
public enum EnvironmentState {
    CREATED,
    STARTED,
    ATTACHED,
    EXITED,
    REMOVED
}
