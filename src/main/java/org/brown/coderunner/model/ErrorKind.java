package org.brown.coderunner.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 실행/세션 실패 분류
 *
 * 직렬화 시 wireName 을 사용한다 (예: "ExecutionTimeout").
 */
public enum ErrorKind {

    UNSUPPORTED_LANGUAGE("UnsupportedLanguage"),
    WORKSPACE_IO_ERROR("WorkspaceIOError"),
    IMAGE_UNAVAILABLE("ImageUnavailable"),
    ENVIRONMENT_START_ERROR("EnvironmentStartError"),
    EXECUTION_TIMEOUT("ExecutionTimeout"),
    INFRASTRUCTURE_ERROR("InfrastructureError"),
    SESSION_NOT_FOUND("SessionNotFound"),
    INPUT_AFTER_CLOSE("InputAfterClose"),
    CAPACITY_EXCEEDED("CapacityExceeded"),
    SIMULATED_EXECUTION("SimulatedExecution");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
