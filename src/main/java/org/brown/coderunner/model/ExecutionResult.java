package org.brown.coderunner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * 배치 실행 결과 (생성 후 불변)
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionResult {

    String executionId;

    ExecutionStatus status;

    /**
     * stdout + stderr 를 도착 순서대로 합친 출력
     */
    String output;

    /**
     * 실제로 측정한 종료 코드. 측정하지 못했으면 null (타임아웃, 시뮬레이션, 플랫폼 실패)
     */
    Integer exitCode;

    ErrorKind errorKind;

    /**
     * 실제 격리 실행이 아닌 시뮬레이션 결과인지 여부
     */
    boolean simulated;

    long durationMillis;

    @JsonIgnore
    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }

    public static ExecutionResult failure(String executionId, ErrorKind errorKind, String message, long durationMillis) {
        return ExecutionResult.builder()
                .executionId(executionId)
                .status(ExecutionStatus.ERROR)
                .output(message != null ? message : "")
                .errorKind(errorKind)
                .durationMillis(durationMillis)
                .build();
    }

    @Override
    public String toString() {
        return String.format(
                "ExecutionResult[executionId=%s, status=%s, exitCode=%s, errorKind=%s, simulated=%s, durationMillis=%d]",
                executionId, status, exitCode, errorKind, simulated, durationMillis
        );
    }
}
