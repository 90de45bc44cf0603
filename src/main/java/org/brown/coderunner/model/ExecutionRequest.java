package org.brown.coderunner.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 배치 실행 요청 DTO
 *
 * JSON 스키마 예시:
 * {
 *   "executionId": "uuid-string",   (생략 시 서버에서 생성)
 *   "language": "python",
 *   "code": "print('hi')",
 *   "input": "Ada",
 *   "timeoutMs": 5000
 * }
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionRequest {

    @JsonProperty("executionId")
    @JsonAlias("requestId")
    private String executionId;

    @JsonProperty("language")
    @JsonAlias("runtime")
    private String language;

    @JsonProperty("sourceCode")
    @JsonAlias("code")
    private String sourceCode;

    @JsonProperty("stdin")
    @JsonAlias("input")
    private String stdin;

    @JsonProperty("timeoutMs")
    private Long timeoutMs;  // 없으면 기본 타임아웃

    public ExecutionRequest(String executionId, String language, String sourceCode, String stdin) {
        this(executionId, language, sourceCode, stdin, null);
    }

    public boolean hasStdin() {
        return stdin != null && !stdin.isEmpty();
    }

    @Override
    public String toString() {
        return String.format(
                "ExecutionRequest[executionId=%s, language=%s, sourceLength=%d, stdinLength=%d, timeoutMs=%s]",
                executionId, language,
                sourceCode != null ? sourceCode.length() : 0,
                stdin != null ? stdin.length() : 0,
                timeoutMs
        );
    }
}
