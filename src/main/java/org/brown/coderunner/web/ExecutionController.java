package org.brown.coderunner.web;

import lombok.extern.slf4j.Slf4j;
import org.brown.coderunner.config.RunnerProperties;
import org.brown.coderunner.exception.UnsupportedLanguageException;
import org.brown.coderunner.execution.ExecutionService;
import org.brown.coderunner.model.ErrorKind;
import org.brown.coderunner.model.ExecutionRequest;
import org.brown.coderunner.model.ExecutionResult;
import org.brown.coderunner.redis.RedisResultPublisher;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 배치 실행 API
 *
 * 엔드포인트:
 * - POST /api/execute: 코드 실행 후 결과 반환 (Redis 가 켜져 있으면 result:{executionId} 로도 전송)
 */
@Slf4j
@RestController
public class ExecutionController {

    private final ExecutionService executionService;
    private final RunnerProperties runnerProperties;
    private final ObjectProvider<RedisResultPublisher> redisResultPublisher;

    public ExecutionController(ExecutionService executionService, RunnerProperties runnerProperties,
                               ObjectProvider<RedisResultPublisher> redisResultPublisher) {
        this.executionService = executionService;
        this.runnerProperties = runnerProperties;
        this.redisResultPublisher = redisResultPublisher;
    }

    @PostMapping("/api/execute")
    public ResponseEntity<?> execute(@RequestBody ExecutionRequest request) {
        if (isBlank(request.getLanguage()) || isBlank(request.getSourceCode())) {
            return ResponseEntity.badRequest().body(error(null, "language and code are required"));
        }
        if (isBlank(request.getExecutionId())) {
            request.setExecutionId(UUID.randomUUID().toString());
        }

        ExecutionResult result = executionService.run(request,
                runnerProperties.getExecution().resolveTimeout(request.getTimeoutMs()));

        RedisResultPublisher publisher = redisResultPublisher.getIfAvailable();
        if (publisher != null) {
            publisher.publishResult(result);
        }

        if (result.getErrorKind() == ErrorKind.CAPACITY_EXCEEDED) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(result);
        }
        return ResponseEntity.ok(result);
    }

    @ExceptionHandler(UnsupportedLanguageException.class)
    public ResponseEntity<Map<String, Object>> handleUnsupportedLanguage(UnsupportedLanguageException e) {
        log.warn("[FAIL][UNSUPPORTED_LANGUAGE] {}", e.getMessage());
        return ResponseEntity.badRequest().body(error(e.getErrorKind(), e.getMessage()));
    }

    private static Map<String, Object> error(ErrorKind errorKind, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (errorKind != null) {
            body.put("errorKind", errorKind);
        }
        body.put("message", message);
        return body;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
