package org.brown.coderunner.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.coderunner.config.RunnerProperties;
import org.brown.coderunner.docker.ImageCache;
import org.brown.coderunner.execution.AdmissionLimiter;
import org.brown.coderunner.execution.ExecutionService;
import org.brown.coderunner.language.LanguageProfileRegistry;
import org.brown.coderunner.terminal.TerminalSessionRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runner 상태 확인 API
 *
 * 엔드포인트:
 * - GET /health: 간단한 헬스체크
 * - GET /status: 실행 모드, admission, 터미널 세션, 이미지 캐시, 언어별 이미지
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class RunnerStatusController {

    private final RunnerProperties runnerProperties;
    private final ExecutionService executionService;
    private final AdmissionLimiter admissionLimiter;
    private final TerminalSessionRegistry terminalSessionRegistry;
    private final ImageCache imageCache;
    private final LanguageProfileRegistry languageProfileRegistry;

    @GetMapping("/health")
    public String health() {
        return "OK";
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();

        status.put("status", "UP");
        status.put("application", "CodeRunner");
        status.put("mode", executionService.getMode());

        Map<String, Object> admission = new LinkedHashMap<>();
        admission.put("maxConcurrentEnvironments", admissionLimiter.getMaxPermits());
        admission.put("available", admissionLimiter.getAvailablePermits());
        status.put("admission", admission);

        status.put("terminalSessions", terminalSessionRegistry.countByState());
        status.put("imageCache", imageCache.snapshot());

        Map<String, String> languages = new LinkedHashMap<>();
        languageProfileRegistry.all().forEach((language, profile) -> languages.put(language.getId(), profile.getImage()));
        status.put("languages", languages);

        Map<String, Object> sqs = new LinkedHashMap<>();
        sqs.put("enabled", runnerProperties.getPolling().isEnabled());
        sqs.put("queueUrl", maskSensitiveUrl(runnerProperties.getSqs().getQueueUrl()));
        status.put("sqs", sqs);
        status.put("redisEnabled", runnerProperties.getRedis().isEnabled());

        log.debug("Status check requested");
        return status;
    }

    /**
     * 민감한 URL 마스킹
     */
    private String maskSensitiveUrl(String url) {
        if (url == null) return "N/A";
        int lastSlash = url.lastIndexOf('/');
        if (lastSlash > 0) {
            return url.substring(0, lastSlash + 1) + "***";
        }
        return "***";
    }
}
