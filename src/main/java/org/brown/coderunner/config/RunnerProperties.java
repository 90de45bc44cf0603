package org.brown.coderunner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Runner 통합 설정 프로퍼티
 *
 * application.yml의 runner.* 설정을 바인딩
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "runner")
public class RunnerProperties {

    private WorkspaceConfig workspace = new WorkspaceConfig();
    private DockerConfig docker = new DockerConfig();
    private LimitsConfig limits = new LimitsConfig();
    private ExecutionConfig execution = new ExecutionConfig();
    private AdmissionConfig admission = new AdmissionConfig();
    private TerminalConfig terminal = new TerminalConfig();
    private SimulationConfig simulation = new SimulationConfig();
    private PollingConfig polling = new PollingConfig();
    private SqsConfig sqs = new SqsConfig();
    private AwsConfig aws = new AwsConfig();
    private RedisConfig redis = new RedisConfig();

    /**
     * 언어별 런타임 이미지 오버라이드 (예: python: python:3.12-alpine)
     */
    private Map<String, String> images = new HashMap<>();

    @Data
    public static class WorkspaceConfig {
        private String baseDir = "/tmp/coderunner";
    }

    @Data
    public static class DockerConfig {
        private String host;  // 비어 있으면 DOCKER_HOST 또는 기본 소켓 사용
        private String containerWorkDir = "/code";
        private int maxConnections = 100;
        private long connectionTimeoutSeconds = 30;
        private long responseTimeoutSeconds = 0;  // 0 = 제한 없음
    }

    @Data
    public static class LimitsConfig {
        private long memoryBytes = 512L * 1024 * 1024;
        private double cpuQuotaFraction = 0.5;
        private long pidsLimit = 50;
        private long terminalPidsLimit = 100;
    }

    @Data
    public static class ExecutionConfig {
        private long defaultTimeoutMs = 10000;
        private long maxTimeoutMs = 30000;
        private int maxOutputBytes = 1024 * 1024;
        private long outputDrainMs = 2000;
        private StdinMode stdinMode = StdinMode.STREAM;

        /**
         * 요청 타임아웃(없으면 기본값)을 [1ms, maxTimeoutMs] 로 제한
         */
        public Duration resolveTimeout(Long requestedMs) {
            long timeoutMs = requestedMs != null && requestedMs > 0 ? requestedMs : defaultTimeoutMs;
            return Duration.ofMillis(Math.max(1, Math.min(timeoutMs, maxTimeoutMs)));
        }
    }

    /**
     * stdin 전달 방식
     * STREAM: attach 스트림으로 전달 후 닫아서 EOF 전달
     * FILE: 워크스페이스의 input.txt를 파이프하는 커맨드 사용
     */
    public enum StdinMode {
        STREAM,
        FILE
    }

    @Data
    public static class AdmissionConfig {
        private int maxConcurrentEnvironments = 16;
        private long acquireTimeoutMs = 5000;
    }

    @Data
    public static class TerminalConfig {
        private long idleTimeoutMs = 15 * 60 * 1000L;
        private long closedRetentionMs = 60 * 1000L;
        private long reaperFixedDelayMs = 30 * 1000L;
        private int stopTimeoutSeconds = 2;
    }

    @Data
    public static class SimulationConfig {
        private boolean enabled = false;
    }

    @Data
    public static class PollingConfig {
        private boolean enabled = false;
        private long fixedDelayMillis = 1000;
    }

    @Data
    public static class SqsConfig {
        private String queueUrl;
        private int waitTimeSeconds = 20;
        private int maxNumberOfMessages = 10;
    }

    @Data
    public static class AwsConfig {
        private String region = "ap-northeast-2";
    }

    @Data
    public static class RedisConfig {
        private boolean enabled = false;
        private String host = "127.0.0.1";
        private int port = 6379;
        private String password = "";
        private String resultPrefix = "result:";
    }
}
