package org.brown.coderunner.sqs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.brown.coderunner.config.RunnerProperties;
import org.brown.coderunner.exception.UnsupportedLanguageException;
import org.brown.coderunner.execution.ExecutionService;
import org.brown.coderunner.model.ExecutionRequest;
import org.brown.coderunner.model.ExecutionResult;
import org.brown.coderunner.redis.RedisResultPublisher;
import org.slf4j.MDC;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.DeleteMessageRequest;
import software.amazon.awssdk.services.sqs.model.Message;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageRequest;
import software.amazon.awssdk.services.sqs.model.ReceiveMessageResponse;

import java.util.List;

/**
 * SQS Long Polling 기반 실행 요청 수신
 *
 * - 메시지 본문 = ExecutionRequest JSON
 * - 실행 결과는 Redis 로 전송 (활성화된 경우)
 * - 파싱 불가 메시지는 삭제, 미지원 언어는 삭제하지 않음 (DLQ 로 이동)
 * - 한 메시지 실패가 폴러 전체를 멈추지 않음
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "runner.polling.enabled", havingValue = "true")
public class SqsPoller {

    private final SqsClient sqsClient;
    private final ObjectMapper objectMapper;
    private final RunnerProperties runnerProperties;
    private final ExecutionService executionService;
    private final ObjectProvider<RedisResultPublisher> redisResultPublisher;

    public SqsPoller(SqsClient sqsClient, ObjectMapper objectMapper, RunnerProperties runnerProperties,
                     ExecutionService executionService, ObjectProvider<RedisResultPublisher> redisResultPublisher) {
        this.sqsClient = sqsClient;
        this.objectMapper = objectMapper;
        this.runnerProperties = runnerProperties;
        this.executionService = executionService;
        this.redisResultPublisher = redisResultPublisher;
    }

    /**
     * 주기적으로 SQS 큐를 폴링
     */
    @Scheduled(fixedDelayString = "${runner.polling.fixedDelayMillis:1000}")
    public void pollQueue() {
        try {
            String queueUrl = runnerProperties.getSqs().getQueueUrl();

            if (queueUrl == null || queueUrl.isEmpty()) {
                log.warn("SQS queue URL is not configured");
                return;
            }

            ReceiveMessageRequest receiveRequest = ReceiveMessageRequest.builder()
                    .queueUrl(queueUrl)
                    .maxNumberOfMessages(runnerProperties.getSqs().getMaxNumberOfMessages())
                    .waitTimeSeconds(runnerProperties.getSqs().getWaitTimeSeconds())
                    .build();

            ReceiveMessageResponse receiveResponse = sqsClient.receiveMessage(receiveRequest);
            List<Message> messages = receiveResponse.messages();

            if (messages == null || messages.isEmpty()) {
                log.debug("No messages received");
                return;
            }

            log.info("Received {} SQS message(s)", messages.size());
            for (Message message : messages) {
                processMessage(queueUrl, message);
            }

        } catch (RuntimeException e) {
            // 폴러가 죽지 않도록 다음 주기에 다시 시도
            log.error("[FAIL][POLLING] Error while polling SQS, will retry on next cycle", e);
        }
    }

    void processMessage(String queueUrl, Message message) {
        String receiptHandle = message.receiptHandle();
        ExecutionRequest request = null;

        try {
            request = objectMapper.readValue(message.body(), ExecutionRequest.class);

            if (request == null || request.getExecutionId() == null
                    || request.getLanguage() == null || request.getSourceCode() == null) {
                log.error("[FAIL][PARSE] Message is missing executionId, language or code: {}", message.messageId());
                deleteMessage(queueUrl, receiptHandle);
                return;
            }

            MDC.put("executionId", request.getExecutionId());
            MDC.put("language", request.getLanguage());
            log.info("Received execution request: {}", request);

            ExecutionResult result = executionService.run(request,
                    runnerProperties.getExecution().resolveTimeout(request.getTimeoutMs()));

            log.info("Execution {} finished: status={}, exitCode={}, errorKind={}, duration={}ms",
                    result.getExecutionId(), result.getStatus(), result.getExitCode(),
                    result.getErrorKind(), result.getDurationMillis());
            log.debug("Output:\n{}", result.getOutput());

            RedisResultPublisher publisher = redisResultPublisher.getIfAvailable();
            if (publisher != null) {
                // 전송 실패해도 메시지는 삭제 (실행은 끝났으므로)
                publisher.publishResult(result);
            }

            deleteMessage(queueUrl, receiptHandle);
            log.info("[DONE][OK] executionId={}", request.getExecutionId());

        } catch (JsonProcessingException e) {
            log.error("[FAIL][JSON_PARSE] Could not parse message {}", message.messageId(), e);
            deleteMessage(queueUrl, receiptHandle);

        } catch (UnsupportedLanguageException e) {
            // 삭제하지 않음 (DLQ 로 이동)
            log.error("[FAIL][UNSUPPORTED_LANGUAGE] {}", e.getMessage());

        } catch (RuntimeException e) {
            // 삭제하지 않음 (재시도 가능)
            log.error("[FAIL][UNKNOWN] Execution failed: executionId={}",
                    request != null ? request.getExecutionId() : "unknown", e);

        } finally {
            MDC.remove("executionId");
            MDC.remove("language");
        }
    }

    private void deleteMessage(String queueUrl, String receiptHandle) {
        try {
            sqsClient.deleteMessage(DeleteMessageRequest.builder()
                    .queueUrl(queueUrl)
                    .receiptHandle(receiptHandle)
                    .build());
            log.debug("Deleted SQS message");
        } catch (RuntimeException e) {
            log.warn("Failed to delete SQS message, it may be processed again", e);
        }
    }
}
