package org.brown.coderunner.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.coderunner.config.RunnerProperties;
import org.brown.coderunner.model.ExecutionResult;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Redis Pub/Sub 으로 실행 결과 전송
 * 구독자는 result:{executionId} 채널을 구독하며 결과를 대기함
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "runner.redis.enabled", havingValue = "true")
public class RedisResultPublisher {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final RunnerProperties runnerProperties;

    /**
     * 실행 결과를 result:{executionId} 채널로 전송. 실패는 로그만 남긴다.
     *
     * @return 전송에 성공했으면 true
     */
    public boolean publishResult(ExecutionResult result) {
        String executionId = result.getExecutionId();
        String channel = runnerProperties.getRedis().getResultPrefix() + executionId;

        try {
            String jsonMessage = objectMapper.writeValueAsString(result);
            log.info("[REDIS] Publishing result to channel: {} (executionId={})", channel, executionId);
            log.debug("   Payload: {}", jsonMessage);

            Long subscriberCount = redisTemplate.convertAndSend(channel, jsonMessage);

            if (subscriberCount != null && subscriberCount > 0) {
                log.info("[REDIS] Result published for executionId={}, subscribers={}", executionId, subscriberCount);
            } else {
                log.warn("[REDIS] Result published but no subscribers on channel: {} (executionId={})",
                        channel, executionId);
            }
            return true;

        } catch (JsonProcessingException e) {
            log.error("[REDIS][FAIL] Could not serialize result for executionId={}", executionId, e);
            return false;
        } catch (RuntimeException e) {
            log.error("[REDIS][FAIL] Failed to publish result for executionId={} to channel={}",
                    executionId, channel, e);
            return false;
        }
    }
}
