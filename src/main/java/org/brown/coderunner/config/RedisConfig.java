package org.brown.coderunner.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

@Slf4j
@Configuration
@ConditionalOnProperty(name = "runner.redis.enabled", havingValue = "true")
public class RedisConfig {

    private final RunnerProperties runnerProperties;

    public RedisConfig(RunnerProperties runnerProperties) {
        this.runnerProperties = runnerProperties;
    }

    @Bean
    public RedisConnectionFactory redisConnectionFactory() {
        log.info("Redis connection: {}:{}",
                runnerProperties.getRedis().getHost(),
                runnerProperties.getRedis().getPort());

        RedisStandaloneConfiguration config = new RedisStandaloneConfiguration();
        config.setHostName(runnerProperties.getRedis().getHost());
        config.setPort(runnerProperties.getRedis().getPort());

        String password = runnerProperties.getRedis().getPassword();
        if (password != null && !password.isEmpty()) {
            config.setPassword(password);
        }

        return new LettuceConnectionFactory(config);
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }
}
