package org.brown.coderunner.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sqs.SqsClient;

/**
 * AWS SDK 클라이언트 설정
 *
 * SQS 폴링이 켜져 있을 때만 클라이언트를 만든다.
 */
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(name = "runner.polling.enabled", havingValue = "true")
public class AwsConfig {

    private final RunnerProperties runnerProperties;

    @Bean
    public SqsClient sqsClient() {
        return SqsClient.builder()
                .region(Region.of(runnerProperties.getAws().getRegion()))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }
}
