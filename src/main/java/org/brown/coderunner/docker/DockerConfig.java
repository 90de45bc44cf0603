package org.brown.coderunner.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import lombok.extern.slf4j.Slf4j;
import org.brown.coderunner.config.RunnerProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Docker Client 설정
 *
 * runner.docker.host 가 없으면 DOCKER_HOST 또는 기본 소켓 (/var/run/docker.sock) 에 연결
 */
@Slf4j
@Configuration
public class DockerConfig {

    @Bean(destroyMethod = "close")
    public DockerClient dockerClient(RunnerProperties runnerProperties) {
        RunnerProperties.DockerConfig docker = runnerProperties.getDocker();

        DefaultDockerClientConfig.Builder configBuilder = DefaultDockerClientConfig.createDefaultConfigBuilder();
        if (docker.getHost() != null && !docker.getHost().isBlank()) {
            configBuilder.withDockerHost(docker.getHost());
        }
        DefaultDockerClientConfig config = configBuilder.build();
        log.info("Docker host: {}", config.getDockerHost());

        ApacheDockerHttpClient.Builder httpClientBuilder = new ApacheDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .maxConnections(docker.getMaxConnections())
                .connectionTimeout(Duration.ofSeconds(docker.getConnectionTimeoutSeconds()));
        // 터미널 attach 스트림은 오래 조용할 수 있으므로 기본값은 응답 타임아웃 없음
        if (docker.getResponseTimeoutSeconds() > 0) {
            httpClientBuilder.responseTimeout(Duration.ofSeconds(docker.getResponseTimeoutSeconds()));
        }
        ApacheDockerHttpClient httpClient = httpClientBuilder.build();

        return DockerClientImpl.getInstance(config, httpClient);
    }
}
