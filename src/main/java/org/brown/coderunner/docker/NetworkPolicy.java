package org.brown.coderunner.docker;

/**
 * 컨테이너 네트워크 정책
 */
public enum NetworkPolicy {
    NONE("none"),
    BRIDGE("bridge");

    private final String dockerMode;

    NetworkPolicy(String dockerMode) {
        this.dockerMode = dockerMode;
    }

    public String getDockerMode() {
        return dockerMode;
    }
}
