package org.brown.coderunner.execution;

import lombok.extern.slf4j.Slf4j;
import org.brown.coderunner.config.RunnerProperties;
import org.brown.coderunner.exception.CapacityExceededException;
import org.springframework.stereotype.Component;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 동시에 살아 있는 격리 환경 수 제한
 *
 * 배치 실행은 실행 동안, 터미널 세션은 세션 수명 동안 permit 하나를 가진다.
 * 대기 시간 안에 permit 을 못 얻으면 CapacityExceeded 로 거절한다.
 */
@Slf4j
@Component
public class AdmissionLimiter {

    private final int maxPermits;
    private final long acquireTimeoutMs;
    private final Semaphore permits;

    public AdmissionLimiter(RunnerProperties runnerProperties) {
        this.maxPermits = runnerProperties.getAdmission().getMaxConcurrentEnvironments();
        this.acquireTimeoutMs = runnerProperties.getAdmission().getAcquireTimeoutMs();
        this.permits = new Semaphore(maxPermits, true);
    }

    public Permit acquire(String ownerId) throws InterruptedException {
        if (!permits.tryAcquire(acquireTimeoutMs, TimeUnit.MILLISECONDS)) {
            log.warn("Admission rejected for {}: {} environments already running", ownerId, maxPermits);
            throw new CapacityExceededException(
                    "Too many concurrent environments (limit " + maxPermits + "), try again later");
        }
        log.debug("Admission granted for {} (available={})", ownerId, permits.availablePermits());
        return new Permit(ownerId);
    }

    public int getAvailablePermits() {
        return permits.availablePermits();
    }

    public int getMaxPermits() {
        return maxPermits;
    }

    public final class Permit implements AutoCloseable {

        private final String ownerId;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit(String ownerId) {
            this.ownerId = ownerId;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                permits.release();
                log.debug("Admission released for {}", ownerId);
            }
        }
    }
}
