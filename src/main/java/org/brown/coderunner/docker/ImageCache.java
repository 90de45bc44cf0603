package org.brown.coderunner.docker;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.coderunner.exception.ImageUnavailableException;
import org.brown.coderunner.exception.InfrastructureException;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 런타임 이미지 캐시 + single-flight pull
 *
 * 같은 이미지에 대해 동시에 여러 요청이 들어와도 pull 은 한 번만 수행하고,
 * 나머지 요청은 같은 결과(성공 또는 ImageUnavailable)를 기다린다.
 * 여러 요청이 동시에 바꾸는 유일한 공유 상태이므로 map 변경은 lock 안에서 한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImageCache {

    private final IsolationBackend backend;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Entry> entries = new HashMap<>();

    /**
     * 이미지가 로컬에 있음을 보장한다. 필요하면 pull 하거나 진행 중인 확인/pull 을 기다린다.
     *
     * lock 은 map 을 바꾸는 동안만 잡는다. 백엔드 호출(inspect, pull)은 lock 밖에서 하므로
     * 한 이미지의 느린 조회가 다른 이미지 요청을 막지 않는다.
     *
     * @throws ImageUnavailableException pull 실패
     * @throws InterruptedException      대기 중 인터럽트
     */
    public void ensureAvailable(String image) throws InterruptedException {
        CompletableFuture<Void> flight;
        boolean owner = false;

        lock.lockInterruptibly();
        try {
            Entry entry = entries.computeIfAbsent(image, key -> new Entry());
            if (entry.present) {
                return;
            }
            if (entry.pullInFlight == null) {
                entry.pullInFlight = new CompletableFuture<>();
                owner = true;
            }
            flight = entry.pullInFlight;
        } finally {
            lock.unlock();
        }

        if (owner) {
            resolve(image, flight);
        } else {
            log.debug("Waiting for in-flight pull of image: {}", image);
        }
        awaitPull(image, flight);
    }

    private void resolve(String image, CompletableFuture<Void> flight) throws InterruptedException {
        Throwable failure = null;
        try {
            // 다른 경로로 이미 받아져 있을 수 있으므로 pull 전에 한 번 확인
            if (backend.isImagePresent(image)) {
                log.debug("Image already present locally: {}", image);
            } else {
                backend.pullImage(image);
            }
        } catch (InterruptedException e) {
            failure = e;
            throw e;
        } catch (RuntimeException e) {
            failure = e;
        } finally {
            lock.lock();
            try {
                Entry entry = entries.get(image);
                entry.pullInFlight = null;
                entry.present = failure == null;
            } finally {
                lock.unlock();
            }
            if (failure == null) {
                flight.complete(null);
            } else {
                log.error("Failed to make image available: {}", image, failure);
                flight.completeExceptionally(failure);
            }
        }
    }

    private void awaitPull(String image, CompletableFuture<Void> pull) throws InterruptedException {
        try {
            pull.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ImageUnavailableException imageUnavailable) {
                throw imageUnavailable;
            }
            if (cause instanceof InfrastructureException infrastructure) {
                throw new ImageUnavailableException("Image " + image + " unavailable: " + infrastructure.getMessage(), cause);
            }
            throw new ImageUnavailableException("Failed to pull image " + image + ": " + cause.getMessage(), cause);
        }
    }

    /**
     * 상태 조회용 스냅샷 (image → PRESENT / PULLING / ABSENT)
     */
    public Map<String, String> snapshot() {
        lock.lock();
        try {
            Map<String, String> view = new LinkedHashMap<>();
            entries.forEach((image, entry) -> view.put(image,
                    entry.present ? "PRESENT" : entry.pullInFlight != null ? "PULLING" : "ABSENT"));
            return view;
        } finally {
            lock.unlock();
        }
    }

    private static final class Entry {
        private boolean present;
        private CompletableFuture<Void> pullInFlight;
    }
}
