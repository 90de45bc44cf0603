package org.brown.coderunner.terminal;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * sessionId → TerminalSession
 */
@Component
public class TerminalSessionRegistry {

    private final Map<String, TerminalSession> sessions = new ConcurrentHashMap<>();

    void register(TerminalSession session) {
        sessions.put(session.getId(), session);
    }

    public Optional<TerminalSession> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    void remove(String sessionId) {
        sessions.remove(sessionId);
    }

    public List<TerminalSession> all() {
        return List.copyOf(sessions.values());
    }

    public List<TerminalSession> ownedBy(String ownerId) {
        return sessions.values().stream()
                .filter(session -> session.getOwnerId().equals(ownerId))
                .collect(Collectors.toList());
    }

    /**
     * 상태 조회용 상태별 세션 수
     */
    public Map<TerminalState, Long> countByState() {
        Map<TerminalState, Long> counts = new EnumMap<>(TerminalState.class);
        for (TerminalState state : TerminalState.values()) {
            counts.put(state, 0L);
        }
        sessions.values().forEach(session -> counts.merge(session.getState(), 1L, Long::sum));
        return counts;
    }
}
