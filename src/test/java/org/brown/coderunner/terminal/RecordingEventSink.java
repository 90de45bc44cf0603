package org.brown.coderunner.terminal;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import java.util.stream.Collectors;

class RecordingEventSink implements TerminalEventSink {

    private final List<TerminalEvent> events = new CopyOnWriteArrayList<>();
    private final List<String> owners = new CopyOnWriteArrayList<>();

    @Override
    public synchronized void publish(String ownerId, TerminalEvent event) {
        owners.add(ownerId);
        events.add(event);
    }

    /**
     * sessionId 이벤트를 받은 연결 목록 (중복 제거)
     */
    synchronized List<String> recipientsOf(String sessionId) {
        List<String> recipients = new ArrayList<>();
        for (int i = 0; i < events.size(); i++) {
            String owner = owners.get(i);
            if (sessionId.equals(events.get(i).getSessionId()) && !recipients.contains(owner)) {
                recipients.add(owner);
            }
        }
        return recipients;
    }

    List<TerminalEvent> events() {
        return List.copyOf(events);
    }

    List<TerminalEvent> eventsFor(String sessionId) {
        return events.stream().filter(event -> sessionId.equals(event.getSessionId())).collect(Collectors.toList());
    }

    String outputOf(String sessionId) {
        return eventsFor(sessionId).stream()
                .filter(event -> TerminalEvent.OUTPUT.equals(event.getType()))
                .map(TerminalEvent::getData)
                .collect(Collectors.joining());
    }

    TerminalEvent await(Predicate<TerminalEvent> condition, long timeoutMillis) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (System.currentTimeMillis() < deadline) {
            for (TerminalEvent event : events) {
                if (condition.test(event)) {
                    return event;
                }
            }
            Thread.sleep(10);
        }
        throw new AssertionError("No matching event within " + timeoutMillis + "ms, got " + events);
    }

    TerminalEvent awaitClosed(String sessionId) throws InterruptedException {
        return await(event -> TerminalEvent.CLOSED.equals(event.getType()) && sessionId.equals(event.getSessionId()),
                5000);
    }
}
