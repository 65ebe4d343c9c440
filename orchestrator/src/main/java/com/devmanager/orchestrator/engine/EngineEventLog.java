package com.devmanager.orchestrator.engine;

import com.devmanager.orchestrator.model.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Default {@link EngineListener}: logs every event and keeps the most recent
 * ones in memory for the REST surface to page through.
 */
public class EngineEventLog implements EngineListener {

    private static final Logger log = LoggerFactory.getLogger(EngineEventLog.class);

    public static final int DEFAULT_CAPACITY = 500;

    private final int               capacity;
    private final Deque<EngineEvent> events = new ArrayDeque<>();

    public EngineEventLog() {
        this(DEFAULT_CAPACITY);
    }

    public EngineEventLog(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive");
        this.capacity = capacity;
    }

    @Override
    public void onEvent(EngineEvent event) {
        switch (event.type()) {
            case ERROR -> {
                EngineError error = (EngineError) event.payload();
                log.warn("Engine error [{}]: {}", error.kind(), error.message());
            }
            case NEW_MESSAGE -> {
                Turn turn = (Turn) event.payload();
                log.info("[{}] {}", turn.sender().wireName(), abbreviate(turn.message()));
            }
            case STATUS_UPDATE, STATE_CHANGE, USER_INPUT_NEEDED, TASK_COMPLETE ->
                    log.info("{}: {}", event.type(), event.payload());
            case PROJECT_LOADED -> {
                ProjectLoaded loaded = (ProjectLoaded) event.payload();
                log.info("Project '{}' loaded in state {} with {} turns",
                        loaded.projectName(), loaded.state(), loaded.history().size());
            }
        }
        synchronized (events) {
            if (events.size() == capacity) events.removeFirst();
            events.addLast(event);
        }
    }

    /** Up to {@code limit} most recent events, oldest first. */
    public List<EngineEvent> recent(int limit) {
        synchronized (events) {
            int skip = Math.max(0, events.size() - Math.max(0, limit));
            return events.stream().skip(skip).toList();
        }
    }

    private static String abbreviate(String text) {
        String oneLine = text.replace('\n', ' ');
        return oneLine.length() <= 120 ? oneLine : oneLine.substring(0, 117) + "...";
    }
}
