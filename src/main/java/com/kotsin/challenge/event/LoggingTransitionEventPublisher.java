package com.kotsin.challenge.event;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Writes every transition to the log and keeps a bounded tail in memory for the operator API.
 */
@Slf4j
public class LoggingTransitionEventPublisher implements TransitionEventPublisher {

    private final int retain;
    private final Deque<TransitionEvent> tail = new ArrayDeque<>();

    public LoggingTransitionEventPublisher(int retain) {
        this.retain = Math.max(1, retain);
    }

    @Override
    public void publish(TransitionEvent event) {
        log.info("TRANSITION type={} symbol={} entity={} before={} after={} msg={}",
                event.getType(), event.getSymbol(), event.getEntityId(),
                event.getBefore(), event.getAfter(), event.getMessage());
        synchronized (tail) {
            tail.addLast(event);
            while (tail.size() > retain) {
                tail.removeFirst();
            }
        }
    }

    @Override
    public List<TransitionEvent> recent() {
        synchronized (tail) {
            return new ArrayList<>(tail);
        }
    }
}
