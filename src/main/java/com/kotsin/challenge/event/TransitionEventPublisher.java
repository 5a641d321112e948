package com.kotsin.challenge.event;

import java.util.List;

public interface TransitionEventPublisher {

    void publish(TransitionEvent event);

    /** Most recent events, oldest first. */
    List<TransitionEvent> recent();
}
