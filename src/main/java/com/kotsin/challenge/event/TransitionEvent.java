package com.kotsin.challenge.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One record per state transition; enough to rebuild trade history without replaying the engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TransitionEvent {

    private String eventId;
    private Instant timestamp;
    private String symbol;
    /** entryId, positionId or "account" */
    private String entityId;
    private TransitionType type;
    @Builder.Default
    private Map<String, Object> before = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Object> after = new LinkedHashMap<>();
    private String message;

    public static TransitionEvent of(Instant at, TransitionType type, String symbol, String entityId, String message) {
        return TransitionEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .timestamp(at)
                .type(type)
                .symbol(symbol)
                .entityId(entityId)
                .message(message)
                .build();
    }

    public TransitionEvent before(String key, Object value) {
        before.put(key, value);
        return this;
    }

    public TransitionEvent after(String key, Object value) {
        after.put(key, value);
        return this;
    }
}
