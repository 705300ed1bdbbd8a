package com.warden.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.warden.core.events.Event;

import java.time.Instant;
import java.util.Map;

public record EventResponse(
    long id,
    String kind,
    Map<String, Object> payload,
    @JsonProperty("created_at") Instant createdAt
) {

    public static EventResponse from(Event event) {
        return new EventResponse(event.id(), event.kind(), event.payload(), event.createdAt());
    }
}
