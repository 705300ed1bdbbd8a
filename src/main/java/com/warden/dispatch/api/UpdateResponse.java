package com.warden.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.warden.core.model.UpdateOutcome;
import com.warden.core.model.UpdateRecord;

import java.time.Instant;
import java.util.Map;

/**
 * JSON view of an update record. {@code error} is set only when the applier
 * call that produced this response failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UpdateResponse(
    long id,
    String name,
    String version,
    String state,
    Map<String, Object> meta,
    @JsonProperty("created_at") Instant createdAt,
    String error
) {

    public static UpdateResponse from(UpdateRecord record) {
        return new UpdateResponse(record.id(), record.name(), record.version(), record.state().wireName(),
                record.meta(), record.createdAt(), null);
    }

    public static UpdateResponse from(UpdateOutcome outcome) {
        UpdateRecord record = outcome.record();
        return new UpdateResponse(record.id(), record.name(), record.version(), record.state().wireName(),
                record.meta(), record.createdAt(), outcome.isSuccess() ? null : outcome.failure().getMessage());
    }
}
