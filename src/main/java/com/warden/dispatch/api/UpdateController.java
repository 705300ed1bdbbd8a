package com.warden.dispatch.api;

import com.warden.core.engine.UpdateStateMachine;
import com.warden.core.model.UpdateOutcome;
import com.warden.core.model.UpdateRecord;
import com.warden.core.model.UpdateState;
import com.warden.core.persistence.Ledger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for update lifecycle operations.
 * <p>
 * Apply and rollback run synchronously: the response carries the resolved
 * record. An applier failure is not an HTTP error; it is reported in the
 * body's {@code error} field with the record in {@code failed}.
 */
@RestController
@RequestMapping("/api/v1")
public class UpdateController {

    private static final Logger log = LoggerFactory.getLogger(UpdateController.class);

    private final UpdateStateMachine stateMachine;
    private final Ledger ledger;

    public UpdateController(UpdateStateMachine stateMachine, Ledger ledger) {
        this.stateMachine = stateMachine;
        this.ledger = ledger;
    }

    /**
     * GET /api/v1/updates: At most {@code limit} recent updates, optionally filtered by state.
     */
    @GetMapping("/updates")
    public List<UpdateResponse> listUpdates(@RequestParam(required = false) String state,
                                            @RequestParam(defaultValue = "50") int limit) {
        List<UpdateRecord> records = state != null
                ? ledger.updates().listRecentByState(UpdateState.fromWireName(state), limit)
                : ledger.updates().listAll(limit);
        return records.stream().map(UpdateResponse::from).toList();
    }

    /**
     * GET /api/v1/updates/{id}
     */
    @GetMapping("/updates/{id}")
    public UpdateResponse getUpdate(@PathVariable long id) {
        return UpdateResponse.from(ledger.updates().get(id));
    }

    /**
     * GET /api/v1/updates/{id}/events: History of one update in append order.
     */
    @GetMapping("/updates/{id}/events")
    public List<EventResponse> getUpdateEvents(@PathVariable long id) {
        ledger.updates().get(id);
        return ledger.events().readByReference(id).stream().map(EventResponse::from).toList();
    }

    /**
     * POST /api/v1/updates: Apply an update. 201 with the resolved record.
     */
    @PostMapping("/updates")
    public ResponseEntity<UpdateResponse> applyUpdate(@RequestBody ApplyRequest request) {
        if (request.name() == null || request.name().isBlank()) {
            throw new IllegalArgumentException("name is required");
        }
        UpdateOutcome outcome = stateMachine.apply(request.name(), request.version());
        log.info("Apply via API: update {} -> {}", outcome.record().id(), outcome.record().state().wireName());
        return ResponseEntity.status(HttpStatus.CREATED).body(UpdateResponse.from(outcome));
    }

    /**
     * POST /api/v1/updates/{id}/rollback
     */
    @PostMapping("/updates/{id}/rollback")
    public UpdateResponse rollbackUpdate(@PathVariable long id) {
        return UpdateResponse.from(stateMachine.rollback(id));
    }

    /**
     * GET /api/v1/events: One page of the event log after {@code after}.
     */
    @GetMapping("/events")
    public List<EventResponse> listEvents(@RequestParam(defaultValue = "0") long after,
                                          @RequestParam(defaultValue = "100") int limit) {
        return ledger.events().readAfter(after, limit).stream().map(EventResponse::from).toList();
    }
}
