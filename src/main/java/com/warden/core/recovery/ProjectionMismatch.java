package com.warden.core.recovery;

import com.warden.core.model.UpdateState;

/**
 * A record whose stored state disagrees with the replay of its events.
 *
 * @param projected {@code null} when the history itself is invalid
 * @param detail    human-readable explanation
 */
public record ProjectionMismatch(long updateId, UpdateState stored, UpdateState projected, String detail) {}
