package com.warden.core.recovery;

import java.util.List;

/**
 * What one recovery pass found and changed.
 *
 * @param examined        records inspected (pending ones plus rollback candidates)
 * @param interrupted     pending attempts that crashed mid-flight and were failed
 * @param resynced        records whose stored state lagged behind the event log
 * @param rollbacksClosed rollbacks that started but never recorded an outcome
 * @param inFlight        applies or rollbacks still running in a live process, left untouched
 * @param skipped         records left untouched because their history is inconsistent
 *                        or they changed concurrently
 */
public record RecoveryReport(
    int examined,
    List<Long> interrupted,
    List<Long> resynced,
    List<Long> rollbacksClosed,
    List<Long> inFlight,
    List<Long> skipped
) {

    public RecoveryReport {
        interrupted = List.copyOf(interrupted);
        resynced = List.copyOf(resynced);
        rollbacksClosed = List.copyOf(rollbacksClosed);
        inFlight = List.copyOf(inFlight);
        skipped = List.copyOf(skipped);
    }

    public int changed() {
        return interrupted.size() + resynced.size() + rollbacksClosed.size();
    }

    public boolean isClean() {
        return changed() == 0 && skipped.isEmpty();
    }
}
