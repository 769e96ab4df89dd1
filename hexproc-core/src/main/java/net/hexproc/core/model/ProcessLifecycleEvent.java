package net.hexproc.core.model;

import java.time.Instant;

/**
 * 종료 전이(COMPLETED/CANCELLED/FAILED) 시 외부 중계자에게 넘기는 신호.
 * 포맷/전달은 코어의 책임이 아니다.
 */
public record ProcessLifecycleEvent(
        long processId,
        long ownerId,
        long gatewayServerId,
        ProcessType processType,
        ProcessState state,
        Resources freed,
        Instant occurredAt
) {
    public static ProcessLifecycleEvent of(ProcessRecord r, ProcessState state, Resources freed, Instant at) {
        return new ProcessLifecycleEvent(r.id(), r.ownerId(), r.gatewayServerId(), r.processType(), state, freed, at);
    }
}
