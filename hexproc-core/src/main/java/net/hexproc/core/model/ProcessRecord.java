package net.hexproc.core.model;

import java.time.Instant;

public record ProcessRecord(
        Long id,
        Long ownerId,
        Long gatewayServerId,   // 예약을 차감한 풀
        Long targetServerId,
        ProcessType processType,
        ProcessPriority priority,
        ProcessState state,
        Resources reservation,  // 입장 시점 값 그대로 저장/반환
        double progress,
        double requiredWork,
        long version,           // 상태 변경 UPDATE 의 CAS 키
        Instant createdAt,
        Instant lastCheckpointAt,
        Instant completedAt,
        Instant updatedAt
) {
    public boolean ownedBy(long userId) {
        return ownerId != null && ownerId == userId;
    }

    public boolean workDone() {
        return progress >= requiredWork;
    }

    public double remainingWork() {
        return Math.max(0.0, requiredWork - progress);
    }
}
