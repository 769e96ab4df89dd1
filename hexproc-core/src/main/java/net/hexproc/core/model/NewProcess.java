package net.hexproc.core.model;

import java.time.Instant;

/** INSERT 전용 값. id/version 은 저장소가 발번 */
public record NewProcess(
        long ownerId,
        long gatewayServerId,
        long targetServerId,
        ProcessType processType,
        ProcessPriority priority,
        Resources reservation,
        double requiredWork,
        Instant createdAt
) {}
