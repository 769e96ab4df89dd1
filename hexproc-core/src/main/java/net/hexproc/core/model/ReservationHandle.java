package net.hexproc.core.model;

/** 입장 성공 결과: 새 프로세스 id 와 확정된 예약 */
public record ReservationHandle(
        long processId,
        long gatewayServerId,
        Resources reservation,
        double requiredWork
) {}
