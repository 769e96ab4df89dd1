package net.hexproc.core.model;

import java.time.Instant;

/**
 * 서버 하나의 용량 원장. 불변식: 모든 차원에서 available <= total.
 * debit/credit 는 순수 함수이며, 저장소 반영은 ServerRepository 가 같은 트랜잭션에서 수행한다.
 */
public record ResourcePool(
        Long serverId,
        Resources total,
        Resources available,
        int difficulty,         // 0..100, 타깃으로 쓰일 때의 난이도
        Instant createdAt,
        Instant updatedAt
) {
    public static final int DEFAULT_DIFFICULTY = 50;

    public ResourcePool {
        if (total == null || available == null) {
            throw new IllegalArgumentException("total and available are required");
        }
        if (!available.fitsWithin(total)) {
            throw new IllegalArgumentException("available " + available + " exceeds total " + total + " on server " + serverId);
        }
        if (difficulty < 0 || difficulty > 100) {
            throw new IllegalArgumentException("difficulty must be in 0..100: " + difficulty);
        }
    }

    public static ResourcePool ofNew(long serverId, Resources total, int difficulty) {
        return new ResourcePool(serverId, total, total, difficulty, null, null);
    }

    public boolean canAdmit(Resources requested) {
        return requested.fitsWithin(available);
    }

    public ResourcePool debit(Resources amount) {
        if (!canAdmit(amount)) {
            throw new IllegalArgumentException("cannot debit " + amount + " from available " + available);
        }
        return new ResourcePool(serverId, total, available.minus(amount), difficulty, createdAt, updatedAt);
    }

    /** total 을 넘기는 credit 은 이중 반환이므로 거부 */
    public ResourcePool credit(Resources amount) {
        return new ResourcePool(serverId, total, available.plus(amount), difficulty, createdAt, updatedAt);
    }

    /** 현재 예약되어 있는 총량 = total - available */
    public Resources reserved() {
        return total.minus(available);
    }
}
