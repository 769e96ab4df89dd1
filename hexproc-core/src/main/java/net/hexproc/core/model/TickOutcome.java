package net.hexproc.core.model;

/**
 * tick 한 번의 결과.
 * record 는 트랜잭션 커밋 시점의 행 상태 (행이 없거나 경합에서 진 경우 null).
 */
public record TickOutcome(Kind kind, ProcessRecord record) {

    public enum Kind {
        /** QUEUED -> RUNNING (진전 포함) */
        STARTED,
        /** RUNNING 유지, progress 증가 */
        ADVANCED,
        COMPLETED,
        FAILED,
        /** CANCELLING 관측 → 이 틱이 취소 완료 단계를 수행 */
        CANCELLED,
        /** 종료 상태, 행 없음, 또는 다른 트랜잭션이 먼저 바꿈 */
        NOOP
    }

    public static TickOutcome noop(ProcessRecord r) {
        return new TickOutcome(Kind.NOOP, r);
    }

    public boolean terminal() {
        return kind == Kind.COMPLETED || kind == Kind.FAILED || kind == Kind.CANCELLED;
    }
}
