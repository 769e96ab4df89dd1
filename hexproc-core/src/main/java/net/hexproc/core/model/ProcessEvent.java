package net.hexproc.core.model;

/** 상태 전이를 일으키는 입력 */
public enum ProcessEvent {
    /** 틱 엔진이 QUEUED 를 처음 관측 */
    START,
    /** progress >= requiredWork */
    FINISH,
    /** 실행 중 타깃/전제조건 위반 발견 */
    FAIL,
    /** 취소 요청 단계 */
    REQUEST_CANCEL,
    /** 취소 완료 단계 (예약 반환과 같은 트랜잭션) */
    CONFIRM_CANCEL
}
