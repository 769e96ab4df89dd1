package net.hexproc.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * 프로세스 상태와 전이 그래프.
 * <pre>
 * QUEUED -> RUNNING -> COMPLETED | FAILED
 * QUEUED | RUNNING -> CANCELLING -> CANCELLED
 * </pre>
 * COMPLETED/FAILED/CANCELLED 는 종료 상태이며, 종료 상태에 대한 모든 이벤트는 no-op.
 */
public enum ProcessState {
    QUEUED, RUNNING, CANCELLING, COMPLETED, FAILED, CANCELLED;

    /**
     * 전이 함수. 허용되지 않는 (상태, 이벤트) 조합은 empty → 호출자는 no-op 처리.
     */
    public Optional<ProcessState> next(ProcessEvent event) {
        ProcessState to = switch (this) {
            case QUEUED -> switch (event) {
                case START -> RUNNING;
                case REQUEST_CANCEL -> CANCELLING;
                case FINISH, FAIL, CONFIRM_CANCEL -> null;
            };
            case RUNNING -> switch (event) {
                case FINISH -> COMPLETED;
                case FAIL -> FAILED;
                case REQUEST_CANCEL -> CANCELLING;
                case START, CONFIRM_CANCEL -> null;
            };
            case CANCELLING -> switch (event) {
                case CONFIRM_CANCEL -> CANCELLED;
                case START, FINISH, FAIL, REQUEST_CANCEL -> null;
            };
            case COMPLETED, FAILED, CANCELLED -> null;
        };
        return Optional.ofNullable(to);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /** 풀에서 예약을 점유하고 있는 상태 */
    public boolean holdsReservation() {
        return !isTerminal();
    }

    /** 틱 엔진이 progress 를 진전시킬 수 있는 상태 */
    public boolean advances() {
        return this == QUEUED || this == RUNNING;
    }

    public static ProcessState from(String s) {
        if (s == null) throw new IllegalArgumentException("state code is null");
        return ProcessState.valueOf(s.trim().toUpperCase(Locale.ROOT));
    }

    public String code() { return name(); }
}
