package net.hexproc.core.error;

/**
 * 저장소 트랜잭션/연결 실패. 트랜잭션은 이미 롤백된 상태이며,
 * 다음 스케줄 주기에 재시도하면 된다.
 */
public class StoreUnavailableException extends ProcessEngineException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
