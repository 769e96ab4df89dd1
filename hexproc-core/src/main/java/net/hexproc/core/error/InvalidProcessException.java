package net.hexproc.core.error;

/** 알 수 없는 프로세스 id/종류, 또는 존재하지 않는 서버 */
public class InvalidProcessException extends ProcessEngineException {
    public InvalidProcessException(String message) {
        super(message);
    }
}
