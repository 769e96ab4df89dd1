package net.hexproc.core.error;

/** 엔진이 호출자에게 드러내는 오류의 공통 상위 타입 */
public abstract class ProcessEngineException extends Exception {
    protected ProcessEngineException(String message) {
        super(message);
    }

    protected ProcessEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
