package net.hexproc.core.spi;

import java.util.concurrent.Callable;

/**
 * 트랜잭션 경계. 모든 Repository 호출은 이 안에서 실행되어야 한다.
 * 본문이 예외를 던지면 롤백 후 그대로 재던짐. 저장소 자체 실패는 StoreUnavailableException 으로 변환된다.
 */
public interface TxRunner {
    /** 진행 중인 트랜잭션이 있으면 참여, 없으면 새로 시작 */
    <T> T required(Callable<T> body) throws Exception;

    /** 바깥 트랜잭션을 정지하고 새 커넥션으로 독립 실행 */
    <T> T requiresNew(Callable<T> body) throws Exception;
}
