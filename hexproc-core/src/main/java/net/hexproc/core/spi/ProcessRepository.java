package net.hexproc.core.spi;

import net.hexproc.core.model.NewProcess;
import net.hexproc.core.model.ProcessRecord;
import net.hexproc.core.model.ProcessState;
import net.hexproc.core.model.Resources;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ProcessRepository {
    /** QUEUED, progress=0, version=0 으로 INSERT 후 저장된 행 반환 */
    ProcessRecord insert(NewProcess p) throws Exception;

    Optional<ProcessRecord> findById(long processId) throws Exception;

    /** (id, owner) 범위 행을 FOR UPDATE SKIP LOCKED 로 잠금. 다른 트랜잭션이 잡고 있으면 empty */
    Optional<ProcessRecord> lockOwnedSkipLocked(long processId, long ownerId) throws Exception;

    /** id 행에 대기 락 */
    Optional<ProcessRecord> lockById(long processId) throws Exception;

    /** state = CANCELLING 인 id 행에 대기 락 */
    Optional<ProcessRecord> lockCancelling(long processId) throws Exception;

    /**
     * CAS 상태 전이: WHERE ID=? AND STATE=from AND VERSION=expectedVersion.
     * 종료 상태로 가면 COMPLETED_AT=now. 반영 여부 반환.
     */
    boolean transition(long processId, long expectedVersion, ProcessState from, ProcessState to, Instant now) throws Exception;

    /** CAS 진행 갱신: progress/checkpoint/state 를 함께 기록 */
    boolean advance(long processId, long expectedVersion, ProcessState from, ProcessState to,
                    double progress, Instant checkpointAt) throws Exception;

    /** 비종료 상태 id 목록. priority desc, checkpoint asc. 잠그지 않음 */
    List<Long> findActiveIds(int limit) throws Exception;

    List<Long> findIdsInState(ProcessState state, int limit) throws Exception;

    List<ProcessRecord> findActiveByOwner(long ownerId) throws Exception;

    /** gateway 서버의 비종료 프로세스 예약 합계 */
    Resources sumActiveReservations(long gatewayServerId) throws Exception;
}
