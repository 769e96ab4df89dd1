package net.hexproc.core.service;

import net.hexproc.core.error.InvalidProcessException;
import net.hexproc.core.error.ResourceExhaustedException;
import net.hexproc.core.model.AdmissionRequest;
import net.hexproc.core.model.NewProcess;
import net.hexproc.core.model.ProcessRecord;
import net.hexproc.core.model.ReservationHandle;
import net.hexproc.core.model.ResourcePool;
import net.hexproc.core.spi.Clock;
import net.hexproc.core.spi.ProcessRepository;
import net.hexproc.core.spi.ServerRepository;
import net.hexproc.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 입장 제어. 풀 행 락 → 용량 확인 → 조건부 차감 → 프로세스 INSERT 를 한 트랜잭션에서 수행한다.
 * 용량 부족이면 거부하고 아무것도 남기지 않는다 (큐잉 없음).
 */
public final class AdmissionService {
    private static final Logger log = LoggerFactory.getLogger(AdmissionService.class);

    private final ServerRepository servers;
    private final ProcessRepository processes;
    private final TxRunner tx;
    private final Clock clock;

    public AdmissionService(ServerRepository servers,
                            ProcessRepository processes,
                            TxRunner tx,
                            Clock clock) {
        this.servers = servers;
        this.processes = processes;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * @throws ResourceExhaustedException 어느 한 차원이라도 requested > available
     * @throws InvalidProcessException    gateway/target 서버가 없음
     */
    public ReservationHandle admit(AdmissionRequest req) throws Exception {
        ReservationHandle handle;
        try {
            handle = tx.requiresNew(() -> admitLocked(req));
        } catch (ResourceExhaustedException e) {
            log.info("admission rejected: owner={} type={} {}", req.ownerId(), req.processType(), e.getMessage());
            throw e;
        }
        log.info("admitted process {}: owner={} type={} gateway={} target={} reservation={} work={}",
                handle.processId(), req.ownerId(), req.processType(), req.gatewayServerId(),
                req.targetServerId(), handle.reservation(), handle.requiredWork());
        return handle;
    }

    private ReservationHandle admitLocked(AdmissionRequest req) throws Exception {
        // 1) gateway 풀 잠금: 동시 입장은 여기서 직렬화된다
        ResourcePool pool = servers.lockPool(req.gatewayServerId())
                .orElseThrow(() -> new InvalidProcessException("unknown gateway server " + req.gatewayServerId()));

        ResourcePool target = req.targetServerId() == req.gatewayServerId()
                ? pool
                : servers.findById(req.targetServerId())
                    .orElseThrow(() -> new InvalidProcessException("unknown target server " + req.targetServerId()));

        // 2) 용량 확인
        if (!pool.canAdmit(req.requested())) {
            throw new ResourceExhaustedException(req.gatewayServerId(), req.requested(), pool.available());
        }

        // 3) 조건부 차감 (락을 못 믿는 저장소에서도 stale available 로 두 번 통과하지 않도록)
        if (!servers.debit(req.gatewayServerId(), req.requested())) {
            throw new ResourceExhaustedException(req.gatewayServerId(), req.requested(), pool.available());
        }

        // 4) 예약을 그대로 기록
        ProcessRecord rec = processes.insert(new NewProcess(
                req.ownerId(),
                req.gatewayServerId(),
                req.targetServerId(),
                req.processType(),
                req.priority(),
                req.requested(),
                req.processType().requiredWork(target.difficulty()),
                clock.now()));

        return new ReservationHandle(rec.id(), rec.gatewayServerId(), rec.reservation(), rec.requiredWork());
    }
}
