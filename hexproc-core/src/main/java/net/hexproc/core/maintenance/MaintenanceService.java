package net.hexproc.core.maintenance;

import net.hexproc.core.model.ProcessState;
import net.hexproc.core.model.ResourcePool;
import net.hexproc.core.model.Resources;
import net.hexproc.core.service.CancellationService;
import net.hexproc.core.spi.Clock;
import net.hexproc.core.spi.ProcessRepository;
import net.hexproc.core.spi.ServerRepository;
import net.hexproc.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class MaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

    private final ServerRepository servers;
    private final ProcessRepository processes;
    private final CancellationService cancellation;
    private final TxRunner tx;
    private final Clock clock;

    public MaintenanceService(ServerRepository servers,
                              ProcessRepository processes,
                              CancellationService cancellation,
                              TxRunner tx,
                              Clock clock) {
        this.servers = servers;
        this.processes = processes;
        this.cancellation = cancellation;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * 주기 점검 메인 루틴.
     * - CANCELLING 에 머문 프로세스의 취소 완료
     * - 서버별 available + 활성 예약 합 == total 감사 (어긋나면 보고만 하고 고치지 않음)
     */
    public MaintenanceReport runOnce(int cancellingLimit) throws Exception {
        MaintenanceReport r = new MaintenanceReport();
        r.timestamp = clock.now();

        // 1) 취소 완료 스윕
        List<Long> cancelling = tx.required(() -> processes.findIdsInState(ProcessState.CANCELLING, cancellingLimit));
        for (Long id : cancelling) {
            if (cancellation.completeCancellation(id)) {
                r.cancellationsCompleted++;
            }
        }

        // 2) 풀 감사: 서버마다 풀 행을 잠근 상태에서 합계를 본다
        List<Long> serverIds = tx.required(servers::findAllIds);
        for (Long serverId : serverIds) {
            Optional<PoolDrift> drift = tx.requiresNew(() -> audit(serverId));
            r.serversAudited++;
            drift.ifPresent(d -> {
                log.warn("pool drift on server {}: total={} available={} activeReservations={}",
                        d.serverId(), d.total(), d.available(), d.activeReservations());
                r.drifts.add(d);
            });
        }

        if (r.cancellationsCompleted > 0 || !r.drifts.isEmpty()) {
            log.info("maintenance: {}", r);
        }
        return r;
    }

    private Optional<PoolDrift> audit(long serverId) throws Exception {
        Optional<ResourcePool> opt = servers.lockPool(serverId);
        if (opt.isEmpty()) return Optional.empty();

        ResourcePool pool = opt.get();
        Resources active = processes.sumActiveReservations(serverId);
        boolean balanced;
        try {
            balanced = pool.available().plus(active).equals(pool.total());
        } catch (ArithmeticException overflow) {
            balanced = false;
        }
        return balanced
                ? Optional.empty()
                : Optional.of(new PoolDrift(serverId, pool.total(), pool.available(), active));
    }

    /** 감사에서 어긋난 서버 하나 */
    public record PoolDrift(long serverId, Resources total, Resources available, Resources activeReservations) {}

    /** 간단 리포트 DTO */
    public static final class MaintenanceReport {
        public Instant timestamp;
        public int cancellationsCompleted;
        public int serversAudited;
        public final List<PoolDrift> drifts = new ArrayList<>();

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", cancellationsCompleted=" + cancellationsCompleted +
                    ", serversAudited=" + serversAudited +
                    ", drifts=" + drifts +
                    '}';
        }
    }
}
