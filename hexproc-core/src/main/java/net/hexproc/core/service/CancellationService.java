package net.hexproc.core.service;

import net.hexproc.core.error.StoreUnavailableException;
import net.hexproc.core.model.CancelAck;
import net.hexproc.core.model.ProcessEvent;
import net.hexproc.core.model.ProcessLifecycleEvent;
import net.hexproc.core.model.ProcessRecord;
import net.hexproc.core.model.ProcessState;
import net.hexproc.core.model.Resources;
import net.hexproc.core.spi.Clock;
import net.hexproc.core.spi.ProcessEventPublisher;
import net.hexproc.core.spi.ProcessRepository;
import net.hexproc.core.spi.ServerRepository;
import net.hexproc.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * 2단계 취소.
 * <ol>
 *   <li>요청: (id, owner) 행을 SKIP LOCKED 로 잠그고 QUEUED/RUNNING → CANCELLING. 항상 "ok".</li>
 *   <li>완료: CANCELLING 행을 대기 락으로 잡고 예약 반환 + CANCELLED. 그 외 상태면 no-op.</li>
 * </ol>
 * 두 단계 모두 몇 번을 어떤 순서로 호출해도 예약은 정확히 한 번 반환된다.
 */
public final class CancellationService {
    private static final Logger log = LoggerFactory.getLogger(CancellationService.class);

    private final ProcessRepository processes;
    private final ReservationReleaser releaser;
    private final EventRelay events;
    private final TxRunner tx;
    private final Clock clock;

    public CancellationService(ProcessRepository processes,
                               ServerRepository servers,
                               ProcessEventPublisher publisher,
                               TxRunner tx,
                               Clock clock) {
        this.processes = processes;
        this.releaser = new ReservationReleaser(servers);
        this.events = new EventRelay(publisher);
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * 요청 단계. 행이 없거나, 주인이 다르거나, 다른 트랜잭션이 잠그고 있으면 변경 없이 성공.
     * 워커가 잡은 락을 기다리지 않는다.
     */
    public CancelAck requestCancel(long processId, long ownerId) throws Exception {
        try {
            boolean changed = tx.requiresNew(() -> {
                Optional<ProcessRecord> opt = processes.lockOwnedSkipLocked(processId, ownerId);
                if (opt.isEmpty()) return false;

                ProcessRecord r = opt.get();
                Optional<ProcessState> to = r.state().next(ProcessEvent.REQUEST_CANCEL);
                if (to.isEmpty()) return false; // 이미 CANCELLING 또는 종료 상태

                return processes.transition(processId, r.version(), r.state(), to.get(), clock.now());
            });
            if (changed) {
                log.info("cancellation requested: process={} owner={}", processId, ownerId);
            } else {
                log.debug("cancellation request ignored: process={} owner={}", processId, ownerId);
            }
        } catch (StoreUnavailableException e) {
            // 사용자에게 취소 오류는 보여주지 않는다. 다음 요청/틱에서 다시 시도됨
            log.warn("cancellation request for process {} not recorded: {}", processId, e.getMessage(), e);
        }
        return CancelAck.ok(processId);
    }

    /**
     * 완료 단계. CANCELLING 이 아니면 no-op.
     *
     * @return 이번 호출이 예약을 반환하고 CANCELLED 로 바꿨으면 true
     */
    public boolean completeCancellation(long processId) throws Exception {
        Optional<ProcessLifecycleEvent> done = tx.requiresNew(() -> {
            Optional<ProcessRecord> opt = processes.lockCancelling(processId);
            if (opt.isEmpty()) return Optional.<ProcessLifecycleEvent>empty();
            return completeLocked(opt.get(), clock.now());
        });
        done.ifPresent(e -> {
            log.info("process {} cancelled, freed {}", processId, e.freed());
            events.relay(e);
        });
        return done.isPresent();
    }

    /**
     * 이미 행 락을 가진 트랜잭션(취소 완료 단계 또는 틱)에서 호출.
     * 이벤트는 커밋 후 호출자가 중계한다.
     */
    Optional<ProcessLifecycleEvent> completeLocked(ProcessRecord r, Instant now) throws Exception {
        Optional<ProcessState> to = r.state().next(ProcessEvent.CONFIRM_CANCEL);
        if (to.isEmpty()) return Optional.empty();
        if (!processes.transition(r.id(), r.version(), r.state(), to.get(), now)) {
            return Optional.empty(); // 다른 트랜잭션이 먼저 완료
        }
        Resources freed = releaser.release(r);
        return Optional.of(ProcessLifecycleEvent.of(r, to.get(), freed, now));
    }
}
