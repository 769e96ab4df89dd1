package net.hexproc.core.service;

import net.hexproc.core.model.ProcessEvent;
import net.hexproc.core.model.ProcessLifecycleEvent;
import net.hexproc.core.model.ProcessRecord;
import net.hexproc.core.model.ProcessState;
import net.hexproc.core.model.ResourcePool;
import net.hexproc.core.model.Resources;
import net.hexproc.core.model.TickOutcome;
import net.hexproc.core.spi.Clock;
import net.hexproc.core.spi.ProcessEventPublisher;
import net.hexproc.core.spi.ProcessRepository;
import net.hexproc.core.spi.ServerRepository;
import net.hexproc.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 프로세스 하나를 경과 시간만큼 진전시킨다.
 * 행 락(대기) → 상태별 처리 → CAS UPDATE 를 한 트랜잭션에서 수행하고,
 * 종료 전이면 같은 트랜잭션에서 예약을 반환한다. 이벤트는 커밋 후 중계.
 */
public final class TickEngine {
    private static final Logger log = LoggerFactory.getLogger(TickEngine.class);

    private final ProcessRepository processes;
    private final ServerRepository servers;
    private final CancellationService cancellation;
    private final ThroughputPolicy throughput;
    private final ReservationReleaser releaser;
    private final EventRelay events;
    private final TxRunner tx;
    private final Clock clock;

    public TickEngine(ProcessRepository processes,
                      ServerRepository servers,
                      CancellationService cancellation,
                      ThroughputPolicy throughput,
                      ProcessEventPublisher publisher,
                      TxRunner tx,
                      Clock clock) {
        this.processes = processes;
        this.servers = servers;
        this.cancellation = cancellation;
        this.throughput = throughput;
        this.releaser = new ReservationReleaser(servers);
        this.events = new EventRelay(publisher);
        this.tx = tx;
        this.clock = clock;
    }

    /** 주어진 경과 시간만큼 진전. 음수 elapsed 는 거부 */
    public TickOutcome tick(long processId, Duration elapsed) throws Exception {
        if (elapsed == null || elapsed.isNegative()) {
            throw new IllegalArgumentException("elapsed must be >= 0: " + elapsed);
        }
        return run(processId, elapsed);
    }

    /** 마지막 체크포인트부터 지금까지를 경과 시간으로 삼는다 (스케줄러 패스용) */
    public TickOutcome catchUp(long processId) throws Exception {
        return run(processId, null);
    }

    private TickOutcome run(long processId, Duration elapsed) throws Exception {
        Step step = tx.requiresNew(() -> tickLocked(processId, elapsed));
        if (step.event != null) {
            events.relay(step.event);
        }
        if (step.outcome.terminal()) {
            log.info("process {} -> {} (freed {})", processId, step.outcome.kind(),
                    step.event == null ? Resources.ZERO : step.event.freed());
        } else {
            log.debug("process {} tick: {}", processId, step.outcome.kind());
        }
        return step.outcome;
    }

    private Step tickLocked(long processId, Duration requested) throws Exception {
        Optional<ProcessRecord> opt = processes.lockById(processId);
        if (opt.isEmpty()) return Step.of(TickOutcome.noop(null));

        ProcessRecord r = opt.get();
        Instant now = clock.now();

        if (r.state().isTerminal()) {
            return Step.of(TickOutcome.noop(r));
        }

        // 취소 요청 관측 → 이 틱이 완료 단계를 대신 수행
        if (r.state() == ProcessState.CANCELLING) {
            Optional<ProcessLifecycleEvent> done = cancellation.completeLocked(r, now);
            if (done.isEmpty()) return Step.of(TickOutcome.noop(reload(processId)));
            return new Step(new TickOutcome(TickOutcome.Kind.CANCELLED, reload(processId)), done.get());
        }

        if (!servers.exists(r.targetServerId())) {
            return fail(r, now, "target server " + r.targetServerId() + " is gone");
        }

        if (r.state() == ProcessState.QUEUED) {
            Optional<ResourcePool> gateway = servers.findById(r.gatewayServerId());
            if (gateway.isEmpty()) {
                return fail(r, now, "gateway server " + r.gatewayServerId() + " is gone");
            }
            // 예약이 풀에 반영되지 않은 채 시작하는 일은 없어야 한다
            if (!r.reservation().fitsWithin(gateway.get().reserved())) {
                throw new IllegalStateException("process " + r.id() + " reservation " + r.reservation()
                        + " is not accounted in server " + r.gatewayServerId() + " (reserved "
                        + gateway.get().reserved() + ")");
            }
        }

        Duration elapsed = requested != null ? requested : sinceCheckpoint(r, now);
        double rate = throughput.workPerSecond(r.reservation());
        if (Double.isNaN(rate) || rate < 0) {
            throw new IllegalStateException("throughput policy returned " + rate + " for " + r.reservation());
        }
        double seconds = elapsed.toNanos() / 1_000_000_000.0;
        double progress = Math.min(r.requiredWork(), r.progress() + rate * seconds);

        if (progress >= r.requiredWork()) {
            return complete(r, progress, now);
        }

        ProcessState to = r.state() == ProcessState.QUEUED
                ? r.state().next(ProcessEvent.START).orElseThrow()
                : r.state();
        if (!processes.advance(r.id(), r.version(), r.state(), to, progress, now)) {
            return Step.of(TickOutcome.noop(reload(processId)));
        }
        TickOutcome.Kind kind = r.state() == ProcessState.QUEUED ? TickOutcome.Kind.STARTED : TickOutcome.Kind.ADVANCED;
        return Step.of(new TickOutcome(kind, reload(processId)));
    }

    private Step complete(ProcessRecord r, double progress, Instant now) throws Exception {
        // QUEUED 는 START 를 거쳐 FINISH
        ProcessState running = r.state() == ProcessState.QUEUED
                ? r.state().next(ProcessEvent.START).orElseThrow()
                : r.state();
        ProcessState done = running.next(ProcessEvent.FINISH).orElseThrow();

        if (!processes.advance(r.id(), r.version(), r.state(), done, progress, now)) {
            return Step.of(TickOutcome.noop(reload(r.id())));
        }
        Resources freed = releaser.release(r);
        return new Step(new TickOutcome(TickOutcome.Kind.COMPLETED, reload(r.id())),
                ProcessLifecycleEvent.of(r, done, freed, now));
    }

    private Step fail(ProcessRecord r, Instant now, String reason) throws Exception {
        // QUEUED 는 START 를 거쳐 FAIL
        ProcessState running = r.state() == ProcessState.QUEUED
                ? r.state().next(ProcessEvent.START).orElseThrow()
                : r.state();
        ProcessState to = running.next(ProcessEvent.FAIL).orElseThrow();
        if (!processes.transition(r.id(), r.version(), r.state(), to, now)) {
            return Step.of(TickOutcome.noop(reload(r.id())));
        }
        log.warn("process {} failed: {}", r.id(), reason);
        Resources freed = releaser.release(r);
        return new Step(new TickOutcome(TickOutcome.Kind.FAILED, reload(r.id())),
                ProcessLifecycleEvent.of(r, to, freed, now));
    }

    private static Duration sinceCheckpoint(ProcessRecord r, Instant now) {
        Instant from = r.lastCheckpointAt() != null ? r.lastCheckpointAt() : r.createdAt();
        if (from == null || now.isBefore(from)) return Duration.ZERO;
        return Duration.between(from, now);
    }

    private ProcessRecord reload(long processId) throws Exception {
        return processes.findById(processId).orElse(null);
    }

    private record Step(TickOutcome outcome, ProcessLifecycleEvent event) {
        static Step of(TickOutcome outcome) {
            return new Step(outcome, null);
        }
    }
}
