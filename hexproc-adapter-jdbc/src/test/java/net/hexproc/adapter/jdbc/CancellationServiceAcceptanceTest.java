package net.hexproc.adapter.jdbc;

import net.hexproc.core.model.AdmissionRequest;
import net.hexproc.core.model.CancelAck;
import net.hexproc.core.model.ProcessLifecycleEvent;
import net.hexproc.core.model.ProcessState;
import net.hexproc.core.model.ProcessType;
import net.hexproc.core.model.Resources;
import net.hexproc.core.model.TickOutcome;
import net.hexproc.core.service.AdmissionService;
import net.hexproc.core.service.CancellationService;
import net.hexproc.core.service.ThroughputPolicy;
import net.hexproc.core.service.TickEngine;
import org.junit.jupiter.api.*;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 2단계 취소 인수 테스트
 * - 요청은 주인만, 항상 "ok"
 * - 완료는 CANCELLING 에서만, 예약은 정확히 한 번 반환
 * - 요청 단계는 잠긴 행을 기다리지 않는다
 */
@TestMethodOrder(MethodOrderer.MethodName.class)
class CancellationServiceAcceptanceTest extends TestSupport {

    private AdmissionService admission;
    private CancellationService cancellation;
    private TickEngine ticks;

    @BeforeEach
    void initServices() {
        admission = new AdmissionService(servers, processes, tx, clock);
        cancellation = new CancellationService(processes, servers, events, tx, clock);
        ticks = new TickEngine(processes, servers, cancellation, ThroughputPolicy.constant(1.0), events, tx, clock);
    }

    private long admit(long owner, Resources req) throws Exception {
        return admission.admit(AdmissionRequest.of(owner, ProcessType.HACK, 1, 1, req)).processId();
    }

    @Test
    @DisplayName("다른 사용자의 취소 요청: RUNNING 유지, 풀 그대로, 응답은 ok")
    void t1_nonOwnerIsIgnored() throws Exception {
        seedServer(1, Resources.cpu(100));
        long pid = admit(1, Resources.cpu(50));
        assertEquals(TickOutcome.Kind.STARTED, ticks.tick(pid, Duration.ofSeconds(1)).kind());

        CancelAck ack = cancellation.requestCancel(pid, 2);

        assertEquals(CancelAck.OK, ack.status());
        assertEquals(ProcessState.RUNNING, process(pid).state());
        assertEquals(50, pool(1).available().cpu());
    }

    @Test
    @DisplayName("QUEUED 취소 → CANCELLING, 틱은 진전시키지 않음, 완료 후 CANCELLED + 전액 반환")
    void t2_queuedCancelThenComplete() throws Exception {
        seedServer(1, Resources.of(100, 64, 10, 10));
        Resources req = Resources.of(40, 32, 5, 1);
        long pid = admit(1, req);

        assertEquals(CancelAck.OK, cancellation.requestCancel(pid, 1).status());
        assertEquals(ProcessState.CANCELLING, process(pid).state());
        assertEquals(Resources.of(60, 32, 5, 9), pool(1).available(), "request phase does not release");

        assertTrue(cancellation.completeCancellation(pid));
        assertEquals(ProcessState.CANCELLED, process(pid).state());
        assertEquals(0.0, process(pid).progress());
        assertNotNull(process(pid).completedAt());
        assertEquals(Resources.of(100, 64, 10, 10), pool(1).available());

        assertEquals(1, events.published.size());
        ProcessLifecycleEvent e = events.published.get(0);
        assertEquals(ProcessState.CANCELLED, e.state());
        assertEquals(req, e.freed());
        assertEquals(pid, e.processId());
    }

    @Test
    @DisplayName("CANCELLING 을 본 틱이 완료 단계를 수행, progress 는 그대로")
    void t3_tickCompletesCancellation() throws Exception {
        seedServer(1, Resources.cpu(100));
        long pid = admit(1, Resources.cpu(30));
        ticks.tick(pid, Duration.ofSeconds(10));
        double before = process(pid).progress();

        cancellation.requestCancel(pid, 1);
        TickOutcome out = ticks.tick(pid, Duration.ofSeconds(100));

        assertEquals(TickOutcome.Kind.CANCELLED, out.kind());
        assertEquals(ProcessState.CANCELLED, out.record().state());
        assertEquals(before, out.record().progress(), 1e-9);
        assertEquals(100, pool(1).available().cpu());
        assertFalse(cancellation.completeCancellation(pid), "already completed by the tick");
        assertEquals(100, pool(1).available().cpu());
    }

    @Test
    @DisplayName("요청/완료를 여러 번, 어떤 순서로 불러도 반환은 한 번")
    void t4_idempotent() throws Exception {
        seedServer(1, Resources.cpu(100));
        long pid = admit(1, Resources.cpu(70));

        assertFalse(cancellation.completeCancellation(pid), "not cancelling yet");
        cancellation.requestCancel(pid, 1);
        cancellation.requestCancel(pid, 1);
        assertTrue(cancellation.completeCancellation(pid));
        assertFalse(cancellation.completeCancellation(pid));
        assertEquals(CancelAck.OK, cancellation.requestCancel(pid, 1).status());

        assertEquals(ProcessState.CANCELLED, process(pid).state());
        assertEquals(100, pool(1).available().cpu());
        assertEquals(1, events.published.size());
    }

    @Test
    @DisplayName("종료된 프로세스/없는 id 취소 요청: 변화 없이 ok")
    void t5_terminalAndUnknown() throws Exception {
        seedServer(1, Resources.cpu(100));
        long pid = admit(1, Resources.cpu(10));
        ticks.tick(pid, Duration.ofHours(1));
        assertEquals(ProcessState.COMPLETED, process(pid).state());

        assertEquals(CancelAck.OK, cancellation.requestCancel(pid, 1).status());
        assertEquals(CancelAck.OK, cancellation.requestCancel(987654L, 1).status());
        assertEquals(ProcessState.COMPLETED, process(pid).state());
        assertEquals(100, pool(1).available().cpu());
    }

    @Test
    @DisplayName("다른 트랜잭션이 행을 잡고 있으면 요청은 기다리지 않고 ok, 상태 변화 없음")
    void t6_skipLockedDoesNotBlock() throws Exception {
        seedServer(1, Resources.cpu(100));
        long pid = admit(1, Resources.cpu(10));

        try (Connection holder = ds.getConnection()) {
            holder.setAutoCommit(false);
            try (PreparedStatement ps = holder.prepareStatement("SELECT ID FROM TB_PROCESS WHERE ID = ? FOR UPDATE")) {
                ps.setLong(1, pid);
                try (ResultSet rs = ps.executeQuery()) {
                    assertTrue(rs.next());
                }
            }

            CancelAck ack = assertTimeout(Duration.ofSeconds(5), () -> cancellation.requestCancel(pid, 1));
            assertEquals(CancelAck.OK, ack.status());

            holder.rollback();
        }

        assertEquals(ProcessState.QUEUED, process(pid).state(), "skipped request leaves the row untouched");

        // 락이 풀리면 다시 요청 가능
        cancellation.requestCancel(pid, 1);
        assertEquals(ProcessState.CANCELLING, process(pid).state());
    }
}
