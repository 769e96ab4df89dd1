package net.hexproc.adapter.jdbc;

import net.hexproc.core.error.ResourceExhaustedException;
import net.hexproc.core.model.AdmissionRequest;
import net.hexproc.core.model.CancelAck;
import net.hexproc.core.model.ProcessState;
import net.hexproc.core.model.ProcessType;
import net.hexproc.core.model.Resources;
import net.hexproc.core.model.TickOutcome;
import net.hexproc.core.service.AdmissionService;
import net.hexproc.core.service.CancellationService;
import net.hexproc.core.service.ThroughputPolicy;
import net.hexproc.core.service.TickEngine;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 병렬 경합 인수 테스트
 * - 모든 Repo는 TxContext 커넥션만 사용
 * - 풀 행 락 + 조건부 UPDATE, 프로세스 행 락 + VERSION CAS 가 경합에서도
 *   "초과 차감 없음 / 반환은 정확히 한 번" 을 지키는지 검증
 */
@TestMethodOrder(MethodOrderer.MethodName.class)
class ConcurrentProcessingAcceptanceTest extends TestSupport {

    private AdmissionService admission;
    private CancellationService cancellation;
    private TickEngine ticks;

    @BeforeEach
    void initServices() {
        admission = new AdmissionService(servers, processes, tx, clock);
        cancellation = new CancellationService(processes, servers, events, tx, clock);
        ticks = new TickEngine(processes, servers, cancellation, ThroughputPolicy.constant(5), events, tx, clock);
    }

    private <T> List<T> race(int threads, Callable<T> body) throws Exception {
        ExecutorService es = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<T>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            futures.add(es.submit(() -> {
                start.await();
                return body.call();
            }));
        }
        start.countDown();

        List<T> out = new ArrayList<>();
        try {
            for (Future<T> f : futures) out.add(f.get(60, TimeUnit.SECONDS));
        } finally {
            es.shutdownNow();
        }
        return out;
    }

    // ========== t1: 동시 입장: 총량을 넘겨 차감되지 않음 ==========
    @Test
    void t1_concurrentAdmissions_neverOverdraw() throws Exception {
        seedServer(1, Resources.cpu(100));

        List<Boolean> results = race(20, () -> {
            try {
                admission.admit(AdmissionRequest.of(1, ProcessType.DOWNLOAD, 1, 1, Resources.cpu(10)));
                return true;
            } catch (ResourceExhaustedException e) {
                return false;
            }
        });

        long admitted = results.stream().filter(b -> b).count();
        assertEquals(10, admitted, "exactly total/request admissions fit");
        assertEquals(0, pool(1).available().cpu());
        assertEquals(Resources.cpu(100), tx.required(() -> processes.sumActiveReservations(1)));
    }

    // ========== t2: 완료 임계점을 동시에 넘는 틱: 반환은 한 번 ==========
    @Test
    void t2_concurrentTicksAcrossThreshold_creditOnce() throws Exception {
        seedServer(1, Resources.cpu(100));
        seedServer(2, Resources.cpu(1), 0);
        long pid = admission.admit(AdmissionRequest.of(1, ProcessType.HACK, 1, 2, Resources.cpu(40))).processId();
        ticks.tick(pid, Duration.ofSeconds(59)); // 295 / 300

        List<TickOutcome.Kind> kinds = race(6, () -> ticks.tick(pid, Duration.ofSeconds(5)).kind());

        assertEquals(1, kinds.stream().filter(k -> k == TickOutcome.Kind.COMPLETED).count());
        assertEquals(5, kinds.stream().filter(k -> k == TickOutcome.Kind.NOOP).count());
        assertEquals(100, pool(1).available().cpu());
        assertEquals(1, events.published.size());
    }

    // ========== t3: 취소 완료와 틱이 경합: CANCELLED 한 번, 반환 한 번 ==========
    @Test
    void t3_completeCancellationRacesTick_creditOnce() throws Exception {
        seedServer(1, Resources.cpu(100));
        long pid = admission.admit(AdmissionRequest.of(1, ProcessType.HACK, 1, 1, Resources.cpu(60))).processId();
        cancellation.requestCancel(pid, 1);

        int threads = 8;
        List<Boolean> won = race(threads, new Callable<Boolean>() {
            private final AtomicInteger n = new AtomicInteger();

            @Override
            public Boolean call() throws Exception {
                if (n.getAndIncrement() % 2 == 0) {
                    return cancellation.completeCancellation(pid);
                }
                return ticks.tick(pid, Duration.ofSeconds(1)).kind() == TickOutcome.Kind.CANCELLED;
            }
        });

        assertEquals(1, won.stream().filter(b -> b).count());
        assertEquals(ProcessState.CANCELLED, process(pid).state());
        assertEquals(100, pool(1).available().cpu());
        assertEquals(1, events.published.size());
    }

    // ========== t4: 동시 취소 요청: 모두 ok, 상태는 CANCELLING 하나 ==========
    @Test
    void t4_concurrentCancelRequests_allOk() throws Exception {
        seedServer(1, Resources.cpu(100));
        long pid = admission.admit(AdmissionRequest.of(1, ProcessType.HACK, 1, 1, Resources.cpu(60))).processId();

        List<CancelAck> acks = race(6, () -> cancellation.requestCancel(pid, 1));

        assertTrue(acks.stream().allMatch(a -> CancelAck.OK.equals(a.status())));
        assertEquals(ProcessState.CANCELLING, process(pid).state());
        assertEquals(40, pool(1).available().cpu(), "request phase never releases");
        assertEquals(1L, process(pid).version());
    }
}
