package net.hexproc.adapter.jdbc;

import net.hexproc.core.error.InvalidProcessException;
import net.hexproc.core.error.ResourceExhaustedException;
import net.hexproc.core.model.AdmissionRequest;
import net.hexproc.core.model.ProcessPriority;
import net.hexproc.core.model.ProcessRecord;
import net.hexproc.core.model.ProcessState;
import net.hexproc.core.model.ProcessType;
import net.hexproc.core.model.ReservationHandle;
import net.hexproc.core.model.Resources;
import net.hexproc.core.service.AdmissionService;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AdmissionService 인수 테스트 (TestSupport 상속)
 * - 풀 차감과 프로세스 INSERT 가 한 트랜잭션인지
 * - 거부 시 아무것도 남지 않는지
 */
@TestMethodOrder(MethodOrderer.MethodName.class)
class AdmissionServiceAcceptanceTest extends TestSupport {

    private AdmissionService admission;

    @BeforeEach
    void initService() {
        admission = new AdmissionService(servers, processes, tx, clock);
    }

    @Test
    @DisplayName("cpu 100 중 50 입장 → 성공, 60 추가 입장 → 거부, available 50 유지")
    void t1_admitThenExhaust() throws Exception {
        seedServer(1, Resources.cpu(100));

        ReservationHandle h = admission.admit(AdmissionRequest.of(7, ProcessType.DOWNLOAD, 1, 1, Resources.cpu(50)));
        assertEquals(Resources.cpu(50), h.reservation());
        assertEquals(50, pool(1).available().cpu());

        ResourceExhaustedException ex = assertThrows(ResourceExhaustedException.class,
                () -> admission.admit(AdmissionRequest.of(7, ProcessType.DOWNLOAD, 1, 1, Resources.cpu(60))));
        assertEquals(1, ex.serverId());
        assertEquals(Resources.cpu(50), ex.available());
        assertEquals(50, pool(1).available().cpu(), "rejected admission must not touch the pool");
        assertEquals(1, tx.required(() -> processes.findActiveByOwner(7)).size());
    }

    @Test
    @DisplayName("입장 직후 레코드: QUEUED, progress 0, 예약 그대로 저장")
    void t2_admittedRecordShape() throws Exception {
        seedServer(1, Resources.of(100, 2048, 500, 100));
        seedServer(2, Resources.cpu(10), 100);

        Resources req = Resources.of(30, 512, 10, 25);
        ReservationHandle h = admission.admit(
                new AdmissionRequest(7, ProcessType.DOWNLOAD, 1, 2, req, ProcessPriority.HIGH));

        ProcessRecord r = process(h.processId());
        assertEquals(ProcessState.QUEUED, r.state());
        assertEquals(0.0, r.progress());
        assertEquals(req, r.reservation());
        assertEquals(ProcessPriority.HIGH, r.priority());
        assertEquals(7L, r.ownerId());
        assertEquals(0L, r.version());
        assertEquals(T0, r.createdAt());
        assertEquals(T0, r.lastCheckpointAt());
        assertNull(r.completedAt());
        // 타깃 난이도 100 → 종류의 최대 소요시간
        assertEquals(ProcessType.DOWNLOAD.maxSeconds(), r.requiredWork(), 1e-6);
        assertEquals(h.requiredWork(), r.requiredWork(), 1e-6);

        assertEquals(Resources.of(70, 1536, 490, 75), pool(1).available());
        assertEquals(Resources.cpu(10), pool(2).available(), "target pool is never debited");
    }

    @Test
    @DisplayName("한 차원이라도 모자라면 거부")
    void t3_anyDimensionShort() throws Exception {
        seedServer(1, Resources.of(100, 100, 100, 10));

        assertThrows(ResourceExhaustedException.class,
                () -> admission.admit(AdmissionRequest.of(1, ProcessType.UPLOAD, 1, 1, Resources.of(1, 1, 1, 11))));
        assertEquals(Resources.of(100, 100, 100, 10), pool(1).available());
    }

    @Test
    @DisplayName("요청량이 available 과 정확히 같으면 입장, 0 으로 떨어짐")
    void t4_exactFit() throws Exception {
        seedServer(1, Resources.of(40, 40, 40, 40));

        admission.admit(AdmissionRequest.of(1, ProcessType.HACK, 1, 1, Resources.of(40, 40, 40, 40)));
        assertTrue(pool(1).available().isZero());
    }

    @Test
    @DisplayName("없는 gateway/target → InvalidProcessException, 풀 변화 없음")
    void t5_unknownServers() throws Exception {
        seedServer(1, Resources.cpu(100));

        assertThrows(InvalidProcessException.class,
                () -> admission.admit(AdmissionRequest.of(1, ProcessType.HACK, 99, 1, Resources.cpu(1))));
        assertThrows(InvalidProcessException.class,
                () -> admission.admit(AdmissionRequest.of(1, ProcessType.HACK, 1, 99, Resources.cpu(1))));
        assertEquals(100, pool(1).available().cpu());
    }
}
