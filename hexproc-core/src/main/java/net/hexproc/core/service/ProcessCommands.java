package net.hexproc.core.service;

import net.hexproc.core.error.InvalidProcessException;
import net.hexproc.core.error.PermissionDeniedException;
import net.hexproc.core.model.AdmissionRequest;
import net.hexproc.core.model.CancelAck;
import net.hexproc.core.model.ProcessPriority;
import net.hexproc.core.model.ProcessRecord;
import net.hexproc.core.model.ProcessType;
import net.hexproc.core.model.ReservationHandle;
import net.hexproc.core.model.Resources;
import net.hexproc.core.spi.ProcessRepository;
import net.hexproc.core.spi.TxRunner;

import java.util.List;

/**
 * 외부 진입점(HTTP/RPC 핸들러 등)이 쓰는 얇은 파사드.
 * 문자열 코드를 닫힌 타입으로 해석하고 소유권을 확인한 뒤 서비스로 넘긴다.
 */
public final class ProcessCommands {
    private final AdmissionService admission;
    private final CancellationService cancellation;
    private final ProcessRepository processes;
    private final TxRunner tx;

    public ProcessCommands(AdmissionService admission,
                           CancellationService cancellation,
                           ProcessRepository processes,
                           TxRunner tx) {
        this.admission = admission;
        this.cancellation = cancellation;
        this.processes = processes;
        this.tx = tx;
    }

    public ReservationHandle create(long ownerId,
                                    String typeCode,
                                    long gatewayServerId,
                                    long targetServerId,
                                    Resources requested,
                                    String priorityCode) throws Exception {
        ProcessType type = ProcessType.from(typeCode)
                .orElseThrow(() -> new InvalidProcessException("unknown process type: " + typeCode));
        ProcessPriority priority = ProcessPriority.from(priorityCode)
                .orElseThrow(() -> new InvalidProcessException("unknown priority: " + priorityCode));
        if (requested == null) {
            throw new InvalidProcessException("requested resources are required");
        }
        return admission.admit(new AdmissionRequest(ownerId, type, gatewayServerId, targetServerId, requested, priority));
    }

    public CancelAck cancel(long processId, long ownerId) throws Exception {
        return cancellation.requestCancel(processId, ownerId);
    }

    /**
     * @throws InvalidProcessException    없는 id
     * @throws PermissionDeniedException 다른 사용자의 프로세스
     */
    public ProcessRecord describe(long processId, long ownerId) throws Exception {
        ProcessRecord r = tx.required(() -> processes.findById(processId))
                .orElseThrow(() -> new InvalidProcessException("unknown process " + processId));
        if (!r.ownedBy(ownerId)) {
            throw new PermissionDeniedException(processId, ownerId);
        }
        return r;
    }

    public List<ProcessRecord> listActive(long ownerId) throws Exception {
        return tx.required(() -> processes.findActiveByOwner(ownerId));
    }
}
