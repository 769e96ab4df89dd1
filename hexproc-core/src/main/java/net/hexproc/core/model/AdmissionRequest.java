package net.hexproc.core.model;

import java.util.Objects;

public record AdmissionRequest(
        long ownerId,
        ProcessType processType,
        long gatewayServerId,
        long targetServerId,
        Resources requested,
        ProcessPriority priority
) {
    public AdmissionRequest {
        Objects.requireNonNull(processType, "processType");
        Objects.requireNonNull(requested, "requested");
        if (priority == null) priority = ProcessPriority.NORMAL;
    }

    public static AdmissionRequest of(long ownerId, ProcessType type, long gateway, long target, Resources requested) {
        return new AdmissionRequest(ownerId, type, gateway, target, requested, ProcessPriority.NORMAL);
    }
}
