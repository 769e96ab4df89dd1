package net.hexproc.core.error;

import net.hexproc.core.model.Resources;

/** 입장 거부. 요청은 큐잉되지 않는다 */
public class ResourceExhaustedException extends ProcessEngineException {
    private final long serverId;
    private final Resources requested;
    private final Resources available;

    public ResourceExhaustedException(long serverId, Resources requested, Resources available) {
        super("not enough capacity on server " + serverId + ": requested=" + requested + ", available=" + available);
        this.serverId = serverId;
        this.requested = requested;
        this.available = available;
    }

    public long serverId() { return serverId; }

    public Resources requested() { return requested; }

    public Resources available() { return available; }
}
