package net.hexproc.core.spi;

import net.hexproc.core.model.ResourcePool;
import net.hexproc.core.model.Resources;

import java.util.List;
import java.util.Optional;

public interface ServerRepository {
    /** 풀 행에 배타 락(FOR UPDATE, 대기) 후 조회 */
    Optional<ResourcePool> lockPool(long serverId) throws Exception;

    Optional<ResourcePool> findById(long serverId) throws Exception;

    boolean exists(long serverId) throws Exception;

    /** 조건부 차감: 모든 차원에서 available >= amount 일 때만 반영. 반영 여부 반환 */
    boolean debit(long serverId, Resources amount) throws Exception;

    /** 예약 반환. total 을 넘기게 되면 반영하지 않고 false (이중 반환 방지) */
    boolean credit(long serverId, Resources amount) throws Exception;

    /** 없을 때만 INSERT (available = total). 삽입 여부 반환 */
    boolean insertIfAbsent(ResourcePool pool) throws Exception;

    List<Long> findAllIds() throws Exception;
}
