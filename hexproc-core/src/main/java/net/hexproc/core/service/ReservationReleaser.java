package net.hexproc.core.service;

import net.hexproc.core.model.ProcessRecord;
import net.hexproc.core.model.Resources;
import net.hexproc.core.spi.ServerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 종료 전이와 같은 트랜잭션에서 저장된 예약을 gateway 풀에 되돌린다.
 * 호출 전에 CAS 전이가 성공해 있어야 한다 (한 행당 한 번만 호출되는 근거).
 */
final class ReservationReleaser {
    private static final Logger log = LoggerFactory.getLogger(ReservationReleaser.class);

    private final ServerRepository servers;

    ReservationReleaser(ServerRepository servers) {
        this.servers = servers;
    }

    /** 실제로 풀에 반환된 양 */
    Resources release(ProcessRecord r) throws Exception {
        Resources amount = r.reservation();
        if (amount.isZero()) return amount;
        if (servers.credit(r.gatewayServerId(), amount)) return amount;

        if (!servers.exists(r.gatewayServerId())) {
            log.warn("gateway server {} is gone; reservation {} of process {} has nowhere to return",
                    r.gatewayServerId(), amount, r.id());
            return Resources.ZERO;
        }
        // total 초과 = 이미 반환된 예약을 또 반환하려는 것. 트랜잭션 전체를 롤백시킨다
        throw new IllegalStateException("crediting " + amount + " to server " + r.gatewayServerId()
                + " would exceed its total (process " + r.id() + ")");
    }
}
