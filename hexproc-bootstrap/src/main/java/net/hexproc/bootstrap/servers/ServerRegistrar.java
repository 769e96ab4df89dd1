package net.hexproc.bootstrap.servers;

import net.hexproc.bootstrap.props.HexprocProperties;
import net.hexproc.core.model.ResourcePool;
import net.hexproc.core.model.Resources;
import net.hexproc.core.spi.ServerRepository;
import net.hexproc.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 설정에 선언된 서버 풀을 기동 시 등록한다.
 * 이미 있는 서버는 건드리지 않는다 (재기동해도 진행 중인 예약이 날아가지 않게).
 */
public class ServerRegistrar {
    private static final Logger log = LoggerFactory.getLogger(ServerRegistrar.class);

    private final ServerRepository servers;
    private final TxRunner tx;

    public ServerRegistrar(ServerRepository servers, TxRunner tx) {
        this.servers = servers;
        this.tx = tx;
    }

    public int register(HexprocProperties.Servers def) throws Exception {
        int inserted = 0;
        for (var p : def.getPools()) {
            if (p.getId() == null) {
                throw new IllegalArgumentException("hexproc.servers.pools[].id is required: " + p);
            }
            ResourcePool pool = ResourcePool.ofNew(p.getId(),
                    Resources.of(p.getCpu(), p.getRam(), p.getHdd(), p.getNet()),
                    p.getDifficulty());
            boolean created = tx.required(() -> servers.insertIfAbsent(pool));
            if (created) {
                inserted++;
                log.info("Server registered: id={} total={} difficulty={}", pool.serverId(), pool.total(), pool.difficulty());
            } else {
                log.debug("Server {} already present; left as is", pool.serverId());
            }
        }
        return inserted;
    }
}
