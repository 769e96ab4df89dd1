package net.hexproc.core.service;

import net.hexproc.core.model.TickOutcome;
import net.hexproc.core.spi.ProcessRepository;
import net.hexproc.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 스케줄러가 부르는 틱 패스. 활성 프로세스 id 를 우선순위 순으로 읽고
 * 각 id 를 독립 트랜잭션으로 catch-up 한다. 한 프로세스의 실패가 패스 전체를 멈추지 않는다.
 */
public final class TickPassService {
    private static final Logger log = LoggerFactory.getLogger(TickPassService.class);

    private final ProcessRepository processes;
    private final TickEngine tickEngine;
    private final TxRunner tx;

    public TickPassService(ProcessRepository processes, TickEngine tickEngine, TxRunner tx) {
        this.processes = processes;
        this.tickEngine = tickEngine;
        this.tx = tx;
    }

    public TickPassReport runOnce(int maxTicks) throws Exception {
        TickPassReport report = new TickPassReport();
        List<Long> ids = tx.required(() -> processes.findActiveIds(maxTicks));

        for (Long id : ids) {
            TickOutcome outcome;
            try {
                outcome = tickEngine.catchUp(id);
            } catch (IllegalStateException e) {
                // 불변식 위반은 해당 트랜잭션만 롤백. 나머지 프로세스는 계속 진행
                report.errors++;
                log.error("tick of process {} rolled back: {}", id, e.getMessage(), e);
                continue;
            }
            report.visited++;
            switch (outcome.kind()) {
                case STARTED -> report.started++;
                case ADVANCED -> report.advanced++;
                case COMPLETED -> report.completed++;
                case FAILED -> report.failed++;
                case CANCELLED -> report.cancelled++;
                case NOOP -> report.skipped++;
            }
        }
        if (report.visited > 0 || report.errors > 0) {
            log.debug("tick pass: {}", report);
        }
        return report;
    }

    /** 간단 리포트 DTO */
    public static final class TickPassReport {
        public int visited;
        public int started;
        public int advanced;
        public int completed;
        public int failed;
        public int cancelled;
        public int skipped;
        public int errors;

        @Override public String toString() {
            return "TickPassReport{" +
                    "visited=" + visited +
                    ", started=" + started +
                    ", advanced=" + advanced +
                    ", completed=" + completed +
                    ", failed=" + failed +
                    ", cancelled=" + cancelled +
                    ", skipped=" + skipped +
                    ", errors=" + errors +
                    '}';
        }
    }
}
