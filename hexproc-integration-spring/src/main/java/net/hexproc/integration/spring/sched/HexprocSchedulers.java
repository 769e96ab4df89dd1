package net.hexproc.integration.spring.sched;

import net.hexproc.core.error.StoreUnavailableException;
import net.hexproc.core.maintenance.MaintenanceService;
import net.hexproc.core.service.TickPassService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

public class HexprocSchedulers {
    private static final Logger log = LoggerFactory.getLogger(HexprocSchedulers.class);

    private final TickPassService tickPass;
    private final MaintenanceService maintenance;

    private int maxTicksPerPass = 100;
    private int maintenanceBatch = 100;

    public HexprocSchedulers(TickPassService tickPass, MaintenanceService maintenance) {
        this.tickPass = tickPass;
        this.maintenance = maintenance;
    }

    @Scheduled(fixedDelayString = "${hexproc.scheduler.tick-delay-ms:1000}")
    public void tick() throws Exception {
        try {
            tickPass.runOnce(maxTicksPerPass);
        } catch (StoreUnavailableException e) {
            // 이번 패스는 건너뛰고 다음 주기에 재시도
            log.warn("tick pass skipped: {}", e.getMessage());
        }
    }

    @Scheduled(fixedDelayString = "${hexproc.scheduler.maintenance-delay-ms:10000}")
    public void maintenance() throws Exception {
        try {
            maintenance.runOnce(maintenanceBatch);
        } catch (StoreUnavailableException e) {
            log.warn("maintenance skipped: {}", e.getMessage());
        }
    }

    public void setMaxTicksPerPass(int maxTicksPerPass) {
        this.maxTicksPerPass = maxTicksPerPass;
    }

    public void setMaintenanceBatch(int maintenanceBatch) {
        this.maintenanceBatch = maintenanceBatch;
    }
}
