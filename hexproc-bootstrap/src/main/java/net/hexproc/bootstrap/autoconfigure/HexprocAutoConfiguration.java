package net.hexproc.bootstrap.autoconfigure;

import net.hexproc.bootstrap.props.HexprocProperties;
import net.hexproc.bootstrap.servers.ServerRegistrar;
import net.hexproc.core.maintenance.MaintenanceService;
import net.hexproc.core.service.*;
import net.hexproc.core.spi.*;
import net.hexproc.integration.spring.HexprocSpringConfig;
import net.hexproc.integration.spring.sched.HexprocSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

@AutoConfiguration
@EnableConfigurationProperties(HexprocProperties.class)
@Import(HexprocSpringConfig.class) // integration-spring: repos/tx/clock/event wiring
public class HexprocAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(HexprocAutoConfiguration.class);

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean(ThroughputPolicy.class)
    public ThroughputPolicy throughputPolicy(HexprocProperties props) {
        var t = props.getThroughput();
        return ThroughputPolicy.linear(t.getBaseRate(), t.getCpuWeight(), t.getNetWeight());
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public AdmissionService admissionService(ServerRepository servers,
                                             ProcessRepository processes,
                                             TxRunner tx,
                                             Clock clock) {
        return new AdmissionService(servers, processes, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public CancellationService cancellationService(ProcessRepository processes,
                                                   ServerRepository servers,
                                                   ProcessEventPublisher publisher,
                                                   TxRunner tx,
                                                   Clock clock) {
        return new CancellationService(processes, servers, publisher, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public TickEngine tickEngine(ProcessRepository processes,
                                 ServerRepository servers,
                                 CancellationService cancellation,
                                 ThroughputPolicy throughput,
                                 ProcessEventPublisher publisher,
                                 TxRunner tx,
                                 Clock clock) {
        return new TickEngine(processes, servers, cancellation, throughput, publisher, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public TickPassService tickPassService(ProcessRepository processes, TickEngine tickEngine, TxRunner tx) {
        return new TickPassService(processes, tickEngine, tx);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessCommands processCommands(AdmissionService admission,
                                           CancellationService cancellation,
                                           ProcessRepository processes,
                                           TxRunner tx) {
        return new ProcessCommands(admission, cancellation, processes, tx);
    }

    @Bean
    @ConditionalOnMissingBean
    public MaintenanceService maintenance(ServerRepository servers,
                                          ProcessRepository processes,
                                          CancellationService cancellation,
                                          TxRunner tx,
                                          Clock clock) {
        return new MaintenanceService(servers, processes, cancellation, tx, clock);
    }

    // --- 스케줄러 등록 (프로퍼티로 주기 제어) ---

    @Bean
    @ConditionalOnProperty(prefix = "hexproc.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public HexprocSchedulers hexprocSchedulers(TickPassService tickPass,
                                               MaintenanceService maintenance,
                                               HexprocProperties props) {
        var s = new HexprocSchedulers(tickPass, maintenance);

        // @Scheduled의 딜레이는 hexproc.scheduler.tick-delay-ms / maintenance-delay-ms 에서 읽힘.
        // 나머지 파라미터만 세터로 주입
        s.setMaxTicksPerPass(props.getScheduler().getMaxTicksPerPass());
        s.setMaintenanceBatch(props.getScheduler().getMaintenanceBatch());
        return s;
    }

    @Bean
    @ConditionalOnMissingBean
    public ServerRegistrar serverRegistrar(ServerRepository servers, TxRunner tx) {
        return new ServerRegistrar(servers, tx);
    }

    @Bean
    @ConditionalOnProperty(prefix = "hexproc.servers", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner serverRunner(ServerRegistrar registrar, HexprocProperties props) {
        log.info("server pools declared: {}", props.getServers().getPools());
        return args -> registrar.register(props.getServers());
    }
}
