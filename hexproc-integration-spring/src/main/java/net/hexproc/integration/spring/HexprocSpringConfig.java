package net.hexproc.integration.spring;

import net.hexproc.adapter.jdbc.repo.JdbcProcessRepository;
import net.hexproc.adapter.jdbc.repo.JdbcServerRepository;
import net.hexproc.core.spi.*;
import net.hexproc.integration.spring.event.SpringProcessEventPublisher;
import net.hexproc.integration.spring.tx.SpringTxRunner;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
public class HexprocSpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // Repository 구현 등록 (adapter-jdbc 재사용)
    @Bean public ServerRepository serverRepository() { return new JdbcServerRepository(); }
    @Bean public ProcessRepository processRepository() { return new JdbcProcessRepository(); }

    // 종료 이벤트는 스프링 ApplicationEvent 로 흘려보낸다 (@EventListener 로 구독)
    @Bean
    public ProcessEventPublisher processEventPublisher(ApplicationEventPublisher publisher) {
        return new SpringProcessEventPublisher(publisher);
    }

    @Bean public Clock systemClock() { return java.time.Instant::now; }
}
