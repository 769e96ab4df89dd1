package net.hexproc.integration.spring.event;

import net.hexproc.core.model.ProcessLifecycleEvent;
import net.hexproc.core.spi.ProcessEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

/** ProcessLifecycleEvent 를 payload 이벤트로 발행 */
public final class SpringProcessEventPublisher implements ProcessEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(SpringProcessEventPublisher.class);

    private final ApplicationEventPublisher publisher;

    public SpringProcessEventPublisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Override
    public void publish(ProcessLifecycleEvent event) {
        log.debug("publishing {} for process {}", event.state(), event.processId());
        publisher.publishEvent(event);
    }
}
