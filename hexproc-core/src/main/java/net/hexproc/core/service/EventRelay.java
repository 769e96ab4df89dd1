package net.hexproc.core.service;

import net.hexproc.core.model.ProcessLifecycleEvent;
import net.hexproc.core.spi.ProcessEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** 커밋 이후 이벤트 전달. 중계 실패는 이미 커밋된 전이에 영향을 주지 않는다 */
final class EventRelay {
    private static final Logger log = LoggerFactory.getLogger(EventRelay.class);

    private final ProcessEventPublisher publisher;

    EventRelay(ProcessEventPublisher publisher) {
        this.publisher = publisher == null ? ProcessEventPublisher.noop() : publisher;
    }

    void relay(ProcessLifecycleEvent event) {
        if (event == null) return;
        try {
            publisher.publish(event);
        } catch (RuntimeException e) {
            log.warn("failed to relay {} of process {}: {}", event.state(), event.processId(), e.toString(), e);
        }
    }
}
