package net.hexproc.core.spi;

import net.hexproc.core.model.ProcessLifecycleEvent;

/** 종료 전이 신호를 외부(웹소켓 중계 등)로 넘기는 출구. 커밋 이후에만 호출된다 */
@FunctionalInterface
public interface ProcessEventPublisher {
    void publish(ProcessLifecycleEvent event);

    static ProcessEventPublisher noop() {
        return e -> { };
    }
}
