package net.hexproc.core.service;

import net.hexproc.core.model.Resources;

/**
 * 예약량 → 초당 작업량. 예약이 클수록 결과가 작아지면 안 되고(단조),
 * 같은 입력에는 같은 값을 돌려줘야 한다(결정적).
 */
public interface ThroughputPolicy {
    double workPerSecond(Resources reservation);

    /** 예약과 무관한 고정 처리량 */
    static ThroughputPolicy constant(double rate) {
        if (!(rate >= 0)) throw new IllegalArgumentException("rate must be >= 0: " + rate);
        return reservation -> rate;
    }

    static ThroughputPolicy linear(double baseRate, double cpuWeight, double netWeight) {
        return new LinearThroughputPolicy(baseRate, cpuWeight, netWeight);
    }
}
