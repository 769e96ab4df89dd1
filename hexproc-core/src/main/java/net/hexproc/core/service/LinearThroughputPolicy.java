package net.hexproc.core.service;

import net.hexproc.core.model.Resources;

/** base + cpu*cpuWeight + net*netWeight. 가중치가 음수가 아니므로 단조 */
final class LinearThroughputPolicy implements ThroughputPolicy {
    private final double baseRate;
    private final double cpuWeight;
    private final double netWeight;

    LinearThroughputPolicy(double baseRate, double cpuWeight, double netWeight) {
        if (!(baseRate >= 0) || !(cpuWeight >= 0) || !(netWeight >= 0)) {
            throw new IllegalArgumentException("throughput weights must be >= 0: base=" + baseRate
                    + ", cpu=" + cpuWeight + ", net=" + netWeight);
        }
        this.baseRate = baseRate;
        this.cpuWeight = cpuWeight;
        this.netWeight = netWeight;
    }

    @Override
    public double workPerSecond(Resources r) {
        return baseRate + r.cpu() * cpuWeight + r.net() * netWeight;
    }

    @Override
    public String toString() {
        return "LinearThroughputPolicy{base=" + baseRate + ", cpu=" + cpuWeight + ", net=" + netWeight + '}';
    }
}
