package net.hexproc.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * 프로세스 종류(닫힌 집합). 종류별 기본 소요시간 범위 [min,max] (초).
 * 작업량 1 = throughput 1.0 에서 1초.
 */
public enum ProcessType {
    DOWNLOAD(60, 300),
    UPLOAD(60, 300),
    HACK(300, 600),
    BANK_HACK(600, 1200),
    INSTALL(120, 300),
    PORT_SCAN(30, 120),
    DDOS(600, 900),
    COLLECT(60, 180),
    RESEARCH(900, 1800),
    LOG_FORGE(60, 240);

    private final long minSeconds;
    private final long maxSeconds;

    ProcessType(long minSeconds, long maxSeconds) {
        this.minSeconds = minSeconds;
        this.maxSeconds = maxSeconds;
    }

    public long minSeconds() { return minSeconds; }

    public long maxSeconds() { return maxSeconds; }

    /** difficulty(0..100) 에 따라 [min,max] 사이를 선형 보간 */
    public double requiredWork(int difficulty) {
        int d = Math.max(0, Math.min(100, difficulty));
        return minSeconds + (maxSeconds - minSeconds) * (d / 100.0);
    }

    public static Optional<ProcessType> from(String s) {
        if (s == null || s.isBlank()) return Optional.empty();
        try {
            return Optional.of(ProcessType.valueOf(s.trim().toUpperCase(Locale.ROOT).replace('-', '_')));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public String code() { return name(); }
}
