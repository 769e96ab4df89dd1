package net.hexproc.core.model;

import java.util.Locale;
import java.util.Optional;

/** 틱 패스 방문 순서. weight 가 클수록 먼저 */
public enum ProcessPriority {
    LOW(1), NORMAL(5), HIGH(10), CRITICAL(15);

    private final int weight;

    ProcessPriority(int weight) { this.weight = weight; }

    public int weight() { return weight; }

    public static ProcessPriority fromWeight(int weight) {
        for (ProcessPriority p : values()) {
            if (p.weight == weight) return p;
        }
        throw new IllegalArgumentException("unknown priority weight: " + weight);
    }

    public static Optional<ProcessPriority> from(String s) {
        if (s == null || s.isBlank()) return Optional.of(NORMAL);
        try {
            return Optional.of(ProcessPriority.valueOf(s.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
