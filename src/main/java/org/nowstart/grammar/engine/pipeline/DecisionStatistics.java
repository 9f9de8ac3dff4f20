package org.nowstart.grammar.engine.pipeline;

import java.util.EnumMap;
import java.util.Map;
import org.nowstart.grammar.data.type.ReasonCode;

public class DecisionStatistics {

    private final Map<ReasonCode, Long> counts = new EnumMap<>(ReasonCode.class);

    public void record(ReasonCode reasonCode) {
        counts.merge(reasonCode, 1L, Long::sum);
    }

    public long count(ReasonCode reasonCode) {
        return counts.getOrDefault(reasonCode, 0L);
    }

    public long allowed() {
        return count(ReasonCode.ALLOWED);
    }

    public long denied() {
        return counts.entrySet().stream()
                .filter(entry -> entry.getKey().isDenial())
                .mapToLong(Map.Entry::getValue)
                .sum();
    }

    public Map<ReasonCode, Long> snapshot() {
        return Map.copyOf(counts);
    }
}
