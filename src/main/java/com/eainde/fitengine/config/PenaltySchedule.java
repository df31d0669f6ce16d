package com.eainde.fitengine.config;

import com.eainde.fitengine.model.JobFunction;
import com.eainde.fitengine.model.SeniorityLevel;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Penalty values scoped to (function, level) pairs.
 *
 * <p>Lookup order: exact (function, level), then (function, any level), then the global default.
 * A penalty type missing from all three resolves to zero.</p>
 */
public final class PenaltySchedule {

    private final Map<PenaltyType, Integer> defaults;
    private final Map<ScopeKey, Map<PenaltyType, Integer>> scoped;

    private PenaltySchedule(Map<PenaltyType, Integer> defaults, Map<ScopeKey, Map<PenaltyType, Integer>> scoped) {
        this.defaults = Map.copyOf(defaults);
        Map<ScopeKey, Map<PenaltyType, Integer>> copy = new HashMap<>();
        scoped.forEach((k, v) -> copy.put(k, Map.copyOf(v)));
        this.scoped = Map.copyOf(copy);
    }

    public static PenaltySchedule of(Map<PenaltyType, Integer> defaults) {
        return new PenaltySchedule(defaults, Map.of());
    }

    public PenaltySchedule withScope(JobFunction function, SeniorityLevel level, Map<PenaltyType, Integer> values) {
        Map<ScopeKey, Map<PenaltyType, Integer>> next = new HashMap<>(scoped);
        next.merge(new ScopeKey(function, level), values, (a, b) -> {
            Map<PenaltyType, Integer> merged = new EnumMap<>(PenaltyType.class);
            merged.putAll(a);
            merged.putAll(b);
            return merged;
        });
        return new PenaltySchedule(defaults, next);
    }

    public int valueOf(PenaltyType type, JobFunction function, SeniorityLevel level) {
        Map<PenaltyType, Integer> exact = scoped.get(new ScopeKey(function, level));
        if (exact != null && exact.containsKey(type)) {
            return exact.get(type);
        }
        Map<PenaltyType, Integer> functionWide = scoped.get(new ScopeKey(function, null));
        if (functionWide != null && functionWide.containsKey(type)) {
            return functionWide.get(type);
        }
        return defaults.getOrDefault(type, 0);
    }

    private record ScopeKey(JobFunction function, SeniorityLevel level) {
    }
}
