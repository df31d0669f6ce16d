package com.eainde.fitengine.config;

import com.eainde.fitengine.model.JobFunction;
import com.eainde.fitengine.model.SeniorityLevel;
import com.eainde.fitengine.model.SignalType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Minimum count of valid signals per type that a level requires, per function.
 *
 * <p>Levels absent from a threshold table have no requirement beyond the level below them.
 * {@link SeniorityLevel#ENTRY} is always met.</p>
 */
public final class LevelingFramework {

    private final Map<SeniorityLevel, Map<SignalType, Integer>> defaults;
    private final Map<JobFunction, Map<SeniorityLevel, Map<SignalType, Integer>>> overrides;

    private LevelingFramework(Map<SeniorityLevel, Map<SignalType, Integer>> defaults,
                              Map<JobFunction, Map<SeniorityLevel, Map<SignalType, Integer>>> overrides) {
        this.defaults = freeze(defaults);
        Map<JobFunction, Map<SeniorityLevel, Map<SignalType, Integer>>> copy = new EnumMap<>(JobFunction.class);
        overrides.forEach((fn, table) -> copy.put(fn, freeze(table)));
        this.overrides = Collections.unmodifiableMap(copy);
    }

    public static LevelingFramework defaults() {
        Map<SeniorityLevel, Map<SignalType, Integer>> table = new EnumMap<>(SeniorityLevel.class);
        table.put(SeniorityLevel.ASSOCIATE, Map.of(SignalType.TECHNICAL_DEPTH, 1));
        table.put(SeniorityLevel.MID, Map.of(SignalType.TECHNICAL_DEPTH, 2));
        table.put(SeniorityLevel.SENIOR, Map.of(SignalType.TECHNICAL_DEPTH, 2, SignalType.SCOPE, 1));
        table.put(SeniorityLevel.STAFF, Map.of(SignalType.TECHNICAL_DEPTH, 3, SignalType.SCOPE, 2));
        table.put(SeniorityLevel.DIRECTOR, Map.of(SignalType.SCOPE, 3, SignalType.LEADERSHIP, 2));
        table.put(SeniorityLevel.VP, Map.of(SignalType.SCOPE, 4, SignalType.LEADERSHIP, 3));
        table.put(SeniorityLevel.EXECUTIVE, Map.of(SignalType.SCOPE, 5, SignalType.LEADERSHIP, 4));
        return new LevelingFramework(table, Map.of());
    }

    public LevelingFramework withOverride(JobFunction function, Map<SeniorityLevel, Map<SignalType, Integer>> table) {
        Map<JobFunction, Map<SeniorityLevel, Map<SignalType, Integer>>> next = new EnumMap<>(JobFunction.class);
        next.putAll(overrides);
        next.put(function, table);
        return new LevelingFramework(defaults, next);
    }

    public Map<SignalType, Integer> thresholdFor(JobFunction function, SeniorityLevel level) {
        Map<SeniorityLevel, Map<SignalType, Integer>> table = overrides.getOrDefault(function, defaults);
        return table.getOrDefault(level, Map.of());
    }

    private static Map<SeniorityLevel, Map<SignalType, Integer>> freeze(Map<SeniorityLevel, Map<SignalType, Integer>> table) {
        Map<SeniorityLevel, Map<SignalType, Integer>> copy = new EnumMap<>(SeniorityLevel.class);
        table.forEach((level, min) -> copy.put(level, Map.copyOf(min)));
        return Collections.unmodifiableMap(copy);
    }
}
