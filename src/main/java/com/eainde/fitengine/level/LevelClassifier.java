package com.eainde.fitengine.level;

import com.eainde.fitengine.config.LevelingFramework;
import com.eainde.fitengine.model.CandidateSignal;
import com.eainde.fitengine.model.JobFunction;
import com.eainde.fitengine.model.LevelAssessment;
import com.eainde.fitengine.model.SeniorityLevel;
import com.eainde.fitengine.model.SignalType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Detected level is the highest level whose signal thresholds are met by valid signals.
 * Pure function of its inputs; unsupported and title signals are ignored.
 */
@Slf4j
@Component
public class LevelClassifier {

    public LevelAssessment classify(List<CandidateSignal> signals,
                                    SeniorityLevel target,
                                    JobFunction function,
                                    LevelingFramework framework) {
        Map<SignalType, Integer> counts = new EnumMap<>(SignalType.class);
        for (CandidateSignal signal : signals) {
            if (signal.valid() && signal.evidenceFound() && signal.type() != SignalType.TITLE) {
                counts.merge(signal.type(), 1, Integer::sum);
            }
        }

        SeniorityLevel detected = SeniorityLevel.ENTRY;
        boolean previousMet = true;
        for (SeniorityLevel level : SeniorityLevel.values()) {
            if (level == SeniorityLevel.ENTRY) {
                continue;
            }
            Map<SignalType, Integer> threshold = framework.thresholdFor(function, level);
            boolean met = threshold.isEmpty() ? previousMet : meets(counts, threshold);
            if (met) {
                detected = level;
            }
            previousMet = met;
        }

        LevelAssessment assessment = LevelAssessment.of(detected, target);
        log.info("Level assessment: detected={} target={} distance={} from valid signal counts {}",
                detected, target, assessment.distance(), counts);
        return assessment;
    }

    private static boolean meets(Map<SignalType, Integer> counts, Map<SignalType, Integer> threshold) {
        for (Map.Entry<SignalType, Integer> min : threshold.entrySet()) {
            if (counts.getOrDefault(min.getKey(), 0) < min.getValue()) {
                return false;
            }
        }
        return true;
    }
}
