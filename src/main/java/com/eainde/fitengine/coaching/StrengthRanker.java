package com.eainde.fitengine.coaching;

import com.eainde.fitengine.model.CandidateSignal;
import com.eainde.fitengine.model.FunctionMatch;
import com.eainde.fitengine.model.ResumeDocument;
import com.eainde.fitengine.model.SignalExtraction;
import com.eainde.fitengine.model.SignalType;
import com.eainde.fitengine.model.Strength;
import com.eainde.fitengine.model.StrengthTier;
import com.eainde.fitengine.score.CapabilityExtractor;
import com.eainde.fitengine.signal.SignalPatterns;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Orders strengths JD-first: required capabilities with resume evidence, then transferable
 * capabilities, then generic leadership. Generic leadership is dropped once a required
 * capability is evidenced.
 */
@Slf4j
@Component
public class StrengthRanker {

    static final int MAX_STRENGTHS = 5;

    public List<Strength> rank(ResumeDocument resume,
                               List<String> requiredCapabilities,
                               FunctionMatch function,
                               SignalExtraction extraction) {
        Set<String> validSpans = new HashSet<>();
        extraction.validSignals().forEach(s -> validSpans.add(s.sourceSpan()));

        List<Strength> required = new ArrayList<>();
        for (String capability : requiredCapabilities) {
            evidenced(capability, resume, validSpans)
                    .ifPresent(span -> required.add(new Strength(StrengthTier.JD_REQUIRED, capability, span)));
        }

        List<Strength> adjacent = new ArrayList<>();
        for (String capability : function.transferable()) {
            if (requiredCapabilities.contains(capability)) {
                continue;
            }
            evidenced(capability, resume, validSpans)
                    .ifPresent(span -> adjacent.add(new Strength(StrengthTier.JD_ADJACENT, capability, span)));
        }

        List<Strength> ranked = new ArrayList<>(required);
        ranked.addAll(adjacent);
        if (required.isEmpty()) {
            for (CandidateSignal signal : extraction.validSignals()) {
                if (signal.type() == SignalType.LEADERSHIP || signal.type() == SignalType.SCOPE) {
                    String capability = signal.type() == SignalType.LEADERSHIP ? "team leadership" : "operating scope";
                    ranked.add(new Strength(StrengthTier.GENERIC, capability, signal.sourceSpan()));
                }
            }
        }

        List<Strength> result = ranked.size() > MAX_STRENGTHS ? ranked.subList(0, MAX_STRENGTHS) : ranked;
        log.info("Ranked {} strength(s): {} required, {} adjacent, {} generic",
                result.size(), required.size(), adjacent.size(), ranked.size() - required.size() - adjacent.size());
        return List.copyOf(result);
    }

    /**
     * A statement that names the capability and carries evidence of its own: a valid signal,
     * or at least a number.
     */
    private static Optional<String> evidenced(String capability, ResumeDocument resume, Set<String> validSpans) {
        return CapabilityExtractor.statements(resume).stream()
                .filter(s -> CapabilityExtractor.mentions(s.toLowerCase(Locale.ROOT), capability))
                .filter(s -> validSpans.contains(s.trim()) || SignalPatterns.hasMetric(s))
                .findFirst();
    }
}
