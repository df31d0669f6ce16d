package com.eainde.fitengine.model;

import java.util.List;

/**
 * Hand-off from the signal extractor to every later stage.
 */
public record SignalExtraction(
        List<CandidateSignal> signals,
        SessionFlags flags,
        KeywordStuffingReport keywordReport,
        List<TitleFinding> titleFindings
) {

    public SignalExtraction {
        signals = List.copyOf(signals);
        titleFindings = titleFindings == null ? List.of() : List.copyOf(titleFindings);
        keywordReport = keywordReport == null ? KeywordStuffingReport.clean() : keywordReport;
    }

    public List<CandidateSignal> validSignals() {
        return signals.stream().filter(CandidateSignal::valid).toList();
    }

    public long count(SignalType type) {
        return validSignals().stream().filter(s -> s.type() == type).count();
    }
}
