package com.eainde.fitengine.gap;

import com.eainde.fitengine.model.CredibilityFinding;
import com.eainde.fitengine.model.FunctionMatch;
import com.eainde.fitengine.model.GapCategory;
import com.eainde.fitengine.model.GapClassification;
import com.eainde.fitengine.model.GapFinding;
import com.eainde.fitengine.model.GapSeverity;
import com.eainde.fitengine.model.JobFunction;
import com.eainde.fitengine.model.LevelAssessment;
import com.eainde.fitengine.model.MismatchSeverity;
import com.eainde.fitengine.model.SeniorityLevel;
import com.eainde.fitengine.model.SignalType;
import com.eainde.fitengine.model.TitleFinding;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Evaluates every gap condition, then lets decision authority pick the one that governs.
 *
 * <p>All conditions are checked so the inert ones are recorded, but only the highest-authority
 * finding becomes active. Nothing below it can soften the outcome.</p>
 */
@Slf4j
@Component
public class GapClassifier {

    static final int EXPERIENCE_GAP_DISTANCE = 2;
    static final int SEVERE_GAP_DISTANCE = 3;

    public GapClassification classify(GapInputs inputs) {
        List<GapFinding> fired = new ArrayList<>();
        credibility(inputs).ifPresent(fired::add);
        eligibility(inputs).ifPresent(fired::add);
        functionMismatch(inputs).ifPresent(fired::add);
        experienceGap(inputs).ifPresent(fired::add);
        presentationGap(inputs).ifPresent(fired::add);

        fired.sort((a, b) -> GapCategory.BY_AUTHORITY.compare(a.category(), b.category()));
        GapFinding active = fired.isEmpty() ? GapFinding.none() : fired.get(0);
        List<GapFinding> inert = fired.isEmpty() ? List.of() : fired.subList(1, fired.size());

        logAuthorityChain(fired, active);
        return new GapClassification(active, inert, inputs.domain().translationSupported());
    }

    // =========================================================================
    //  Conditions, in authority order
    // =========================================================================

    private Optional<GapFinding> credibility(GapInputs in) {
        List<String> reasons = new ArrayList<>();
        boolean titleInflation = in.extraction().flags().titleInflationDetected();
        if (titleInflation) {
            in.extraction().titleFindings().stream()
                    .filter(TitleFinding::inflated)
                    .forEach(f -> reasons.add("Title '" + f.title() + "' not supported by evidence"));
            if (reasons.isEmpty()) {
                reasons.add("Title not supported by evidence");
            }
        }
        in.credibility().stream().map(CredibilityFinding::detail).forEach(reasons::add);
        if (reasons.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new GapFinding(GapCategory.CREDIBILITY_VIOLATION, GapSeverity.SEVERE,
                String.join("; ", reasons),
                "Target " + in.level().detected().label() + "-level roles that match the evidence on your resume",
                titleInflation));
    }

    private Optional<GapFinding> eligibility(GapInputs in) {
        if (in.eligibility().eligible()) {
            return Optional.empty();
        }
        List<String> reasons = new ArrayList<>();
        in.eligibility().missingCredentials().forEach(c -> reasons.add("Missing required " + c));
        reasons.addAll(in.eligibility().disqualifiers());
        String redirect = in.eligibility().missingCredentials().isEmpty()
                ? "Target roles without this requirement"
                : "Obtain " + String.join(", ", in.eligibility().missingCredentials())
                + " or target roles without this requirement";
        return Optional.of(new GapFinding(GapCategory.ELIGIBILITY_VIOLATION, GapSeverity.SEVERE,
                String.join("; ", reasons), redirect));
    }

    private Optional<GapFinding> functionMismatch(GapInputs in) {
        FunctionMatch fm = in.function();
        if (!fm.severity().isMismatch()) {
            return Optional.empty();
        }
        GapSeverity severity = fm.severity() == MismatchSeverity.COMPLETE ? GapSeverity.SEVERE : GapSeverity.HIGH;
        return Optional.of(new GapFinding(GapCategory.FUNCTION_MISMATCH, severity,
                "Background is " + fm.candidateFunction().label() + "; role is " + fm.targetFunction().label(),
                "Target " + fm.candidateFunction().label() + " roles where your evidence applies directly"));
    }

    private Optional<GapFinding> experienceGap(GapInputs in) {
        LevelAssessment level = in.level();
        FunctionMatch fm = in.function();
        boolean levelGap = level.distance() >= EXPERIENCE_GAP_DISTANCE;
        boolean noRolesInFunction = in.structuredHistory()
                && fm.targetFunction() != JobFunction.OTHER
                && fm.rolesInTargetFunction() == 0;
        if (!levelGap && !noRolesInFunction) {
            return Optional.empty();
        }

        GapSeverity severity;
        String reason;
        if (levelGap) {
            severity = level.distance() >= SEVERE_GAP_DISTANCE ? GapSeverity.SEVERE : GapSeverity.HIGH;
            reason = "Evidenced level " + level.detected().label() + " is " + level.distance()
                    + " levels below target " + level.target().label();
        } else {
            severity = GapSeverity.MODERATE;
            reason = "No roles in " + fm.targetFunction().label();
        }
        SeniorityLevel next = SeniorityLevel.fromRank(level.detected().rank() + 1).orElse(level.detected());
        return Optional.of(new GapFinding(GapCategory.EXPERIENCE_GAP, severity, reason,
                "Target " + next.label() + "-level roles while building toward " + level.target().label()));
    }

    private Optional<GapFinding> presentationGap(GapInputs in) {
        List<String> reasons = new ArrayList<>();
        if (in.extraction().flags().keywordStuffingDetected()) {
            reasons.add("Keywords listed without applied context: "
                    + String.join(", ", in.extraction().keywordReport().uncontextualized()));
        }
        List<SignalType> missingCore = missingCoreSignals(in);
        if (!missingCore.isEmpty()) {
            reasons.add("No evidenced " + missingCore.stream().map(t -> t.name().toLowerCase(Locale.ROOT).replace('_', ' '))
                    .collect(Collectors.joining(" or ")) + " signal for a " + in.level().target().label() + " role");
        }
        if (in.level().distance() == 1) {
            reasons.add("Evidence reads one level below target");
        }
        if (reasons.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new GapFinding(GapCategory.PRESENTATION_GAP, GapSeverity.MODERATE,
                String.join("; ", reasons), null));
    }

    static List<SignalType> missingCoreSignals(GapInputs in) {
        SeniorityLevel target = in.level().target();
        List<SignalType> missing = new ArrayList<>();
        if (target.isAtLeast(SeniorityLevel.SENIOR) && in.extraction().count(SignalType.SCOPE) == 0) {
            missing.add(SignalType.SCOPE);
        }
        if (target.isAtLeast(SeniorityLevel.DIRECTOR) && in.extraction().count(SignalType.LEADERSHIP) == 0) {
            missing.add(SignalType.LEADERSHIP);
        }
        return missing;
    }

    private static void logAuthorityChain(List<GapFinding> fired, GapFinding active) {
        for (GapCategory category : GapCategory.values()) {
            if (category == GapCategory.NONE) {
                continue;
            }
            Optional<GapFinding> finding = fired.stream().filter(f -> f.category() == category).findFirst();
            String state = finding.isEmpty() ? "not fired" : (finding.get() == active ? "ACTIVE" : "inert");
            log.debug("Authority {} {}: {}", category.authority(), category, state);
        }
        log.info("Gap classification: active={} severity={} inert={}", active.category(), active.severity(),
                fired.stream().filter(f -> f != active).map(GapFinding::category).toList());
    }
}
