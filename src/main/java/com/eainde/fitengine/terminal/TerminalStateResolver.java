package com.eainde.fitengine.terminal;

import com.eainde.fitengine.model.GapCategory;
import com.eainde.fitengine.model.GapClassification;
import com.eainde.fitengine.model.GapSeverity;
import com.eainde.fitengine.model.SensitiveTopic;
import com.eainde.fitengine.model.TerminalState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Derives the session's terminal state from its gap classification. A table lookup plus phrase
 * templating; no free text is generated here.
 */
@Slf4j
@Component
public class TerminalStateResolver {

    public TerminalState resolve(GapClassification gap, ResolutionContext ctx) {
        GapCategory category = gap.category();
        boolean severe = gap.severity() == GapSeverity.SEVERE
                && (category == GapCategory.EXPERIENCE_GAP || category == GapCategory.FUNCTION_MISMATCH);
        TerminalStateCatalog.Entry entry = TerminalStateCatalog.entryFor(category, severe);

        List<String> required = new ArrayList<>();
        List<String> forbidden = new ArrayList<>(entry.forbidden());
        List<Pattern> forbiddenPatterns = new ArrayList<>();
        Map<SensitiveTopic, String> canonical = new EnumMap<>(SensitiveTopic.class);
        String role = ctx.roleTitle() == null || ctx.roleTitle().isBlank() ? "this role" : ctx.roleTitle();

        String headline;
        switch (category) {
            case CREDIBILITY_VIOLATION -> {
                boolean titleIssue = gap.active().titleInflation();
                headline = titleIssue
                        ? "Senior title not supported by evidence in your bullets, which hiring teams read as a credibility risk."
                        : "Claims on this resume read as a credibility risk until they carry verifiable detail.";
                required.add("credibility risk");
                if (titleIssue) {
                    required.add("title not supported by evidence");
                    canonical.put(SensitiveTopic.TITLE_INFLATION,
                            "Rewrite the title section so every senior claim sits next to the team size, budget or scope that proves it.");
                }
                canonical.put(SensitiveTopic.CREDIBILITY,
                        "Until the evidence matches the claims, applying to " + role + " puts your credibility at risk.");
                forbidden.add("supports " + lower(role));
            }
            case ELIGIBILITY_VIOLATION -> {
                String missing = ctx.eligibility() == null || ctx.eligibility().missingCredentials().isEmpty()
                        ? "a stated hard requirement"
                        : String.join(", ", ctx.eligibility().missingCredentials());
                headline = "This application does not meet eligibility requirements: " + missing + ".";
                required.add("does not meet eligibility requirements");
                canonical.put(SensitiveTopic.ELIGIBILITY,
                        "Hard requirements are screened before any human review, so eligibility comes first.");
            }
            case FUNCTION_MISMATCH -> {
                String roleFn = ctx.function().targetFunction().label();
                String candidateFn = ctx.function().candidateFunction().label();
                headline = "Function mismatch: " + role + " requires " + roleFn
                        + " experience, and your evidence is in " + candidateFn + ".";
                required.add("function mismatch");
                required.add("requires " + lower(roleFn) + " experience");
                canonical.put(SensitiveTopic.FUNCTION_MISMATCH,
                        "This is " + article(roleFn) + " " + roleFn + " role, not " + article(candidateFn) + " "
                                + candidateFn + " role.");
                forbidden.add("supports " + lower(role));
                forbidden.add("supports " + lower(roleFn));
            }
            case EXPERIENCE_GAP -> {
                headline = "Experience gap: your evidenced level is " + ctx.level().detected().label()
                        + ", below target level " + ctx.level().target().label() + ".";
                required.add("experience gap");
                required.add("below target level");
                forbidden.add("supports " + lower(role));
            }
            case PRESENTATION_GAP -> {
                headline = "Presentation gap: the evidence for " + role + " is only partly visible on your resume.";
                required.add("presentation gap");
            }
            default -> headline = "Strong alignment with " + role + ".";
        }

        if (category != GapCategory.NONE) {
            forbidden.addAll(TerminalStateCatalog.UNIVERSAL_FORBIDDEN);
        }
        if (!gap.translationSupported()) {
            forbiddenPatterns.addAll(TerminalStateCatalog.TRANSLATION_PATTERNS);
            String target = ctx.domain() == null || ctx.domain().targetDomain() == null
                    ? "this domain" : ctx.domain().targetDomain().replace('_', ' ');
            canonical.put(SensitiveTopic.DOMAIN_TRANSLATION,
                    "Your resume does not yet show overlap with " + target + ", so treat the domain shift as a gap to close.");
        }

        TerminalState state = new TerminalState(category, severe, entry.scoreCap(), entry.ceiling(),
                entry.affordance(), entry.mode(), headline, required, forbidden, forbiddenPatterns, canonical,
                entry.closingPlans(), gap.redirectSuggestion());

        log.info("Terminal state: category={} severe={} cap={} ceiling={} affordance={} mode={}",
                category, severe, entry.scoreCap(), entry.ceiling(), entry.affordance(), entry.mode());
        return state;
    }

    private static String article(String word) {
        return "aeiou".indexOf(Character.toLowerCase(word.charAt(0))) >= 0 ? "an" : "a";
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
