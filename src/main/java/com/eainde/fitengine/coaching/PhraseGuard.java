package com.eainde.fitengine.coaching;

import com.eainde.fitengine.model.CoachingNarrative;
import com.eainde.fitengine.model.NarrativeDraft;
import com.eainde.fitengine.model.SensitiveTopic;
import com.eainde.fitengine.model.Strength;
import com.eainde.fitengine.model.StrengthTier;
import com.eainde.fitengine.model.TerminalState;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Post-hoc scan of provider output against the terminal state's phrase rules. Returns the list of
 * violations; an empty list means the draft may be used.
 */
@Component
public class PhraseGuard {

    static final int MAX_YOUR_MOVE_SENTENCES = 3;

    static final List<String> GENERIC_LEADERSHIP = List.of(
            "proven leader",
            "natural leader",
            "strong leadership",
            "leadership skills",
            "leadership qualities",
            "track record of leadership",
            "born leader");

    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");

    public List<String> check(NarrativeDraft draft, TerminalState state, List<Strength> strengths) {
        List<String> violations = new ArrayList<>();
        List<String> texts = providerTexts(draft);
        String all = normalize(String.join("\n", texts));

        for (String phrase : state.forbiddenPhrases()) {
            if (all.contains(normalize(phrase))) {
                violations.add("Forbidden phrase used: \"" + phrase + "\"");
            }
        }
        for (Pattern pattern : state.forbiddenPatterns()) {
            Matcher m = pattern.matcher(all);
            if (m.find()) {
                violations.add("Forbidden claim used: \"" + m.group() + "\"");
            }
        }

        for (String text : texts) {
            for (String sentence : sentences(text)) {
                for (SensitiveTopic topic : SensitiveTopic.values()) {
                    if (topic.isTouchedBy(sentence)) {
                        violations.add("Sentence on " + topic + " must not be written by the provider: \""
                                + sentence.trim() + "\"");
                    }
                }
            }
        }

        if (sentences(draft.yourMove()).size() > MAX_YOUR_MOVE_SENTENCES) {
            violations.add("'yourMove' has more than " + MAX_YOUR_MOVE_SENTENCES + " sentences");
        }

        if (state.requiresClosingPlans()) {
            if (draft.threeMonthPlan().isEmpty()) {
                violations.add("Missing 3-month plan");
            }
            if (draft.sixToTwelveMonthPlan().isEmpty()) {
                violations.add("Missing 6-12 month plan");
            }
        }

        boolean requiredEvidenced = strengths.stream().anyMatch(s -> s.tier() == StrengthTier.JD_REQUIRED);
        if (requiredEvidenced) {
            for (String phrase : GENERIC_LEADERSHIP) {
                if (all.contains(phrase)) {
                    violations.add("Generic leadership language used while role-specific evidence exists: \""
                            + phrase + "\"");
                }
            }
        }
        return violations;
    }

    /**
     * Required phrases that the assembled narrative does not contain anywhere.
     */
    public List<String> missingRequired(CoachingNarrative narrative, TerminalState state) {
        List<String> parts = new ArrayList<>(narrative.statements());
        parts.add(narrative.summary());
        parts.addAll(narrative.strengths());
        parts.addAll(narrative.gaps());
        parts.add(narrative.yourMove());
        String all = normalize(String.join("\n", parts));
        return state.requiredPhrases().stream()
                .filter(p -> !all.contains(normalize(p)))
                .toList();
    }

    static String normalize(String text) {
        return text.replace('’', '\'').replace('‘', '\'').toLowerCase(Locale.ROOT);
    }

    static List<String> sentences(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return Arrays.stream(SENTENCE_END.split(text.trim()))
                .filter(s -> !s.isBlank())
                .toList();
    }

    private static List<String> providerTexts(NarrativeDraft draft) {
        List<String> texts = new ArrayList<>();
        texts.add(draft.summary());
        texts.addAll(draft.strengths());
        texts.addAll(draft.gaps());
        texts.add(draft.yourMove());
        texts.addAll(draft.threeMonthPlan());
        texts.addAll(draft.sixToTwelveMonthPlan());
        texts.removeIf(t -> t == null);
        return texts;
    }
}
