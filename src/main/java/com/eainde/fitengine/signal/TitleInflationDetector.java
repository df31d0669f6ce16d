package com.eainde.fitengine.signal;

import com.eainde.fitengine.model.ExperienceEntry;
import com.eainde.fitengine.model.SeniorityLevel;
import com.eainde.fitengine.model.TitleFinding;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Checks senior titles against the evidence in the bullets written under them.
 *
 * <p>Director and above (director, VP, chief, head of) need two of scope, leadership and
 * strategic evidence. Other senior titles (staff, principal, senior) need scope or leadership.
 * A senior title with no bullets at all is inflated.</p>
 */
@Component
public class TitleInflationDetector {

    private static final List<String> SENIOR_IC = List.of("principal", "staff", "senior", "sr.", "lead");

    /**
     * @return a finding when the title implies senior or higher, empty otherwise
     */
    public Optional<TitleFinding> evaluate(ExperienceEntry entry) {
        Optional<SeniorityLevel> implied = impliedLevel(entry.title());
        if (implied.isEmpty()) {
            return Optional.empty();
        }

        boolean scope = false;
        boolean leadership = false;
        boolean strategic = false;
        for (String bullet : entry.bullets()) {
            scope |= SignalPatterns.hasScopeEvidence(bullet);
            leadership |= SignalPatterns.hasLeadershipEvidence(bullet);
            strategic |= SignalPatterns.hasStrategicEvidence(bullet);
        }

        List<String> evidence = new ArrayList<>();
        if (scope) evidence.add("scope");
        if (leadership) evidence.add("leadership");
        if (strategic) evidence.add("strategic");

        boolean inflated;
        if (implied.get().isAtLeast(SeniorityLevel.DIRECTOR)) {
            inflated = evidence.size() < 2;
        } else {
            inflated = !scope && !leadership;
        }
        return Optional.of(new TitleFinding(entry.title(), implied.get(), inflated, evidence));
    }

    public static Optional<SeniorityLevel> impliedLevel(String title) {
        if (title == null || title.isBlank()) {
            return Optional.empty();
        }
        String t = " " + title.toLowerCase(Locale.ROOT) + " ";
        if (t.contains("chief") || containsWord(t, "ceo") || containsWord(t, "cto") || containsWord(t, "cfo")
                || containsWord(t, "coo") || containsWord(t, "cmo")) {
            return Optional.of(SeniorityLevel.EXECUTIVE);
        }
        if (containsWord(t, "vp") || t.contains("vice president") || containsWord(t, "svp") || containsWord(t, "evp")) {
            return Optional.of(SeniorityLevel.VP);
        }
        if (t.contains("director") || t.contains("head of")) {
            return Optional.of(SeniorityLevel.DIRECTOR);
        }
        if (containsWord(t, "principal") || containsWord(t, "staff")) {
            return Optional.of(SeniorityLevel.STAFF);
        }
        for (String marker : SENIOR_IC) {
            if (containsWord(t, marker)) {
                return Optional.of(SeniorityLevel.SENIOR);
            }
        }
        return Optional.empty();
    }

    private static boolean containsWord(String padded, String word) {
        return padded.matches(".*(?<![a-z])" + Pattern.quote(word) + "(?![a-z]).*");
    }
}
