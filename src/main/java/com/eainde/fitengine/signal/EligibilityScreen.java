package com.eainde.fitengine.signal;

import com.eainde.fitengine.config.CredentialRule;
import com.eainde.fitengine.model.EligibilityResult;
import com.eainde.fitengine.model.JobDescription;
import com.eainde.fitengine.model.ResumeDocument;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Hard requirement check: credentials a posting marks as mandatory, and explicit disqualifiers.
 */
@Component
public class EligibilityScreen {

    private static final Pattern SPONSORSHIP_DISQUALIFIER = Pattern.compile(
            "\\b(no|not able to|unable to|will not|cannot)\\s+(provide\\s+)?(visa\\s+)?sponsor", Pattern.CASE_INSENSITIVE);
    private static final Pattern NEEDS_SPONSORSHIP = Pattern.compile(
            "\\b(require[sd]?|need[sd]?)\\s+(visa\\s+)?sponsorship", Pattern.CASE_INSENSITIVE);

    public EligibilityResult screen(ResumeDocument resume, JobDescription jd, List<CredentialRule> rules) {
        String resumeText = resume.searchableText();
        String jdText = jd.searchableText();
        Set<String> missing = new LinkedHashSet<>();

        for (CredentialRule rule : rules) {
            boolean demanded = rule.requirement().matcher(jdText).find()
                    || jd.requiredCredentials().stream().anyMatch(c -> c.equalsIgnoreCase(rule.name()));
            if (demanded && !holds(resumeText, rule.evidenceTerms())) {
                missing.add(rule.name());
            }
        }

        // structured requirements with no matching rule fall back to a plain term search
        for (String required : jd.requiredCredentials()) {
            boolean covered = rules.stream().anyMatch(r -> r.name().equalsIgnoreCase(required));
            if (!covered && !resumeText.contains(required.toLowerCase(Locale.ROOT))) {
                missing.add(required);
            }
        }

        List<String> disqualifiers = new ArrayList<>();
        if (SPONSORSHIP_DISQUALIFIER.matcher(jdText).find() && NEEDS_SPONSORSHIP.matcher(resumeText).find()) {
            disqualifiers.add("Role does not offer visa sponsorship");
        }

        return new EligibilityResult(List.copyOf(missing), disqualifiers);
    }

    private static boolean holds(String resumeText, List<String> evidenceTerms) {
        return evidenceTerms.stream().anyMatch(t -> resumeText.contains(t.toLowerCase(Locale.ROOT)));
    }
}
