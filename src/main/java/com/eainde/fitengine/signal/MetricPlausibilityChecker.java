package com.eainde.fitengine.signal;

import com.eainde.fitengine.model.CredibilityFinding;
import com.eainde.fitengine.model.ResumeDocument;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flags claims that cannot be true as written: reductions beyond 100% and years of
 * experience exceeding the tenure the resume itself lists.
 */
@Component
public class MetricPlausibilityChecker {

    /** The percentage must be the amount of the reduction itself: "cut X by 250%", "a reduction of 250%". */
    private static final List<Pattern> REDUCTIONS = List.of(
            Pattern.compile("\\b(?:reduc\\w*|cut|decreas\\w*|lower\\w*|eliminat\\w*)\\b[^.,;]{0,40}?\\bby\\s+(\\d{3,})%",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:reduction|decrease|cut)\\s+of\\s+(\\d{3,})%", Pattern.CASE_INSENSITIVE));
    private static final Pattern CLAIMED_YEARS = Pattern.compile(
            "\\b(\\d{1,2})\\+?\\s+years?\\s+(of\\s+)?(experience|expertise)", Pattern.CASE_INSENSITIVE);

    /** Slack between claimed and listed years before a timeline is called inconsistent. */
    private static final double YEARS_TOLERANCE = 3.0;

    public List<CredibilityFinding> check(ResumeDocument resume) {
        List<CredibilityFinding> findings = new ArrayList<>();

        // the text repeats the structured bullets when both are present
        List<String> lines = new ArrayList<>(resume.allBullets());
        lines.add(resume.summary());
        if (resume.allBullets().isEmpty()) {
            lines.add(resume.text());
        }
        for (String line : lines) {
            for (Pattern reduction : REDUCTIONS) {
                Matcher m = reduction.matcher(line);
                while (m.find()) {
                    int pct = Integer.parseInt(m.group(1));
                    if (pct > 100) {
                        findings.add(new CredibilityFinding(CredibilityFinding.Kind.IMPLAUSIBLE_METRIC,
                                "Reduction of " + pct + "% is not possible: " + abbreviate(line)));
                    }
                }
            }
        }

        double listedYears = resume.experience().stream().mapToDouble(e -> Math.max(0, e.years())).sum();
        if (listedYears > 0) {
            Matcher m = CLAIMED_YEARS.matcher(resume.summary() + "\n" + resume.text());
            while (m.find()) {
                int claimed = Integer.parseInt(m.group(1));
                if (claimed > listedYears + YEARS_TOLERANCE) {
                    findings.add(new CredibilityFinding(CredibilityFinding.Kind.TIMELINE_INCONSISTENCY,
                            "Claims " + claimed + " years of experience but roles add up to " + listedYears));
                    break;
                }
            }
        }
        return findings;
    }

    private static String abbreviate(String s) {
        return s.length() <= 80 ? s : s.substring(0, 77) + "...";
    }
}
