package com.eainde.fitengine.signal;

import com.eainde.fitengine.config.FunctionTaxonomy;
import com.eainde.fitengine.model.ExperienceEntry;
import com.eainde.fitengine.model.FunctionMatch;
import com.eainde.fitengine.model.JobDescription;
import com.eainde.fitengine.model.JobFunction;
import com.eainde.fitengine.model.ResumeDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads the primary function of a resume and of a job description from the role taxonomy and
 * compares them. Title hits weigh three points, responsibility keywords one.
 */
@Slf4j
@Component
public class FunctionClassifier {

    private static final double TITLE_WEIGHT = 3.0;
    private static final double SIGNAL_WEIGHT = 1.0;

    public FunctionMatch match(ResumeDocument resume, JobDescription jd, FunctionTaxonomy taxonomy) {
        List<String> titles = resume.experience().stream().map(ExperienceEntry::title).toList();
        JobFunction candidate = classify(titles, resume.searchableText(), taxonomy);
        JobFunction role = classify(List.of(jd.roleTitle()), jd.searchableText(), taxonomy);

        int rolesInTarget = (int) resume.experience().stream()
                .filter(e -> classify(List.of(e.title()), "", taxonomy) == role)
                .count();

        FunctionTaxonomy.Adjacency adjacency = taxonomy.adjacencyOf(candidate, role);
        log.debug("Function match: candidate={} role={} severity={} rolesInTarget={}",
                candidate, role, adjacency.severity(), rolesInTarget);

        return new FunctionMatch(candidate, role, adjacency.severity(), adjacency.transferable(), rolesInTarget);
    }

    public JobFunction classify(List<String> titles, String text, FunctionTaxonomy taxonomy) {
        String body = text == null ? "" : text.toLowerCase(Locale.ROOT);
        Map<JobFunction, Double> scores = new EnumMap<>(JobFunction.class);

        for (Map.Entry<JobFunction, FunctionTaxonomy.Definition> entry : taxonomy.definitions().entrySet()) {
            double score = 0.0;
            for (String title : titles) {
                String t = title == null ? "" : title.toLowerCase(Locale.ROOT);
                if (entry.getValue().titles().stream().anyMatch(p -> containsPhrase(t, p))) {
                    score += TITLE_WEIGHT;
                }
            }
            for (String signal : entry.getValue().signals()) {
                if (containsPhrase(body, signal)) {
                    score += SIGNAL_WEIGHT;
                }
            }
            scores.put(entry.getKey(), score);
        }

        return scores.entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse(JobFunction.OTHER);
    }

    private static boolean containsPhrase(String text, String phrase) {
        return Pattern.compile("(?<![a-z0-9])" + Pattern.quote(phrase) + "(?![a-z0-9])").matcher(text).find();
    }
}
