package com.eainde.fitengine.score;

import com.eainde.fitengine.config.GlobalConfiguration;
import com.eainde.fitengine.model.JobDescription;
import com.eainde.fitengine.model.JobFunction;
import com.eainde.fitengine.model.ResumeDocument;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads the capabilities a job description asks for, using only vocabulary the global
 * configuration already knows: function responsibilities, technical keywords and domain terms.
 */
@Component
public class CapabilityExtractor {

    private static final Pattern BULLET_PREFIX = Pattern.compile("^\\s*([-*•▪>]|\\d+[.)])\\s*");

    public List<String> requiredCapabilities(JobDescription jd, JobFunction targetFunction, GlobalConfiguration config) {
        String text = jd.searchableText();
        Set<String> found = new LinkedHashSet<>();

        var definition = config.functions().definitions().get(targetFunction);
        if (definition != null) {
            definition.signals().stream().filter(s -> mentions(text, s)).forEach(found::add);
        }
        config.keywords().technicalKeywords().stream().filter(k -> mentions(text, k)).forEach(found::add);
        config.domains().keywords().values().forEach(terms ->
                terms.stream().filter(t -> mentions(text, t)).forEach(found::add));
        return new ArrayList<>(found);
    }

    public boolean isCovered(String capability, ResumeDocument resume) {
        return mentions(resume.searchableText(), capability);
    }

    /**
     * Structured bullets when present, otherwise the non-empty lines of the resume text.
     */
    public static List<String> statements(ResumeDocument resume) {
        List<String> bullets = resume.allBullets();
        if (!bullets.isEmpty()) {
            return bullets.stream().map(String::trim).toList();
        }
        return Arrays.stream(resume.text().split("\\R"))
                .map(line -> BULLET_PREFIX.matcher(line).replaceFirst("").trim())
                .filter(l -> !l.isEmpty())
                .toList();
    }

    /**
     * Whole-term match of {@code term} inside already lower-cased text.
     */
    public static boolean mentions(String lowerText, String term) {
        String t = term.toLowerCase(Locale.ROOT);
        return Pattern.compile("(?<![a-z0-9])" + Pattern.quote(t) + "(?![a-z0-9])").matcher(lowerText).find();
    }
}
