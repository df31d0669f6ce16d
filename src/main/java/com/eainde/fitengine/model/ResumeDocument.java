package com.eainde.fitengine.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Resume content as handed over by the upstream parsing collaborator.
 *
 * <p>{@code text} is the full plain text; {@code experience} is the structured breakdown
 * when the parser produced one. Either may be used by the extractor, but an empty text with
 * no experience entries is rejected as input.</p>
 */
public record ResumeDocument(
        String text,
        String summary,
        List<ExperienceEntry> experience,
        List<String> skills,
        List<String> credentials
) {

    public ResumeDocument {
        text = text == null ? "" : text;
        summary = summary == null ? "" : summary;
        experience = experience == null ? List.of() : List.copyOf(experience);
        skills = skills == null ? List.of() : List.copyOf(skills);
        credentials = credentials == null ? List.of() : List.copyOf(credentials);
    }

    public boolean isBlank() {
        return text.isBlank() && experience.stream().allMatch(e -> e.title().isBlank() && e.bullets().isEmpty());
    }

    public List<String> allBullets() {
        List<String> bullets = new ArrayList<>();
        experience.forEach(e -> bullets.addAll(e.bullets()));
        return bullets;
    }

    /**
     * Everything searchable in one lower-cased blob: text, summary, titles, bullets, skills.
     */
    public String searchableText() {
        StringBuilder sb = new StringBuilder(text).append('\n').append(summary);
        for (ExperienceEntry e : experience) {
            sb.append('\n').append(e.title());
            e.bullets().forEach(b -> sb.append('\n').append(b));
        }
        skills.forEach(s -> sb.append('\n').append(s));
        credentials.forEach(c -> sb.append('\n').append(c));
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}
