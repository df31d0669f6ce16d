package com.eainde.fitengine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A single role from the parsed resume.
 *
 * @param title   job title as written
 * @param company employer, may be null
 * @param years   tenure in the role, 0 when unknown
 * @param bullets achievement lines for the role
 */
public record ExperienceEntry(
        @JsonProperty("title")   String title,
        @JsonProperty("company") String company,
        @JsonProperty("years")   double years,
        @JsonProperty("bullets") List<String> bullets
) {

    public ExperienceEntry {
        title = title == null ? "" : title.trim();
        bullets = bullets == null ? List.of() : List.copyOf(bullets);
    }
}
