package com.eainde.fitengine.level;

import com.eainde.fitengine.model.JobDescription;
import com.eainde.fitengine.model.SeniorityLevel;
import com.eainde.fitengine.signal.TitleInflationDetector;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Target level of a posting: the caller's stated level, else the title, else the years asked
 * for in the body. Defaults to {@link SeniorityLevel#MID}.
 */
@Component
public class JobLevelDetector {

    private static final Pattern YEARS = Pattern.compile("\\b(\\d{1,2})\\+?\\s*(?:-\\s*\\d{1,2}\\s*)?years?", Pattern.CASE_INSENSITIVE);
    private static final Pattern JUNIOR = Pattern.compile("\\b(junior|jr\\.?|entry[- ]level|graduate|intern)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ASSOCIATE = Pattern.compile("\\bassociate\\b", Pattern.CASE_INSENSITIVE);

    public SeniorityLevel detect(JobDescription jd) {
        if (jd.statedLevel() != null) {
            return jd.statedLevel();
        }
        String title = jd.roleTitle().toLowerCase(Locale.ROOT);
        if (JUNIOR.matcher(title).find()) {
            return SeniorityLevel.ENTRY;
        }
        if (ASSOCIATE.matcher(title).find()) {
            return SeniorityLevel.ASSOCIATE;
        }
        Optional<SeniorityLevel> fromTitle = TitleInflationDetector.impliedLevel(jd.roleTitle());
        if (fromTitle.isPresent()) {
            return fromTitle.get();
        }
        return fromYears(jd.body()).orElse(SeniorityLevel.MID);
    }

    static Optional<SeniorityLevel> fromYears(String body) {
        Matcher m = YEARS.matcher(body == null ? "" : body);
        if (!m.find()) {
            return Optional.empty();
        }
        int years = Integer.parseInt(m.group(1));
        if (years <= 1) return Optional.of(SeniorityLevel.ENTRY);
        if (years <= 2) return Optional.of(SeniorityLevel.ASSOCIATE);
        if (years <= 4) return Optional.of(SeniorityLevel.MID);
        if (years <= 7) return Optional.of(SeniorityLevel.SENIOR);
        if (years <= 10) return Optional.of(SeniorityLevel.STAFF);
        return Optional.of(SeniorityLevel.DIRECTOR);
    }
}
