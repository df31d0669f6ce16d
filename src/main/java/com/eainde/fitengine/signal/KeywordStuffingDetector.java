package com.eainde.fitengine.signal;

import com.eainde.fitengine.config.KeywordHeuristics;
import com.eainde.fitengine.model.KeywordStuffingReport;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Counts technical keywords across bullets and flags the ones dropped in without applied context.
 */
@Component
public class KeywordStuffingDetector {

    public KeywordStuffingReport detect(List<String> bullets, KeywordHeuristics heuristics) {
        if (bullets == null || bullets.isEmpty()) {
            return KeywordStuffingReport.clean();
        }

        String allText = String.join(" ", bullets).toLowerCase(Locale.ROOT);
        Pattern context = contextPattern(heuristics.contextWords());

        int keywordCount = 0;
        List<String> uncontextualized = new ArrayList<>();

        for (String keyword : heuristics.technicalKeywords()) {
            Pattern kw = Pattern.compile("\\b" + Pattern.quote(keyword.toLowerCase(Locale.ROOT)) + "\\b");
            int occurrences = count(kw.matcher(allText));
            if (occurrences == 0) {
                continue;
            }
            keywordCount += occurrences;

            boolean applied = bullets.stream()
                    .map(b -> b.toLowerCase(Locale.ROOT))
                    .filter(b -> kw.matcher(b).find())
                    .anyMatch(b -> context.matcher(b).find());
            if (!applied && occurrences > heuristics.repeatThreshold()) {
                uncontextualized.add(keyword);
            }
        }

        // ten words per bullet is the reference length
        double density = (keywordCount / (bullets.size() * 10.0)) * 100.0;
        boolean stuffed = density > heuristics.maxDensityPercent()
                || uncontextualized.size() > heuristics.maxUncontextualized();

        return new KeywordStuffingReport(keywordCount, uncontextualized.size(), density, uncontextualized, stuffed);
    }

    private static Pattern contextPattern(List<String> words) {
        StringBuilder sb = new StringBuilder("\\b(");
        for (int i = 0; i < words.size(); i++) {
            if (i > 0) {
                sb.append('|');
            }
            sb.append(Pattern.quote(words.get(i).toLowerCase(Locale.ROOT)));
        }
        return Pattern.compile(sb.append(")\\b").toString());
    }

    private static int count(Matcher m) {
        int n = 0;
        while (m.find()) {
            n++;
        }
        return n;
    }
}
