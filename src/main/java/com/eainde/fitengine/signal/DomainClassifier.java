package com.eainde.fitengine.signal;

import com.eainde.fitengine.config.DomainTaxonomy;
import com.eainde.fitengine.model.DomainMatch;
import com.eainde.fitengine.model.JobDescription;
import com.eainde.fitengine.model.ResumeDocument;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Decides whether "your experience translates to X" is a claim the evidence supports.
 *
 * <p>Supported when the candidate has direct or adjacent domain experience, or when the
 * posting's domain cannot be identified.</p>
 */
@Component
public class DomainClassifier {

    public DomainMatch match(ResumeDocument resume, JobDescription jd, DomainTaxonomy taxonomy) {
        List<String> candidateDomains = candidateDomains(resume.searchableText(), taxonomy);
        String target = targetDomain(jd.searchableText(), taxonomy);

        if (target == null) {
            return new DomainMatch(candidateDomains, null, true, "Target domain not identified");
        }
        if (candidateDomains.contains(target)) {
            return new DomainMatch(candidateDomains, target, true, "Direct experience in " + target);
        }
        for (String domain : candidateDomains) {
            if (taxonomy.areAdjacent(domain, target)) {
                return new DomainMatch(candidateDomains, target, true,
                        "Adjacent experience: " + domain + " is adjacent to " + target);
            }
        }
        return new DomainMatch(candidateDomains, target, false,
                "No experience in " + target + " or an adjacent domain");
    }

    List<String> candidateDomains(String text, DomainTaxonomy taxonomy) {
        List<String> domains = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : taxonomy.keywords().entrySet()) {
            long hits = entry.getValue().stream().filter(text::contains).count();
            if (hits >= taxonomy.minimumMatches()) {
                domains.add(entry.getKey());
            }
        }
        return domains;
    }

    String targetDomain(String text, DomainTaxonomy taxonomy) {
        String best = null;
        long bestHits = 0;
        for (Map.Entry<String, List<String>> entry : taxonomy.keywords().entrySet()) {
            long hits = entry.getValue().stream().filter(text::contains).count();
            if (hits > bestHits) {
                best = entry.getKey();
                bestHits = hits;
            }
        }
        return best;
    }
}
