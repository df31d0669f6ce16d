package com.eainde.fitengine.signal;

import com.eainde.fitengine.config.GlobalConfiguration;
import com.eainde.fitengine.exception.InputValidationException;
import com.eainde.fitengine.model.CandidateSignal;
import com.eainde.fitengine.model.ExperienceEntry;
import com.eainde.fitengine.model.JobDescription;
import com.eainde.fitengine.model.KeywordStuffingReport;
import com.eainde.fitengine.model.ResumeDocument;
import com.eainde.fitengine.model.SessionFlags;
import com.eainde.fitengine.model.SignalExtraction;
import com.eainde.fitengine.model.SignalType;
import com.eainde.fitengine.model.TitleFinding;
import com.eainde.fitengine.session.AnalysisSession;
import com.eainde.fitengine.session.SessionKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns resume statements into evidence-checked signals and raises the inflation and stuffing
 * flags. Never fabricates a signal: a claim without evidence is kept as an unsupported signal
 * and cannot count toward level classification.
 */
@Slf4j
@Component
public class SignalExtractor {

    private static final Pattern BULLET_PREFIX = Pattern.compile("^\\s*([-*•▪>]|\\d+[.)])\\s*");
    private static final Pattern HAS_LETTERS = Pattern.compile("[A-Za-z]{2,}");
    private static final int MAX_TITLE_WORDS = 8;

    private final KeywordStuffingDetector keywordStuffingDetector;
    private final TitleInflationDetector titleInflationDetector;

    public SignalExtractor(KeywordStuffingDetector keywordStuffingDetector,
                           TitleInflationDetector titleInflationDetector) {
        this.keywordStuffingDetector = keywordStuffingDetector;
        this.titleInflationDetector = titleInflationDetector;
    }

    public SignalExtraction extract(ResumeDocument resume, JobDescription jd, AnalysisSession session) {
        if (resume == null || resume.isBlank()) {
            throw new InputValidationException("Resume text is empty");
        }
        if (jd == null || jd.isBlank()) {
            throw new InputValidationException("Job description text is empty");
        }

        GlobalConfiguration config = session.getConfiguration();
        List<ExperienceEntry> roles = roles(resume);
        List<Statement> statements = statements(roles);
        boolean titled = roles.stream().anyMatch(r -> !r.title().isBlank());
        if (statements.isEmpty() && !titled) {
            throw new InputValidationException("Resume text could not be parsed into any statement");
        }

        List<CandidateSignal> signals = new ArrayList<>();
        for (Statement statement : statements) {
            signals.addAll(classify(statement, config));
        }

        List<TitleFinding> titleFindings = new ArrayList<>();
        boolean titleInflation = false;
        for (ExperienceEntry entry : roles) {
            if (entry.title().isBlank()) {
                continue;
            }
            Optional<TitleFinding> finding = titleInflationDetector.evaluate(entry);
            if (finding.isPresent() && finding.get().inflated()) {
                titleInflation = true;
                titleFindings.add(finding.get());
                signals.add(CandidateSignal.unsupported(SignalType.TITLE, entry.title(), entry.title()));
                log.info("Title '{}' implies {} but bullets carry {}", entry.title(),
                        finding.get().impliedLevel(), finding.get().evidence());
            } else {
                finding.ifPresent(titleFindings::add);
                signals.add(CandidateSignal.evidenced(SignalType.TITLE, entry.title(), entry.title(),
                        finding.map(TitleFinding::evidence).orElse(List.of())));
            }
        }

        List<String> bullets = statements.stream().map(Statement::text).toList();
        KeywordStuffingReport keywordReport = keywordStuffingDetector.detect(bullets, config.keywords());

        SessionFlags flags = new SessionFlags(titleInflation, keywordReport.stuffed());
        SignalExtraction extraction = new SignalExtraction(signals, flags, keywordReport, titleFindings);
        session.record(SessionKeys.SIGNALS, extraction);

        log.info("Extracted {} signal(s), {} valid; titleInflation={}, keywordStuffing={} (density {}%, {} uncontextualized)",
                signals.size(), extraction.validSignals().size(), flags.titleInflationDetected(),
                flags.keywordStuffingDetected(), Math.round(keywordReport.densityPercent()),
                keywordReport.uncontextualizedCount());
        return extraction;
    }

    private List<CandidateSignal> classify(Statement statement, GlobalConfiguration config) {
        String text = statement.text();
        List<CandidateSignal> out = new ArrayList<>();

        if (SignalPatterns.SCOPE_CLAIM.matcher(text).find() || SignalPatterns.hasScopeEvidence(text)) {
            out.add(SignalPatterns.hasScopeEvidence(text)
                    ? CandidateSignal.evidenced(SignalType.SCOPE, text, statement.roleTitle(), List.of("quantified scale"))
                    : CandidateSignal.unsupported(SignalType.SCOPE, text, statement.roleTitle()));
        }

        if (SignalPatterns.LEADERSHIP_CLAIM.matcher(text).find()) {
            out.add(SignalPatterns.hasLeadershipEvidence(text)
                    ? CandidateSignal.evidenced(SignalType.LEADERSHIP, text, statement.roleTitle(), List.of("quantified leadership"))
                    : CandidateSignal.unsupported(SignalType.LEADERSHIP, text, statement.roleTitle()));
        }

        if (SignalPatterns.OWNERSHIP_CLAIM.matcher(text).find() || mentionsTechnicalKeyword(text, config)) {
            List<String> evidence = new ArrayList<>();
            if (SignalPatterns.hasImpact(text)) evidence.add("measured impact");
            if (SignalPatterns.hasComplexity(text)) evidence.add("complexity marker");
            if (SignalPatterns.hasScopeEvidence(text)) evidence.add("quantified scale");
            boolean applied = SignalPatterns.hasOwnership(text) && !evidence.isEmpty();
            out.add(applied
                    ? CandidateSignal.evidenced(SignalType.TECHNICAL_DEPTH, text, statement.roleTitle(), evidence)
                    : CandidateSignal.unsupported(SignalType.TECHNICAL_DEPTH, text, statement.roleTitle()));
        }
        return out;
    }

    private static boolean mentionsTechnicalKeyword(String text, GlobalConfiguration config) {
        String lower = text.toLowerCase(Locale.ROOT);
        return config.keywords().technicalKeywords().stream()
                .anyMatch(k -> Pattern.compile("\\b" + Pattern.quote(k) + "\\b").matcher(lower).find());
    }

    /**
     * Structured roles when the parser produced bullets for them, otherwise roles rebuilt from
     * the text lines. A title-only structured breakdown with no text is kept as is so its titles
     * are still checked.
     */
    static List<ExperienceEntry> roles(ResumeDocument resume) {
        if (!resume.allBullets().isEmpty() || resume.text().isBlank()) {
            return resume.experience();
        }
        List<ExperienceEntry> roles = new ArrayList<>();
        String title = "";
        List<String> bullets = new ArrayList<>();
        for (String raw : resume.text().split("\\R")) {
            Matcher prefix = BULLET_PREFIX.matcher(raw);
            boolean bulleted = prefix.lookingAt();
            String line = prefix.replaceFirst("").trim();
            if (!bulleted && isTitleLine(line)) {
                if (!title.isEmpty() || !bullets.isEmpty()) {
                    roles.add(new ExperienceEntry(title, null, 0, bullets));
                }
                title = line;
                bullets = new ArrayList<>();
            } else if (!line.isEmpty()) {
                bullets.add(line);
            }
        }
        if (!title.isEmpty() || !bullets.isEmpty()) {
            roles.add(new ExperienceEntry(title, null, 0, bullets));
        }
        return roles;
    }

    /** An unbulleted short line naming a senior or higher level. */
    private static boolean isTitleLine(String line) {
        return !line.isEmpty()
                && line.split("\\s+").length <= MAX_TITLE_WORDS
                && TitleInflationDetector.impliedLevel(line).isPresent();
    }

    private static List<Statement> statements(List<ExperienceEntry> roles) {
        List<Statement> out = new ArrayList<>();
        for (ExperienceEntry role : roles) {
            String roleTitle = role.title().isBlank() ? null : role.title();
            for (String bullet : role.bullets()) {
                addIfReadable(out, bullet, roleTitle);
            }
        }
        return out;
    }

    private static void addIfReadable(List<Statement> out, String text, String roleTitle) {
        if (text != null && HAS_LETTERS.matcher(text).find()) {
            out.add(new Statement(text.trim(), roleTitle));
        }
    }

    private record Statement(String text, String roleTitle) {
    }
}
